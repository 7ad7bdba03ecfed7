package gatehouse.core.service.auth;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import gatehouse.core.config.LoginConfig;

/**
 * Local checks on submitted credentials, applied before any provider call.
 */
@ApplicationScoped
public class CredentialValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final int MAX_EMAIL_LENGTH = 254;

    private final LoginConfig config;

    @Inject
    public CredentialValidator(LoginConfig config) {
        this.config = config;
    }

    /**
     * Trim and lower-case an email address.
     *
     * @param email raw email, may be null
     * @return normalized email, or empty if null or blank
     */
    public Optional<String> normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(email.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @param normalizedEmail email already passed through {@link #normalizeEmail}
     * @return true if it looks like a deliverable address
     */
    public boolean isValidEmail(String normalizedEmail) {
        return normalizedEmail != null
                && normalizedEmail.length() <= MAX_EMAIL_LENGTH
                && EMAIL.matcher(normalizedEmail).matches();
    }

    /**
     * @param password raw password, may be null
     * @return true if it meets the configured minimum length
     */
    public boolean isValidPassword(String password) {
        return password != null && password.length() >= config.minPasswordLength();
    }
}
