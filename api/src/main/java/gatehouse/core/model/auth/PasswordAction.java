package gatehouse.core.model.auth;

import java.util.Locale;
import java.util.Optional;

/**
 * What a credential submission asks for.
 */
public enum PasswordAction {
    LOGIN,
    SIGNUP;

    /**
     * Parse the wire value ({@code login} / {@code signup}).
     *
     * @param value raw action, may be null
     * @return parsed action, or empty if unrecognised
     */
    public static Optional<PasswordAction> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "login" -> Optional.of(LOGIN);
            case "signup" -> Optional.of(SIGNUP);
            default -> Optional.empty();
        };
    }
}
