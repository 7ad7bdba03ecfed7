package gatehouse.core.model.auth;

/**
 * Failure kinds produced anywhere in the login flows.
 *
 * <p>Each kind carries the short code placed on the login redirect and a
 * sanitized message safe to show to an end user. Raw provider text never
 * reaches the client; it is only logged.
 */
public enum AuthErrorKind {
    MISSING_CODE("no_code", "Authorization failed"),
    SESSION_EXPIRED("session_expired", "Your sign-in session expired. Please try again."),
    INVALID_GRANT("token_failed", "Could not complete sign-in. Please try again."),
    NETWORK_TIMEOUT("timeout", "Server timeout - try again"),
    PROVIDER_ERROR("provider_error", "Authorization failed"),
    PROVIDER_DENIED("access_denied", "Sign-in was cancelled or denied"),
    UNSUPPORTED_PROVIDER("unsupported_provider", "This sign-in method is not available"),
    VALIDATION_ERROR("validation_error", "Invalid email or password"),
    INVALID_CREDENTIALS("invalid_credentials", "Invalid login credentials"),
    DUPLICATE_ACCOUNT("duplicate_account", "A user with this email address has already been registered"),
    TOKEN_INVALID("token_invalid", "Session is no longer valid"),
    TOKEN_EXPIRED("token_expired", "Session expired"),
    SERVER_ERROR("server_error", "Something went wrong. Please try again.");

    private final String code;
    private final String publicMessage;

    AuthErrorKind(String code, String publicMessage) {
        this.code = code;
        this.publicMessage = publicMessage;
    }

    /**
     * Short machine-readable code used in redirects and metrics.
     */
    public String code() {
        return code;
    }

    /**
     * Message safe to display; contains nothing that identifies an account.
     */
    public String publicMessage() {
        return publicMessage;
    }

    /**
     * Whether this failure came from talking to the provider rather than the caller's input.
     */
    public boolean isUpstreamFailure() {
        return this == NETWORK_TIMEOUT || this == PROVIDER_ERROR;
    }
}
