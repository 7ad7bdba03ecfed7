package gatehouse.core.model.flow;

import gatehouse.core.model.auth.AuthErrorKind;

/**
 * Raised when a login cannot even be started (login-initiate).
 *
 * <p>Callback and password flows report failures as {@link LoginOutcome.Failed} instead.
 */
public class LoginFlowException extends RuntimeException {

    private final AuthErrorKind kind;

    public LoginFlowException(AuthErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LoginFlowException(AuthErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AuthErrorKind kind() {
        return kind;
    }
}
