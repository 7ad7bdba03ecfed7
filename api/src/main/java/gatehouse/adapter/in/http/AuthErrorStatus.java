package gatehouse.adapter.in.http;

import jakarta.ws.rs.core.Response.Status;

import gatehouse.core.model.auth.AuthErrorKind;

/**
 * HTTP status for a failure on the JSON auth endpoints.
 */
final class AuthErrorStatus {

    private AuthErrorStatus() {}

    static Status of(AuthErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR, DUPLICATE_ACCOUNT -> Status.BAD_REQUEST;
            case INVALID_CREDENTIALS, TOKEN_INVALID, TOKEN_EXPIRED, INVALID_GRANT, SESSION_EXPIRED -> Status.UNAUTHORIZED;
            case NETWORK_TIMEOUT -> Status.GATEWAY_TIMEOUT;
            case PROVIDER_ERROR, PROVIDER_DENIED -> Status.BAD_GATEWAY;
            default -> Status.INTERNAL_SERVER_ERROR;
        };
    }
}
