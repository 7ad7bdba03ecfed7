package gatehouse.adapter.in.http;

import java.net.URI;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriBuilder;

import gatehouse.core.config.LoginConfig;
import gatehouse.core.model.auth.AuthErrorKind;
import gatehouse.core.model.routing.Destination;

/**
 * Navigation targets for the browser-facing login endpoints.
 */
@ApplicationScoped
public class LoginRedirects {

    private final LoginConfig config;

    @Inject
    public LoginRedirects(LoginConfig config) {
        this.config = config;
    }

    public String pathFor(Destination destination) {
        return switch (destination) {
            case ONBOARDING -> config.onboardingPath();
            case DASHBOARD -> config.dashboardPath();
        };
    }

    public String loginPath() {
        return config.loginPath();
    }

    /**
     * Login page carrying a short error code and its sanitized message.
     */
    public URI loginWithError(AuthErrorKind kind) {
        return UriBuilder.fromPath(config.loginPath())
                .queryParam("error", kind.code())
                .queryParam("msg", kind.publicMessage())
                .build();
    }

    /**
     * A 302 Found redirect.
     */
    public static Response.ResponseBuilder found(URI location) {
        return Response.status(Response.Status.FOUND).location(location);
    }
}
