package gatehouse.adapter.in.http;

import java.net.URI;
import java.util.List;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gatehouse.adapter.in.auth.AuthCookieIssuer;
import gatehouse.core.model.auth.AuthErrorKind;
import gatehouse.core.model.flow.LoginFlowException;
import gatehouse.core.model.flow.LoginOutcome;
import gatehouse.core.port.in.LoginManagement;

/**
 * Browser-facing OAuth login endpoints.
 *
 * <p>Every response is a 302. Failures go to the login page with
 * {@code error=<code>&msg=<text>} and never carry auth cookies.
 */
@Path("/auth")
public class LoginResource {

    private static final Logger LOG = Logger.getLogger(LoginResource.class);
    private static final int MAX_LOGGED_DESCRIPTION = 200;

    private final LoginManagement loginManagement;
    private final AuthCookieIssuer cookies;
    private final LoginRedirects redirects;

    @Inject
    public LoginResource(LoginManagement loginManagement, AuthCookieIssuer cookies, LoginRedirects redirects) {
        this.loginManagement = loginManagement;
        this.cookies = cookies;
        this.redirects = redirects;
    }

    /**
     * Start a social login: store the PKCE verifier and send the browser to the provider.
     */
    @GET
    @Path("/login/{provider}")
    public Uni<Response> login(@PathParam("provider") String provider) {
        return loginManagement
                .initiate(provider)
                .map(initiation -> cookies.pkceSession(initiation.sessionHandle())
                        .applyTo(LoginRedirects.found(initiation.authorizeUri()))
                        .build())
                .onFailure()
                .recoverWithItem(error -> {
                    final var kind = error instanceof LoginFlowException flowError
                            ? flowError.kind()
                            : AuthErrorKind.SERVER_ERROR;
                    if (kind == AuthErrorKind.SERVER_ERROR) {
                        LOG.warnf(error, "Could not start %s login", provider);
                    }
                    return LoginRedirects.found(redirects.loginWithError(kind)).build();
                });
    }

    /**
     * Provider redirect target.
     *
     * @param code             authorization code
     * @param error            error reported by the provider instead of a code
     * @param errorDescription provider's free text; logged, never echoed
     */
    @GET
    @Path("/callback")
    public Uni<Response> callback(
            @QueryParam("code") String code,
            @QueryParam("error") String error,
            @QueryParam("error_description") String errorDescription,
            @Context HttpHeaders headers) {
        if (error != null && errorDescription != null) {
            LOG.debugf("Provider error description: %s", truncate(errorDescription));
        }
        final var handle = cookies.pkceHandle(headers).orElse(null);
        return loginManagement
                .completeCallback(handle, code, error)
                .onFailure()
                .recoverWithItem(failure -> {
                    LOG.warnf(failure, "Callback processing failed");
                    return new LoginOutcome.Failed(AuthErrorKind.SERVER_ERROR, List.of());
                })
                .map(this::toResponse);
    }

    /**
     * Clear all auth cookies and return to the login page.
     */
    @GET
    @Path("/logout")
    public Response logout() {
        return cookies.logout()
                .applyTo(LoginRedirects.found(URI.create(redirects.loginPath())))
                .build();
    }

    private Response toResponse(LoginOutcome outcome) {
        if (outcome instanceof LoginOutcome.Routed routed) {
            final var target = URI.create(redirects.pathFor(routed.decision().destination()));
            return cookies.issueAfterOAuth(routed.tokens())
                    .applyTo(LoginRedirects.found(target))
                    .build();
        }
        final var failed = (LoginOutcome.Failed) outcome;
        return cookies.clearPkceSession()
                .applyTo(LoginRedirects.found(redirects.loginWithError(failed.kind())))
                .build();
    }

    private static String truncate(String value) {
        return value.length() <= MAX_LOGGED_DESCRIPTION ? value : value.substring(0, MAX_LOGGED_DESCRIPTION);
    }
}
