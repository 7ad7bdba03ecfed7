package gatehouse.adapter.in.http;

import java.util.HashMap;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import gatehouse.adapter.in.auth.AuthCookieIssuer;
import gatehouse.core.model.auth.ProviderResult;
import gatehouse.core.model.auth.SubjectRef;
import gatehouse.core.model.auth.TokenSet;
import gatehouse.core.port.in.SessionManagement;

/**
 * Session status and token refresh for the cookie session.
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
public class SessionResource {

    private final SessionManagement sessions;
    private final AuthCookieIssuer cookies;

    @Inject
    public SessionResource(SessionManagement sessions, AuthCookieIssuer cookies) {
        this.sessions = sessions;
        this.cookies = cookies;
    }

    /**
     * Who the access cookie belongs to.
     */
    @GET
    @Path("/status")
    public Uni<Response> status(@Context HttpHeaders headers) {
        return sessions.currentSubject(cookies.accessToken(headers).orElse(null)).map(result -> {
            if (result instanceof ProviderResult.Success<SubjectRef> success) {
                final Map<String, Object> user = new HashMap<>();
                user.put("id", success.value().subjectId());
                user.put("email", success.value().email());
                return Response.ok(Map.of("authenticated", true, "user", user)).build();
            }
            return Response.status(Response.Status.UNAUTHORIZED)
                    .entity(Map.of("authenticated", false))
                    .build();
        });
    }

    /**
     * Trade the refresh cookie for a new token pair.
     *
     * <p>A rejected refresh token clears both auth cookies. A provider outage
     * leaves them in place so the user can retry.
     */
    @POST
    @Path("/refresh")
    public Uni<Response> refresh(@Context HttpHeaders headers) {
        return sessions.refresh(cookies.refreshToken(headers).orElse(null)).map(result -> {
            if (result instanceof ProviderResult.Success<TokenSet> success) {
                return cookies.issue(success.value())
                        .applyTo(Response.ok(Map.of("refreshed", true)))
                        .build();
            }
            final var kind = ((ProviderResult.Failure<TokenSet>) result).kind();
            final var response = Response.status(AuthErrorStatus.of(kind)).entity(Map.of("error", kind.publicMessage()));
            return kind.isUpstreamFailure()
                    ? response.build()
                    : cookies.clearAuth().applyTo(response).build();
        });
    }
}
