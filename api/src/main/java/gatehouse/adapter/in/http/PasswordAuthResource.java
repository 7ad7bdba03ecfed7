package gatehouse.adapter.in.http;

import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import gatehouse.adapter.in.auth.AuthCookieIssuer;
import gatehouse.adapter.in.dto.PasswordAuthRequest;
import gatehouse.adapter.in.dto.SessionInfo;
import gatehouse.core.model.auth.AuthErrorKind;
import gatehouse.core.model.auth.PasswordAction;
import gatehouse.core.model.flow.LoginOutcome;
import gatehouse.core.model.flow.SignupOutcome;
import gatehouse.core.port.in.LoginManagement;

/**
 * Email/password login and signup.
 *
 * <p>Failures return {@code {"error": <message>}} with a message that never
 * tells an unknown email apart from a wrong password.
 */
@Path("/auth/password")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class PasswordAuthResource {

    private static final Logger LOG = Logger.getLogger(PasswordAuthResource.class);
    static final String SIGNUP_MESSAGE = "Signup successful. Check email for confirmation.";
    static final String MALFORMED_BODY_MESSAGE = "Request body must be a JSON object with email, password and action";

    private final LoginManagement loginManagement;
    private final AuthCookieIssuer cookies;
    private final LoginRedirects redirects;

    @Inject
    public PasswordAuthResource(LoginManagement loginManagement, AuthCookieIssuer cookies, LoginRedirects redirects) {
        this.loginManagement = loginManagement;
        this.cookies = cookies;
        this.redirects = redirects;
    }

    @POST
    public Uni<Response> authenticate(PasswordAuthRequest request) {
        if (request == null) {
            return Uni.createFrom().item(error(AuthErrorKind.VALIDATION_ERROR));
        }
        final var action = PasswordAction.parse(request.action());
        if (action.isEmpty()) {
            LOG.debugf("Rejected password request with action: %s", request.action());
            return Uni.createFrom()
                    .item(Response.status(Response.Status.BAD_REQUEST)
                            .entity(Map.of("error", "Action must be login or signup"))
                            .build());
        }
        return switch (action.get()) {
            case LOGIN -> loginManagement
                    .passwordLogin(request.email(), request.password())
                    .map(this::loginResponse);
            case SIGNUP -> loginManagement
                    .passwordSignup(request.email(), request.password())
                    .map(this::signupResponse);
        };
    }

    /**
     * Unparseable bodies keep the {@code {"error": ...}} shape of this endpoint
     * instead of the global problem document.
     */
    @ServerExceptionMapper
    public Response mapMalformedBody(JsonProcessingException e) {
        LOG.debugf("Rejected unparseable password request: %s", e.getOriginalMessage());
        return malformedBody();
    }

    /**
     * The JSON reader may wrap a parse failure in a 400 before it reaches
     * {@link #mapMalformedBody}.
     */
    @ServerExceptionMapper
    public Response mapUnreadableBody(WebApplicationException e) {
        if (e.getResponse().getStatus() != Response.Status.BAD_REQUEST.getStatusCode()) {
            return e.getResponse();
        }
        LOG.debugf("Rejected unreadable password request: %s", e.getMessage());
        return malformedBody();
    }

    private static Response malformedBody() {
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", MALFORMED_BODY_MESSAGE))
                .build();
    }

    private Response loginResponse(LoginOutcome outcome) {
        if (outcome instanceof LoginOutcome.Routed routed) {
            final var tokens = routed.tokens();
            final var body = Map.of(
                    "next", redirects.pathFor(routed.decision().destination()),
                    "session", new SessionInfo(tokens.subjectId(), tokens.email(), tokens.expiresIn()));
            return cookies.issue(tokens).applyTo(Response.ok(body)).build();
        }
        return error(((LoginOutcome.Failed) outcome).kind());
    }

    private Response signupResponse(SignupOutcome outcome) {
        if (outcome instanceof SignupOutcome.Registered) {
            return Response.ok(Map.of("next", redirects.loginPath(), "msg", SIGNUP_MESSAGE))
                    .build();
        }
        return error(((SignupOutcome.Rejected) outcome).kind());
    }

    private static Response error(AuthErrorKind kind) {
        return Response.status(AuthErrorStatus.of(kind))
                .entity(Map.of("error", kind.publicMessage()))
                .build();
    }
}
