package gatehouse.adapter.in.http;

import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import gatehouse.adapter.in.auth.AuthCookieIssuer;
import gatehouse.adapter.in.dto.OnboardingRequest;
import gatehouse.adapter.in.problem.AuthProblem;
import gatehouse.core.model.auth.ProviderResult;
import gatehouse.core.model.auth.SubjectRef;
import gatehouse.core.model.routing.Destination;
import gatehouse.core.port.in.OnboardingManagement;
import gatehouse.core.port.in.SessionManagement;

/**
 * Finishes onboarding for the subject identified by the access cookie.
 */
@Path("/api/onboarding")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class OnboardingResource {

    private final SessionManagement sessions;
    private final OnboardingManagement onboarding;
    private final AuthCookieIssuer cookies;
    private final LoginRedirects redirects;

    @Inject
    public OnboardingResource(
            SessionManagement sessions,
            OnboardingManagement onboarding,
            AuthCookieIssuer cookies,
            LoginRedirects redirects) {
        this.sessions = sessions;
        this.onboarding = onboarding;
        this.cookies = cookies;
        this.redirects = redirects;
    }

    @POST
    @Path("/complete")
    public Uni<Response> complete(OnboardingRequest request, @Context HttpHeaders headers) {
        return sessions.currentSubject(cookies.accessToken(headers).orElse(null)).flatMap(result -> {
            if (!(result instanceof ProviderResult.Success<SubjectRef> success)) {
                throw AuthProblem.unauthorized("Authentication required");
            }
            if (request == null) {
                throw AuthProblem.badRequest("Request body is required");
            }
            return onboarding
                    .completeOnboarding(success.value().subjectId(), request.fullName(), request.role())
                    .map(profile -> profile.map(p -> Response.ok(
                                            Map.of("next", redirects.pathFor(Destination.DASHBOARD)))
                                    .build())
                            .orElseThrow(() -> AuthProblem.notFound("No profile exists for this account")));
        });
    }
}
