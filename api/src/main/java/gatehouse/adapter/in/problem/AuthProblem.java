package gatehouse.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for non-flow errors.
 *
 * <p>Login flow failures use redirects or {@code {"error": ...}} bodies
 * instead; these problems cover the API endpoints around them.
 */
public final class AuthProblem {

    private AuthProblem() {}

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem notFound(String detail) {
        return HttpProblem.builder()
                .withTitle("Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem badGateway(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Gateway")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem serviceUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }
}
