package gatehouse.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import gatehouse.spi.StorageProviderException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugf("Validation error: %s", e.getMessage());
        return toResponse(AuthProblem.badRequest(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapStorageProviderException(StorageProviderException e) {
        LOG.warnf(e, "Storage unavailable");
        return toResponse(AuthProblem.serviceUnavailable("Storage is unavailable"));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
