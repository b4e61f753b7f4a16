package matriarch.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import matriarch.core.model.directory.IdentityNotFoundException;
import matriarch.core.model.directory.PermanentDirectoryException;
import matriarch.core.model.directory.RetriesExhaustedException;
import matriarch.core.model.directory.TransientDirectoryException;
import matriarch.core.model.resolution.ResolutionCancelledException;
import matriarch.core.model.resolution.ResolutionTimeoutException;

/**
 * Global exception mappers for converting resolution failures to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapIdentityNotFound(IdentityNotFoundException e) {
        return toResponse(ResolutionProblem.identityNotFound(e.objectId()));
    }

    @ServerExceptionMapper
    public Response mapRetriesExhausted(RetriesExhaustedException e) {
        LOG.warnv("Directory unavailable: {0}", e.getMessage());
        return toResponse(ResolutionProblem.directoryUnavailable(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapTransientDirectoryFailure(TransientDirectoryException e) {
        LOG.warnv("Directory unavailable: {0}", e.getMessage());
        return toResponse(ResolutionProblem.directoryUnavailable(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapPermanentDirectoryFailure(PermanentDirectoryException e) {
        LOG.warnv("Directory rejected request: {0}", e.getMessage());
        return toResponse(ResolutionProblem.directoryRejected(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapCancelled(ResolutionCancelledException e) {
        LOG.debugv("Resolution cancelled: {0}", e.getMessage());
        return toResponse(ResolutionProblem.cancelled(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapTimeout(ResolutionTimeoutException e) {
        LOG.warnv("Resolution timed out: {0}", e.getMessage());
        return toResponse(ResolutionProblem.timeout(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(ResolutionProblem.badRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
