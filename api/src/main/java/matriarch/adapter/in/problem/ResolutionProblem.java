package matriarch.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for resolution errors.
 */
public final class ResolutionProblem {

    private ResolutionProblem() {}

    public static HttpProblem identityNotFound(String objectId) {
        return HttpProblem.builder()
                .withTitle("Identity Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("No principal with object ID '%s' exists in the directory".formatted(objectId))
                .build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem directoryUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Directory Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem directoryRejected(String detail) {
        return HttpProblem.builder()
                .withTitle("Directory Request Rejected")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem cancelled(String detail) {
        return HttpProblem.builder()
                .withTitle("Resolution Cancelled")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem timeout(String detail) {
        return HttpProblem.builder()
                .withTitle("Resolution Timed Out")
                .withStatus(Status.GATEWAY_TIMEOUT)
                .withDetail(detail)
                .build();
    }
}
