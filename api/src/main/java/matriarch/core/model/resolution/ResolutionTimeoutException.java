package matriarch.core.model.resolution;

import java.time.Duration;

/**
 * A resolution did not complete within the configured time bound.
 */
public class ResolutionTimeoutException extends RuntimeException {

    public ResolutionTimeoutException(String objectId, Duration timeout) {
        super("Resolution of " + objectId + " did not complete within " + timeout);
    }
}
