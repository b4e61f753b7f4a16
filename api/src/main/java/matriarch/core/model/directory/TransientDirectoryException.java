package matriarch.core.model.directory;

import java.time.Duration;
import java.util.Optional;

/**
 * A directory failure worth retrying: network errors, timeouts, throttling
 * (HTTP 429) and server errors (HTTP 5xx).
 */
public class TransientDirectoryException extends DirectoryException {

    private final int statusCode;
    private final Duration retryAfter;

    public TransientDirectoryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.retryAfter = null;
    }

    public TransientDirectoryException(String message, int statusCode, Duration retryAfter) {
        super(message);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    /**
     * HTTP status that triggered the failure, or 0 for transport errors.
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * Server supplied {@code Retry-After} hint, if any.
     */
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
