package matriarch.core.service.resolution;

import java.time.Duration;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import matriarch.core.config.ParallelizationSettings;
import matriarch.core.model.directory.RetriesExhaustedException;
import matriarch.core.model.directory.TransientDirectoryException;
import matriarch.core.port.out.ResolutionMetrics;

/**
 * Bounded fixed-delay retry for directory calls.
 *
 * <p>Only {@link TransientDirectoryException} is retried. Every other failure
 * propagates on the first occurrence without consuming attempts.
 *
 * <p>{@code maxRetryAttempts} counts total attempts, first call included. The
 * wait between attempts is {@code retryDelay}, stretched to a server supplied
 * {@code Retry-After} when that is longer. When all attempts fail the call fails
 * with {@link RetriesExhaustedException} wrapping the last cause.
 *
 * <p>Stateless apart from configuration; safe for concurrent use.
 */
@ApplicationScoped
public class DirectoryRetryPolicy {

    private static final Logger LOG = Logger.getLogger(DirectoryRetryPolicy.class);

    private final int maxAttempts;
    private final Duration retryDelay;
    private final ResolutionMetrics metrics;

    @Inject
    public DirectoryRetryPolicy(ParallelizationSettings settings, ResolutionMetrics metrics) {
        this.maxAttempts = settings.maxRetryAttempts();
        this.retryDelay = settings.retryDelay();
        this.metrics = metrics;
    }

    /**
     * Run an operation with retries.
     *
     * <p>The supplier is invoked once per attempt, so each attempt issues a fresh call.
     *
     * @param operationName name for logging and metrics
     * @param operation     supplier of the call to attempt
     * @param <T>           the result type
     * @return Uni with the first successful result
     */
    public <T> Uni<T> execute(String operationName, Supplier<Uni<T>> operation) {
        return attempt(operationName, operation, 1);
    }

    private <T> Uni<T> attempt(String operationName, Supplier<Uni<T>> operation, int attempt) {
        return Uni.createFrom().deferred(operation::get).onFailure().recoverWithUni(failure -> {
            if (!(failure instanceof TransientDirectoryException transientFailure)) {
                return Uni.createFrom().failure(failure);
            }
            if (attempt >= maxAttempts) {
                LOG.errorv(
                        "Directory operation {0} failed after {1} attempt(s): {2}",
                        operationName, attempt, failure.getMessage());
                return Uni.createFrom().failure(new RetriesExhaustedException(operationName, attempt, failure));
            }

            final var delay = delayFor(transientFailure);
            LOG.warnv(
                    "Directory operation {0} failed transiently (attempt {1} of {2}), retrying in {3}: {4}",
                    operationName, attempt, maxAttempts, delay, failure.getMessage());
            metrics.recordRetry(operationName);

            return pause(delay).chain(() -> attempt(operationName, operation, attempt + 1));
        });
    }

    private Duration delayFor(TransientDirectoryException failure) {
        return failure.retryAfter()
                .filter(hint -> hint.compareTo(retryDelay) > 0)
                .orElse(retryDelay);
    }

    private static Uni<Void> pause(Duration delay) {
        if (delay.isZero()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom().voidItem().onItem().delayIt().by(delay);
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
