package matriarch.core.config;

import java.time.Duration;

/**
 * Validated snapshot of {@link ParallelizationConfig}, bound once at startup.
 *
 * @param maxDegreeOfParallelism               ceiling on in-flight directory calls
 * @param maxRetryAttempts                     total attempts per directory call
 * @param retryDelay                           fixed wait between attempts
 * @param maxConcurrentTransitiveGroupRequests concurrent expansions per traversal chunk
 * @param transitiveGroupBatchSize             groups per traversal chunk
 * @param delayBetweenBatches                  pause between traversal chunks
 */
public record ParallelizationSettings(
        int maxDegreeOfParallelism,
        int maxRetryAttempts,
        Duration retryDelay,
        int maxConcurrentTransitiveGroupRequests,
        int transitiveGroupBatchSize,
        Duration delayBetweenBatches) {

    public ParallelizationSettings {
        validate(maxDegreeOfParallelism, "maxDegreeOfParallelism");
        validate(maxRetryAttempts, "maxRetryAttempts");
        validate(maxConcurrentTransitiveGroupRequests, "maxConcurrentTransitiveGroupRequests");
        validate(transitiveGroupBatchSize, "transitiveGroupBatchSize");
        validate(retryDelay, "retryDelay");
        validate(delayBetweenBatches, "delayBetweenBatches");
    }

    public static ParallelizationSettings defaults() {
        return new ParallelizationSettings(4, 3, Duration.ofSeconds(1), 5, 10, Duration.ofMillis(100));
    }

    public static ParallelizationSettings from(ParallelizationConfig config) {
        return new ParallelizationSettings(
                config.maxDegreeOfParallelism(),
                config.maxRetryAttempts(),
                config.retryDelay(),
                config.maxConcurrentTransitiveGroupRequests(),
                config.transitiveGroupBatchSize(),
                config.delayBetweenBatches());
    }

    private static void validate(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1, got: " + value);
        }
    }

    private static void validate(Duration value, String name) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be zero or positive, got: " + value);
        }
    }
}
