package matriarch.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for directory call concurrency and retry.
 *
 * <p>Configuration prefix: {@code matriarch.parallelization}
 *
 * <p>The transitive group budget ({@link #maxConcurrentTransitiveGroupRequests()}) is
 * independent of the global ceiling ({@link #maxDegreeOfParallelism()}).
 *
 * @see ParallelizationSettings
 */
@ConfigMapping(prefix = "matriarch.parallelization")
public interface ParallelizationConfig {

    /**
     * Ceiling on in-flight directory calls across all concurrent resolutions.
     *
     * @return max in-flight calls (default: 4)
     */
    @WithDefault("4")
    int maxDegreeOfParallelism();

    /**
     * Total attempts per directory call, first call included.
     *
     * @return max attempts (default: 3)
     */
    @WithDefault("3")
    int maxRetryAttempts();

    /**
     * Fixed wait between attempts.
     *
     * @return retry delay (default: 1 second)
     */
    @WithDefault("PT1S")
    Duration retryDelay();

    /**
     * Concurrent group expansions within one traversal chunk.
     *
     * @return max concurrent group requests (default: 5)
     */
    @WithDefault("5")
    int maxConcurrentTransitiveGroupRequests();

    /**
     * Groups expanded per traversal chunk.
     *
     * @return chunk size (default: 10)
     */
    @WithDefault("10")
    int transitiveGroupBatchSize();

    /**
     * Pause between successive traversal chunks.
     *
     * @return inter-chunk delay (default: 100 milliseconds)
     */
    @WithDefault("PT0.1S")
    Duration delayBetweenBatches();
}
