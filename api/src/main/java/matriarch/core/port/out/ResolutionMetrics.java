package matriarch.core.port.out;

import matriarch.core.model.cache.RecordKind;

/**
 * Port for recording resolution metrics.
 */
public interface ResolutionMetrics {

    boolean isEnabled();

    /**
     * Record a directory call attempt.
     *
     * @param operation operation name (e.g. "getGroupParents")
     * @param outcome   "success", "transient" or "permanent"
     */
    void recordDirectoryCall(String operation, String outcome);

    void recordRetry(String operation);

    void recordCacheHit(RecordKind kind);

    void recordCacheMiss(RecordKind kind);

    /**
     * Record a finished resolution.
     *
     * @param outcome    "success", "partial", "not_found", "cancelled", "timeout" or "error"
     * @param durationMs elapsed time in milliseconds
     */
    void recordResolution(String outcome, long durationMs);

    void recordPartialResolution();
}
