package matriarch.core.model.resolution;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token shared by every step of a single resolution.
 *
 * <p>The traversal checks the token before each batch and each remote call. Once
 * cancelled a token stays cancelled.
 */
public final class ResolutionCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static ResolutionCancellation create() {
        return new ResolutionCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Fail fast if the resolution has been cancelled.
     *
     * @param step description of the step about to start
     * @throws ResolutionCancelledException if cancelled
     */
    public void throwIfCancelled(String step) {
        if (cancelled.get()) {
            throw new ResolutionCancelledException("Resolution cancelled before " + step);
        }
    }
}
