package matriarch.core.model.resolution;

/**
 * A resolution was cancelled before it completed. Partial work is discarded.
 */
public class ResolutionCancelledException extends RuntimeException {

    public ResolutionCancelledException(String message) {
        super(message);
    }
}
