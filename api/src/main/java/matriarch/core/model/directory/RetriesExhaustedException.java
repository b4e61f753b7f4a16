package matriarch.core.model.directory;

/**
 * Terminal failure after every permitted attempt of a directory call failed transiently.
 */
public class RetriesExhaustedException extends DirectoryException {

    private final String operation;
    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Throwable lastCause) {
        super("Directory operation '" + operation + "' failed after " + attempts + " attempt(s)", lastCause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String operation() {
        return operation;
    }

    public int attempts() {
        return attempts;
    }
}
