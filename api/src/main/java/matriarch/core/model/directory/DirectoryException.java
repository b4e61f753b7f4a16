package matriarch.core.model.directory;

/**
 * Base exception for failures talking to the directory.
 */
public class DirectoryException extends RuntimeException {

    public DirectoryException(String message) {
        super(message);
    }

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
