package matriarch.core.model.directory;

/**
 * A directory failure that retrying cannot fix (bad request, authorization
 * failure, malformed response).
 */
public class PermanentDirectoryException extends DirectoryException {

    private final int statusCode;

    public PermanentDirectoryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PermanentDirectoryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int statusCode() {
        return statusCode;
    }
}
