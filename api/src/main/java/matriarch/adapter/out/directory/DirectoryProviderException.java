package matriarch.adapter.out.directory;

/**
 * Exception thrown when the configured directory adapter cannot be created.
 */
public class DirectoryProviderException extends RuntimeException {

    public DirectoryProviderException(String message) {
        super(message);
    }
}
