package matriarch.core.model.directory;

/**
 * The requested principal does not exist in the directory.
 */
public class IdentityNotFoundException extends RuntimeException {

    private final String objectId;

    public IdentityNotFoundException(String objectId) {
        super("Identity not found: " + objectId);
        this.objectId = objectId;
    }

    public String objectId() {
        return objectId;
    }
}
