package matriarch.core.model.directory;

/**
 * A security group as returned by a membership query.
 *
 * @param id          group object id
 * @param displayName human-readable name
 * @param description optional description
 */
public record DirectoryGroup(String id, String displayName, String description) {

    public DirectoryGroup {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Group ID cannot be null or blank");
        }
        if (displayName == null) {
            displayName = "";
        }
        if (description == null) {
            description = "";
        }
    }

    public static DirectoryGroup of(String id, String displayName) {
        return new DirectoryGroup(id, displayName, null);
    }
}
