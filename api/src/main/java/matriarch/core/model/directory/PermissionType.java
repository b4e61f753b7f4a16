package matriarch.core.model.directory;

/**
 * How an API permission was granted.
 */
public enum PermissionType {
    /** Granted to the application itself (app role assignment). */
    APPLICATION,
    /** Granted on behalf of a signed-in user (OAuth2 permission grant). */
    DELEGATED
}
