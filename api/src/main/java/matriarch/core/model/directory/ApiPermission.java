package matriarch.core.model.directory;

/**
 * A permission on a target API held by a service principal.
 *
 * @param id                  grant identifier
 * @param resourceDisplayName display name of the target API
 * @param resourceId          object id of the target API's service principal
 * @param permissionType      how the permission was granted
 * @param permissionValue     permission value (e.g. "User.Read.All"), empty when unknown
 */
public record ApiPermission(
        String id,
        String resourceDisplayName,
        String resourceId,
        PermissionType permissionType,
        String permissionValue) {

    public ApiPermission {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("API permission ID cannot be null or blank");
        }
        if (permissionType == null) {
            permissionType = PermissionType.APPLICATION;
        }
        if (resourceDisplayName == null) {
            resourceDisplayName = "";
        }
        if (resourceId == null) {
            resourceId = "";
        }
        if (permissionValue == null) {
            permissionValue = "";
        }
    }
}
