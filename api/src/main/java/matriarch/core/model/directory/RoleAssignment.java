package matriarch.core.model.directory;

/**
 * A role bound to a principal at a resource scope.
 *
 * <p>Read-only fact pulled from the directory; the engine only aggregates these.
 *
 * @param id               assignment identifier, the deduplication key
 * @param roleName         role definition name (e.g. "Reader")
 * @param scope            hierarchical resource path the role applies to
 * @param principalId      object id of the principal the role is assigned to
 * @param roleDefinitionId role definition resource id
 * @param principalType    principal kind as recorded on the assignment (e.g. "Group")
 */
public record RoleAssignment(
        String id, String roleName, String scope, String principalId, String roleDefinitionId, String principalType) {

    public RoleAssignment {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Role assignment ID cannot be null or blank");
        }
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("Role assignment principal ID cannot be null or blank");
        }
        if (roleName == null) {
            roleName = "";
        }
        if (scope == null) {
            scope = "";
        }
        if (roleDefinitionId == null) {
            roleDefinitionId = "";
        }
        if (principalType == null) {
            principalType = "";
        }
    }

    public static RoleAssignment of(String id, String roleName, String scope, String principalId) {
        return new RoleAssignment(id, roleName, scope, principalId, null, null);
    }
}
