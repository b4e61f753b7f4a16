package matriarch.core.model.directory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A security group reached while resolving an identity, with the role
 * assignments bound directly to it.
 *
 * <p>Parent links are held by id only. The membership graph may contain cycles,
 * so a group never owns its parents.
 *
 * @param id              group object id
 * @param displayName     human-readable name
 * @param description     optional description
 * @param roleAssignments role assignments whose principal is this group
 * @param parentGroupIds  ids of the groups this group is a direct member of
 */
public record SecurityGroup(
        String id,
        String displayName,
        String description,
        List<RoleAssignment> roleAssignments,
        Set<String> parentGroupIds) {

    public SecurityGroup {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Group ID cannot be null or blank");
        }
        if (displayName == null) {
            displayName = "";
        }
        if (description == null) {
            description = "";
        }
        roleAssignments = roleAssignments == null ? List.of() : List.copyOf(roleAssignments);
        parentGroupIds = parentGroupIds == null ? Set.of() : Set.copyOf(parentGroupIds);
    }

    /**
     * Build a security group from a directory record and its fetched relations.
     *
     * @param group           the directory record
     * @param roleAssignments role assignments bound to the group
     * @param parents         the group's direct parents
     * @return a new SecurityGroup
     */
    public static SecurityGroup from(
            DirectoryGroup group, List<RoleAssignment> roleAssignments, List<DirectoryGroup> parents) {
        final var parentIds = parents.stream().map(DirectoryGroup::id).collect(Collectors.toSet());
        return new SecurityGroup(group.id(), group.displayName(), group.description(), roleAssignments, parentIds);
    }
}
