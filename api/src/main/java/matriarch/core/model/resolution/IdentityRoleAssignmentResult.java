package matriarch.core.model.resolution;

import java.util.List;
import java.util.Optional;

import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.RoleAssignment;
import matriarch.core.model.directory.SecurityGroup;

/**
 * Effective permissions of a single identity.
 *
 * <p>Produced fresh per resolution and holds no reference to traversal state.
 *
 * @param identity                 the resolved principal
 * @param directRoleAssignments    role assignments bound to the principal itself
 * @param securityGroups           every ancestor group, each with its own role assignments
 * @param apiPermissions           API permissions, empty for users and groups
 * @param effectiveRoleAssignments deduplicated union of direct and inherited role assignments
 * @param partialFailure           set when some groups could not be expanded
 */
public record IdentityRoleAssignmentResult(
        Identity identity,
        List<RoleAssignment> directRoleAssignments,
        List<SecurityGroup> securityGroups,
        List<ApiPermission> apiPermissions,
        List<RoleAssignment> effectiveRoleAssignments,
        PartialTraversalFailure partialFailure) {

    public IdentityRoleAssignmentResult {
        if (identity == null) {
            throw new IllegalArgumentException("Identity cannot be null");
        }
        directRoleAssignments = directRoleAssignments == null ? List.of() : List.copyOf(directRoleAssignments);
        securityGroups = securityGroups == null ? List.of() : List.copyOf(securityGroups);
        apiPermissions = apiPermissions == null ? List.of() : List.copyOf(apiPermissions);
        effectiveRoleAssignments =
                effectiveRoleAssignments == null ? List.of() : List.copyOf(effectiveRoleAssignments);
    }

    public Optional<PartialTraversalFailure> partialFailureDetails() {
        return Optional.ofNullable(partialFailure);
    }

    public boolean isPartial() {
        return partialFailure != null;
    }
}
