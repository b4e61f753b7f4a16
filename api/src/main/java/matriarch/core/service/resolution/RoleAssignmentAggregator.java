package matriarch.core.service.resolution;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.RoleAssignment;
import matriarch.core.model.directory.SecurityGroup;
import matriarch.core.model.resolution.AncestorGroups;
import matriarch.core.model.resolution.IdentityRoleAssignmentResult;
import matriarch.core.model.resolution.PartialTraversalFailure;

/**
 * Merges direct and inherited role assignments into a deterministic result.
 *
 * <p>Assignments are deduplicated by id, direct ones first. Groups keep their own
 * assignment lists. Output order does not depend on traversal order: groups are
 * sorted by display name then id, effective assignments by role name, scope then id.
 */
@ApplicationScoped
public class RoleAssignmentAggregator {

    static final Comparator<SecurityGroup> GROUP_ORDER =
            Comparator.comparing(SecurityGroup::displayName).thenComparing(SecurityGroup::id);

    static final Comparator<RoleAssignment> ASSIGNMENT_ORDER = Comparator.comparing(RoleAssignment::roleName)
            .thenComparing(RoleAssignment::scope)
            .thenComparing(RoleAssignment::id);

    public IdentityRoleAssignmentResult aggregate(
            Identity identity,
            List<RoleAssignment> directAssignments,
            AncestorGroups ancestors,
            List<ApiPermission> apiPermissions) {
        final var groups = new ArrayList<>(ancestors.groups());
        groups.sort(GROUP_ORDER);

        final Map<String, RoleAssignment> effective = new LinkedHashMap<>();
        directAssignments.forEach(assignment -> effective.putIfAbsent(assignment.id(), assignment));
        groups.stream()
                .flatMap(group -> group.roleAssignments().stream())
                .forEach(assignment -> effective.putIfAbsent(assignment.id(), assignment));

        final var effectiveAssignments = new ArrayList<>(effective.values());
        effectiveAssignments.sort(ASSIGNMENT_ORDER);

        final Map<String, ApiPermission> permissions = new LinkedHashMap<>();
        apiPermissions.forEach(permission -> permissions.putIfAbsent(permission.id(), permission));

        final var partialFailure =
                ancestors.isComplete() ? null : new PartialTraversalFailure(ancestors.failedGroupIds());

        return new IdentityRoleAssignmentResult(
                identity,
                directAssignments,
                groups,
                List.copyOf(permissions.values()),
                effectiveAssignments,
                partialFailure);
    }
}
