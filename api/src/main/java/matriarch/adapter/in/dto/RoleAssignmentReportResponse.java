package matriarch.adapter.in.dto;

import java.util.List;
import java.util.Set;

import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.RoleAssignment;
import matriarch.core.model.directory.SecurityGroup;
import matriarch.core.model.resolution.IdentityRoleAssignmentResult;
import matriarch.core.model.resolution.PartialTraversalFailure;

/**
 * Response body for a resolved identity.
 *
 * @param identity                 the principal
 * @param directRoleAssignments    role assignments bound to the principal
 * @param securityGroups           ancestor groups with their own role assignments
 * @param apiPermissions           API permissions of a service principal
 * @param effectiveRoleAssignments deduplicated union of direct and inherited assignments
 * @param partial                  true if some groups could not be expanded
 * @param failedGroupIds           ids of the groups that could not be expanded
 */
public record RoleAssignmentReportResponse(
        Identity identity,
        List<RoleAssignment> directRoleAssignments,
        List<SecurityGroup> securityGroups,
        List<ApiPermission> apiPermissions,
        List<RoleAssignment> effectiveRoleAssignments,
        boolean partial,
        Set<String> failedGroupIds) {

    public static RoleAssignmentReportResponse from(IdentityRoleAssignmentResult result) {
        return new RoleAssignmentReportResponse(
                result.identity(),
                result.directRoleAssignments(),
                result.securityGroups(),
                result.apiPermissions(),
                result.effectiveRoleAssignments(),
                result.isPartial(),
                result.partialFailureDetails()
                        .map(PartialTraversalFailure::failedGroupIds)
                        .orElse(Set.of()));
    }
}
