package matriarch.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.DirectoryGroup;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.IdentityType;
import matriarch.core.model.directory.RoleAssignment;

/**
 * Port for read-only queries against the cloud directory.
 *
 * <p>Every operation fails with
 * {@link matriarch.core.model.directory.TransientDirectoryException} for faults
 * worth retrying and {@link matriarch.core.model.directory.PermanentDirectoryException}
 * otherwise. Implementations follow paging to completion and return only
 * security-enabled groups.
 */
public interface DirectoryClient {

    /**
     * Look up a principal by object id.
     *
     * @param objectId the object id
     * @return Uni with the principal, or empty if no principal has that id
     */
    Uni<Optional<Identity>> findPrincipal(String objectId);

    /**
     * Groups the principal is a direct member of.
     *
     * @param principalId the principal's object id
     * @param type        the principal's kind, selecting the directory collection to query
     * @return Uni with the direct security group memberships
     */
    Uni<List<DirectoryGroup>> getDirectGroupMemberships(String principalId, IdentityType type);

    /**
     * Groups a group is a direct member of.
     *
     * @param groupId the group's object id
     * @return Uni with the parent groups
     */
    Uni<List<DirectoryGroup>> getGroupParents(String groupId);

    /**
     * Role assignments bound directly to a principal.
     *
     * @param principalId the principal's object id
     * @return Uni with the role assignments
     */
    Uni<List<RoleAssignment>> getRoleAssignments(String principalId);

    /**
     * API permissions held by a service principal.
     *
     * @param principalId the service principal's object id
     * @return Uni with the API permissions
     */
    Uni<List<ApiPermission>> getApiPermissions(String principalId);

    /**
     * Find principals matching a query. See
     * {@link matriarch.core.port.in.IdentityResolution#searchIdentities(String)} for matching rules.
     *
     * @param query non-blank search text
     * @return Uni with matching principals
     */
    Uni<List<Identity>> searchPrincipals(String query);
}
