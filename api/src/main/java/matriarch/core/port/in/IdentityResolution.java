package matriarch.core.port.in;

import io.smallrye.mutiny.Uni;

import matriarch.core.model.resolution.IdentityRoleAssignmentResult;
import matriarch.core.model.resolution.IdentitySearchResult;
import matriarch.core.model.resolution.ResolutionCancellation;

/**
 * Port for resolving the effective permissions of directory identities.
 *
 * <p>This is the only port presentation code talks to. Directory access,
 * caching and retries stay behind it.
 */
public interface IdentityResolution {

    /**
     * Resolve the effective role assignments and API permissions of a principal.
     *
     * @param objectId object id of the principal
     * @return Uni with the result; fails with
     *         {@link matriarch.core.model.directory.IdentityNotFoundException} when the principal does not exist
     */
    Uni<IdentityRoleAssignmentResult> resolveIdentity(String objectId);

    /**
     * Resolve the effective permissions of a principal under a caller-owned cancellation token.
     *
     * <p>Cancelling the token stops new directory calls and fails the resolution with
     * {@link matriarch.core.model.resolution.ResolutionCancelledException}.
     *
     * @param objectId     object id of the principal
     * @param cancellation cancellation token
     * @return Uni with the result
     */
    Uni<IdentityRoleAssignmentResult> resolveIdentity(String objectId, ResolutionCancellation cancellation);

    /**
     * Find principals matching a free-form query.
     *
     * <p>A GUID is looked up exactly, an input containing {@code @} is matched against
     * mail and user principal name, anything else is a display-name prefix search.
     *
     * @param query the search text
     * @return Uni with the matches, possibly none
     * @throws IllegalArgumentException if the query is blank
     */
    Uni<IdentitySearchResult> searchIdentities(String query);

    /**
     * Drop every cached directory record.
     */
    Uni<Void> clearCache();

    /**
     * Drop every cached record of one principal.
     *
     * @param principalId object id of the principal
     */
    Uni<Void> evict(String principalId);
}
