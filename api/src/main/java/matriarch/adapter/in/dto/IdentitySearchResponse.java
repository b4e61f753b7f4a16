package matriarch.adapter.in.dto;

import java.util.List;

import matriarch.core.model.directory.Identity;
import matriarch.core.model.resolution.IdentitySearchResult;

/**
 * Response body for an identity search.
 *
 * @param query           the search text as received
 * @param identities      matching principals
 * @param multipleResults true when more than one principal matched
 */
public record IdentitySearchResponse(String query, List<Identity> identities, boolean multipleResults) {

    public static IdentitySearchResponse from(String query, IdentitySearchResult result) {
        return new IdentitySearchResponse(query, result.identities(), result.hasMultipleResults());
    }
}
