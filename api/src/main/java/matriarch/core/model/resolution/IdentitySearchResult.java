package matriarch.core.model.resolution;

import java.util.List;

import matriarch.core.model.directory.Identity;

/**
 * Principals matching a search query. Zero, one and many matches are all successful outcomes.
 *
 * @param identities matching principals
 */
public record IdentitySearchResult(List<Identity> identities) {

    public IdentitySearchResult {
        identities = identities == null ? List.of() : List.copyOf(identities);
    }

    public boolean hasMultipleResults() {
        return identities.size() > 1;
    }

    public boolean isEmpty() {
        return identities.isEmpty();
    }

    /**
     * The only match.
     *
     * @return the single identity
     * @throws IllegalStateException if there is not exactly one match
     */
    public Identity single() {
        if (identities.size() != 1) {
            throw new IllegalStateException("Expected exactly one identity but found " + identities.size());
        }
        return identities.get(0);
    }
}
