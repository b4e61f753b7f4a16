package matriarch.core.model.resolution;

import java.util.Set;

/**
 * Marks a result whose group closure is incomplete because some groups could not be expanded.
 *
 * @param failedGroupIds ids of the groups whose parents or role assignments could not be fetched
 */
public record PartialTraversalFailure(Set<String> failedGroupIds) {

    public PartialTraversalFailure {
        if (failedGroupIds == null || failedGroupIds.isEmpty()) {
            throw new IllegalArgumentException("A partial failure must name at least one group");
        }
        failedGroupIds = Set.copyOf(failedGroupIds);
    }
}
