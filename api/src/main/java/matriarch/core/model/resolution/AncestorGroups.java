package matriarch.core.model.resolution;

import java.util.List;
import java.util.Set;

import matriarch.core.model.directory.SecurityGroup;

/**
 * Outcome of a transitive group traversal.
 *
 * @param groups         every successfully expanded ancestor group, each exactly once
 * @param failedGroupIds ids of groups whose expansion failed
 */
public record AncestorGroups(List<SecurityGroup> groups, Set<String> failedGroupIds) {

    public AncestorGroups {
        groups = groups == null ? List.of() : List.copyOf(groups);
        failedGroupIds = failedGroupIds == null ? Set.of() : Set.copyOf(failedGroupIds);
    }

    public static AncestorGroups empty() {
        return new AncestorGroups(List.of(), Set.of());
    }

    public boolean isComplete() {
        return failedGroupIds.isEmpty();
    }
}
