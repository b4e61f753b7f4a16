package matriarch.core.service.resolution;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import matriarch.core.config.ParallelizationSettings;
import matriarch.core.model.directory.DirectoryException;
import matriarch.core.model.directory.DirectoryGroup;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.IdentityType;
import matriarch.core.model.directory.SecurityGroup;
import matriarch.core.model.resolution.AncestorGroups;
import matriarch.core.model.resolution.ResolutionCancellation;

/**
 * Computes the closure of groups an identity belongs to, directly or through nesting.
 *
 * <p>Breadth-first over an explicit frontier with a visited set, so cycles and
 * diamonds terminate and every group is expanded at most once. Each frontier is
 * split into chunks of {@code transitiveGroupBatchSize}. Groups within a chunk
 * are expanded concurrently, at most {@code maxConcurrentTransitiveGroupRequests}
 * at a time, and successive chunks are separated by {@code delayBetweenBatches}.
 *
 * <p>Expanding a group fetches its parents, then its own role assignments, so at
 * most {@code maxConcurrentTransitiveGroupRequests} directory requests of a chunk
 * are in flight at once. A group whose expansion fails is left out of the result
 * and reported in {@link AncestorGroups#failedGroupIds()}; its parents are not
 * explored.
 */
@ApplicationScoped
public class TransitiveGroupResolver {

    private static final Logger LOG = Logger.getLogger(TransitiveGroupResolver.class);

    private final CachingDirectoryAccess directory;
    private final int batchSize;
    private final int maxConcurrentRequests;
    private final Duration delayBetweenBatches;

    @Inject
    public TransitiveGroupResolver(CachingDirectoryAccess directory, ParallelizationSettings settings) {
        this.directory = directory;
        this.batchSize = settings.transitiveGroupBatchSize();
        this.maxConcurrentRequests = settings.maxConcurrentTransitiveGroupRequests();
        this.delayBetweenBatches = settings.delayBetweenBatches();
    }

    /**
     * Resolve every ancestor group of an identity.
     *
     * <p>A failure to read the identity's own memberships fails the whole call.
     * Failures on individual ancestor groups are recorded instead.
     *
     * @param identity     the identity to start from
     * @param cancellation token checked before each chunk and each directory call
     * @return Uni with the ancestor groups
     */
    public Uni<AncestorGroups> resolve(Identity identity, ResolutionCancellation cancellation) {
        final var seed = identity.type() == IdentityType.GROUP
                ? directory.groupParents(identity.objectId(), cancellation)
                : directory.directGroupMemberships(identity.objectId(), identity.type(), cancellation);

        return seed.chain(memberships -> {
            final var traversal = new Traversal();
            traversal.visited.add(identity.objectId());
            final var frontier = traversal.admit(memberships);
            LOG.debugf(
                    "Identity %s has %d direct group membership(s)", identity.objectId(), frontier.size());
            return expandLevel(frontier, traversal, cancellation, 1).map(ignored -> traversal.result());
        });
    }

    private Uni<Void> expandLevel(
            List<DirectoryGroup> frontier, Traversal traversal, ResolutionCancellation cancellation, int depth) {
        if (frontier.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        LOG.debugf("Expanding %d group(s) at depth %d", frontier.size(), depth);

        return Multi.createFrom()
                .iterable(partition(frontier))
                .onItem()
                .transformToUniAndConcatenate(chunk -> expandChunk(chunk, traversal, cancellation))
                .collect()
                .in(ArrayList<DirectoryGroup>::new, List::addAll)
                .chain(next -> expandLevel(next, traversal, cancellation, depth + 1));
    }

    private Uni<List<DirectoryGroup>> expandChunk(
            List<DirectoryGroup> chunk, Traversal traversal, ResolutionCancellation cancellation) {
        return Uni.createFrom().deferred(() -> pauseBeforeChunk(traversal)).chain(() -> {
            cancellation.throwIfCancelled("group batch");
            return Multi.createFrom()
                    .iterable(chunk)
                    .onItem()
                    .transformToUni(group -> expandGroup(group, traversal, cancellation))
                    .merge(maxConcurrentRequests)
                    .collect()
                    .in(ArrayList<DirectoryGroup>::new, List::addAll);
        });
    }

    private Uni<List<DirectoryGroup>> expandGroup(
            DirectoryGroup group, Traversal traversal, ResolutionCancellation cancellation) {
        return directory
                .groupParents(group.id(), cancellation)
                .chain(parents -> directory
                        .roleAssignments(group.id(), cancellation)
                        .map(assignments -> {
                            traversal.expanded.put(group.id(), SecurityGroup.from(group, assignments, parents));
                            return traversal.admit(parents);
                        }))
                .onFailure(DirectoryException.class)
                .recoverWithItem(failure -> {
                    LOG.warnv(
                            "Could not expand group {0}, continuing without it: {1}", group.id(), failure.getMessage());
                    traversal.failed.add(group.id());
                    return List.of();
                });
    }

    private Uni<Void> pauseBeforeChunk(Traversal traversal) {
        if (traversal.chunks.getAndIncrement() == 0 || delayBetweenBatches.isZero()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom().voidItem().onItem().delayIt().by(delayBetweenBatches);
    }

    private List<List<DirectoryGroup>> partition(List<DirectoryGroup> groups) {
        final List<List<DirectoryGroup>> chunks = new ArrayList<>();
        for (int i = 0; i < groups.size(); i += batchSize) {
            chunks.add(List.copyOf(groups.subList(i, Math.min(i + batchSize, groups.size()))));
        }
        return chunks;
    }

    /**
     * Mutable state of one traversal. Discarded once the result is built.
     */
    private static final class Traversal {
        private final Set<String> visited = ConcurrentHashMap.newKeySet();
        private final Map<String, SecurityGroup> expanded = new ConcurrentHashMap<>();
        private final Set<String> failed = ConcurrentHashMap.newKeySet();
        private final AtomicInteger chunks = new AtomicInteger();

        /**
         * Mark groups as visited, returning only those not seen before.
         */
        List<DirectoryGroup> admit(List<DirectoryGroup> groups) {
            final List<DirectoryGroup> fresh = new ArrayList<>();
            for (final var group : groups) {
                if (visited.add(group.id())) {
                    fresh.add(group);
                }
            }
            return fresh;
        }

        AncestorGroups result() {
            return new AncestorGroups(List.copyOf(expanded.values()), Set.copyOf(failed));
        }
    }
}
