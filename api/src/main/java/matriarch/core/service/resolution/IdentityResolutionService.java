package matriarch.core.service.resolution;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import matriarch.core.config.ResolutionConfig;
import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.IdentityNotFoundException;
import matriarch.core.model.resolution.IdentityRoleAssignmentResult;
import matriarch.core.model.resolution.IdentitySearchResult;
import matriarch.core.model.resolution.ResolutionCancellation;
import matriarch.core.model.resolution.ResolutionCancelledException;
import matriarch.core.model.resolution.ResolutionTimeoutException;
import matriarch.core.port.in.IdentityResolution;
import matriarch.core.port.out.ResolutionMetrics;

/**
 * Resolves the effective permissions of directory identities.
 *
 * <p>A resolution fetches the identity, then its direct role assignments, its
 * ancestor groups and its API permissions concurrently, and aggregates them.
 * Only service principals and managed identities are asked for API permissions.
 *
 * <p>The whole call is bounded by {@code matriarch.resolution.timeout}. Timing
 * out or cancelling the subscription cancels the resolution's token so no further
 * directory calls start.
 */
@ApplicationScoped
public class IdentityResolutionService implements IdentityResolution {

    private static final Logger LOG = Logger.getLogger(IdentityResolutionService.class);

    private final CachingDirectoryAccess directory;
    private final TransitiveGroupResolver groupResolver;
    private final RoleAssignmentAggregator aggregator;
    private final ResolutionMetrics metrics;
    private final Duration timeout;

    @Inject
    public IdentityResolutionService(
            CachingDirectoryAccess directory,
            TransitiveGroupResolver groupResolver,
            RoleAssignmentAggregator aggregator,
            ResolutionMetrics metrics,
            ResolutionConfig resolutionConfig) {
        this.directory = directory;
        this.groupResolver = groupResolver;
        this.aggregator = aggregator;
        this.metrics = metrics;
        this.timeout = resolutionConfig.timeout();
    }

    @Override
    public Uni<IdentityRoleAssignmentResult> resolveIdentity(String objectId) {
        return resolveIdentity(objectId, ResolutionCancellation.create());
    }

    @Override
    public Uni<IdentityRoleAssignmentResult> resolveIdentity(String objectId, ResolutionCancellation cancellation) {
        if (objectId == null || objectId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Object ID cannot be null or blank"));
        }

        return Uni.createFrom().deferred(() -> {
            final long start = System.nanoTime();
            LOG.infov("Resolving effective permissions for {0}", objectId);

            return directory
                    .findPrincipal(objectId, cancellation)
                    .chain(found -> found.map(identity -> Uni.createFrom().item(identity))
                            .orElseGet(() -> Uni.createFrom().failure(new IdentityNotFoundException(objectId))))
                    .chain(identity -> gather(identity, cancellation))
                    .ifNoItem()
                    .after(timeout)
                    .failWith(() -> {
                        cancellation.cancel();
                        return new ResolutionTimeoutException(objectId, timeout);
                    })
                    .onCancellation()
                    .invoke(() -> {
                        LOG.infov("Resolution of {0} cancelled by caller", objectId);
                        cancellation.cancel();
                    })
                    .invoke(result -> onResolved(result, elapsedMillis(start)))
                    .onFailure()
                    .invoke(failure -> onFailed(objectId, failure, elapsedMillis(start)));
        });
    }

    private Uni<IdentityRoleAssignmentResult> gather(Identity identity, ResolutionCancellation cancellation) {
        return Uni.combine()
                .all()
                .unis(
                        directory.roleAssignments(identity.objectId(), cancellation),
                        groupResolver.resolve(identity, cancellation),
                        apiPermissions(identity, cancellation))
                .asTuple()
                .map(parts -> {
                    cancellation.throwIfCancelled("aggregation");
                    return aggregator.aggregate(identity, parts.getItem1(), parts.getItem2(), parts.getItem3());
                });
    }

    private Uni<List<ApiPermission>> apiPermissions(Identity identity, ResolutionCancellation cancellation) {
        if (!identity.type().isServicePrincipalBacked()) {
            return Uni.createFrom().item(List.of());
        }
        return directory.apiPermissions(identity.objectId(), cancellation);
    }

    @Override
    public Uni<IdentitySearchResult> searchIdentities(String query) {
        if (query == null || query.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Search query cannot be blank"));
        }
        final var trimmed = query.trim();
        return directory.searchPrincipals(trimmed).map(found -> {
            final Map<String, Identity> unique = new LinkedHashMap<>();
            found.forEach(identity -> unique.putIfAbsent(identity.objectId(), identity));
            LOG.debugf("Search '%s' matched %d identities", trimmed, unique.size());
            return new IdentitySearchResult(List.copyOf(unique.values()));
        });
    }

    @Override
    public Uni<Void> clearCache() {
        return directory.invalidateAll();
    }

    @Override
    public Uni<Void> evict(String principalId) {
        if (principalId == null || principalId.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Principal ID cannot be null or blank"));
        }
        return directory.invalidate(principalId);
    }

    private void onResolved(IdentityRoleAssignmentResult result, long elapsedMs) {
        final var identity = result.identity();
        if (result.isPartial()) {
            LOG.warnv(
                    "Resolved {0} with partial group closure; failed groups: {1}",
                    identity.objectId(), result.partialFailure().failedGroupIds());
            metrics.recordPartialResolution();
        }
        LOG.infov(
                "Resolved {0} ({1}) in {2}ms: {3} direct, {4} group(s), {5} effective, {6} API permission(s)",
                identity.objectId(),
                identity.type(),
                elapsedMs,
                result.directRoleAssignments().size(),
                result.securityGroups().size(),
                result.effectiveRoleAssignments().size(),
                result.apiPermissions().size());
        metrics.recordResolution(result.isPartial() ? "partial" : "success", elapsedMs);
    }

    private void onFailed(String objectId, Throwable failure, long elapsedMs) {
        final String outcome;
        if (failure instanceof IdentityNotFoundException) {
            outcome = "not_found";
            LOG.infov("Identity {0} not found", objectId);
        } else if (failure instanceof ResolutionCancelledException) {
            outcome = "cancelled";
            LOG.infov("Resolution of {0} cancelled", objectId);
        } else if (failure instanceof ResolutionTimeoutException) {
            outcome = "timeout";
            LOG.warnv("Resolution of {0} timed out after {1}", objectId, timeout);
        } else {
            outcome = "error";
            LOG.warnv("Resolution of {0} failed: {1}", objectId, failure.getMessage());
        }
        metrics.recordResolution(outcome, elapsedMs);
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
