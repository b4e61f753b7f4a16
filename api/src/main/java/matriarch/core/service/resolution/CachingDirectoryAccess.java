package matriarch.core.service.resolution;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import matriarch.core.config.CacheConfig;
import matriarch.core.model.cache.CacheEntry;
import matriarch.core.model.cache.CacheKey;
import matriarch.core.model.cache.RecordKind;
import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.DirectoryGroup;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.IdentityType;
import matriarch.core.model.directory.PermanentDirectoryException;
import matriarch.core.model.directory.RoleAssignment;
import matriarch.core.model.directory.TransientDirectoryException;
import matriarch.core.model.resolution.ResolutionCancellation;
import matriarch.core.port.out.DirectoryCache;
import matriarch.core.port.out.DirectoryClient;
import matriarch.core.port.out.ResolutionMetrics;

/**
 * Single entry point for directory reads during resolution.
 *
 * <p>Each read goes cache, then in-flight coalescing, then retry around the
 * bulkhead around the client. Concurrent reads of the same key within the
 * freshness window reach the directory at most once: the first caller's fetch is
 * shared, it checks the cache again before calling out, and it stores its
 * result before it stops being shared.
 *
 * <p>With caching disabled this is a pass-through that only adds retry and the
 * bulkhead.
 *
 * <p>Every eviction or clear starts a new cache generation. A fetch that began in
 * an earlier generation still answers its callers but never writes to the cache,
 * and later reads start a fresh fetch.
 *
 * <p>Cache failures are logged and treated as misses or dropped writes.
 */
@ApplicationScoped
public class CachingDirectoryAccess {

    private static final Logger LOG = Logger.getLogger(CachingDirectoryAccess.class);

    private final DirectoryClient client;
    private final DirectoryCache cache;
    private final DirectoryRetryPolicy retryPolicy;
    private final RequestBulkhead bulkhead;
    private final ResolutionMetrics metrics;
    private final boolean cachingEnabled;
    private final Map<CacheKey, Uni<Object>> inFlightFetches = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();

    @Inject
    public CachingDirectoryAccess(
            DirectoryClient client,
            DirectoryCache cache,
            CacheConfig cacheConfig,
            DirectoryRetryPolicy retryPolicy,
            RequestBulkhead bulkhead,
            ResolutionMetrics metrics) {
        this(client, cache, cacheConfig.enabled(), retryPolicy, bulkhead, metrics);
    }

    public CachingDirectoryAccess(
            DirectoryClient client,
            DirectoryCache cache,
            boolean cachingEnabled,
            DirectoryRetryPolicy retryPolicy,
            RequestBulkhead bulkhead,
            ResolutionMetrics metrics) {
        this.client = client;
        this.cache = cache;
        this.cachingEnabled = cachingEnabled;
        this.retryPolicy = retryPolicy;
        this.bulkhead = bulkhead;
        this.metrics = metrics;
    }

    public Uni<Optional<Identity>> findPrincipal(String objectId, ResolutionCancellation cancellation) {
        return read(
                CacheKey.of(objectId, RecordKind.PRINCIPAL),
                "findPrincipal",
                cancellation,
                () -> client.findPrincipal(objectId));
    }

    public Uni<List<DirectoryGroup>> directGroupMemberships(
            String principalId, IdentityType type, ResolutionCancellation cancellation) {
        return read(
                CacheKey.of(principalId, RecordKind.MEMBERSHIPS),
                "getDirectGroupMemberships",
                cancellation,
                () -> client.getDirectGroupMemberships(principalId, type));
    }

    public Uni<List<DirectoryGroup>> groupParents(String groupId, ResolutionCancellation cancellation) {
        return read(
                CacheKey.of(groupId, RecordKind.MEMBERSHIPS),
                "getGroupParents",
                cancellation,
                () -> client.getGroupParents(groupId));
    }

    public Uni<List<RoleAssignment>> roleAssignments(String principalId, ResolutionCancellation cancellation) {
        return read(
                CacheKey.of(principalId, RecordKind.ROLE_ASSIGNMENTS),
                "getRoleAssignments",
                cancellation,
                () -> client.getRoleAssignments(principalId));
    }

    public Uni<List<ApiPermission>> apiPermissions(String principalId, ResolutionCancellation cancellation) {
        return read(
                CacheKey.of(principalId, RecordKind.API_PERMISSIONS),
                "getApiPermissions",
                cancellation,
                () -> client.getApiPermissions(principalId));
    }

    /**
     * Search is never cached; it only gets retry and the bulkhead.
     */
    public Uni<List<Identity>> searchPrincipals(String query) {
        return remote("searchPrincipals", ResolutionCancellation.create(), () -> client.searchPrincipals(query));
    }

    public Uni<Void> invalidate(String principalId) {
        if (!cachingEnabled) {
            return Uni.createFrom().voidItem();
        }
        LOG.infov("Evicting cached directory records for {0}", principalId);
        generation.incrementAndGet();
        inFlightFetches.keySet().removeIf(key -> key.principalId().equals(principalId));
        final var invalidations = Arrays.stream(RecordKind.values())
                .map(kind -> cache.invalidate(CacheKey.of(principalId, kind)))
                .toList();
        return Uni.combine().all().unis(invalidations).discardItems();
    }

    public Uni<Void> invalidateAll() {
        if (!cachingEnabled) {
            return Uni.createFrom().voidItem();
        }
        LOG.info("Clearing all cached directory records");
        generation.incrementAndGet();
        inFlightFetches.clear();
        return cache.invalidateAll();
    }

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    private <T> Uni<T> read(
            CacheKey key, String operation, ResolutionCancellation cancellation, Supplier<Uni<T>> call) {
        if (!cachingEnabled) {
            return remote(operation, cancellation, call);
        }
        return Uni.createFrom().deferred(() -> {
            cancellation.throwIfCancelled(operation);
            return lookup(key).chain(hit -> {
                if (hit.isPresent()) {
                    LOG.debugf("Cache hit for %s", key.asString());
                    metrics.recordCacheHit(key.kind());
                    return Uni.createFrom().item(this.<T>unwrap(hit.get()));
                }
                LOG.debugf("Cache miss for %s", key.asString());
                metrics.recordCacheMiss(key.kind());
                return coalesce(key, operation, call);
            });
        });
    }

    /**
     * Join an existing fetch for the key or start a new one.
     */
    @SuppressWarnings("unchecked")
    private <T> Uni<T> coalesce(CacheKey key, String operation, Supplier<Uni<T>> call) {
        return Uni.createFrom()
                .deferred(() -> inFlightFetches.computeIfAbsent(key, k -> createFetch(k, operation, call)))
                .map(value -> (T) value);
    }

    private <T> Uni<Object> createFetch(CacheKey key, String operation, Supplier<Uni<T>> call) {
        final long startedIn = generation.get();
        final var self = new AtomicReference<Uni<Object>>();
        final Uni<Object> fetch = lookup(key).chain(existing -> {
            if (existing.isPresent()) {
                return Uni.createFrom().item(existing.get().value());
            }
            return remote(operation, ResolutionCancellation.create(), call)
                    .call(value -> storeIfCurrent(key, value, startedIn))
                    .map(value -> (Object) value);
        });
        final Uni<Object> shared = fetch.onTermination()
                .invoke(() -> inFlightFetches.remove(key, self.get()))
                .memoize()
                .indefinitely();
        self.set(shared);
        return shared;
    }

    private <T> Uni<T> remote(String operation, ResolutionCancellation cancellation, Supplier<Uni<T>> call) {
        return retryPolicy.execute(operation, () -> {
            cancellation.throwIfCancelled(operation);
            return bulkhead.submit(() -> call.get()
                    .invoke(() -> metrics.recordDirectoryCall(operation, "success"))
                    .onFailure()
                    .invoke(failure -> metrics.recordDirectoryCall(operation, outcomeOf(failure))));
        });
    }

    /**
     * Store a fetched value unless the cache was evicted or cleared since the fetch
     * began. A clear that lands during the write is undone by invalidating the key.
     */
    private Uni<Void> storeIfCurrent(CacheKey key, Object value, long startedIn) {
        if (generation.get() != startedIn) {
            LOG.debugf("Discarding %s fetched before a cache clear", key.asString());
            return Uni.createFrom().voidItem();
        }
        return store(key, value).chain(() -> {
            if (generation.get() == startedIn) {
                return Uni.createFrom().voidItem();
            }
            return cache.invalidate(key).onFailure().recoverWithUni(failure -> {
                LOG.warnv("Cache invalidation failed for {0}: {1}", key.asString(), failure.getMessage());
                return Uni.createFrom().voidItem();
            });
        });
    }

    private Uni<Optional<CacheEntry>> lookup(CacheKey key) {
        return cache.get(key).onFailure().recoverWithItem(failure -> {
            LOG.warnv("Cache read failed for {0}, treating as miss: {1}", key.asString(), failure.getMessage());
            return Optional.empty();
        });
    }

    private Uni<Void> store(CacheKey key, Object value) {
        return cache.put(key, CacheEntry.of(value)).onFailure().recoverWithUni(failure -> {
            LOG.warnv("Cache write failed for {0}: {1}", key.asString(), failure.getMessage());
            return Uni.createFrom().voidItem();
        });
    }

    @SuppressWarnings("unchecked")
    private <T> T unwrap(CacheEntry entry) {
        return (T) entry.value();
    }

    private static String outcomeOf(Throwable failure) {
        if (failure instanceof TransientDirectoryException) {
            return "transient";
        }
        if (failure instanceof PermanentDirectoryException) {
            return "permanent";
        }
        return "error";
    }
}
