package matriarch.core.service.resolution;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

import matriarch.adapter.out.memory.InMemoryDirectoryClient;
import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.DirectoryGroup;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.IdentityType;
import matriarch.core.model.directory.RoleAssignment;
import matriarch.core.port.out.DirectoryClient;

/**
 * Test directory that delegates to an in-memory directory, counts calls per
 * operation and id, and can inject latency, failures and side effects.
 */
class CountingDirectoryClient implements DirectoryClient {

    private final InMemoryDirectoryClient delegate;
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Map<String, Supplier<RuntimeException>> failures = new ConcurrentHashMap<>();
    private final Map<String, Consumer<String>> hooks = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile Duration latency = Duration.ZERO;

    CountingDirectoryClient(InMemoryDirectoryClient delegate) {
        this.delegate = delegate;
    }

    CountingDirectoryClient withLatency(Duration latency) {
        this.latency = latency;
        return this;
    }

    CountingDirectoryClient failOn(String operation, String id, Supplier<RuntimeException> failure) {
        failures.put(key(operation, id), failure);
        return this;
    }

    CountingDirectoryClient onCall(String operation, String id, Consumer<String> hook) {
        hooks.put(key(operation, id), hook);
        return this;
    }

    int calls(String operation, String id) {
        final var count = calls.get(key(operation, id));
        return count == null ? 0 : count.get();
    }

    int totalCalls(String operation) {
        return calls.entrySet().stream()
                .filter(entry -> entry.getKey().startsWith(operation + ":"))
                .mapToInt(entry -> entry.getValue().get())
                .sum();
    }

    int maxInFlight() {
        return maxInFlight.get();
    }

    @Override
    public Uni<Optional<Identity>> findPrincipal(String objectId) {
        return track("findPrincipal", objectId, () -> delegate.findPrincipal(objectId));
    }

    @Override
    public Uni<List<DirectoryGroup>> getDirectGroupMemberships(String principalId, IdentityType type) {
        return track(
                "getDirectGroupMemberships",
                principalId,
                () -> delegate.getDirectGroupMemberships(principalId, type));
    }

    @Override
    public Uni<List<DirectoryGroup>> getGroupParents(String groupId) {
        return track("getGroupParents", groupId, () -> delegate.getGroupParents(groupId));
    }

    @Override
    public Uni<List<RoleAssignment>> getRoleAssignments(String principalId) {
        return track("getRoleAssignments", principalId, () -> delegate.getRoleAssignments(principalId));
    }

    @Override
    public Uni<List<ApiPermission>> getApiPermissions(String principalId) {
        return track("getApiPermissions", principalId, () -> delegate.getApiPermissions(principalId));
    }

    @Override
    public Uni<List<Identity>> searchPrincipals(String query) {
        return track("searchPrincipals", query, () -> delegate.searchPrincipals(query));
    }

    private <T> Uni<T> track(String operation, String id, Supplier<Uni<T>> call) {
        return Uni.createFrom().deferred(() -> {
            final var key = key(operation, id);
            calls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
            final var hook = hooks.get(key);
            if (hook != null) {
                hook.accept(id);
            }
            final var failure = failures.get(key);
            if (failure != null) {
                return Uni.createFrom().failure(failure.get());
            }
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Uni<T> result = call.get();
            if (!latency.isZero()) {
                result = result.onItem().delayIt().by(latency);
            }
            return result.onTermination().invoke(inFlight::decrementAndGet);
        });
    }

    private static String key(String operation, String id) {
        return operation + ":" + id;
    }
}
