package matriarch.adapter.out.memory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import io.smallrye.mutiny.Uni;

import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.DirectoryGroup;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.IdentityType;
import matriarch.core.model.directory.RoleAssignment;
import matriarch.core.model.directory.SearchQuery;
import matriarch.core.port.out.DirectoryClient;

/**
 * In-memory directory, populated programmatically.
 *
 * <p>Suitable for development and tests. Nothing is persisted and no call ever
 * fails. Search follows the same matching rules as the Graph adapter.
 *
 * <p>Thread-safety: backed by concurrent collections; may be populated while in use.
 */
public class InMemoryDirectoryClient implements DirectoryClient {

    private final Map<String, Identity> principals = new ConcurrentHashMap<>();
    private final Map<String, DirectoryGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> memberships = new ConcurrentHashMap<>();
    private final Map<String, List<RoleAssignment>> roleAssignments = new ConcurrentHashMap<>();
    private final Map<String, List<ApiPermission>> apiPermissions = new ConcurrentHashMap<>();
    private final int searchLimit;

    public InMemoryDirectoryClient() {
        this(10);
    }

    public InMemoryDirectoryClient(int searchLimit) {
        this.searchLimit = searchLimit;
    }

    public InMemoryDirectoryClient addPrincipal(Identity identity) {
        principals.put(identity.objectId(), identity);
        return this;
    }

    /**
     * Register a security group. The group is also resolvable as a {@link IdentityType#GROUP} principal.
     */
    public InMemoryDirectoryClient addGroup(DirectoryGroup group) {
        groups.put(group.id(), group);
        principals.put(
                group.id(),
                Identity.builder(group.id(), IdentityType.GROUP)
                        .displayName(group.displayName())
                        .build());
        return this;
    }

    /**
     * Make a principal (or group) a direct member of a group.
     */
    public InMemoryDirectoryClient addMembership(String memberId, String groupId) {
        memberships.computeIfAbsent(memberId, id -> ConcurrentHashMap.newKeySet()).add(groupId);
        return this;
    }

    public InMemoryDirectoryClient addRoleAssignment(RoleAssignment assignment) {
        roleAssignments
                .computeIfAbsent(assignment.principalId(), id -> new CopyOnWriteArrayList<>())
                .add(assignment);
        return this;
    }

    public InMemoryDirectoryClient addApiPermission(String principalId, ApiPermission permission) {
        apiPermissions.computeIfAbsent(principalId, id -> new CopyOnWriteArrayList<>()).add(permission);
        return this;
    }

    @Override
    public Uni<Optional<Identity>> findPrincipal(String objectId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(principals.get(objectId)));
    }

    @Override
    public Uni<List<DirectoryGroup>> getDirectGroupMemberships(String principalId, IdentityType type) {
        return Uni.createFrom().item(() -> groupsOf(principalId));
    }

    @Override
    public Uni<List<DirectoryGroup>> getGroupParents(String groupId) {
        return Uni.createFrom().item(() -> groupsOf(groupId));
    }

    @Override
    public Uni<List<RoleAssignment>> getRoleAssignments(String principalId) {
        return Uni.createFrom().item(() -> List.copyOf(roleAssignments.getOrDefault(principalId, List.of())));
    }

    @Override
    public Uni<List<ApiPermission>> getApiPermissions(String principalId) {
        return Uni.createFrom().item(() -> List.copyOf(apiPermissions.getOrDefault(principalId, List.of())));
    }

    @Override
    public Uni<List<Identity>> searchPrincipals(String query) {
        return Uni.createFrom().item(() -> search(SearchQuery.classify(query)));
    }

    private List<DirectoryGroup> groupsOf(String memberId) {
        return memberships.getOrDefault(memberId, Set.of()).stream()
                .map(groups::get)
                .filter(group -> group != null)
                .toList();
    }

    private List<Identity> search(SearchQuery query) {
        final var text = query.text();
        return switch (query.kind()) {
            case OBJECT_ID -> principals.values().stream()
                    .filter(identity -> text.equalsIgnoreCase(identity.objectId())
                            || text.equalsIgnoreCase(identity.applicationId())
                            || text.equalsIgnoreCase(identity.appRegistrationId()))
                    .toList();
            case EMAIL -> principals.values().stream()
                    .filter(identity -> identity.type() == IdentityType.USER)
                    .filter(identity -> text.equalsIgnoreCase(identity.email()))
                    .toList();
            case DISPLAY_NAME -> byDisplayNamePrefix(text.toLowerCase(Locale.ROOT));
        };
    }

    private List<Identity> byDisplayNamePrefix(String prefix) {
        final List<Identity> matches = new ArrayList<>();
        for (final var type : IdentityType.values()) {
            principals.values().stream()
                    .filter(identity -> identity.type() == type)
                    .filter(identity -> identity.displayName().toLowerCase(Locale.ROOT).startsWith(prefix))
                    .sorted((a, b) -> a.displayName().compareToIgnoreCase(b.displayName()))
                    .limit(searchLimit)
                    .forEach(matches::add);
        }
        return matches;
    }
}
