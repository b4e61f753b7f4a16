package matriarch.core.service.resolution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.IdentityType;
import matriarch.core.model.directory.PermissionType;
import matriarch.core.model.directory.RoleAssignment;
import matriarch.core.model.directory.SecurityGroup;
import matriarch.core.model.resolution.AncestorGroups;
import matriarch.core.model.resolution.PartialTraversalFailure;

@DisplayName("RoleAssignmentAggregator")
class RoleAssignmentAggregatorTest {

    private static final String SUB = "/subscriptions/0000";

    private final RoleAssignmentAggregator aggregator = new RoleAssignmentAggregator();
    private final Identity user = Identity.builder("u1", IdentityType.USER).displayName("Ada").build();

    private static SecurityGroup group(String id, String name, RoleAssignment... assignments) {
        return new SecurityGroup(id, name, null, List.of(assignments), Set.of());
    }

    @Test
    @DisplayName("should equal the direct assignments when there are no groups")
    void shouldReturnDirectWhenNoGroups() {
        var writer = RoleAssignment.of("ra-2", "Writer", SUB, "u1");
        var reader = RoleAssignment.of("ra-1", "Reader", SUB, "u1");

        var result = aggregator.aggregate(user, List.of(writer, reader), AncestorGroups.empty(), List.of());

        assertEquals(List.of(reader, writer), result.effectiveRoleAssignments());
        assertEquals(List.of(writer, reader), result.directRoleAssignments());
        assertTrue(result.securityGroups().isEmpty());
        assertFalse(result.isPartial());
    }

    @Test
    @DisplayName("should count an assignment reached through several paths once")
    void shouldDeduplicateAcrossPaths() {
        var shared = RoleAssignment.of("ra-shared", "Reader", SUB, "g-apex");
        var direct = RoleAssignment.of("ra-direct", "Owner", SUB, "u1");
        var ancestors = new AncestorGroups(
                List.of(group("g-a", "Alpha", shared), group("g-b", "Beta", shared, direct)), Set.of());

        var result = aggregator.aggregate(user, List.of(direct), ancestors, List.of());

        assertEquals(2, result.effectiveRoleAssignments().size());
        assertEquals(
                Set.of("ra-shared", "ra-direct"),
                Set.of(
                        result.effectiveRoleAssignments().get(0).id(),
                        result.effectiveRoleAssignments().get(1).id()));
        assertEquals(2, result.securityGroups().get(1).roleAssignments().size());
    }

    @Test
    @DisplayName("should order groups by name and assignments by role, scope and id")
    void shouldOrderDeterministically() {
        var b = RoleAssignment.of("ra-b", "Reader", SUB + "/rg/b", "g-z");
        var a = RoleAssignment.of("ra-a", "Reader", SUB + "/rg/a", "g-y");
        var c = RoleAssignment.of("ra-c", "Contributor", SUB, "g-x");
        var ancestors = new AncestorGroups(
                List.of(group("g-z", "Zulu", b), group("g-x", "Alpha", c), group("g-y", "Alpha", a)), Set.of());

        var result = aggregator.aggregate(user, List.of(), ancestors, List.of());

        assertEquals(
                List.of("g-x", "g-y", "g-z"),
                result.securityGroups().stream().map(SecurityGroup::id).toList());
        assertEquals(List.of(c, a, b), result.effectiveRoleAssignments());
    }

    @Test
    @DisplayName("should mark the result partial when the closure is incomplete")
    void shouldMarkPartial() {
        var ancestors = new AncestorGroups(List.of(), Set.of("g-broken"));

        var result = aggregator.aggregate(user, List.of(), ancestors, List.of());

        assertTrue(result.isPartial());
        assertEquals(
                Set.of("g-broken"),
                result.partialFailureDetails().map(PartialTraversalFailure::failedGroupIds).orElseThrow());
    }

    @Test
    @DisplayName("should deduplicate API permissions by id")
    void shouldDeduplicateApiPermissions() {
        var app = Identity.builder("sp1", IdentityType.SERVICE_PRINCIPAL).build();
        var permission = new ApiPermission("p1", "Graph", "res-1", PermissionType.APPLICATION, "User.Read.All");

        var result = aggregator.aggregate(app, List.of(), AncestorGroups.empty(), List.of(permission, permission));

        assertEquals(List.of(permission), result.apiPermissions());
    }
}
