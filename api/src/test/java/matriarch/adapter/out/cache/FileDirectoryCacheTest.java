package matriarch.adapter.out.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import matriarch.core.model.cache.CacheEntry;
import matriarch.core.model.cache.CacheKey;
import matriarch.core.model.cache.RecordKind;
import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.DirectoryGroup;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.IdentityType;
import matriarch.core.model.directory.PermissionType;
import matriarch.core.model.directory.RoleAssignment;
import matriarch.core.model.directory.ServicePrincipalKind;

@DisplayName("FileDirectoryCache")
class FileDirectoryCacheTest {

    private static final Duration TTL = Duration.ofMinutes(10);
    private static final Instant FETCHED_AT = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path directory;

    private ObjectMapper objectMapper;
    private Clock clock;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        clock = Clock.fixed(FETCHED_AT.plus(Duration.ofMinutes(1)), ZoneOffset.UTC);
    }

    private FileDirectoryCache cache() {
        return new FileDirectoryCache(directory, TTL, objectMapper, clock);
    }

    private static <T> T await(Uni<T> uni) {
        return uni.await().atMost(Duration.ofSeconds(5));
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        @DisplayName("should survive a new cache instance over the same directory")
        void shouldSurviveRestart() {
            var key = CacheKey.of("g1", RecordKind.MEMBERSHIPS);
            var groups = List.of(new DirectoryGroup("g2", "Platform", "Platform team"));
            await(cache().put(key, new CacheEntry(groups, FETCHED_AT)));

            var entry = await(cache().get(key)).orElseThrow();

            assertEquals(groups, entry.value());
            assertEquals(FETCHED_AT, entry.fetchedAt());
        }

        @Test
        @DisplayName("should store a found principal")
        void shouldStorePrincipal() {
            var key = CacheKey.of("sp1", RecordKind.PRINCIPAL);
            var identity = Identity.builder("sp1", IdentityType.USER_ASSIGNED_MANAGED_IDENTITY)
                    .displayName("deployer")
                    .applicationId("app-9")
                    .servicePrincipalKind(ServicePrincipalKind.MANAGED_IDENTITY)
                    .build();
            var cache = cache();

            await(cache.put(key, new CacheEntry(Optional.of(identity), FETCHED_AT)));

            assertEquals(Optional.of(identity), await(cache.get(key)).orElseThrow().value());
        }

        @Test
        @DisplayName("should store the absence of a principal")
        void shouldStoreAbsence() {
            var key = CacheKey.of("missing", RecordKind.PRINCIPAL);
            var cache = cache();

            await(cache.put(key, new CacheEntry(Optional.empty(), FETCHED_AT)));

            assertEquals(Optional.empty(), await(cache.get(key)).orElseThrow().value());
        }

        @Test
        @DisplayName("should store role assignments and API permissions")
        void shouldStoreLists() {
            var cache = cache();
            var assignments = List.of(new RoleAssignment("ra-1", "Reader", "/s/1", "p1", "/rd/1", "User"));
            var permissions = List.of(
                    new ApiPermission("perm-1", "Microsoft Graph", "res-1", PermissionType.APPLICATION, "Mail.Read"));
            var assignmentsKey = CacheKey.of("p1", RecordKind.ROLE_ASSIGNMENTS);
            var permissionsKey = CacheKey.of("p1", RecordKind.API_PERMISSIONS);

            await(cache.put(assignmentsKey, new CacheEntry(assignments, FETCHED_AT)));
            await(cache.put(permissionsKey, new CacheEntry(permissions, FETCHED_AT)));

            assertEquals(assignments, await(cache.get(assignmentsKey)).orElseThrow().value());
            assertEquals(permissions, await(cache.get(permissionsKey)).orElseThrow().value());
        }
    }

    @Nested
    @DisplayName("Misses")
    class Misses {

        @Test
        @DisplayName("should miss when no file exists")
        void shouldMissWithoutFile() {
            assertTrue(await(cache().get(CacheKey.of("p1", RecordKind.PRINCIPAL))).isEmpty());
        }

        @Test
        @DisplayName("should miss when the entry is older than the TTL")
        void shouldMissStaleFile() {
            var key = CacheKey.of("p1", RecordKind.ROLE_ASSIGNMENTS);
            await(cache().put(key, new CacheEntry(List.of(), FETCHED_AT)));
            clock = Clock.fixed(FETCHED_AT.plus(TTL).plusSeconds(1), ZoneOffset.UTC);

            assertTrue(await(cache().get(key)).isEmpty());
        }

        @Test
        @DisplayName("should miss when the file is corrupt")
        void shouldMissCorruptFile() throws IOException {
            var cache = cache();
            var key = CacheKey.of("p1", RecordKind.MEMBERSHIPS);
            Files.writeString(cache.fileFor(key), "{ not json");

            assertTrue(await(cache.get(key)).isEmpty());
        }

        @Test
        @DisplayName("should miss when the file has no value")
        void shouldMissFileWithoutValue() throws IOException {
            var cache = cache();
            var key = CacheKey.of("p1", RecordKind.MEMBERSHIPS);
            Files.writeString(cache.fileFor(key), "{\"fetchedAt\": " + FETCHED_AT.toEpochMilli() + "}");

            assertTrue(await(cache.get(key)).isEmpty());
        }
    }

    @Nested
    @DisplayName("Invalidation")
    class Invalidation {

        @Test
        @DisplayName("should delete one entry")
        void shouldInvalidateOne() {
            var cache = cache();
            var key = CacheKey.of("p1", RecordKind.ROLE_ASSIGNMENTS);
            await(cache.put(key, new CacheEntry(List.of(), FETCHED_AT)));

            await(cache.invalidate(key));

            assertFalse(Files.exists(cache.fileFor(key)));
        }

        @Test
        @DisplayName("should delete every entry")
        void shouldInvalidateAll() throws IOException {
            var cache = cache();
            await(cache.put(CacheKey.of("p1", RecordKind.ROLE_ASSIGNMENTS), new CacheEntry(List.of(), FETCHED_AT)));
            await(cache.put(CacheKey.of("p2", RecordKind.MEMBERSHIPS), new CacheEntry(List.of(), FETCHED_AT)));

            await(cache.invalidateAll());

            try (var files = Files.list(directory)) {
                assertEquals(0, files.count());
            }
        }
    }

    @Test
    @DisplayName("should give ids that differ only in punctuation separate files")
    void shouldNotShareFilesBetweenSimilarIds() {
        var cache = cache();
        var colon = CacheKey.of("a:b", RecordKind.ROLE_ASSIGNMENTS);
        var underscore = CacheKey.of("a_b", RecordKind.ROLE_ASSIGNMENTS);
        var assignment = RoleAssignment.of("ra-1", "Reader", "/subscriptions/s", "a:b");

        await(cache.put(colon, new CacheEntry(List.of(assignment), FETCHED_AT)));

        assertFalse(cache.fileFor(colon).equals(cache.fileFor(underscore)));
        assertTrue(await(cache.get(underscore)).isEmpty());
        assertEquals(List.of(assignment), await(cache.get(colon)).orElseThrow().value());
    }

    @Test
    @DisplayName("should keep file names inside the cache directory")
    void shouldSanitizeFileNames() {
        var file = cache().fileFor(CacheKey.of("../../etc/passwd", RecordKind.PRINCIPAL));

        assertEquals(directory, file.getParent());
    }
}
