package matriarch.adapter.out.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import matriarch.core.model.cache.CacheEntry;
import matriarch.core.model.cache.CacheKey;
import matriarch.core.model.cache.RecordKind;
import matriarch.core.model.directory.RoleAssignment;

@DisplayName("LocalDirectoryCache")
class LocalDirectoryCacheTest {

    private static final Duration TTL = Duration.ofMinutes(10);
    private static final CacheKey KEY = CacheKey.of("p1", RecordKind.ROLE_ASSIGNMENTS);
    private static final List<RoleAssignment> VALUE = List.of(RoleAssignment.of("ra-1", "Reader", "/s", "p1"));

    @Nested
    @DisplayName("Reads and writes")
    class ReadsAndWrites {

        @Test
        @DisplayName("should return a stored entry")
        void shouldReturnStoredEntry() {
            var cache = new LocalDirectoryCache(TTL, 100, 0.1);
            var entry = CacheEntry.of(VALUE);

            cache.put(KEY, entry).await().indefinitely();

            assertEquals(entry, cache.get(KEY).await().indefinitely().orElseThrow());
        }

        @Test
        @DisplayName("should miss for an unknown key")
        void shouldMissUnknownKey() {
            var cache = new LocalDirectoryCache(TTL, 100, 0.0);

            assertTrue(cache.get(KEY).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should keep record kinds of one principal apart")
        void shouldSeparateKinds() {
            var cache = new LocalDirectoryCache(TTL, 100, 0.0);
            cache.put(KEY, CacheEntry.of(VALUE)).await().indefinitely();

            assertTrue(cache.get(CacheKey.of("p1", RecordKind.MEMBERSHIPS))
                    .await()
                    .indefinitely()
                    .isEmpty());
        }

        @Test
        @DisplayName("should invalidate a single key and then everything")
        void shouldInvalidate() {
            var cache = new LocalDirectoryCache(TTL, 100, 0.0);
            var other = CacheKey.of("p2", RecordKind.ROLE_ASSIGNMENTS);
            cache.put(KEY, CacheEntry.of(VALUE)).await().indefinitely();
            cache.put(other, CacheEntry.of(VALUE)).await().indefinitely();

            cache.invalidate(KEY).await().indefinitely();
            assertTrue(cache.get(KEY).await().indefinitely().isEmpty());
            assertTrue(cache.get(other).await().indefinitely().isPresent());

            cache.invalidateAll().await().indefinitely();
            assertTrue(cache.get(other).await().indefinitely().isEmpty());
        }
    }

    @Nested
    @DisplayName("Freshness")
    class Freshness {

        @Test
        @DisplayName("should treat an entry older than the TTL as a miss")
        void shouldMissStaleEntry() {
            var cache = new LocalDirectoryCache(TTL, 100, 0.0);
            var stale = new CacheEntry(VALUE, Instant.now().minus(TTL).minusSeconds(1));

            cache.put(KEY, stale).await().indefinitely();

            assertTrue(cache.get(KEY).await().indefinitely().isEmpty());
        }

        @Test
        @DisplayName("should judge freshness by the supplied clock")
        void shouldUseClock() {
            var fetchedAt = Instant.parse("2024-01-01T00:00:00Z");
            var clock = Clock.fixed(fetchedAt.plus(Duration.ofMinutes(9)), ZoneOffset.UTC);
            var cache = new LocalDirectoryCache(TTL, 100, 0.0, clock);

            cache.put(KEY, new CacheEntry(VALUE, fetchedAt)).await().indefinitely();

            assertTrue(cache.get(KEY).await().indefinitely().isPresent());
        }

        @Test
        @DisplayName("should reject a jitter factor outside 0 to 0.5")
        void shouldRejectInvalidJitter() {
            assertThrows(IllegalArgumentException.class, () -> new LocalDirectoryCache(TTL, 100, 0.6));
            assertThrows(IllegalArgumentException.class, () -> new LocalDirectoryCache(TTL, 100, -0.1));
        }
    }

    @Test
    @DisplayName("should report its approximate size")
    void shouldReportSize() {
        var cache = new LocalDirectoryCache(TTL, 100, 0.0);
        cache.put(KEY, CacheEntry.of(VALUE)).await().indefinitely();

        assertEquals(1, cache.estimatedSize());
    }
}
