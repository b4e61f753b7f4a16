package matriarch.core.model.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached directory record. Entries are replaced whole, never mutated.
 *
 * <p>The value is the record as returned by the directory client: an
 * {@code Optional<Identity>} for {@link RecordKind#PRINCIPAL} and a list for
 * every other kind.
 *
 * @param value     cached value
 * @param fetchedAt when the value was read from the directory
 */
public record CacheEntry(Object value, Instant fetchedAt) {

    public CacheEntry {
        if (value == null) {
            throw new IllegalArgumentException("Cache entry value cannot be null");
        }
        if (fetchedAt == null) {
            fetchedAt = Instant.now();
        }
    }

    public static CacheEntry of(Object value) {
        return new CacheEntry(value, Instant.now());
    }

    public boolean isFresh(Duration ttl, Instant now) {
        return fetchedAt.plus(ttl).isAfter(now);
    }
}
