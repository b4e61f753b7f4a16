package matriarch.core.model.cache;

import java.util.Locale;

/**
 * Cache key: one entry per principal and record kind.
 *
 * @param principalId object id of the principal (user, group or service principal)
 * @param kind        kind of record cached under the key
 */
public record CacheKey(String principalId, RecordKind kind) {

    public CacheKey {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("Cache key principal ID cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Cache key kind cannot be null");
        }
    }

    public static CacheKey of(String principalId, RecordKind kind) {
        return new CacheKey(principalId, kind);
    }

    /**
     * Flat string form, used by stores that key by string.
     */
    public String asString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + principalId;
    }
}
