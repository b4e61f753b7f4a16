package matriarch.core.model.cache;

/**
 * Kind of directory record held in the cache.
 */
public enum RecordKind {
    PRINCIPAL,
    MEMBERSHIPS,
    ROLE_ASSIGNMENTS,
    API_PERMISSIONS
}
