package matriarch.core.model.directory;

/**
 * Kind of directory principal.
 *
 * <p>Principals are modelled as a tagged union: kind-specific attributes live on
 * {@link Identity} as optional fields rather than in subclasses.
 */
public enum IdentityType {
    USER,
    GROUP,
    SERVICE_PRINCIPAL,
    USER_ASSIGNED_MANAGED_IDENTITY,
    SYSTEM_ASSIGNED_MANAGED_IDENTITY;

    /**
     * Whether principals of this kind are backed by a service principal object.
     *
     * <p>Only service-principal backed identities can hold API permissions
     * (app role assignments).
     *
     * @return true for service principals and managed identities
     */
    public boolean isServicePrincipalBacked() {
        return this == SERVICE_PRINCIPAL
                || this == USER_ASSIGNED_MANAGED_IDENTITY
                || this == SYSTEM_ASSIGNED_MANAGED_IDENTITY;
    }

    /**
     * Map the directory's {@code servicePrincipalType} attribute to an identity kind.
     *
     * @param servicePrincipalType raw attribute value (may be null)
     * @return the matching identity kind, {@link #SERVICE_PRINCIPAL} when unknown
     */
    public static IdentityType fromServicePrincipalType(String servicePrincipalType) {
        if ("ManagedIdentity".equalsIgnoreCase(servicePrincipalType)) {
            return USER_ASSIGNED_MANAGED_IDENTITY;
        }
        return SERVICE_PRINCIPAL;
    }
}
