package matriarch.core.model.directory;

/**
 * Sub-kind of a service principal as reported by the directory.
 */
public enum ServicePrincipalKind {
    APPLICATION,
    MANAGED_IDENTITY;

    /**
     * Parse the directory's {@code servicePrincipalType} attribute.
     *
     * @param value raw attribute value (may be null)
     * @return the sub-kind, or null if the value is absent or not recognised
     */
    public static ServicePrincipalKind fromDirectoryValue(String value) {
        if (value == null) {
            return null;
        }
        return switch (value) {
            case "Application" -> APPLICATION;
            case "ManagedIdentity" -> MANAGED_IDENTITY;
            default -> null;
        };
    }
}
