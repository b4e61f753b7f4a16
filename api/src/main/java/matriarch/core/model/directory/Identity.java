package matriarch.core.model.directory;

/**
 * A directory principal.
 *
 * <p>Immutable once fetched. Service-principal specific attributes
 * ({@code servicePrincipalKind}, {@code appRegistrationId}) are null for other kinds.
 *
 * @param objectId             unique object identifier (for service principals, the enterprise application)
 * @param applicationId        application (client) id, empty unless the principal is an application
 * @param displayName          human-readable name
 * @param email                mail or user principal name, empty for non-users
 * @param type                 kind of principal
 * @param servicePrincipalKind sub-kind for service principals, otherwise null
 * @param appRegistrationId    object id of the originating app registration, otherwise null
 */
public record Identity(
        String objectId,
        String applicationId,
        String displayName,
        String email,
        IdentityType type,
        ServicePrincipalKind servicePrincipalKind,
        String appRegistrationId) {

    public Identity {
        if (objectId == null || objectId.isBlank()) {
            throw new IllegalArgumentException("Identity object ID cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Identity type cannot be null");
        }
        if (applicationId == null) {
            applicationId = "";
        }
        if (displayName == null) {
            displayName = "";
        }
        if (email == null) {
            email = "";
        }
    }

    public static Builder builder(String objectId, IdentityType type) {
        return new Builder(objectId, type);
    }

    public static class Builder {
        private final String objectId;
        private final IdentityType type;
        private String applicationId;
        private String displayName;
        private String email;
        private ServicePrincipalKind servicePrincipalKind;
        private String appRegistrationId;

        private Builder(String objectId, IdentityType type) {
            this.objectId = objectId;
            this.type = type;
        }

        public Builder applicationId(String applicationId) {
            this.applicationId = applicationId;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder servicePrincipalKind(ServicePrincipalKind servicePrincipalKind) {
            this.servicePrincipalKind = servicePrincipalKind;
            return this;
        }

        public Builder appRegistrationId(String appRegistrationId) {
            this.appRegistrationId = appRegistrationId;
            return this;
        }

        public Identity build() {
            return new Identity(
                    objectId, applicationId, displayName, email, type, servicePrincipalKind, appRegistrationId);
        }
    }
}
