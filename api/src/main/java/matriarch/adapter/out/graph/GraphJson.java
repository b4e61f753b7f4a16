package matriarch.adapter.out.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.DirectoryGroup;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.IdentityType;
import matriarch.core.model.directory.PermissionType;
import matriarch.core.model.directory.RoleAssignment;
import matriarch.core.model.directory.ServicePrincipalKind;

/**
 * Mapping from Microsoft Graph and Resource Graph JSON to directory records.
 */
final class GraphJson {

    static final String GROUP_TYPE = "#microsoft.graph.group";

    private GraphJson() {}

    static Identity user(JsonObject json) {
        final var mail = json.getString("mail");
        return Identity.builder(json.getString("id"), IdentityType.USER)
                .displayName(json.getString("displayName"))
                .email(mail != null && !mail.isBlank() ? mail : json.getString("userPrincipalName"))
                .build();
    }

    static Identity servicePrincipal(JsonObject json, String appRegistrationId) {
        final var servicePrincipalType = json.getString("servicePrincipalType");
        return Identity.builder(json.getString("id"), IdentityType.fromServicePrincipalType(servicePrincipalType))
                .applicationId(json.getString("appId"))
                .displayName(json.getString("displayName"))
                .servicePrincipalKind(ServicePrincipalKind.fromDirectoryValue(servicePrincipalType))
                .appRegistrationId(appRegistrationId)
                .build();
    }

    static Identity group(JsonObject json) {
        return Identity.builder(json.getString("id"), IdentityType.GROUP)
                .displayName(json.getString("displayName"))
                .build();
    }

    static boolean isSecurityGroup(JsonObject json) {
        final var odataType = json.getString("@odata.type");
        final var isGroup = odataType == null || GROUP_TYPE.equals(odataType);
        return isGroup && Boolean.TRUE.equals(json.getBoolean("securityEnabled"));
    }

    static DirectoryGroup directoryGroup(JsonObject json) {
        return new DirectoryGroup(json.getString("id"), json.getString("displayName"), json.getString("description"));
    }

    static RoleAssignment roleAssignment(JsonObject json) {
        return new RoleAssignment(
                json.getString("id"),
                json.getString("roleName"),
                json.getString("scope"),
                json.getString("principalId"),
                json.getString("roleDefinitionId"),
                json.getString("principalType"));
    }

    /**
     * Map an app role assignment, resolving the role value from the resource's app roles.
     *
     * @param json       the app role assignment
     * @param roleValues app role id to value for the assignment's resource, empty if unknown
     */
    static ApiPermission apiPermission(JsonObject json, Map<String, String> roleValues) {
        return new ApiPermission(
                json.getString("id"),
                json.getString("resourceDisplayName"),
                json.getString("resourceId"),
                PermissionType.APPLICATION,
                roleValues.getOrDefault(json.getString("appRoleId", ""), ""));
    }

    static Map<String, String> appRoleValues(JsonObject resource) {
        final Map<String, String> values = new HashMap<>();
        for (final var role : objects(resource.getJsonArray("appRoles"))) {
            final var id = role.getString("id");
            final var value = role.getString("value");
            if (id != null && value != null) {
                values.put(id, value);
            }
        }
        return values;
    }

    static List<JsonObject> objects(JsonArray array) {
        final List<JsonObject> objects = new ArrayList<>();
        if (array == null) {
            return objects;
        }
        for (final var item : array) {
            if (item instanceof JsonObject object) {
                objects.add(object);
            }
        }
        return objects;
    }

    /**
     * Escape a value for use inside an OData string literal.
     */
    static String odataLiteral(String value) {
        return value.replace("'", "''");
    }
}
