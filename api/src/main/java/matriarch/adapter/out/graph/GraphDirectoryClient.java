package matriarch.adapter.out.graph;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClientOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpRequest;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import matriarch.core.config.DirectoryConfig;
import matriarch.core.model.directory.ApiPermission;
import matriarch.core.model.directory.DirectoryException;
import matriarch.core.model.directory.DirectoryGroup;
import matriarch.core.model.directory.Identity;
import matriarch.core.model.directory.IdentityType;
import matriarch.core.model.directory.PermanentDirectoryException;
import matriarch.core.model.directory.RoleAssignment;
import matriarch.core.model.directory.SearchQuery;
import matriarch.core.model.directory.TransientDirectoryException;
import matriarch.core.port.out.DirectoryClient;

/**
 * Directory client backed by Microsoft Graph (principals, memberships, app role
 * assignments) and Azure Resource Graph (RBAC role assignments).
 *
 * <p>Error classification:
 * <ul>
 *   <li>HTTP 429, HTTP 5xx, timeouts and connection errors: {@link TransientDirectoryException},
 *       carrying any {@code Retry-After} hint</li>
 *   <li>HTTP 404 on a single-object lookup: absent</li>
 *   <li>Any other non-2xx status or an unparseable body: {@link PermanentDirectoryException}</li>
 * </ul>
 *
 * <p>Collection queries follow {@code @odata.nextLink} (Graph) and {@code $skipToken}
 * (Resource Graph) to the last page. Principal ids are checked to be GUIDs before
 * they are put into a query, and OData string literals are escaped.
 *
 * <p>Bearer tokens come from configuration; this client never acquires them.
 */
public class GraphDirectoryClient implements DirectoryClient {

    private static final Logger LOG = Logger.getLogger(GraphDirectoryClient.class);

    private static final String RESOURCE_GRAPH_PATH =
            "/providers/Microsoft.ResourceGraph/resources?api-version=2021-03-01";
    private static final int RESOURCE_GRAPH_PAGE_SIZE = 1000;
    private static final String NO_APP_ROLE = "00000000-0000-0000-0000-000000000000";

    private static final String USER_FIELDS = "id,displayName,mail,userPrincipalName";
    private static final String SERVICE_PRINCIPAL_FIELDS = "id,appId,displayName,servicePrincipalType";
    private static final String GROUP_FIELDS = "id,displayName,description,securityEnabled";

    private static final String ROLE_ASSIGNMENTS_QUERY = """
            authorizationresources
            | where type =~ 'microsoft.authorization/roleassignments'
            | extend principalId = tostring(properties.principalId)
            | where principalId =~ '%s'
            | extend principalType = tostring(properties.principalType),
                roleDefinitionId = tolower(tostring(properties.roleDefinitionId)),
                scope = tostring(properties.scope)
            | join kind=leftouter (
                authorizationresources
                | where type =~ 'microsoft.authorization/roledefinitions'
                | extend roleDefinitionId = tolower(id), roleName = tostring(properties.roleName)
                | project roleDefinitionId, roleName
            ) on roleDefinitionId
            | project id, principalId, principalType, roleDefinitionId, roleName, scope
            """;

    private final WebClient webClient;
    private final DirectoryConfig.GraphConfig config;
    private final int searchLimit;
    private final long requestTimeoutMs;

    public GraphDirectoryClient(Vertx vertx, DirectoryConfig directoryConfig, int maxConnections) {
        this.webClient = WebClient.create(vertx, new WebClientOptions().setMaxPoolSize(maxConnections));
        this.config = directoryConfig.graph();
        this.searchLimit = directoryConfig.searchLimit();
        this.requestTimeoutMs = config.requestTimeout().toMillis();

        if (config.graphToken().isEmpty()) {
            LOG.warn("No Microsoft Graph token configured; requests will be sent unauthenticated");
        }
        if (config.managementToken().isEmpty()) {
            LOG.warn("No Azure Resource Manager token configured; requests will be sent unauthenticated");
        }
    }

    // -------------------------------------------------------------------------
    // Principals
    // -------------------------------------------------------------------------

    @Override
    public Uni<Optional<Identity>> findPrincipal(String objectId) {
        if (!SearchQuery.isGuid(objectId)) {
            LOG.debugf("Not a GUID, no principal can match: %s", objectId);
            return Uni.createFrom().item(Optional.empty());
        }
        return mapped(
                firstPresent(List.of(
                        () -> findUser(objectId),
                        () -> findServicePrincipal(objectId),
                        () -> findSecurityGroup(objectId))),
                "findPrincipal");
    }

    private Uni<Optional<Identity>> findUser(String objectId) {
        return lookup(graph("/users/" + objectId).addQueryParam("$select", USER_FIELDS), "getUser")
                .map(found -> found.map(GraphJson::user));
    }

    private Uni<Optional<Identity>> findServicePrincipal(String objectId) {
        return lookup(
                        graph("/servicePrincipals/" + objectId).addQueryParam("$select", SERVICE_PRINCIPAL_FIELDS),
                        "getServicePrincipal")
                .chain(this::toServicePrincipal);
    }

    private Uni<Optional<Identity>> findServicePrincipalByAppId(String appId) {
        final var request = graph("/servicePrincipals")
                .addQueryParam("$filter", "appId eq '" + GraphJson.odataLiteral(appId) + "'")
                .addQueryParam("$select", SERVICE_PRINCIPAL_FIELDS);
        return firstValue(request, "findServicePrincipalByAppId").chain(this::toServicePrincipal);
    }

    private Uni<Optional<Identity>> toServicePrincipal(Optional<JsonObject> found) {
        if (found.isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return withAppRegistration(found.get()).map(Optional::of);
    }

    private Uni<Optional<Identity>> findServicePrincipalByAppRegistration(String applicationObjectId) {
        final var request = graph("/applications/" + applicationObjectId).addQueryParam("$select", "id,appId");
        return lookup(request, "getApplication")
                .chain(found -> {
                    final var appId = found.map(app -> app.getString("appId")).orElse(null);
                    if (appId == null) {
                        return Uni.createFrom().item(Optional.<Identity>empty());
                    }
                    return findServicePrincipalByAppId(appId);
                });
    }

    private Uni<Optional<Identity>> findSecurityGroup(String objectId) {
        return lookup(graph("/groups/" + objectId).addQueryParam("$select", GROUP_FIELDS), "getGroup")
                .map(found -> found.filter(GraphJson::isSecurityGroup).map(GraphJson::group));
    }

    /**
     * Attach the app registration object id to a service principal. The registration
     * may live in another tenant or be unreadable, in which case it is left unset.
     */
    private Uni<Identity> withAppRegistration(JsonObject servicePrincipal) {
        final var appId = servicePrincipal.getString("appId");
        if (appId == null || appId.isBlank()) {
            return Uni.createFrom().item(GraphJson.servicePrincipal(servicePrincipal, null));
        }
        final var request = graph("/applications")
                .addQueryParam("$filter", "appId eq '" + GraphJson.odataLiteral(appId) + "'")
                .addQueryParam("$select", "id");
        return firstValue(request, "findApplication")
                .map(app -> GraphJson.servicePrincipal(
                        servicePrincipal, app.map(json -> json.getString("id")).orElse(null)))
                .onFailure(PermanentDirectoryException.class)
                .recoverWithItem(failure -> {
                    LOG.debugf("App registration for %s not readable: %s", appId, failure.getMessage());
                    return GraphJson.servicePrincipal(servicePrincipal, null);
                });
    }

    // -------------------------------------------------------------------------
    // Memberships
    // -------------------------------------------------------------------------

    @Override
    public Uni<List<DirectoryGroup>> getDirectGroupMemberships(String principalId, IdentityType type) {
        final var collection = switch (type) {
            case USER -> "users";
            case GROUP -> "groups";
            case SERVICE_PRINCIPAL, USER_ASSIGNED_MANAGED_IDENTITY, SYSTEM_ASSIGNED_MANAGED_IDENTITY ->
                "servicePrincipals";
        };
        return memberOf(collection, principalId);
    }

    @Override
    public Uni<List<DirectoryGroup>> getGroupParents(String groupId) {
        return memberOf("groups", groupId);
    }

    private Uni<List<DirectoryGroup>> memberOf(String collection, String principalId) {
        final var rejected = requireGuid(principalId);
        if (rejected != null) {
            return Uni.createFrom().failure(rejected);
        }
        final var request = graph("/" + collection + "/" + principalId + "/memberOf")
                .addQueryParam("$top", String.valueOf(config.pageSize()))
                .addQueryParam("$select", GROUP_FIELDS);
        return mapped(
                graphPages(request, "memberOf").map(objects -> objects.stream()
                        .filter(GraphJson::isSecurityGroup)
                        .map(GraphJson::directoryGroup)
                        .toList()),
                "memberOf");
    }

    // -------------------------------------------------------------------------
    // Role assignments (Azure Resource Graph)
    // -------------------------------------------------------------------------

    @Override
    public Uni<List<RoleAssignment>> getRoleAssignments(String principalId) {
        final var rejected = requireGuid(principalId);
        if (rejected != null) {
            return Uni.createFrom().failure(rejected);
        }
        final var query = ROLE_ASSIGNMENTS_QUERY.formatted(principalId);
        return mapped(
                resourceGraphPages(query, null, new ArrayList<>())
                        .map(rows -> rows.stream().map(GraphJson::roleAssignment).toList()),
                "resourceGraphQuery");
    }

    private Uni<List<JsonObject>> resourceGraphPages(String query, String skipToken, List<JsonObject> rows) {
        final var options = new JsonObject()
                .put("resultFormat", "objectArray")
                .put("$top", RESOURCE_GRAPH_PAGE_SIZE);
        if (skipToken != null) {
            options.put("$skipToken", skipToken);
        }
        final var body = new JsonObject().put("query", query).put("options", options);

        final var request = authorize(
                webClient.postAbs(config.managementBaseUrl() + RESOURCE_GRAPH_PATH), config.managementToken());
        return execute(request.putHeader("Content-Type", "application/json"), body, "resourceGraphQuery")
                .chain(page -> {
                    rows.addAll(GraphJson.objects(page.getJsonArray("data")));
                    final var next = page.getString("$skipToken");
                    if (next == null || next.isBlank()) {
                        return Uni.createFrom().item(rows);
                    }
                    return resourceGraphPages(query, next, rows);
                });
    }

    // -------------------------------------------------------------------------
    // API permissions
    // -------------------------------------------------------------------------

    @Override
    public Uni<List<ApiPermission>> getApiPermissions(String principalId) {
        final var rejected = requireGuid(principalId);
        if (rejected != null) {
            return Uni.createFrom().failure(rejected);
        }
        final var request = graph("/servicePrincipals/" + principalId + "/appRoleAssignments")
                .addQueryParam("$top", String.valueOf(config.pageSize()));
        return mapped(graphPages(request, "appRoleAssignments").chain(assignments -> {
            final var resourceIds = new LinkedHashSet<String>();
            assignments.forEach(assignment -> {
                final var resourceId = assignment.getString("resourceId");
                if (resourceId != null) {
                    resourceIds.add(resourceId);
                }
            });
            return appRoleValuesByResource(resourceIds).map(valuesByResource -> assignments.stream()
                    .map(assignment -> GraphJson.apiPermission(
                            assignment,
                            valuesByResource.getOrDefault(assignment.getString("resourceId"), Map.of())))
                    .toList());
        }), "appRoleAssignments");
    }

    /**
     * App role id to value for every resource. A resource whose app roles cannot be read
     * maps to an empty table, so its permissions carry an empty value.
     */
    private Uni<Map<String, Map<String, String>>> appRoleValuesByResource(Iterable<String> resourceIds) {
        return Multi.createFrom()
                .iterable(resourceIds)
                .onItem()
                .transformToUniAndConcatenate(resourceId -> lookup(
                                graph("/servicePrincipals/" + resourceId).addQueryParam("$select", "id,appRoles"),
                                "getResourceServicePrincipal")
                        .map(found -> Map.entry(resourceId, found.map(GraphJson::appRoleValues).orElse(Map.of())))
                        .onFailure(DirectoryException.class)
                        .recoverWithItem(failure -> {
                            LOG.warnv("Could not read app roles of {0}: {1}", resourceId, failure.getMessage());
                            return Map.entry(resourceId, Map.<String, String>of());
                        }))
                .collect()
                .asMap(Map.Entry::getKey, entry -> {
                    final Map<String, String> roles = new HashMap<>(entry.getValue());
                    roles.put(NO_APP_ROLE, "");
                    return roles;
                });
    }

    // -------------------------------------------------------------------------
    // Search
    // -------------------------------------------------------------------------

    @Override
    public Uni<List<Identity>> searchPrincipals(String query) {
        final SearchQuery classified;
        try {
            classified = SearchQuery.classify(query);
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(e);
        }
        final var text = classified.text();
        final Uni<List<Identity>> found = switch (classified.kind()) {
            case OBJECT_ID -> firstPresent(List.of(
                            () -> findUser(text),
                            () -> findServicePrincipal(text),
                            () -> findServicePrincipalByAppId(text),
                            () -> findServicePrincipalByAppRegistration(text),
                            () -> findSecurityGroup(text)))
                    .map(match -> match.map(List::of).orElse(List.of()));
            case EMAIL -> searchUsersByEmail(text);
            case DISPLAY_NAME -> searchByDisplayName(text);
        };
        return mapped(found, "searchPrincipals");
    }

    private Uni<List<Identity>> searchUsersByEmail(String email) {
        final var literal = GraphJson.odataLiteral(email);
        final var request = graph("/users")
                .addQueryParam("$filter", "mail eq '" + literal + "' or userPrincipalName eq '" + literal + "'")
                .addQueryParam("$select", USER_FIELDS)
                .addQueryParam("$top", String.valueOf(searchLimit));
        return firstPage(request, "searchUsers")
                .map(users -> users.stream().map(GraphJson::user).toList());
    }

    private Uni<List<Identity>> searchByDisplayName(String prefix) {
        final var startsWith = "startswith(displayName,'" + GraphJson.odataLiteral(prefix) + "')";
        final var top = String.valueOf(searchLimit);

        final var users = firstPage(
                        graph("/users")
                                .addQueryParam("$filter", startsWith)
                                .addQueryParam("$select", USER_FIELDS)
                                .addQueryParam("$top", top),
                        "searchUsers")
                .map(found -> found.stream().map(GraphJson::user).toList());
        final var servicePrincipals = firstPage(
                        graph("/servicePrincipals")
                                .addQueryParam("$filter", startsWith)
                                .addQueryParam("$select", SERVICE_PRINCIPAL_FIELDS)
                                .addQueryParam("$top", top),
                        "searchServicePrincipals")
                .map(found -> found.stream()
                        .map(json -> GraphJson.servicePrincipal(json, null))
                        .toList());
        final var groups = firstPage(
                        graph("/groups")
                                .addQueryParam("$filter", "securityEnabled eq true and " + startsWith)
                                .addQueryParam("$select", GROUP_FIELDS)
                                .addQueryParam("$top", top),
                        "searchGroups")
                .map(found -> found.stream().map(GraphJson::group).toList());

        return Uni.combine().all().unis(users, servicePrincipals, groups).asTuple().map(found -> {
            final Map<String, Identity> merged = new LinkedHashMap<>();
            found.getItem1().forEach(identity -> merged.putIfAbsent(identity.objectId(), identity));
            found.getItem2().forEach(identity -> merged.putIfAbsent(identity.objectId(), identity));
            found.getItem3().forEach(identity -> merged.putIfAbsent(identity.objectId(), identity));
            return List.copyOf(merged.values());
        });
    }

    // -------------------------------------------------------------------------
    // HTTP plumbing
    // -------------------------------------------------------------------------

    private HttpRequest<Buffer> graph(String path) {
        return authorize(webClient.getAbs(config.graphBaseUrl() + path), config.graphToken());
    }

    private HttpRequest<Buffer> authorize(HttpRequest<Buffer> request, Optional<String> token) {
        request.timeout(requestTimeoutMs).putHeader("Accept", "application/json");
        token.ifPresent(value -> request.putHeader("Authorization", "Bearer " + value));
        return request;
    }

    /**
     * Run lookups in order and return the first that finds something.
     */
    private Uni<Optional<Identity>> firstPresent(List<Supplier<Uni<Optional<Identity>>>> lookups) {
        Uni<Optional<Identity>> result = Uni.createFrom().item(Optional.empty());
        for (final var next : lookups) {
            result = result.chain(found -> {
                if (found.isPresent()) {
                    return Uni.createFrom().item(found);
                }
                return next.get();
            });
        }
        return result;
    }

    private Uni<Optional<JsonObject>> lookup(HttpRequest<Buffer> request, String operation) {
        return request.send()
                .map(response -> {
                    if (response.statusCode() == 404) {
                        return Optional.<JsonObject>empty();
                    }
                    return Optional.of(body(response, operation));
                })
                .onFailure(failure -> !(failure instanceof DirectoryException))
                .transform(failure -> transportFailure(operation, failure));
    }

    private Uni<Optional<JsonObject>> firstValue(HttpRequest<Buffer> request, String operation) {
        return firstPage(request, operation).map(values -> values.stream().findFirst());
    }

    private Uni<List<JsonObject>> firstPage(HttpRequest<Buffer> request, String operation) {
        return execute(request, null, operation).map(page -> GraphJson.objects(page.getJsonArray("value")));
    }

    private Uni<List<JsonObject>> graphPages(HttpRequest<Buffer> firstPage, String operation) {
        return nextPages(firstPage, operation, new ArrayList<>());
    }

    private Uni<List<JsonObject>> nextPages(HttpRequest<Buffer> request, String operation, List<JsonObject> values) {
        return execute(request, null, operation).chain(page -> {
            values.addAll(GraphJson.objects(page.getJsonArray("value")));
            final var nextLink = page.getString("@odata.nextLink");
            if (nextLink == null || nextLink.isBlank()) {
                return Uni.createFrom().item(values);
            }
            LOG.debugf("Following %s next page, %d item(s) so far", operation, values.size());
            return nextPages(authorize(webClient.getAbs(nextLink), config.graphToken()), operation, values);
        });
    }

    /**
     * Report a record the model rejects, such as a row without an id, as a permanent
     * fault of the operation. Transport and status failures are already translated.
     */
    private static <T> Uni<T> mapped(Uni<T> result, String operation) {
        return result.onFailure(failure -> !(failure instanceof DirectoryException))
                .transform(failure -> {
                    LOG.debugf("%s returned an unusable record: %s", operation, failure.getMessage());
                    return new PermanentDirectoryException(
                            operation + " returned an unusable record: " + failure.getMessage(), failure);
                });
    }

    private Uni<JsonObject> execute(HttpRequest<Buffer> request, JsonObject body, String operation) {
        final Uni<HttpResponse<Buffer>> sent = body == null ? request.send() : request.sendJsonObject(body);
        return sent.map(response -> body(response, operation))
                .onFailure(failure -> !(failure instanceof DirectoryException))
                .transform(failure -> transportFailure(operation, failure));
    }

    private JsonObject body(HttpResponse<Buffer> response, String operation) {
        final var status = response.statusCode();
        if (status == 429 || status >= 500) {
            LOG.debugf("%s returned %d", operation, status);
            throw new TransientDirectoryException(
                    operation + " returned status " + status, status, retryAfter(response));
        }
        if (status < 200 || status >= 300) {
            LOG.warnf("%s returned %d: %s", operation, status, truncate(response.bodyAsString()));
            throw new PermanentDirectoryException(operation + " returned status " + status, status);
        }
        try {
            final var json = response.bodyAsJsonObject();
            if (json == null) {
                throw new PermanentDirectoryException(operation + " returned an empty body", status);
            }
            return json;
        } catch (DecodeException e) {
            throw new PermanentDirectoryException(operation + " returned malformed JSON", e);
        }
    }

    private static Throwable transportFailure(String operation, Throwable failure) {
        return new TransientDirectoryException(operation + " failed: " + failure.getMessage(), failure);
    }

    private static Duration retryAfter(HttpResponse<Buffer> response) {
        final var header = response.getHeader("Retry-After");
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring non-numeric Retry-After header: %s", header);
            return null;
        }
    }

    private static PermanentDirectoryException requireGuid(String principalId) {
        if (SearchQuery.isGuid(principalId)) {
            return null;
        }
        return new PermanentDirectoryException("Principal ID is not a GUID: " + principalId, 400);
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
