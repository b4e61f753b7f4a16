package matriarch.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import matriarch.adapter.in.dto.IdentitySearchResponse;
import matriarch.adapter.in.dto.RoleAssignmentReportResponse;
import matriarch.core.port.in.IdentityResolution;

/**
 * REST resource for identity search and effective permission resolution.
 *
 * <p>Endpoints:
 * <ul>
 * <li>{@code GET /identities?query=} searches principals by id, email or display name</li>
 * <li>{@code GET /identities/{objectId}/role-assignments} resolves effective permissions</li>
 * <li>{@code DELETE /identities/cache} clears every cached directory record</li>
 * <li>{@code DELETE /identities/cache/{principalId}} clears one principal's records</li>
 * </ul>
 */
@Path("/identities")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class IdentityResource {

    private final IdentityResolution identityResolution;

    @Inject
    public IdentityResource(IdentityResolution identityResolution) {
        this.identityResolution = identityResolution;
    }

    /**
     * Search principals.
     *
     * @param query object id, application id, email, or display name prefix
     * @return the matches, or 400 if the query is blank
     */
    @GET
    public Uni<IdentitySearchResponse> search(
            @QueryParam("query") @NotBlank(message = "query is required") String query) {
        return identityResolution
                .searchIdentities(query)
                .map(result -> IdentitySearchResponse.from(query, result));
    }

    /**
     * Resolve a principal's effective role assignments.
     *
     * @param objectId the principal's object id
     * @return the report, or 404 if the principal does not exist
     */
    @GET
    @Path("/{objectId}/role-assignments")
    public Uni<RoleAssignmentReportResponse> resolve(@PathParam("objectId") String objectId) {
        return identityResolution.resolveIdentity(objectId).map(RoleAssignmentReportResponse::from);
    }

    @DELETE
    @Path("/cache")
    public Uni<Response> clearCache() {
        return identityResolution.clearCache().map(ignored -> Response.noContent().build());
    }

    @DELETE
    @Path("/cache/{principalId}")
    public Uni<Response> evict(@PathParam("principalId") String principalId) {
        return identityResolution.evict(principalId).map(ignored -> Response.noContent().build());
    }
}
