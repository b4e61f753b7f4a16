package matriarch;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Integration tests for the identity endpoints.
 *
 * <p>Runs against the in-memory directory configured by the test profile, which starts empty.
 */
@QuarkusTest
@DisplayName("Identity Endpoint Tests")
class IdentityEndpointTest {

    private static final String UNKNOWN_ID = "00000000-0000-0000-0000-000000000001";

    @Nested
    @DisplayName("Role assignments")
    class RoleAssignmentTests {

        @Test
        @DisplayName("should return 404 problem for an unknown identity")
        void shouldReturnNotFound() {
            given().when()
                    .get("/identities/{id}/role-assignments", UNKNOWN_ID)
                    .then()
                    .statusCode(404)
                    .contentType("application/problem+json")
                    .body("title", equalTo("Identity Not Found"));
        }
    }

    @Nested
    @DisplayName("Search")
    class SearchTests {

        @Test
        @DisplayName("should return an empty result when nothing matches")
        void shouldReturnEmptyResult() {
            given().queryParam("query", "Nobody")
                    .when()
                    .get("/identities")
                    .then()
                    .statusCode(200)
                    .body("query", equalTo("Nobody"))
                    .body("identities", hasSize(0))
                    .body("multipleResults", equalTo(false));
        }

        @Test
        @DisplayName("should return 400 for a blank query")
        void shouldRejectBlankQuery() {
            given().queryParam("query", " ").when().get("/identities").then().statusCode(400);
        }

        @Test
        @DisplayName("should return 400 when the query is missing")
        void shouldRejectMissingQuery() {
            given().when().get("/identities").then().statusCode(400);
        }
    }

    @Nested
    @DisplayName("Cache administration")
    class CacheTests {

        @Test
        @DisplayName("should return 204 after clearing the cache")
        void shouldClearCache() {
            given().when().delete("/identities/cache").then().statusCode(204);
        }

        @Test
        @DisplayName("should return 204 after evicting one principal")
        void shouldEvictPrincipal() {
            given().when().delete("/identities/cache/{id}", UNKNOWN_ID).then().statusCode(204);
        }
    }

    @Test
    @DisplayName("should report the directory readiness check as UP")
    void shouldReportReadiness() {
        given().when()
                .get("/q/health/ready")
                .then()
                .statusCode(200)
                .body("status", equalTo("UP"))
                .body("checks.find { it.name == 'directory' }.data.provider", equalTo("memory"));
    }
}
