package br.edu.ifba.graphrag.api;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;

@QuarkusTest
class GraphResourcesTest {

    @Test
    @DisplayName("GET /graph/stats should count the seed graph")
    void shouldReturnStats() {
        given()
            .when()
            .get("/graph/stats")
            .then()
            .statusCode(200)
            .body("totalNodes", equalTo(13))
            .body("totalEdges", equalTo(17))
            .body("people", equalTo(5))
            .body("organizations", equalTo(8));
    }

    @Test
    @DisplayName("GET /graph/nodes should match names by substring")
    void shouldFindNodesByName() {
        given()
            .queryParam("name", "musk")
            .when()
            .get("/graph/nodes")
            .then()
            .statusCode(200)
            .body("$", hasSize(1))
            .body("[0].id", equalTo("p1"))
            .body("[0].kind", equalTo("person"));
    }

    @Test
    @DisplayName("GET /graph/nodes without a name should list every node")
    void shouldListAllNodes() {
        given()
            .when()
            .get("/graph/nodes")
            .then()
            .statusCode(200)
            .body("$", hasSize(13));
    }

    @Test
    @DisplayName("GET /graph/nodes/{id}/relationships should list outgoing then incoming facts")
    void shouldListRelationships() {
        given()
            .when()
            .get("/graph/nodes/c4/relationships")
            .then()
            .statusCode(200)
            .body("$", hasSize(4))
            .body("[0].direction", equalTo("OUTGOING"))
            .body("[0].relation", equalTo("invested_in"))
            .body("[0].attributes.amount", equalTo("$13B"))
            .body("[3].direction", equalTo("INCOMING"))
            .body("[3].sourceName", equalTo("NVIDIA"));
    }

    @Test
    @DisplayName("GET /graph/nodes/{id}/relationships should return 404 for an unknown node")
    void shouldReturnNotFound() {
        given()
            .when()
            .get("/graph/nodes/zz/relationships")
            .then()
            .statusCode(404)
            .body("status", equalTo(404))
            .body("detail", containsString("zz"));
    }
}
