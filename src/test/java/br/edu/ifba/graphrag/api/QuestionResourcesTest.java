package br.edu.ifba.graphrag.api;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;

/**
 * The test profile disables generation, so answers carry the raw context.
 */
@QuarkusTest
class QuestionResourcesTest {

    @Test
    @DisplayName("POST /questions should answer from the graph")
    void shouldAnswerQuestion() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"question\": \"What companies did Elon Musk found?\"}")
            .when()
            .post("/questions")
            .then()
            .statusCode(200)
            .body("question", equalTo("What companies did Elon Musk found?"))
            .body("entities", hasSize(1))
            .body("entities[0].name", equalTo("Elon Musk"))
            .body("entities[0].kind", equalTo("person"))
            .body("relationIntents", hasItem("founded"))
            .body("matchedNodeIds", hasItem("p1"))
            .body("facts", hasSize(5))
            .body("context", containsString("Elon Musk founded Tesla in 2003"))
            .body("answer", startsWith("[LLM not available - showing raw context]"))
            .body("generationAvailable", equalTo(false))
            .body("trace", hasItem("[detect-entities] STEP 1: Entity Detection"));
    }

    @Test
    @DisplayName("POST /questions should give the fixed answer for unknown topics")
    void shouldAnswerUnknownTopic() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"question\": \"hello\"}")
            .when()
            .post("/questions")
            .then()
            .statusCode(200)
            .body("entities", hasSize(0))
            .body("context", equalTo("No relevant information found in the knowledge graph."))
            .body("answer", equalTo(
                    "I couldn't find any relevant information in the knowledge graph to answer your question."));
    }

    @Test
    @DisplayName("POST /questions should reject a missing question")
    void shouldRejectMissingQuestion() {
        given()
            .contentType(ContentType.JSON)
            .body("{}")
            .when()
            .post("/questions")
            .then()
            .statusCode(400);
    }

    @Test
    @DisplayName("GET /questions/samples should list the sample questions")
    void shouldListSamples() {
        given()
            .when()
            .get("/questions/samples")
            .then()
            .statusCode(200)
            .body("$", hasSize(5))
            .body("$", hasItem("Who leads OpenAI?"));
    }
}
