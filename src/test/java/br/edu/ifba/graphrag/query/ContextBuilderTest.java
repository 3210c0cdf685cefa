package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.EntityMention;
import br.edu.ifba.graphrag.core.Fact;
import br.edu.ifba.graphrag.core.NodeKind;
import br.edu.ifba.graphrag.core.RelationshipAttributes;
import br.edu.ifba.graphrag.core.TraversalResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextBuilderTest {

    private final ContextBuilder builder = new ContextBuilder();

    private static Fact fact(String source, String relation, String target, Map<String, ?> attributes) {
        return new Fact(Fact.Direction.OUTGOING, source.toLowerCase(), source, target.toLowerCase(), target,
                relation, RelationshipAttributes.fromMap(attributes));
    }

    @Nested
    @DisplayName("formatFact")
    class FormatFactTests {

        @Test
        @DisplayName("should use the relation phrase and the year")
        void shouldFormatFoundedWithYear() {
            Fact fact = fact("Elon Musk", "founded", "Tesla", Map.of("year", 2003));

            assertEquals("Elon Musk founded Tesla in 2003", builder.formatFact(fact));
        }

        @Test
        @DisplayName("should put the year before the amount")
        void shouldOrderYearThenAmount() {
            Fact fact = fact("Microsoft", "invested_in", "OpenAI", Map.of("amount", "$13B", "year", 2023));

            assertEquals("Microsoft invested in OpenAI in 2023 ($13B)", builder.formatFact(fact));
        }

        @Test
        @DisplayName("should render the role only for leads")
        void shouldRenderRoleOnlyForLeads() {
            assertEquals("Sam Altman leads OpenAI as CEO",
                    builder.formatFact(fact("Sam Altman", "leads", "OpenAI", Map.of("role", "CEO"))));
            assertEquals("Sam Altman works at OpenAI",
                    builder.formatFact(fact("Sam Altman", "works_at", "OpenAI", Map.of("role", "CEO"))));
        }

        @Test
        @DisplayName("should render the product and ignore the type")
        void shouldRenderProduct() {
            assertEquals("NVIDIA supplies to OpenAI (GPUs)",
                    builder.formatFact(fact("NVIDIA", "supplies", "OpenAI", Map.of("product", "GPUs"))));
            assertEquals("Microsoft partners with OpenAI",
                    builder.formatFact(fact("Microsoft", "partners_with", "OpenAI", Map.of("type", "strategic"))));
        }

        @Test
        @DisplayName("should insert unknown labels verbatim")
        void shouldKeepUnknownLabel() {
            assertEquals("Google mentors DeepMind in 2015",
                    builder.formatFact(fact("Google", "mentors", "DeepMind", Map.of("year", "2015"))));
        }

        @Test
        @DisplayName("should render co_founded with a hyphen")
        void shouldRenderCoFounded() {
            assertEquals("Sam Altman co-founded OpenAI in 2015",
                    builder.formatFact(fact("Sam Altman", "co_founded", "OpenAI", Map.of("year", 2015))));
        }
    }

    @Nested
    @DisplayName("render")
    class RenderTests {

        @Test
        @DisplayName("should return the sentinel when there are no facts")
        void shouldReturnSentinel() {
            List<EntityMention> entities = List.of(new EntityMention("Tesla", NodeKind.ORGANIZATION, "tesla"));

            assertEquals(ContextBuilder.NO_GROUNDING_CONTEXT, builder.render(List.of(), entities));
        }

        @Test
        @DisplayName("should list entities then facts")
        void shouldRenderEntitiesAndFacts() {
            List<EntityMention> entities = List.of(
                    new EntityMention("Microsoft", NodeKind.ORGANIZATION, "microsoft"),
                    new EntityMention("OpenAI", NodeKind.ORGANIZATION, "openai"));
            List<Fact> facts = List.of(
                    fact("Microsoft", "invested_in", "OpenAI", Map.of("amount", "$13B", "year", 2023)),
                    fact("Microsoft", "partners_with", "OpenAI", Map.of("type", "strategic")));

            String expected = """
                    Information about: Microsoft, OpenAI

                    Known facts:
                    - Microsoft invested in OpenAI in 2023 ($13B)
                    - Microsoft partners with OpenAI""";
            assertEquals(expected, builder.render(facts, entities));
        }

        @Test
        @DisplayName("should omit the entity header when no entity was detected")
        void shouldOmitHeaderWithoutEntities() {
            List<Fact> facts = List.of(fact("Google", "acquired", "DeepMind", Map.of("year", 2014)));

            assertEquals("Known facts:\n- Google acquired DeepMind in 2014", builder.render(facts, List.of()));
        }
    }

    @Test
    @DisplayName("should summarize a traversal")
    void shouldSummarizeTraversal() {
        TraversalResult result = new TraversalResult("p1", List.of("p1", "c1"),
                List.of(fact("Elon Musk", "founded", "Tesla", Map.of("year", 2003))));

        assertEquals("Started from: p1\nVisited nodes: p1, c1\nFacts discovered: 1",
                builder.formatTraversalSummary(result));
    }
}
