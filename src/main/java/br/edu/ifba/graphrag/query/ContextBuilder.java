package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.EntityMention;
import br.edu.ifba.graphrag.core.Fact;
import br.edu.ifba.graphrag.core.RelationType;
import br.edu.ifba.graphrag.core.RelationshipAttributes;
import br.edu.ifba.graphrag.core.TraversalResult;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns graph facts into the grounding context sent to the answer generator.
 *
 * <h2>Context Structure:</h2>
 * <pre>
 * Information about: Elon Musk
 *
 * Known facts:
 * - Elon Musk founded Tesla in 2003
 * - Elon Musk leads Tesla as CEO
 * </pre>
 *
 * <p>When there are no facts the context is {@link #NO_GROUNDING_CONTEXT}. Callers
 * compare against that constant to decide whether generation is worth attempting.</p>
 */
public class ContextBuilder {

    /**
     * Context returned when no fact was found.
     */
    public static final String NO_GROUNDING_CONTEXT = "No relevant information found in the knowledge graph.";

    private static final String HEADER_ENTITIES = "Information about: ";
    private static final String HEADER_FACTS = "Known facts:";

    /**
     * Renders facts into a grounding context.
     *
     * @param facts    facts in the order they should appear
     * @param entities detected entities, listed in the header when present
     * @return the context, or {@link #NO_GROUNDING_CONTEXT} when {@code facts} is empty
     */
    @NotNull
    public String render(@NotNull List<Fact> facts, @NotNull List<EntityMention> entities) {
        if (facts.isEmpty()) {
            return NO_GROUNDING_CONTEXT;
        }

        List<String> lines = new ArrayList<>();

        if (!entities.isEmpty()) {
            List<String> names = entities.stream().map(EntityMention::name).toList();
            lines.add(HEADER_ENTITIES + String.join(", ", names));
            lines.add("");
        }

        lines.add(HEADER_FACTS);
        for (Fact fact : facts) {
            lines.add("- " + formatFact(fact));
        }

        return String.join("\n", lines);
    }

    /**
     * Renders one fact as a sentence.
     *
     * <p>Known relation types use their phrase ({@code co_founded} becomes "co-founded");
     * other labels are inserted verbatim. Attribute fragments follow in a fixed order:
     * year ({@code in 2003}), amount ({@code ($13B)}), role for {@code leads} only
     * ({@code as CEO}), product ({@code (GPUs)}).</p>
     */
    @NotNull
    public String formatFact(@NotNull Fact fact) {
        Optional<RelationType> type = RelationType.fromLabel(fact.relation());
        String phrase = type.map(RelationType::getPhrase).orElse(fact.relation());
        StringBuilder sentence = new StringBuilder()
                .append(fact.sourceName()).append(' ')
                .append(phrase).append(' ')
                .append(fact.targetName());

        RelationshipAttributes attrs = fact.attributes();
        List<String> parts = new ArrayList<>();
        if (attrs.year() != null) {
            parts.add("in " + attrs.year());
        }
        if (attrs.amount() != null) {
            parts.add("(" + attrs.amount() + ")");
        }
        if (attrs.role() != null && type.orElse(null) == RelationType.LEADS) {
            parts.add("as " + attrs.role());
        }
        if (attrs.product() != null) {
            parts.add("(" + attrs.product() + ")");
        }

        if (!parts.isEmpty()) {
            sentence.append(' ').append(String.join(" ", parts));
        }
        return sentence.toString();
    }

    /**
     * Short human-readable summary of one traversal.
     */
    @NotNull
    public String formatTraversalSummary(@NotNull TraversalResult traversal) {
        return "Started from: " + traversal.startNodeId() + "\n" +
               "Visited nodes: " + String.join(", ", traversal.visitedNodes()) + "\n" +
               "Facts discovered: " + traversal.facts().size();
    }
}
