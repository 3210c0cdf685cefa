package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.RelationType;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Guesses which relation labels a question is about from keyword stems.
 *
 * <p>The result is informational: it is recorded on the pipeline state and in the
 * trace, but traversal does not filter on it.</p>
 */
public class RelationIntentDetector {

    private static final Map<RelationType, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(RelationType.FOUNDED, List.of("found", "start", "creat", "establish"));
        KEYWORDS.put(RelationType.LEADS, List.of("lead", "run", "ceo", "head", "manage"));
        KEYWORDS.put(RelationType.WORKS_AT, List.of("work", "employ"));
        KEYWORDS.put(RelationType.INVESTED_IN, List.of("invest", "fund", "money"));
        KEYWORDS.put(RelationType.ACQUIRED, List.of("acquir", "bought", "purchase"));
        KEYWORDS.put(RelationType.PARTNERS_WITH, List.of("partner", "collaborat", "work with"));
        KEYWORDS.put(RelationType.SUPPLIES, List.of("supply", "provide", "sell"));
    }

    /**
     * Returns relation labels whose stems occur in {@code text}, in a fixed order.
     */
    @NotNull
    public List<String> detect(@NotNull String text) {
        String textLower = text.toLowerCase(Locale.ROOT);
        List<String> intents = new ArrayList<>();

        for (Map.Entry<RelationType, List<String>> entry : KEYWORDS.entrySet()) {
            boolean mentioned = entry.getValue().stream().anyMatch(textLower::contains);
            if (mentioned) {
                intents.add(entry.getKey().getLabel());
            }
        }

        return intents;
    }
}
