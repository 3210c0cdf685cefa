package br.edu.ifba.graphrag.core;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * Relation labels known to the sentence renderer.
 *
 * <p>The label set of the graph is open: edges keep their raw label, and a label
 * that is not listed here renders as {@code <source> <label> <target>}.</p>
 */
public enum RelationType {

    FOUNDED("founded", "founded"),
    CO_FOUNDED("co_founded", "co-founded"),
    LEADS("leads", "leads"),
    WORKS_AT("works_at", "works at"),
    INVESTED_IN("invested_in", "invested in"),
    ACQUIRED("acquired", "acquired"),
    PARTNERS_WITH("partners_with", "partners with"),
    SUPPLIES("supplies", "supplies to");

    private final String label;
    private final String phrase;

    RelationType(String label, String phrase) {
        this.label = label;
        this.phrase = phrase;
    }

    /**
     * Label as it appears on edges and in seed data (e.g. {@code co_founded}).
     */
    @NotNull
    public String getLabel() {
        return label;
    }

    /**
     * Verb phrase placed between source and target names (e.g. {@code co-founded}).
     */
    @NotNull
    public String getPhrase() {
        return phrase;
    }

    @NotNull
    public static Optional<RelationType> fromLabel(@NotNull String label) {
        for (RelationType type : values()) {
            if (type.label.equals(label)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
