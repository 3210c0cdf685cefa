package br.edu.ifba.graphrag.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Kind of a node in the knowledge graph.
 */
public enum NodeKind {

    PERSON("person"),
    ORGANIZATION("organization");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    @JsonValue
    @NotNull
    public String getLabel() {
        return label;
    }

    /**
     * Resolves a seed label. {@code company} is accepted as an alias of {@code organization}.
     *
     * @param label the label as written in seed data
     * @return the matching kind
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    @NotNull
    public static NodeKind fromLabel(@NotNull String label) {
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "person" -> PERSON;
            case "organization", "company" -> ORGANIZATION;
            default -> throw new IllegalArgumentException("Unknown node kind: " + label);
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
