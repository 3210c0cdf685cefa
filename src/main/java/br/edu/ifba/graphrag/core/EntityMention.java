package br.edu.ifba.graphrag.core;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A known entity recognized in question text.
 *
 * @param name        canonical display name (e.g. {@code Elon Musk})
 * @param kind        inferred node kind
 * @param matchedText the lowercase surface form found in the text (e.g. {@code musk})
 */
public record EntityMention(
    @NotNull String name,
    @NotNull NodeKind kind,
    @NotNull String matchedText
) {
    public EntityMention {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(matchedText, "matchedText must not be null");
    }
}
