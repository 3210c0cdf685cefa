package br.edu.ifba.graphrag.api;

import jakarta.validation.constraints.NotNull;

/**
 * A question for the knowledge graph. Empty text is accepted and yields the
 * no-information answer.
 */
public record QuestionRequest(
    @NotNull(message = "Question is required")
    String question
) {}
