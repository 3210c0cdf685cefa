package br.edu.ifba.graphrag.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one bounded traversal.
 *
 * @param startNodeId  node the walk started from
 * @param visitedNodes node IDs in visit order
 * @param facts        deduplicated facts in first-seen order
 */
public record TraversalResult(
    @NotNull String startNodeId,
    @NotNull List<String> visitedNodes,
    @NotNull List<Fact> facts
) {
    public TraversalResult {
        Objects.requireNonNull(startNodeId, "startNodeId must not be null");
        visitedNodes = List.copyOf(visitedNodes);
        facts = List.copyOf(facts);
    }
}
