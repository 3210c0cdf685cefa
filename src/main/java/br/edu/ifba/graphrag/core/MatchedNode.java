package br.edu.ifba.graphrag.core;

import org.jetbrains.annotations.NotNull;

/**
 * A graph node found for a detected entity.
 *
 * @param nodeId        ID of the node
 * @param node          the node itself
 * @param matchedEntity canonical name of the mention that led to this node
 */
public record MatchedNode(
    @NotNull String nodeId,
    @NotNull Node node,
    @NotNull String matchedEntity
) {}
