package br.edu.ifba.graphrag.core;

/**
 * Size of the knowledge graph.
 */
public record GraphStats(
    int totalNodes,
    int totalEdges,
    int people,
    int organizations
) {}
