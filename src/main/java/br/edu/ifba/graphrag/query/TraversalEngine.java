package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.Fact;
import br.edu.ifba.graphrag.core.TraversalResult;
import br.edu.ifba.graphrag.storage.GraphStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

/**
 * Bounded breadth-first walk over the knowledge graph.
 *
 * <p>Starting from one node, every visited node contributes all its incident
 * relationships as facts. Neighbors in both directions are queued one level deeper
 * while the current depth is below the limit. A node is expanded at most once, so
 * cycles and parallel edges cannot make the walk loop.</p>
 *
 * <pre>
 * depth 0: facts of the start node only
 * depth 1: facts of the start node and of its direct neighbors (default)
 * </pre>
 */
public class TraversalEngine {

    private static final Logger logger = LoggerFactory.getLogger(TraversalEngine.class);

    public static final int DEFAULT_DEPTH = 1;

    /**
     * Traverses from {@code startId} with the default depth.
     */
    @NotNull
    public TraversalResult traverse(@NotNull GraphStore graph, @NotNull String startId) {
        return traverse(graph, startId, DEFAULT_DEPTH);
    }

    /**
     * Traverses from {@code startId} up to {@code maxDepth} hops.
     *
     * @param graph    the graph to walk
     * @param startId  ID of the start node
     * @param maxDepth maximum number of hops, 0 or more
     * @return visited nodes in visit order and deduplicated facts
     * @throws IllegalArgumentException if {@code maxDepth} is negative or the start node does not exist
     */
    @NotNull
    public TraversalResult traverse(@NotNull GraphStore graph, @NotNull String startId, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got: " + maxDepth);
        }
        if (!graph.containsNode(startId)) {
            throw new IllegalArgumentException("Unknown start node: " + startId);
        }

        Set<String> visited = new LinkedHashSet<>();
        List<Fact> facts = new ArrayList<>();
        Queue<QueueEntry> toVisit = new ArrayDeque<>();
        toVisit.add(new QueueEntry(startId, 0));

        while (!toVisit.isEmpty()) {
            QueueEntry current = toVisit.poll();

            if (!visited.add(current.nodeId())) {
                continue;
            }

            facts.addAll(graph.relationshipsOf(current.nodeId()));

            if (current.depth() < maxDepth) {
                enqueueUnvisited(graph.successors(current.nodeId()), current.depth() + 1, visited, toVisit);
                enqueueUnvisited(graph.predecessors(current.nodeId()), current.depth() + 1, visited, toVisit);
            }
        }

        List<Fact> uniqueFacts = deduplicate(facts);
        logger.debug("Traversal from {} (depth {}) visited {} nodes, found {} facts ({} unique)",
                startId, maxDepth, visited.size(), facts.size(), uniqueFacts.size());

        return new TraversalResult(startId, new ArrayList<>(visited), uniqueFacts);
    }

    /**
     * Removes facts whose {@code (sourceId, targetId, relation)} key was already seen,
     * keeping the first occurrence and the input order. Idempotent.
     */
    @NotNull
    public static List<Fact> deduplicate(@NotNull Collection<Fact> facts) {
        Set<Fact.FactKey> seen = new HashSet<>();
        List<Fact> unique = new ArrayList<>();
        for (Fact fact : facts) {
            if (seen.add(fact.key())) {
                unique.add(fact);
            }
        }
        return unique;
    }

    private static void enqueueUnvisited(
            List<String> neighbors, int depth, Set<String> visited, Queue<QueueEntry> toVisit) {
        for (String neighbor : neighbors) {
            if (!visited.contains(neighbor)) {
                toVisit.add(new QueueEntry(neighbor, depth));
            }
        }
    }

    private record QueueEntry(String nodeId, int depth) {}
}
