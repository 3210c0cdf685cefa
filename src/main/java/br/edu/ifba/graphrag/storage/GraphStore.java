package br.edu.ifba.graphrag.storage;

import br.edu.ifba.graphrag.core.Fact;
import br.edu.ifba.graphrag.core.GraphStats;
import br.edu.ifba.graphrag.core.Node;
import br.edu.ifba.graphrag.core.Relationship;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the knowledge graph of people, organizations and their relationships.
 *
 * <p>The graph is a directed multigraph: parallel edges with different relation labels
 * may connect the same ordered pair. Implementations are built once and never mutated,
 * so a single instance can serve concurrent queries without locking.</p>
 *
 * Implementations: InMemoryGraphStore
 */
public interface GraphStore {

    /**
     * Gets a node by ID.
     *
     * @param nodeId the node ID
     * @return the node, or empty if no node has this ID
     */
    @NotNull
    Optional<Node> getNode(@NotNull String nodeId);

    /**
     * Checks whether a node with this ID exists.
     */
    default boolean containsNode(@NotNull String nodeId) {
        return getNode(nodeId).isPresent();
    }

    /**
     * Finds nodes by name using a case-insensitive mutual substring rule.
     *
     * <p>A node matches when the lowercased query is contained in the lowercased node
     * name, or the lowercased node name is contained in the lowercased query. So both
     * {@code "musk"} and {@code "Elon Musk Jr"} match {@code "Elon Musk"}. Short queries
     * can match many nodes; this is kept as is.</p>
     *
     * @param query the name to look up
     * @return matching nodes in insertion order, empty list if none
     */
    @NotNull
    List<Node> findNodesByName(@NotNull String query);

    /**
     * Gets every relationship touching a node, as facts.
     *
     * <p>Outgoing edges come first (tagged {@link Fact.Direction#OUTGOING}), then incoming
     * edges (tagged {@link Fact.Direction#INCOMING}). Each edge yields exactly one fact;
     * no deduplication happens here.</p>
     *
     * @param nodeId the node ID
     * @return facts for the node, empty list if the node has no edges
     * @throws IllegalArgumentException if the node does not exist
     */
    @NotNull
    List<Fact> relationshipsOf(@NotNull String nodeId);

    /**
     * Distinct IDs of nodes reachable through one outgoing edge, in edge order.
     */
    @NotNull
    List<String> successors(@NotNull String nodeId);

    /**
     * Distinct IDs of nodes with an edge pointing to this node, in edge order.
     */
    @NotNull
    List<String> predecessors(@NotNull String nodeId);

    /**
     * All nodes in insertion order.
     */
    @NotNull
    List<Node> nodes();

    /**
     * All relationships in insertion order.
     */
    @NotNull
    List<Relationship> relationships();

    /**
     * Counts nodes and edges.
     */
    @NotNull
    GraphStats stats();
}
