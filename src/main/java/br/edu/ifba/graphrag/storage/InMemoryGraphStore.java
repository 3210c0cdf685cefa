package br.edu.ifba.graphrag.storage;

import br.edu.ifba.graphrag.core.Fact;
import br.edu.ifba.graphrag.core.GraphStats;
import br.edu.ifba.graphrag.core.Node;
import br.edu.ifba.graphrag.core.NodeKind;
import br.edu.ifba.graphrag.core.Relationship;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory directed multigraph.
 * Uses adjacency lists in both directions so successor and predecessor queries are cheap.
 *
 * <p>Instances are immutable once {@link #build(List, List)} returns. All collections
 * are copied and wrapped, so the store can be shared across threads without
 * synchronization.</p>
 */
public final class InMemoryGraphStore implements GraphStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStore.class);

    // Node storage: nodeId -> Node, insertion order
    private final Map<String, Node> nodes;

    // Edge storage, insertion order
    private final List<Relationship> relationships;

    // Adjacency list for outgoing edges: srcId -> edges
    private final Map<String, List<Relationship>> outgoingEdges;

    // Adjacency list for incoming edges: tgtId -> edges
    private final Map<String, List<Relationship>> incomingEdges;

    private InMemoryGraphStore(
            Map<String, Node> nodes,
            List<Relationship> relationships,
            Map<String, List<Relationship>> outgoingEdges,
            Map<String, List<Relationship>> incomingEdges) {
        this.nodes = nodes;
        this.relationships = relationships;
        this.outgoingEdges = outgoingEdges;
        this.incomingEdges = incomingEdges;
    }

    /**
     * Builds a graph from nodes and relationships.
     *
     * @param nodeList         nodes, IDs must be unique
     * @param relationshipList edges, both endpoints must reference a node of {@code nodeList}
     * @return the immutable graph
     * @throws GraphConstructionException on a duplicate node ID, a blank ID, name or label,
     *                                    or an edge endpoint that references no node
     */
    @NotNull
    public static InMemoryGraphStore build(
            @NotNull List<Node> nodeList,
            @NotNull List<Relationship> relationshipList) {

        Map<String, Node> nodes = new LinkedHashMap<>();
        for (Node node : nodeList) {
            if (node.getId().isBlank()) {
                throw new GraphConstructionException("Node ID must not be blank: " + node);
            }
            if (node.getName().isBlank()) {
                throw new GraphConstructionException("Node name must not be blank: " + node.getId());
            }
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                throw new GraphConstructionException("Duplicate node ID: " + node.getId());
            }
        }

        Map<String, List<Relationship>> outgoing = new LinkedHashMap<>();
        Map<String, List<Relationship>> incoming = new LinkedHashMap<>();
        for (Node node : nodes.values()) {
            outgoing.put(node.getId(), new ArrayList<>());
            incoming.put(node.getId(), new ArrayList<>());
        }

        for (Relationship relationship : relationshipList) {
            if (!nodes.containsKey(relationship.getSrcId())) {
                throw new GraphConstructionException(
                    "Relationship references unknown source node: " + relationship);
            }
            if (!nodes.containsKey(relationship.getTgtId())) {
                throw new GraphConstructionException(
                    "Relationship references unknown target node: " + relationship);
            }
            if (relationship.getRelation().isBlank()) {
                throw new GraphConstructionException("Relationship label must not be blank: " + relationship);
            }
            outgoing.get(relationship.getSrcId()).add(relationship);
            incoming.get(relationship.getTgtId()).add(relationship);
        }

        Map<String, List<Relationship>> frozenOutgoing = new LinkedHashMap<>();
        outgoing.forEach((id, edges) -> frozenOutgoing.put(id, List.copyOf(edges)));
        Map<String, List<Relationship>> frozenIncoming = new LinkedHashMap<>();
        incoming.forEach((id, edges) -> frozenIncoming.put(id, List.copyOf(edges)));

        InMemoryGraphStore store = new InMemoryGraphStore(
            Collections.unmodifiableMap(nodes),
            List.copyOf(relationshipList),
            Collections.unmodifiableMap(frozenOutgoing),
            Collections.unmodifiableMap(frozenIncoming)
        );
        logger.debug("Built graph with {} nodes and {} relationships", nodes.size(), relationshipList.size());
        return store;
    }

    @Override
    @NotNull
    public Optional<Node> getNode(@NotNull String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    @Override
    @NotNull
    public List<Node> findNodesByName(@NotNull String query) {
        String queryLower = query.toLowerCase(Locale.ROOT);
        List<Node> matches = new ArrayList<>();

        for (Node node : nodes.values()) {
            String nodeName = node.getName().toLowerCase(Locale.ROOT);
            if (nodeName.contains(queryLower) || queryLower.contains(nodeName)) {
                matches.add(node);
            }
        }

        return matches;
    }

    @Override
    @NotNull
    public List<Fact> relationshipsOf(@NotNull String nodeId) {
        Node node = requireNode(nodeId);
        List<Fact> facts = new ArrayList<>();

        for (Relationship relationship : outgoingEdges.get(nodeId)) {
            facts.add(Fact.of(Fact.Direction.OUTGOING, relationship, node, nodes.get(relationship.getTgtId())));
        }

        for (Relationship relationship : incomingEdges.get(nodeId)) {
            facts.add(Fact.of(Fact.Direction.INCOMING, relationship, nodes.get(relationship.getSrcId()), node));
        }

        return facts;
    }

    @Override
    @NotNull
    public List<String> successors(@NotNull String nodeId) {
        requireNode(nodeId);
        Set<String> ids = new LinkedHashSet<>();
        for (Relationship relationship : outgoingEdges.get(nodeId)) {
            ids.add(relationship.getTgtId());
        }
        return new ArrayList<>(ids);
    }

    @Override
    @NotNull
    public List<String> predecessors(@NotNull String nodeId) {
        requireNode(nodeId);
        Set<String> ids = new LinkedHashSet<>();
        for (Relationship relationship : incomingEdges.get(nodeId)) {
            ids.add(relationship.getSrcId());
        }
        return new ArrayList<>(ids);
    }

    @Override
    @NotNull
    public List<Node> nodes() {
        return List.copyOf(nodes.values());
    }

    @Override
    @NotNull
    public List<Relationship> relationships() {
        return relationships;
    }

    @Override
    @NotNull
    public GraphStats stats() {
        int people = 0;
        int organizations = 0;
        for (Node node : nodes.values()) {
            if (node.getKind() == NodeKind.PERSON) {
                people++;
            } else {
                organizations++;
            }
        }
        return new GraphStats(nodes.size(), relationships.size(), people, organizations);
    }

    private Node requireNode(String nodeId) {
        Node node = nodes.get(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node ID: " + nodeId);
        }
        return node;
    }
}
