package br.edu.ifba.graphrag.storage;

import br.edu.ifba.graphrag.core.Node;
import br.edu.ifba.graphrag.core.NodeKind;
import br.edu.ifba.graphrag.core.Relationship;
import br.edu.ifba.graphrag.core.RelationshipAttributes;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Bootstrap data for the knowledge graph, as read from the seed resource.
 *
 * <pre>
 * {
 *   "people":        [ {"id": "p1", "name": "Elon Musk", "role": "CEO"} ],
 *   "organizations": [ {"id": "c1", "name": "Tesla", "industry": "automotive"} ],
 *   "relationships": [ {"source": "p1", "target": "c1", "relation": "founded", "attributes": {"year": 2003}} ],
 *   "nodes":         [ {"id": "c9", "name": "Anthropic", "type": "company"} ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphSeed(
    List<PersonSeed> people,
    List<OrganizationSeed> organizations,
    List<RelationshipSeed> relationships,
    List<NodeSeed> nodes
) {

    public GraphSeed {
        people = people != null ? List.copyOf(people) : List.of();
        organizations = organizations != null ? List.copyOf(organizations) : List.of();
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
    }

    /**
     * People first, then organizations, then typed {@code nodes}, each in file order.
     *
     * @throws GraphConstructionException if a record misses its id or name
     */
    @NotNull
    public List<Node> toNodes() {
        List<Node> nodes = new ArrayList<>(people.size() + organizations.size());
        for (PersonSeed person : people) {
            requireText(person.id(), "person id");
            requireText(person.name(), "person name of " + person.id());
            nodes.add(Node.person(person.id(), person.name(), person.role()));
        }
        for (OrganizationSeed organization : organizations) {
            requireText(organization.id(), "organization id");
            requireText(organization.name(), "organization name of " + organization.id());
            nodes.add(Node.organization(organization.id(), organization.name(), organization.industry()));
        }
        for (NodeSeed node : this.nodes) {
            requireText(node.id(), "node id");
            requireText(node.name(), "node name of " + node.id());
            if (node.type() == null) {
                throw new GraphConstructionException("Seed data is missing node type of " + node.id());
            }
            nodes.add(new Node(node.id(), node.name(), node.type(), node.role(), node.industry(), null));
        }
        return nodes;
    }

    /**
     * Relationships in file order.
     *
     * @throws GraphConstructionException if a record misses an endpoint or label, or has a malformed attribute
     */
    @NotNull
    public List<Relationship> toRelationships() {
        List<Relationship> result = new ArrayList<>(relationships.size());
        for (RelationshipSeed seed : relationships) {
            requireText(seed.source(), "relationship source");
            requireText(seed.target(), "relationship target");
            requireText(seed.relation(), "relationship label " + seed.source() + "->" + seed.target());
            RelationshipAttributes attributes;
            try {
                attributes = RelationshipAttributes.fromMap(seed.attributes());
            } catch (IllegalArgumentException e) {
                throw new GraphConstructionException(
                    "Invalid attributes on " + seed.source() + " -[" + seed.relation() + "]-> " + seed.target(), e);
            }
            result.add(new Relationship(seed.source(), seed.target(), seed.relation(), attributes));
        }
        return result;
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new GraphConstructionException("Seed data is missing " + what);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PersonSeed(String id, String name, String role) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OrganizationSeed(String id, String name, String industry) {}

    /**
     * A node with an explicit {@code type} label ({@code person}, {@code organization}
     * or {@code company}).
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NodeSeed(String id, String name, NodeKind type, String role, String industry) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RelationshipSeed(
        String source,
        String target,
        String relation,
        Map<String, Object> attributes
    ) {}
}
