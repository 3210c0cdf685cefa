package br.edu.ifba.graphrag.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Represents a person or organization in the knowledge graph.
 * Nodes are created once while the graph is built and never change afterwards.
 *
 * <p>Kind-specific attributes have their own fields ({@code role} for people,
 * {@code industry} for organizations). Anything else found in seed data is kept
 * in {@link #getExtraAttributes()}.</p>
 */
public final class Node {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("name")
    @NotNull
    private final String name;

    @JsonProperty("kind")
    @NotNull
    private final NodeKind kind;

    @JsonProperty("role")
    @Nullable
    private final String role;

    @JsonProperty("industry")
    @Nullable
    private final String industry;

    @JsonProperty("extra_attributes")
    @NotNull
    private final Map<String, String> extraAttributes;

    public Node(
            @NotNull String id,
            @NotNull String name,
            @NotNull NodeKind kind,
            @Nullable String role,
            @Nullable String industry,
            @Nullable Map<String, String> extraAttributes) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.role = role;
        this.industry = industry;
        this.extraAttributes = extraAttributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(extraAttributes))
            : Collections.emptyMap();
    }

    /**
     * Creates a person node.
     */
    public static Node person(@NotNull String id, @NotNull String name, @Nullable String role) {
        return new Node(id, name, NodeKind.PERSON, role, null, null);
    }

    /**
     * Creates an organization node.
     */
    public static Node organization(@NotNull String id, @NotNull String name, @Nullable String industry) {
        return new Node(id, name, NodeKind.ORGANIZATION, null, industry, null);
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public NodeKind getKind() {
        return kind;
    }

    @Nullable
    public String getRole() {
        return role;
    }

    @Nullable
    public String getIndustry() {
        return industry;
    }

    @NotNull
    public Map<String, String> getExtraAttributes() {
        return extraAttributes;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Node node = (Node) obj;
        return id.equals(node.id) &&
               name.equals(node.name) &&
               kind == node.kind &&
               Objects.equals(role, node.role) &&
               Objects.equals(industry, node.industry) &&
               extraAttributes.equals(node.extraAttributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, kind, role, industry, extraAttributes);
    }

    @Override
    public String toString() {
        return "Node{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", kind=" + kind +
                ", role='" + role + '\'' +
                ", industry='" + industry + '\'' +
                '}';
    }
}
