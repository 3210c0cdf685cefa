package br.edu.ifba.graphrag.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A directed, labeled edge between two nodes of the knowledge graph.
 * The graph is multi-relational: the same ordered pair may carry several edges
 * with different labels.
 */
public final class Relationship {

    @JsonProperty("src_id")
    @NotNull
    private final String srcId;

    @JsonProperty("tgt_id")
    @NotNull
    private final String tgtId;

    @JsonProperty("relation")
    @NotNull
    private final String relation;

    @JsonProperty("attributes")
    @NotNull
    private final RelationshipAttributes attributes;

    /**
     * Constructs a new Relationship.
     *
     * @param srcId      the source node ID (required)
     * @param tgtId      the target node ID (required)
     * @param relation   the relation label, e.g. {@code founded} (required)
     * @param attributes edge attributes (optional, empty when null)
     */
    public Relationship(
            @NotNull String srcId,
            @NotNull String tgtId,
            @NotNull String relation,
            @Nullable RelationshipAttributes attributes) {
        this.srcId = Objects.requireNonNull(srcId, "srcId must not be null");
        this.tgtId = Objects.requireNonNull(tgtId, "tgtId must not be null");
        this.relation = Objects.requireNonNull(relation, "relation must not be null");
        this.attributes = attributes != null ? attributes : RelationshipAttributes.EMPTY;
    }

    @NotNull
    public String getSrcId() {
        return srcId;
    }

    @NotNull
    public String getTgtId() {
        return tgtId;
    }

    @NotNull
    public String getRelation() {
        return relation;
    }

    @NotNull
    public RelationshipAttributes getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Relationship other = (Relationship) obj;
        return srcId.equals(other.srcId) &&
               tgtId.equals(other.tgtId) &&
               relation.equals(other.relation) &&
               attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(srcId, tgtId, relation, attributes);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "srcId='" + srcId + '\'' +
                ", tgtId='" + tgtId + '\'' +
                ", relation='" + relation + '\'' +
                ", attributes=" + attributes.asMap() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Relationship instances.
     */
    public static class Builder {
        private String srcId;
        private String tgtId;
        private String relation;
        private RelationshipAttributes attributes = RelationshipAttributes.EMPTY;

        public Builder srcId(@NotNull String srcId) {
            this.srcId = srcId;
            return this;
        }

        public Builder tgtId(@NotNull String tgtId) {
            this.tgtId = tgtId;
            return this;
        }

        public Builder relation(@NotNull String relation) {
            this.relation = relation;
            return this;
        }

        public Builder relation(@NotNull RelationType type) {
            this.relation = type.getLabel();
            return this;
        }

        public Builder attributes(@Nullable RelationshipAttributes attributes) {
            this.attributes = attributes;
            return this;
        }

        public Relationship build() {
            return new Relationship(srcId, tgtId, relation, attributes);
        }
    }
}
