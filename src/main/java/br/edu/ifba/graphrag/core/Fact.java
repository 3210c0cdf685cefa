package br.edu.ifba.graphrag.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One relationship as seen from a visited node, with display names resolved on both ends.
 *
 * <p>Two facts describe the same edge when their {@link #key()} is equal, regardless
 * of the direction they were discovered from.</p>
 *
 * @param direction  whether the visited node was the source or the target of the edge
 * @param sourceId   source node ID
 * @param sourceName source display name
 * @param targetId   target node ID
 * @param targetName target display name
 * @param relation   relation label
 * @param attributes edge attributes
 */
public record Fact(
    @NotNull Direction direction,
    @NotNull String sourceId,
    @NotNull String sourceName,
    @NotNull String targetId,
    @NotNull String targetName,
    @NotNull String relation,
    @NotNull RelationshipAttributes attributes
) {

    public Fact {
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(targetName, "targetName must not be null");
        Objects.requireNonNull(relation, "relation must not be null");
        Objects.requireNonNull(attributes, "attributes must not be null");
    }

    /**
     * Builds the fact for {@code relationship} as seen from one of its endpoints.
     */
    @NotNull
    public static Fact of(
            @NotNull Direction direction,
            @NotNull Relationship relationship,
            @NotNull Node source,
            @NotNull Node target) {
        return new Fact(
            direction,
            source.getId(),
            source.getName(),
            target.getId(),
            target.getName(),
            relationship.getRelation(),
            relationship.getAttributes()
        );
    }

    /**
     * Deduplication key: {@code (sourceId, targetId, relation)}.
     */
    @JsonIgnore
    @NotNull
    public FactKey key() {
        return new FactKey(sourceId, targetId, relation);
    }

    /**
     * Which end of the edge the visited node sits on.
     */
    public enum Direction {
        OUTGOING,
        INCOMING
    }

    /**
     * Identity of the edge behind a fact.
     */
    public record FactKey(
        @NotNull String sourceId,
        @NotNull String targetId,
        @NotNull String relation
    ) {}
}
