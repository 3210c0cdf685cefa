package br.edu.ifba.graphrag.query.pipeline;

import br.edu.ifba.graphrag.core.EntityMention;
import br.edu.ifba.graphrag.core.Fact;
import br.edu.ifba.graphrag.core.MatchedNode;
import br.edu.ifba.graphrag.core.TraversalResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Partial result of one pipeline step.
 *
 * <p>Fields left unset keep their current value in {@link PipelineState}; trace lines
 * are always appended. Produced by {@link PipelineStage#process} and applied by
 * {@link PipelineState#merge}.</p>
 */
public final class StateUpdate {

    @Nullable private List<EntityMention> detectedEntities;
    @Nullable private List<String> relationIntents;
    @Nullable private List<MatchedNode> matchedNodes;
    @Nullable private List<TraversalResult> traversalResults;
    @Nullable private List<Fact> facts;
    @Nullable private String context;
    @Nullable private String answer;
    private final List<String> traceLines = new ArrayList<>();

    public StateUpdate detectedEntities(@NotNull List<EntityMention> entities) {
        this.detectedEntities = List.copyOf(entities);
        return this;
    }

    public StateUpdate relationIntents(@NotNull List<String> intents) {
        this.relationIntents = List.copyOf(intents);
        return this;
    }

    public StateUpdate matchedNodes(@NotNull List<MatchedNode> nodes) {
        this.matchedNodes = List.copyOf(nodes);
        return this;
    }

    public StateUpdate traversalResults(@NotNull List<TraversalResult> results) {
        this.traversalResults = List.copyOf(results);
        return this;
    }

    public StateUpdate facts(@NotNull List<Fact> facts) {
        this.facts = List.copyOf(facts);
        return this;
    }

    public StateUpdate context(@NotNull String context) {
        this.context = context;
        return this;
    }

    public StateUpdate answer(@NotNull String answer) {
        this.answer = answer;
        return this;
    }

    public StateUpdate trace(@NotNull String line) {
        this.traceLines.add(line);
        return this;
    }

    @Nullable
    List<EntityMention> getDetectedEntities() {
        return detectedEntities;
    }

    @Nullable
    List<String> getRelationIntents() {
        return relationIntents;
    }

    @Nullable
    List<MatchedNode> getMatchedNodes() {
        return matchedNodes;
    }

    @Nullable
    List<TraversalResult> getTraversalResults() {
        return traversalResults;
    }

    @Nullable
    List<Fact> getFacts() {
        return facts;
    }

    @Nullable
    String getContext() {
        return context;
    }

    @Nullable
    String getAnswer() {
        return answer;
    }

    @NotNull
    public List<String> getTraceLines() {
        return List.copyOf(traceLines);
    }
}
