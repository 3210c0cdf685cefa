package br.edu.ifba.graphrag.api;

import java.util.List;

import br.edu.ifba.graphrag.core.EntityMention;
import br.edu.ifba.graphrag.core.Fact;
import br.edu.ifba.graphrag.core.MatchedNode;
import br.edu.ifba.graphrag.query.pipeline.PipelineState;
import br.edu.ifba.graphrag.query.pipeline.TraceEntry;

public record AnswerResponse(
    String question,
    List<EntityMention> entities,
    List<String> relationIntents,
    List<String> matchedNodeIds,
    List<Fact> facts,
    String context,
    String answer,
    List<String> trace,
    boolean generationAvailable
) {
    public static AnswerResponse from(final PipelineState state, final boolean generationAvailable) {
        return new AnswerResponse(
            state.getQuestion(),
            state.getDetectedEntities(),
            state.getRelationIntents(),
            state.getMatchedNodes().stream().map(MatchedNode::nodeId).toList(),
            state.getFacts(),
            state.getContext(),
            state.getAnswer(),
            state.getTrace().stream().map(TraceEntry::toString).toList(),
            generationAvailable
        );
    }
}
