package br.edu.ifba.graphrag.query.pipeline;

import br.edu.ifba.graphrag.core.Fact;
import br.edu.ifba.graphrag.core.TraversalResult;
import br.edu.ifba.graphrag.query.ContextBuilder;
import br.edu.ifba.graphrag.query.TraversalEngine;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline stage that merges the facts of all traversals and renders the grounding context.
 *
 * <p>Two start nodes can rediscover the same edge, so facts are deduplicated again
 * across traversals with the same key used inside a single traversal.</p>
 */
public class BuildContextStage implements PipelineStage {

    private static final int MAX_CONTEXT_LINES_IN_TRACE = 8;

    private final ContextBuilder contextBuilder;

    public BuildContextStage(@NotNull ContextBuilder contextBuilder) {
        this.contextBuilder = contextBuilder;
    }

    @Override
    @NotNull
    public StateUpdate process(@NotNull PipelineState state) {
        List<Fact> allFacts = new ArrayList<>();
        for (TraversalResult traversal : state.getTraversalResults()) {
            allFacts.addAll(traversal.facts());
        }
        List<Fact> uniqueFacts = TraversalEngine.deduplicate(allFacts);

        String context = contextBuilder.render(uniqueFacts, state.getDetectedEntities());

        StateUpdate update = new StateUpdate()
                .facts(uniqueFacts)
                .context(context)
                .trace(getStep().getTitle())
                .trace("   Unique facts collected: " + uniqueFacts.size())
                .trace("   Context preview:");

        context.lines()
                .limit(MAX_CONTEXT_LINES_IN_TRACE)
                .forEach(line -> update.trace("   | " + line));

        return update;
    }

    @Override
    @NotNull
    public PipelineStep getStep() {
        return PipelineStep.BUILD_CONTEXT;
    }
}
