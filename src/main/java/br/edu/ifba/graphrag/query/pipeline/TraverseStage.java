package br.edu.ifba.graphrag.query.pipeline;

import br.edu.ifba.graphrag.core.Fact;
import br.edu.ifba.graphrag.core.MatchedNode;
import br.edu.ifba.graphrag.core.TraversalResult;
import br.edu.ifba.graphrag.query.TraversalEngine;
import br.edu.ifba.graphrag.storage.GraphStore;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline stage that walks the graph around every matched node.
 */
public class TraverseStage implements PipelineStage {

    private static final int MAX_FACTS_IN_TRACE = 5;

    private final GraphStore graph;
    private final TraversalEngine traversalEngine;
    private final int maxDepth;

    /**
     * @param graph           the graph to walk
     * @param traversalEngine the walker
     * @param maxDepth        hops from each matched node, 0 or more
     */
    public TraverseStage(@NotNull GraphStore graph, @NotNull TraversalEngine traversalEngine, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got: " + maxDepth);
        }
        this.graph = graph;
        this.traversalEngine = traversalEngine;
        this.maxDepth = maxDepth;
    }

    @Override
    @NotNull
    public StateUpdate process(@NotNull PipelineState state) {
        List<TraversalResult> traversals = new ArrayList<>();
        StateUpdate update = new StateUpdate().trace(getStep().getTitle());

        for (MatchedNode matched : state.getMatchedNodes()) {
            TraversalResult traversal = traversalEngine.traverse(graph, matched.nodeId(), maxDepth);
            traversals.add(traversal);

            update.trace("   Traversing from: " + matched.node().getName())
                  .trace("   - Visited " + traversal.visitedNodes().size() + " nodes")
                  .trace("   - Found " + traversal.facts().size() + " relationships");

            traversal.facts().stream()
                    .limit(MAX_FACTS_IN_TRACE)
                    .forEach(fact -> update.trace("     -> " + describe(fact)));
        }

        return update.traversalResults(traversals);
    }

    private static String describe(Fact fact) {
        return fact.sourceName() + " --[" + fact.relation() + "]--> " + fact.targetName();
    }

    @Override
    @NotNull
    public PipelineStep getStep() {
        return PipelineStep.TRAVERSE;
    }
}
