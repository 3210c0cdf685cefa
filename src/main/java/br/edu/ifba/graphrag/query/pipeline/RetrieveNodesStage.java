package br.edu.ifba.graphrag.query.pipeline;

import br.edu.ifba.graphrag.core.EntityMention;
import br.edu.ifba.graphrag.core.MatchedNode;
import br.edu.ifba.graphrag.core.Node;
import br.edu.ifba.graphrag.storage.GraphStore;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline stage that looks up graph nodes for every detected entity.
 *
 * <p>A node matched by two different mentions appears twice; each match gets its own
 * traversal and the duplicate facts collapse when the context is built.</p>
 */
public class RetrieveNodesStage implements PipelineStage {

    private final GraphStore graph;

    public RetrieveNodesStage(@NotNull GraphStore graph) {
        this.graph = graph;
    }

    @Override
    @NotNull
    public StateUpdate process(@NotNull PipelineState state) {
        List<MatchedNode> matchedNodes = new ArrayList<>();
        StateUpdate update = new StateUpdate().trace(getStep().getTitle());

        for (EntityMention entity : state.getDetectedEntities()) {
            for (Node node : graph.findNodesByName(entity.name())) {
                matchedNodes.add(new MatchedNode(node.getId(), node, entity.name()));
                update.trace("   Found: " + node.getName() + " (ID: " + node.getId() + ")");
            }
        }

        if (matchedNodes.isEmpty()) {
            update.trace("   WARNING: No matching nodes found in graph");
        } else {
            update.trace("   Total nodes matched: " + matchedNodes.size());
        }

        return update.matchedNodes(matchedNodes);
    }

    @Override
    @NotNull
    public PipelineStep getStep() {
        return PipelineStep.RETRIEVE;
    }
}
