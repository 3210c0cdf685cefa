package br.edu.ifba.graphrag.api;

import java.util.List;

import br.edu.ifba.graphrag.GraphRagService;
import br.edu.ifba.graphrag.core.Fact;
import br.edu.ifba.graphrag.core.GraphStats;
import br.edu.ifba.graphrag.core.Node;
import br.edu.ifba.graphrag.exception.NodeNotFoundException;
import br.edu.ifba.graphrag.storage.GraphStore;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

/**
 * Read-only inspection of the loaded knowledge graph.
 */
@Path("/graph")
@Produces(MediaType.APPLICATION_JSON)
public class GraphResources {

    @Inject
    GraphRagService graphRagService;

    @GET
    @Path("/stats")
    public GraphStats stats() {
        return graphRagService.getGraph().stats();
    }

    /**
     * Lists nodes matching {@code name}, or every node when no name is given.
     */
    @GET
    @Path("/nodes")
    public List<Node> nodes(@QueryParam("name") final String name) {
        final GraphStore graph = graphRagService.getGraph();
        if (name == null || name.isBlank()) {
            return graph.nodes();
        }
        return graph.findNodesByName(name);
    }

    @GET
    @Path("/nodes/{id}/relationships")
    public List<Fact> relationships(@PathParam("id") final String id) {
        final GraphStore graph = graphRagService.getGraph();
        if (!graph.containsNode(id)) {
            throw new NodeNotFoundException(id);
        }
        return graph.relationshipsOf(id);
    }
}
