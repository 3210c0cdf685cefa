package br.edu.ifba.graphrag.api;

import java.util.List;

import br.edu.ifba.graphrag.GraphRagService;
import br.edu.ifba.graphrag.query.pipeline.PipelineState;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

/**
 * Question answering over the knowledge graph.
 *
 * <h2>Endpoints:</h2>
 * <ul>
 *   <li>{@code POST /questions} - Runs a question through the pipeline</li>
 *   <li>{@code GET /questions/samples} - Example questions for the seed graph</li>
 * </ul>
 */
@Path("/questions")
@Produces(MediaType.APPLICATION_JSON)
public class QuestionResources {

    private static final Logger LOG = Logger.getLogger(QuestionResources.class);

    @Inject
    GraphRagService graphRagService;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public AnswerResponse ask(@Valid @NotNull(message = "Request body is required") final QuestionRequest request) {
        LOG.debugf("Question received: %s", request.question());
        final PipelineState state = graphRagService.ask(request.question());
        return AnswerResponse.from(state, graphRagService.isGenerationAvailable());
    }

    @GET
    @Path("/samples")
    public List<String> samples() {
        return graphRagService.sampleQuestions();
    }
}
