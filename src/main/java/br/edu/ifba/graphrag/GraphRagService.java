package br.edu.ifba.graphrag;

import br.edu.ifba.graphrag.adapters.QuarkusLLMAdapter;
import br.edu.ifba.graphrag.core.GraphStats;
import br.edu.ifba.graphrag.llm.GenerationConfig;
import br.edu.ifba.graphrag.query.pipeline.GenerationSettings;
import br.edu.ifba.graphrag.query.pipeline.GraphRagPipeline;
import br.edu.ifba.graphrag.query.pipeline.PipelineState;
import br.edu.ifba.graphrag.storage.GraphSeedLoader;
import br.edu.ifba.graphrag.storage.GraphStore;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;

/**
 * Service that owns the knowledge graph and the question answering pipeline.
 *
 * <p>The graph is loaded from the configured seed resource when the application
 * starts. A seed that cannot be read or that references unknown nodes fails
 * startup with a {@link br.edu.ifba.graphrag.storage.GraphConstructionException}.</p>
 *
 * <p>Live generation is used only when {@code graphrag.generation.enabled} is true
 * and an API key is configured; otherwise answers carry the raw context.</p>
 */
@ApplicationScoped
@Startup
public class GraphRagService {

    private static final Logger LOG = Logger.getLogger(GraphRagService.class);

    static final List<String> SAMPLE_QUESTIONS = List.of(
            "What companies did Elon Musk found?",
            "Who leads OpenAI?",
            "What is the relationship between Microsoft and OpenAI?",
            "Tell me about NVIDIA",
            "Who founded DeepMind?"
    );

    @Inject
    QuarkusLLMAdapter llmAdapter;

    @Inject
    GenerationConfig generationConfig;

    @ConfigProperty(name = "graphrag.graph.seed-resource", defaultValue = "seed/knowledge-graph.json")
    String seedResource;

    @ConfigProperty(name = "graphrag.traversal.depth", defaultValue = "1")
    int traversalDepth;

    private GraphRagPipeline pipeline;

    @PostConstruct
    void initialize() {
        LOG.infof("Loading knowledge graph from %s", seedResource);
        final GraphStore graph = GraphSeedLoader.loadGraph(seedResource);
        final GraphStats stats = graph.stats();
        LOG.infof("Knowledge graph ready: %d nodes (%d people, %d organizations), %d relationships",
                stats.totalNodes(), stats.people(), stats.organizations(), stats.totalEdges());

        final GenerationSettings generation = generationConfig.isAvailable()
                ? GenerationSettings.enabled(llmAdapter, Duration.ofMillis(generationConfig.timeoutMs()))
                : GenerationSettings.unavailable();
        LOG.info(generationConfig.describe());
        if (!generation.generationAvailable()) {
            LOG.warn("Answers will contain the raw graph context only. "
                    + "Set GROQ_API_KEY to enable LLM responses.");
        }

        this.pipeline = GraphRagPipeline.builder()
                .graph(graph)
                .traversalDepth(traversalDepth)
                .generation(generation)
                .build();
        LOG.infof("GraphRAG pipeline initialized (traversal depth %d)", traversalDepth);
    }

    /**
     * Answers one question. Never fails for recoverable conditions such as unknown
     * entities or an unreachable generator.
     */
    public PipelineState ask(final String question) {
        return pipeline.run(question);
    }

    public GraphStore getGraph() {
        return pipeline.getGraph();
    }

    public boolean isGenerationAvailable() {
        return pipeline.isGenerationAvailable();
    }

    public List<String> sampleQuestions() {
        return SAMPLE_QUESTIONS;
    }
}
