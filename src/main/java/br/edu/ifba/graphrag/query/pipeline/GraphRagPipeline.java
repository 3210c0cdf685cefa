package br.edu.ifba.graphrag.query.pipeline;

import br.edu.ifba.graphrag.query.ContextBuilder;
import br.edu.ifba.graphrag.query.EntityRecognizer;
import br.edu.ifba.graphrag.query.RelationIntentDetector;
import br.edu.ifba.graphrag.query.TraversalEngine;
import br.edu.ifba.graphrag.storage.GraphStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Answers a question by running it through the five pipeline steps.
 *
 * <ol>
 *   <li><b>Detect</b> - Recognizes known entities in the question</li>
 *   <li><b>Retrieve</b> - Looks up graph nodes for the entities</li>
 *   <li><b>Traverse</b> - Walks the graph around every matched node</li>
 *   <li><b>BuildContext</b> - Deduplicates facts and renders the grounding context</li>
 *   <li><b>Generate</b> - Asks the LLM, or degrades to the raw context</li>
 * </ol>
 *
 * <p>The pipeline holds no per-question state. Each call to {@link #run(String)} starts
 * from a fresh {@link PipelineState}; the graph is the only shared object and is
 * read-only, so one instance may answer questions from several threads at once.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * GraphRagPipeline pipeline = GraphRagPipeline.builder()
 *     .graph(graphStore)
 *     .traversalDepth(1)
 *     .generation(GenerationSettings.enabled(llmFunction, Duration.ofSeconds(30)))
 *     .build();
 *
 * PipelineState result = pipeline.run("Who leads OpenAI?");
 * String answer = result.getAnswer();
 * }</pre>
 */
public class GraphRagPipeline {

    private static final Logger logger = LoggerFactory.getLogger(GraphRagPipeline.class);

    private final Map<PipelineStep, PipelineStage> stages;
    private final GraphStore graph;
    private final boolean generationAvailable;

    private GraphRagPipeline(Builder builder) {
        this.graph = builder.graph;
        this.generationAvailable = builder.generation.generationAvailable();

        Map<PipelineStep, PipelineStage> defaults = new EnumMap<>(PipelineStep.class);
        defaults.put(PipelineStep.DETECT, new DetectEntitiesStage(builder.recognizer, builder.intentDetector));
        defaults.put(PipelineStep.RETRIEVE, new RetrieveNodesStage(builder.graph));
        defaults.put(PipelineStep.TRAVERSE,
                new TraverseStage(builder.graph, builder.traversalEngine, builder.traversalDepth));
        defaults.put(PipelineStep.BUILD_CONTEXT, new BuildContextStage(builder.contextBuilder));
        defaults.put(PipelineStep.GENERATE, new GenerateAnswerStage(builder.generation));
        defaults.putAll(builder.overrides);
        this.stages = defaults;
    }

    /**
     * Runs the question through every step.
     *
     * @param question any text, including empty
     * @return the final state, with {@link PipelineState#getAnswer()} always set
     * @throws PipelineException only if a stage fails unexpectedly (a bug, not a recoverable condition)
     */
    @NotNull
    public PipelineState run(@NotNull String question) {
        Objects.requireNonNull(question, "question must not be null");
        logger.info("Starting pipeline for question: '{}'", question);
        long startTime = System.currentTimeMillis();

        PipelineState state = PipelineState.initial(question);
        while (!state.isDone()) {
            state = executeStage(stages.get(state.getStep()), state);
        }

        long elapsed = System.currentTimeMillis() - startTime;
        logger.info("Pipeline completed in {}ms, entities={}, facts={}",
                elapsed, state.getDetectedEntities().size(), state.getFacts().size());
        return state;
    }

    /**
     * Executes a single stage and merges its update.
     */
    private PipelineState executeStage(@NotNull PipelineStage stage, @NotNull PipelineState state) {
        String stageName = state.getStep().getStageName();
        logger.debug("Executing stage: {}", stageName);
        long stageStart = System.currentTimeMillis();

        StateUpdate update;
        try {
            update = stage.process(state);
        } catch (RuntimeException e) {
            logger.error("Stage {} failed: {}", stageName, e.getMessage(), e);
            throw new PipelineException("Stage " + stageName + " failed", e);
        }

        PipelineState next = state.merge(update);
        if (logger.isDebugEnabled()) {
            update.getTraceLines().forEach(line -> logger.debug("[{}] {}", stageName, line));
            logger.debug("Stage {} completed in {}ms", stageName, System.currentTimeMillis() - stageStart);
        }
        return next;
    }

    @NotNull
    public GraphStore getGraph() {
        return graph;
    }

    public boolean isGenerationAvailable() {
        return generationAvailable;
    }

    /**
     * Creates a new builder for GraphRagPipeline.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for GraphRagPipeline.
     */
    public static class Builder {
        private GraphStore graph;
        private EntityRecognizer recognizer = new EntityRecognizer();
        private RelationIntentDetector intentDetector = new RelationIntentDetector();
        private TraversalEngine traversalEngine = new TraversalEngine();
        private ContextBuilder contextBuilder = new ContextBuilder();
        private int traversalDepth = TraversalEngine.DEFAULT_DEPTH;
        private GenerationSettings generation = GenerationSettings.unavailable();
        private final Map<PipelineStep, PipelineStage> overrides = new EnumMap<>(PipelineStep.class);

        /**
         * Sets the knowledge graph. Required.
         */
        public Builder graph(@NotNull GraphStore graph) {
            this.graph = graph;
            return this;
        }

        public Builder recognizer(@NotNull EntityRecognizer recognizer) {
            this.recognizer = recognizer;
            return this;
        }

        public Builder intentDetector(@NotNull RelationIntentDetector intentDetector) {
            this.intentDetector = intentDetector;
            return this;
        }

        public Builder traversalEngine(@NotNull TraversalEngine traversalEngine) {
            this.traversalEngine = traversalEngine;
            return this;
        }

        public Builder contextBuilder(@NotNull ContextBuilder contextBuilder) {
            this.contextBuilder = contextBuilder;
            return this;
        }

        /**
         * Sets how many hops each traversal may take. Defaults to 1.
         */
        public Builder traversalDepth(int traversalDepth) {
            this.traversalDepth = traversalDepth;
            return this;
        }

        /**
         * Sets how the answer generator is reached. Defaults to unavailable.
         */
        public Builder generation(@NotNull GenerationSettings generation) {
            this.generation = generation;
            return this;
        }

        /**
         * Replaces the stage used for one step.
         */
        public Builder stage(@NotNull PipelineStage stage) {
            this.overrides.put(stage.getStep(), stage);
            return this;
        }

        /**
         * Builds the GraphRagPipeline.
         *
         * @throws IllegalStateException if required components are missing or invalid
         */
        public GraphRagPipeline build() {
            if (graph == null) {
                throw new IllegalStateException("graph is required");
            }
            if (traversalDepth < 0) {
                throw new IllegalStateException("traversalDepth must be >= 0, got: " + traversalDepth);
            }
            if (overrides.containsKey(PipelineStep.DONE)) {
                throw new IllegalStateException("DONE is terminal and has no stage");
            }
            return new GraphRagPipeline(this);
        }
    }

    /**
     * Exception thrown when a pipeline stage fails.
     */
    public static class PipelineException extends RuntimeException {
        public PipelineException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
