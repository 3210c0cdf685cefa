package br.edu.ifba.graphrag.query.pipeline;

import org.jetbrains.annotations.NotNull;

/**
 * States of the question-answering pipeline.
 *
 * <p>The topology is fixed and linear:</p>
 * <pre>
 * DETECT → RETRIEVE → TRAVERSE → BUILD_CONTEXT → GENERATE → DONE
 * </pre>
 */
public enum PipelineStep {

    DETECT("detect-entities", "STEP 1: Entity Detection"),
    RETRIEVE("retrieve-nodes", "STEP 2: Node Retrieval"),
    TRAVERSE("traverse-relationships", "STEP 3: Graph Traversal"),
    BUILD_CONTEXT("build-context", "STEP 4: Context Building"),
    GENERATE("generate-answer", "STEP 5: Answer Generation"),
    DONE("done", "Done");

    private final String stageName;
    private final String title;

    PipelineStep(String stageName, String title) {
        this.stageName = stageName;
        this.title = title;
    }

    /**
     * Name used in logs (e.g. {@code build-context}).
     */
    @NotNull
    public String getStageName() {
        return stageName;
    }

    /**
     * Heading written to the trace when the step starts.
     */
    @NotNull
    public String getTitle() {
        return title;
    }

    /**
     * The step that follows this one.
     *
     * @throws IllegalStateException when called on {@link #DONE}
     */
    @NotNull
    public PipelineStep next() {
        return switch (this) {
            case DETECT -> RETRIEVE;
            case RETRIEVE -> TRAVERSE;
            case TRAVERSE -> BUILD_CONTEXT;
            case BUILD_CONTEXT -> GENERATE;
            case GENERATE -> DONE;
            case DONE -> throw new IllegalStateException("DONE is terminal");
        };
    }

    public boolean isTerminal() {
        return this == DONE;
    }
}
