package br.edu.ifba.graphrag.query.pipeline;

import org.jetbrains.annotations.NotNull;

/**
 * One step of the question-answering pipeline.
 *
 * <h2>Stage Contract:</h2>
 * <ul>
 *   <li>Read inputs from the {@link PipelineState}</li>
 *   <li>Return a {@link StateUpdate} with the fields this step owns and its trace lines</li>
 *   <li>Never mutate the state; the orchestrator merges the update</li>
 *   <li>Never throw for expected conditions such as "nothing found"; return empty collections instead</li>
 * </ul>
 */
public interface PipelineStage {

    /**
     * Computes this step's update for {@code state}.
     *
     * @param state the state produced by the previous steps
     * @return the partial update to merge
     */
    @NotNull
    StateUpdate process(@NotNull PipelineState state);

    /**
     * The pipeline step this stage implements.
     */
    @NotNull
    PipelineStep getStep();
}
