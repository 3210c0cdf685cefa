package br.edu.ifba.graphrag.query.pipeline;

import org.jetbrains.annotations.NotNull;

/**
 * One diagnostic line written by a pipeline step.
 */
public record TraceEntry(@NotNull PipelineStep step, @NotNull String message) {

    @Override
    public String toString() {
        return "[" + step.getStageName() + "] " + message;
    }
}
