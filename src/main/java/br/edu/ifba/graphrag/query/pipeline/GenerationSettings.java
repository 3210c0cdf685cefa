package br.edu.ifba.graphrag.query.pipeline;

import br.edu.ifba.graphrag.llm.LLMFunction;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.Objects;

/**
 * How the generate step reaches the answer generator.
 *
 * @param llmFunction         the generator, null when none was configured
 * @param generationAvailable whether live generation may be attempted
 * @param timeout             how long to wait for one answer
 * @param instruction         instruction placed before the context in the prompt
 */
public record GenerationSettings(
    @Nullable LLMFunction llmFunction,
    boolean generationAvailable,
    @NotNull Duration timeout,
    @NotNull String instruction
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public static final String DEFAULT_INSTRUCTION = """
            You are a helpful assistant answering questions based on a knowledge graph.
            Use ONLY the provided context to answer. Be concise and direct.
            If the context doesn't contain enough information, say so.""";

    public GenerationSettings {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(instruction, "instruction must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        if (generationAvailable && llmFunction == null) {
            throw new IllegalArgumentException("generationAvailable requires an llmFunction");
        }
    }

    /**
     * Settings that enable generation through {@code llmFunction}.
     */
    @NotNull
    public static GenerationSettings enabled(@NotNull LLMFunction llmFunction, @NotNull Duration timeout) {
        return new GenerationSettings(llmFunction, true, timeout, DEFAULT_INSTRUCTION);
    }

    /**
     * Settings for when no generator is configured.
     */
    @NotNull
    public static GenerationSettings unavailable() {
        return new GenerationSettings(null, false, DEFAULT_TIMEOUT, DEFAULT_INSTRUCTION);
    }
}
