package br.edu.ifba.graphrag.llm;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for Large Language Model completion.
 * Implementations should handle API calls to LLM providers (Groq, OpenAI, etc.).
 *
 * <p>The contract is prompt in, answer out: a failed call completes the future
 * exceptionally. Callers decide how long to wait and may cancel the future.</p>
 */
@FunctionalInterface
public interface LLMFunction {

    /**
     * Generate a completion from the LLM.
     *
     * @param prompt The full prompt (instruction, context and question)
     * @param kwargs Additional parameters (model, temperature, max_tokens)
     * @return CompletableFuture with the generated response text
     */
    CompletableFuture<String> apply(@NotNull String prompt, @NotNull Map<String, Object> kwargs);

    /**
     * Convenience method for prompts using the provider defaults.
     */
    default CompletableFuture<String> apply(@NotNull String prompt) {
        return apply(prompt, Map.of());
    }
}
