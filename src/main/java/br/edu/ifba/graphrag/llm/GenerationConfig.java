package br.edu.ifba.graphrag.llm;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the answer generation step.
 *
 * <p>Loaded from application.properties with the "graphrag.generation" prefix.
 * The endpoint itself is the {@code llm-chat} REST client
 * ({@code quarkus.rest-client.llm-chat.url}).
 *
 * <p>Example configuration:
 * <pre>
 * graphrag.generation.enabled=true
 * graphrag.generation.api-key=${GROQ_API_KEY:}
 * graphrag.generation.model=llama-3.1-8b-instant
 * graphrag.generation.temperature=0
 * graphrag.generation.timeout-ms=30000
 * </pre>
 */
@ConfigMapping(prefix = "graphrag.generation")
public interface GenerationConfig {

    /**
     * Whether live generation may be attempted at all.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * API key sent as a bearer token. Generation is disabled when missing or blank.
     */
    @WithName("api-key")
    Optional<String> apiKey();

    @WithDefault("llama-3.1-8b-instant")
    String model();

    @WithDefault("0")
    double temperature();

    @WithName("max-tokens")
    @WithDefault("1024")
    int maxTokens();

    /**
     * How long the generate step waits for an answer before degrading.
     */
    @WithName("timeout-ms")
    @WithDefault("30000")
    long timeoutMs();

    /**
     * Checks if live generation can be attempted.
     *
     * @return true when enabled and an API key is configured
     */
    default boolean isAvailable() {
        return enabled() && apiKey().filter(k -> !k.isBlank()).isPresent();
    }

    /**
     * Gets a human-readable description of the current configuration.
     */
    default String describe() {
        if (!enabled()) {
            return "Generation disabled";
        }
        if (!isAvailable()) {
            return "Generation unavailable (no API key)";
        }
        return "Generation via model " + model() + " (timeout " + timeoutMs() + "ms)";
    }
}
