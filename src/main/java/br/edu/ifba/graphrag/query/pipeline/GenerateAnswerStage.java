package br.edu.ifba.graphrag.query.pipeline;

import br.edu.ifba.graphrag.query.ContextBuilder;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pipeline stage that produces the final answer.
 *
 * <p>Outcomes, in order of precedence:</p>
 * <ol>
 *   <li>Context is {@link ContextBuilder#NO_GROUNDING_CONTEXT}: fixed
 *       {@link #NO_INFORMATION_ANSWER}, the generator is not called</li>
 *   <li>Generation unavailable: the raw context with a configuration hint</li>
 *   <li>Generator answers in time: its answer</li>
 *   <li>Timeout, transport failure or empty response: an error note plus the raw context</li>
 * </ol>
 *
 * <p>This stage never throws for a failed generator call. On timeout the pending call
 * is cancelled.</p>
 */
public class GenerateAnswerStage implements PipelineStage {

    private static final Logger logger = LoggerFactory.getLogger(GenerateAnswerStage.class);

    public static final String NO_INFORMATION_ANSWER =
            "I couldn't find any relevant information in the knowledge graph to answer your question.";

    static final String UNAVAILABLE_HEADER = "[LLM not available - showing raw context]";
    static final String UNAVAILABLE_HINT =
            "Set the GROQ_API_KEY environment variable (graphrag.generation.api-key) to enable LLM responses.";

    private final GenerationSettings settings;

    public GenerateAnswerStage(@NotNull GenerationSettings settings) {
        this.settings = settings;
    }

    @Override
    @NotNull
    public StateUpdate process(@NotNull PipelineState state) {
        String context = state.getContext();
        StateUpdate update = new StateUpdate().trace(getStep().getTitle());

        if (ContextBuilder.NO_GROUNDING_CONTEXT.equals(context)) {
            return update.answer(NO_INFORMATION_ANSWER)
                    .trace("   No context available, skipping LLM");
        }

        if (!settings.generationAvailable()) {
            String answer = UNAVAILABLE_HEADER + "\n\n" + context + "\n\n" + UNAVAILABLE_HINT;
            return update.answer(answer)
                    .trace("   WARNING: LLM not available (missing API key or disabled)");
        }

        String prompt = buildPrompt(context, state.getQuestion());
        try {
            String answer = callGenerator(prompt);
            return update.answer(answer)
                    .trace("   LLM response generated successfully");
        } catch (GenerationFailure e) {
            logger.warn("Answer generation failed: {}", e.getMessage());
            String answer = "Error generating response: " + e.getMessage() + "\n\nRaw context:\n" + context;
            return update.answer(answer)
                    .trace("   ERROR: LLM error: " + e.getMessage());
        }
    }

    /**
     * Builds the single prompt string sent to the generator.
     */
    @NotNull
    public String buildPrompt(@NotNull String context, @NotNull String question) {
        return settings.instruction() + "\n\n" +
               "Context from knowledge graph:\n" +
               context + "\n\n" +
               "Question: " + question + "\n\n" +
               "Answer:";
    }

    private String callGenerator(String prompt) throws GenerationFailure {
        long timeoutMs = settings.timeout().toMillis();
        CompletableFuture<String> future;
        try {
            future = settings.llmFunction().apply(prompt);
        } catch (RuntimeException e) {
            throw new GenerationFailure(describe(e), e);
        }

        try {
            String answer = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (answer == null || answer.isBlank()) {
                throw new GenerationFailure("LLM returned an empty response", null);
            }
            return answer;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GenerationFailure("LLM call timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new GenerationFailure(describe(cause), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GenerationFailure("LLM call interrupted", e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    @Override
    @NotNull
    public PipelineStep getStep() {
        return PipelineStep.GENERATE;
    }

    /**
     * A generator call that did not produce a usable answer.
     */
    private static final class GenerationFailure extends Exception {
        GenerationFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
