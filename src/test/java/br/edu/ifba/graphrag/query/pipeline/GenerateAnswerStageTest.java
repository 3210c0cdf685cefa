package br.edu.ifba.graphrag.query.pipeline;

import br.edu.ifba.graphrag.llm.LLMFunction;
import br.edu.ifba.graphrag.query.ContextBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GenerateAnswerStageTest {

    private static final String CONTEXT = "Known facts:\n- Sam Altman leads OpenAI as CEO";

    private LLMFunction llm;

    @BeforeEach
    void setUp() {
        llm = mock(LLMFunction.class);
    }

    private static PipelineState stateWithContext(String context) {
        PipelineState state = PipelineState.initial("Who leads OpenAI?");
        state = state.merge(new StateUpdate());
        state = state.merge(new StateUpdate());
        state = state.merge(new StateUpdate());
        return state.merge(new StateUpdate().context(context));
    }

    private GenerateAnswerStage stage(Duration timeout) {
        return new GenerateAnswerStage(GenerationSettings.enabled(llm, timeout));
    }

    @Test
    @DisplayName("should return the generator's answer")
    void shouldReturnGeneratedAnswer() {
        when(llm.apply(anyString())).thenReturn(CompletableFuture.completedFuture("Sam Altman leads OpenAI."));

        StateUpdate update = stage(Duration.ofSeconds(1)).process(stateWithContext(CONTEXT));
        PipelineState result = stateWithContext(CONTEXT).merge(update);

        assertEquals("Sam Altman leads OpenAI.", result.getAnswer());
        assertTrue(result.traceOf(PipelineStep.GENERATE).contains("   LLM response generated successfully"));
    }

    @Test
    @DisplayName("should not call the generator without grounding context")
    void shouldSkipGeneratorForSentinel() {
        StateUpdate update = stage(Duration.ofSeconds(1))
                .process(stateWithContext(ContextBuilder.NO_GROUNDING_CONTEXT));
        PipelineState result = stateWithContext(ContextBuilder.NO_GROUNDING_CONTEXT).merge(update);

        assertEquals(GenerateAnswerStage.NO_INFORMATION_ANSWER, result.getAnswer());
        verify(llm, never()).apply(anyString());
    }

    @Test
    @DisplayName("should degrade to the raw context when the call fails")
    void shouldDegradeOnFailure() {
        when(llm.apply(anyString())).thenReturn(CompletableFuture.failedFuture(new RuntimeException("503 Service Unavailable")));

        PipelineState result = stateWithContext(CONTEXT)
                .merge(stage(Duration.ofSeconds(1)).process(stateWithContext(CONTEXT)));

        assertEquals("Error generating response: 503 Service Unavailable\n\nRaw context:\n" + CONTEXT,
                result.getAnswer());
        assertTrue(result.traceOf(PipelineStep.GENERATE).contains("   ERROR: LLM error: 503 Service Unavailable"));
    }

    @Test
    @DisplayName("should degrade when the generator throws synchronously")
    void shouldDegradeOnSynchronousFailure() {
        when(llm.apply(anyString())).thenThrow(new IllegalStateException("client closed"));

        StateUpdate update = stage(Duration.ofSeconds(1)).process(stateWithContext(CONTEXT));

        assertTrue(stateWithContext(CONTEXT).merge(update).getAnswer()
                .startsWith("Error generating response: client closed"));
    }

    @Test
    @DisplayName("should cancel the call and degrade on timeout")
    void shouldCancelOnTimeout() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        when(llm.apply(anyString())).thenReturn(pending);

        PipelineState result = stateWithContext(CONTEXT)
                .merge(stage(Duration.ofMillis(50)).process(stateWithContext(CONTEXT)));

        assertTrue(pending.isCancelled());
        assertTrue(result.getAnswer().startsWith("Error generating response: LLM call timed out after 50ms"));
        assertTrue(result.getAnswer().endsWith(CONTEXT));
    }

    @Test
    @DisplayName("should treat a blank answer as a failure")
    void shouldRejectBlankAnswer() {
        when(llm.apply(anyString())).thenReturn(CompletableFuture.completedFuture("  "));

        PipelineState result = stateWithContext(CONTEXT)
                .merge(stage(Duration.ofSeconds(1)).process(stateWithContext(CONTEXT)));

        assertTrue(result.getAnswer().startsWith("Error generating response: LLM returned an empty response"));
    }

    @Test
    @DisplayName("should show the raw context with a hint when generation is unavailable")
    void shouldShowRawContextWhenUnavailable() {
        GenerateAnswerStage unavailable = new GenerateAnswerStage(GenerationSettings.unavailable());

        PipelineState result = stateWithContext(CONTEXT).merge(unavailable.process(stateWithContext(CONTEXT)));

        assertEquals(GenerateAnswerStage.UNAVAILABLE_HEADER + "\n\n" + CONTEXT + "\n\n"
                + GenerateAnswerStage.UNAVAILABLE_HINT, result.getAnswer());
        assertEquals(List.of(PipelineStep.GENERATE.getTitle(),
                "   WARNING: LLM not available (missing API key or disabled)"),
                result.traceOf(PipelineStep.GENERATE));
    }

    @Test
    @DisplayName("prompt should contain instruction, context and question in order")
    void shouldBuildPrompt() {
        String prompt = stage(Duration.ofSeconds(1)).buildPrompt(CONTEXT, "Who leads OpenAI?");

        assertTrue(prompt.startsWith(GenerationSettings.DEFAULT_INSTRUCTION));
        assertTrue(prompt.endsWith("Context from knowledge graph:\n" + CONTEXT
                + "\n\nQuestion: Who leads OpenAI?\n\nAnswer:"));
    }

    @Test
    @DisplayName("settings should reject an enabled generator without a function")
    void shouldValidateSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> new GenerationSettings(null, true, Duration.ofSeconds(1), "x"));
        assertThrows(IllegalArgumentException.class,
                () -> GenerationSettings.enabled(llm, Duration.ZERO));
    }
}
