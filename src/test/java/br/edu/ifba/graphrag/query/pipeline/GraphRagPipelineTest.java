package br.edu.ifba.graphrag.query.pipeline;

import br.edu.ifba.graphrag.core.EntityMention;
import br.edu.ifba.graphrag.core.MatchedNode;
import br.edu.ifba.graphrag.core.NodeKind;
import br.edu.ifba.graphrag.llm.LLMFunction;
import br.edu.ifba.graphrag.query.ContextBuilder;
import br.edu.ifba.graphrag.storage.GraphSeedLoader;
import br.edu.ifba.graphrag.storage.GraphStore;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end runs of the pipeline over the bundled seed graph.
 */
class GraphRagPipelineTest {

    private static GraphStore graph;

    @BeforeAll
    static void loadGraph() {
        graph = GraphSeedLoader.loadGraph("seed/knowledge-graph.json");
    }

    private static GraphRagPipeline offlinePipeline() {
        return GraphRagPipeline.builder().graph(graph).build();
    }

    @Nested
    @DisplayName("without a generator")
    class OfflineTests {

        @Test
        @DisplayName("should collect Elon Musk's founding facts")
        void shouldAnswerFoundedQuestion() {
            PipelineState state = offlinePipeline().run("What companies did Elon Musk found?");

            assertTrue(state.isDone());
            assertEquals(List.of(new EntityMention("Elon Musk", NodeKind.PERSON, "elon musk")),
                    state.getDetectedEntities());
            assertEquals(List.of("founded"), state.getRelationIntents());
            assertEquals(List.of("p1"), state.getMatchedNodes().stream().map(MatchedNode::nodeId).toList());
            assertEquals(5, state.getFacts().size());

            String context = state.getContext();
            assertTrue(context.startsWith("Information about: Elon Musk\n\nKnown facts:\n"));
            assertTrue(context.contains("- Elon Musk founded Tesla in 2003"));
            assertTrue(context.contains("- Elon Musk founded SpaceX in 2002"));
            assertTrue(context.contains("- Elon Musk founded Neuralink in 2016"));
            assertTrue(state.getAnswer().startsWith(GenerateAnswerStage.UNAVAILABLE_HEADER));
            assertTrue(state.getAnswer().contains(context));
        }

        @Test
        @DisplayName("should relate Microsoft and OpenAI")
        void shouldAnswerRelationshipQuestion() {
            PipelineState state = offlinePipeline().run("What is the relationship between Microsoft and OpenAI?");

            assertEquals(List.of("Microsoft", "OpenAI"),
                    state.getDetectedEntities().stream().map(EntityMention::name).toList());
            assertEquals(List.of("c4", "c3"),
                    state.getMatchedNodes().stream().map(MatchedNode::nodeId).toList());
            assertTrue(state.getContext().contains("- Microsoft invested in OpenAI in 2023 ($13B)"));
            assertTrue(state.getContext().contains("- Microsoft partners with OpenAI"));

            long investments = state.getFacts().stream()
                    .filter(f -> f.relation().equals("invested_in"))
                    .count();
            assertEquals(1, investments);
        }

        @Test
        @DisplayName("should give the fixed answer when nothing is found")
        void shouldAnswerUnknownQuestion() {
            PipelineState state = offlinePipeline().run("hello");

            assertTrue(state.getDetectedEntities().isEmpty());
            assertTrue(state.getMatchedNodes().isEmpty());
            assertEquals(ContextBuilder.NO_GROUNDING_CONTEXT, state.getContext());
            assertEquals(GenerateAnswerStage.NO_INFORMATION_ANSWER, state.getAnswer());
            assertTrue(state.traceOf(PipelineStep.DETECT).contains("   WARNING: No entities detected"));
            assertTrue(state.traceOf(PipelineStep.RETRIEVE).contains("   WARNING: No matching nodes found in graph"));
        }

        @Test
        @DisplayName("should accept an empty question")
        void shouldAcceptEmptyQuestion() {
            PipelineState state = offlinePipeline().run("");

            assertEquals(GenerateAnswerStage.NO_INFORMATION_ANSWER, state.getAnswer());
        }

        @Test
        @DisplayName("trace should follow step order and start with each step title")
        void traceFollowsStepOrder() {
            PipelineState state = offlinePipeline().run("Who leads OpenAI?");

            List<PipelineStep> steps = state.getTrace().stream().map(TraceEntry::step).distinct().toList();
            assertEquals(List.of(PipelineStep.DETECT, PipelineStep.RETRIEVE, PipelineStep.TRAVERSE,
                    PipelineStep.BUILD_CONTEXT, PipelineStep.GENERATE), steps);
            for (PipelineStep step : steps) {
                assertEquals(step.getTitle(), state.traceOf(step).get(0));
            }
            assertTrue(state.traceOf(PipelineStep.RETRIEVE).contains("   Found: OpenAI (ID: c3)"));
        }

        @Test
        @DisplayName("should honor a traversal depth of 0")
        void shouldHonorDepthZero() {
            GraphRagPipeline pipeline = GraphRagPipeline.builder().graph(graph).traversalDepth(0).build();

            PipelineState state = pipeline.run("Tell me about NVIDIA");

            assertEquals(4, state.getFacts().size());
            assertTrue(state.getContext().contains("- NVIDIA supplies to OpenAI (GPUs)"));
            assertTrue(state.getContext().contains("- Jensen Huang founded NVIDIA in 1993"));
        }

        @Test
        @DisplayName("concurrent runs on a shared pipeline should match sequential runs")
        void shouldRunConcurrently() throws Exception {
            GraphRagPipeline pipeline = offlinePipeline();
            List<String> questions = List.of(
                    "What companies did Elon Musk found?",
                    "What is the relationship between Microsoft and OpenAI?");
            Map<String, String> expected = new HashMap<>();
            for (String question : questions) {
                expected.put(question, pipeline.run(question).getContext());
            }

            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Future<PipelineState>> runs = new ArrayList<>();
                for (int i = 0; i < 64; i++) {
                    String question = questions.get(i % questions.size());
                    runs.add(executor.submit(() -> pipeline.run(question)));
                }
                for (Future<PipelineState> run : runs) {
                    PipelineState state = run.get(10, TimeUnit.SECONDS);
                    assertTrue(state.isDone());
                    assertEquals(expected.get(state.getQuestion()), state.getContext());
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("with a generator")
    class GenerationTests {

        @Test
        @DisplayName("should send the grounded prompt and return the answer")
        void shouldUseGenerator() {
            LLMFunction llm = mock(LLMFunction.class);
            when(llm.apply(anyString())).thenReturn(CompletableFuture.completedFuture("Sam Altman leads OpenAI."));

            GraphRagPipeline pipeline = GraphRagPipeline.builder()
                    .graph(graph)
                    .generation(GenerationSettings.enabled(llm, Duration.ofSeconds(2)))
                    .build();

            PipelineState state = pipeline.run("Who leads OpenAI?");

            assertTrue(pipeline.isGenerationAvailable());
            assertEquals("Sam Altman leads OpenAI.", state.getAnswer());
            verify(llm).apply(contains("Question: Who leads OpenAI?"));
        }

        @Test
        @DisplayName("should not call the generator when no fact was found")
        void shouldSkipGeneratorWithoutFacts() {
            LLMFunction llm = mock(LLMFunction.class);
            GraphRagPipeline pipeline = GraphRagPipeline.builder()
                    .graph(graph)
                    .generation(GenerationSettings.enabled(llm, Duration.ofSeconds(2)))
                    .build();

            PipelineState state = pipeline.run("hello");

            assertEquals(GenerateAnswerStage.NO_INFORMATION_ANSWER, state.getAnswer());
            verify(llm, never()).apply(anyString());
        }
    }

    @Nested
    @DisplayName("builder")
    class BuilderTests {

        @Test
        @DisplayName("should require a graph and a non-negative depth")
        void shouldValidate() {
            assertThrows(IllegalStateException.class, () -> GraphRagPipeline.builder().build());
            assertThrows(IllegalStateException.class,
                    () -> GraphRagPipeline.builder().graph(graph).traversalDepth(-1).build());
        }

        @Test
        @DisplayName("should use an overriding stage")
        void shouldUseOverride() {
            PipelineStage fixedAnswer = new PipelineStage() {
                @Override
                public @NotNull StateUpdate process(@NotNull PipelineState state) {
                    return new StateUpdate().answer("fixed").trace("custom");
                }

                @Override
                public @NotNull PipelineStep getStep() {
                    return PipelineStep.GENERATE;
                }
            };

            PipelineState state = GraphRagPipeline.builder().graph(graph).stage(fixedAnswer).build()
                    .run("Who leads OpenAI?");

            assertEquals("fixed", state.getAnswer());
            assertEquals(List.of("custom"), state.traceOf(PipelineStep.GENERATE));
        }

        @Test
        @DisplayName("should wrap unexpected stage failures")
        void shouldWrapStageFailure() {
            PipelineStage broken = new PipelineStage() {
                @Override
                public @NotNull StateUpdate process(@NotNull PipelineState state) {
                    throw new IllegalStateException("boom");
                }

                @Override
                public @NotNull PipelineStep getStep() {
                    return PipelineStep.TRAVERSE;
                }
            };

            GraphRagPipeline pipeline = GraphRagPipeline.builder().graph(graph).stage(broken).build();

            GraphRagPipeline.PipelineException error =
                    assertThrows(GraphRagPipeline.PipelineException.class, () -> pipeline.run("Who leads OpenAI?"));
            assertEquals("boom", error.getCause().getMessage());
        }
    }
}
