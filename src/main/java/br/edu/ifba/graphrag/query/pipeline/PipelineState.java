package br.edu.ifba.graphrag.query.pipeline;

import br.edu.ifba.graphrag.core.EntityMention;
import br.edu.ifba.graphrag.core.Fact;
import br.edu.ifba.graphrag.core.MatchedNode;
import br.edu.ifba.graphrag.core.TraversalResult;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * State that flows through the question-answering pipeline.
 *
 * <p>Each instance is immutable. A step produces a {@link StateUpdate} and
 * {@link #merge(StateUpdate)} returns the next state, so one invocation owns its
 * states and nothing is shared between concurrent questions.</p>
 *
 * <h2>Pipeline Flow:</h2>
 * <pre>
 * question → [Detect] → [Retrieve] → [Traverse] → [BuildContext] → [Generate] → answer
 *               ↓            ↓            ↓              ↓               ↓
 *           entities   matchedNodes  traversals   facts, context      answer
 * </pre>
 */
public final class PipelineState {

    // === Input data ===

    private final String question;

    // === Intermediate data (set by steps) ===

    private final List<EntityMention> detectedEntities;
    private final List<String> relationIntents;
    private final List<MatchedNode> matchedNodes;
    private final List<TraversalResult> traversalResults;

    /** Globally deduplicated facts, in first-seen order */
    private final List<Fact> facts;

    // === Output data ===

    private final String context;
    private final String answer;

    /** Append-only, in step order */
    private final List<TraceEntry> trace;

    private final PipelineStep step;

    private PipelineState(
            String question,
            List<EntityMention> detectedEntities,
            List<String> relationIntents,
            List<MatchedNode> matchedNodes,
            List<TraversalResult> traversalResults,
            List<Fact> facts,
            String context,
            String answer,
            List<TraceEntry> trace,
            PipelineStep step) {
        this.question = question;
        this.detectedEntities = detectedEntities;
        this.relationIntents = relationIntents;
        this.matchedNodes = matchedNodes;
        this.traversalResults = traversalResults;
        this.facts = facts;
        this.context = context;
        this.answer = answer;
        this.trace = trace;
        this.step = step;
    }

    /**
     * Creates the state a new invocation starts from.
     *
     * @param question the user question, may be empty
     */
    @NotNull
    public static PipelineState initial(@NotNull String question) {
        Objects.requireNonNull(question, "question must not be null");
        return new PipelineState(question, List.of(), List.of(), List.of(), List.of(), List.of(),
                "", "", List.of(), PipelineStep.DETECT);
    }

    /**
     * Applies the update produced by the current step and advances to the next step.
     *
     * <p>Fields set on the update replace the current values; the update's trace lines are
     * appended, tagged with the current step.</p>
     *
     * @throws IllegalStateException if the pipeline is already done
     */
    @NotNull
    public PipelineState merge(@NotNull StateUpdate update) {
        if (step.isTerminal()) {
            throw new IllegalStateException("Cannot merge into a finished pipeline state");
        }

        List<TraceEntry> mergedTrace = new ArrayList<>(trace);
        for (String line : update.getTraceLines()) {
            mergedTrace.add(new TraceEntry(step, line));
        }

        return new PipelineState(
                question,
                orElse(update.getDetectedEntities(), detectedEntities),
                orElse(update.getRelationIntents(), relationIntents),
                orElse(update.getMatchedNodes(), matchedNodes),
                orElse(update.getTraversalResults(), traversalResults),
                orElse(update.getFacts(), facts),
                orElse(update.getContext(), context),
                orElse(update.getAnswer(), answer),
                List.copyOf(mergedTrace),
                step.next()
        );
    }

    private static <T> T orElse(T value, T fallback) {
        return value != null ? value : fallback;
    }

    @NotNull
    public String getQuestion() {
        return question;
    }

    @NotNull
    public List<EntityMention> getDetectedEntities() {
        return detectedEntities;
    }

    @NotNull
    public List<String> getRelationIntents() {
        return relationIntents;
    }

    @NotNull
    public List<MatchedNode> getMatchedNodes() {
        return matchedNodes;
    }

    @NotNull
    public List<TraversalResult> getTraversalResults() {
        return traversalResults;
    }

    @NotNull
    public List<Fact> getFacts() {
        return facts;
    }

    @NotNull
    public String getContext() {
        return context;
    }

    @NotNull
    public String getAnswer() {
        return answer;
    }

    @NotNull
    public List<TraceEntry> getTrace() {
        return trace;
    }

    /**
     * The step that will run next, {@link PipelineStep#DONE} once the answer is set.
     */
    @NotNull
    public PipelineStep getStep() {
        return step;
    }

    /**
     * Trace lines written by one step, in order.
     */
    @NotNull
    public List<String> traceOf(@NotNull PipelineStep traceStep) {
        return trace.stream()
                .filter(entry -> entry.step() == traceStep)
                .map(TraceEntry::message)
                .toList();
    }

    public boolean isDone() {
        return step.isTerminal();
    }

    @Override
    public String toString() {
        return "PipelineState{" +
                "question='" + (question.length() > 50 ? question.substring(0, 50) + "..." : question) + '\'' +
                ", step=" + step +
                ", entities=" + detectedEntities.size() +
                ", matchedNodes=" + matchedNodes.size() +
                ", facts=" + facts.size() +
                ", trace=" + trace.size() +
                '}';
    }
}
