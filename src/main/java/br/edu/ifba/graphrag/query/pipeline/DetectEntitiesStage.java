package br.edu.ifba.graphrag.query.pipeline;

import br.edu.ifba.graphrag.core.EntityMention;
import br.edu.ifba.graphrag.query.EntityRecognizer;
import br.edu.ifba.graphrag.query.RelationIntentDetector;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Pipeline stage that recognizes known entities and relation intents in the question.
 */
public class DetectEntitiesStage implements PipelineStage {

    private final EntityRecognizer recognizer;
    private final RelationIntentDetector intentDetector;

    public DetectEntitiesStage(@NotNull EntityRecognizer recognizer, @NotNull RelationIntentDetector intentDetector) {
        this.recognizer = recognizer;
        this.intentDetector = intentDetector;
    }

    @Override
    @NotNull
    public StateUpdate process(@NotNull PipelineState state) {
        String question = state.getQuestion();
        List<EntityMention> entities = recognizer.detect(question);
        List<String> intents = intentDetector.detect(question);

        StateUpdate update = new StateUpdate()
                .detectedEntities(entities)
                .relationIntents(intents)
                .trace(getStep().getTitle())
                .trace("   Question: " + question)
                .trace("   Detected " + entities.size() + " entities:");

        for (EntityMention entity : entities) {
            update.trace("   - " + entity.name() + " (" + entity.kind() + ")");
        }
        if (entities.isEmpty()) {
            update.trace("   WARNING: No entities detected");
        }
        if (!intents.isEmpty()) {
            update.trace("   Relation intents: " + String.join(", ", intents));
        }

        return update;
    }

    @Override
    @NotNull
    public PipelineStep getStep() {
        return PipelineStep.DETECT;
    }
}
