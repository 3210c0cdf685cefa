package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.EntityMention;
import br.edu.ifba.graphrag.core.NodeKind;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Finds known entities mentioned in question text.
 *
 * <p>This is a closed-vocabulary matcher, not a statistical recognizer: a surface form
 * matches when it is a substring of the lowercased text. Surface forms are tried longest
 * first so that a full name wins over its short aliases, and a canonical name is reported
 * once even when several of its aliases occur.</p>
 *
 * <h2>Kind classification:</h2>
 * <p>A canonical name is a {@code person} when one of its lowercase tokens is in the
 * catalog's surname roster, otherwise an {@code organization}.</p>
 */
public class EntityRecognizer {

    private static final Logger logger = LoggerFactory.getLogger(EntityRecognizer.class);

    private final EntityCatalog catalog;
    private final List<String> scanOrder;

    public EntityRecognizer() {
        this(EntityCatalog.defaultCatalog());
    }

    public EntityRecognizer(@NotNull EntityCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.scanOrder = List.copyOf(catalog.surfaceFormsByLengthDescending());
    }

    /**
     * Detects entity mentions in {@code text}.
     *
     * @param text any text, may be empty
     * @return mentions in scan order (longest surface form first), empty list if none
     */
    @NotNull
    public List<EntityMention> detect(@NotNull String text) {
        String textLower = text.toLowerCase(Locale.ROOT);
        List<EntityMention> detected = new ArrayList<>();
        Set<String> seenNames = new HashSet<>();

        for (String surfaceForm : scanOrder) {
            if (!textLower.contains(surfaceForm)) {
                continue;
            }
            String canonicalName = catalog.surfaceForms().get(surfaceForm);
            if (seenNames.add(canonicalName)) {
                detected.add(new EntityMention(canonicalName, classify(canonicalName), surfaceForm));
            }
        }

        logger.debug("Detected {} entities in '{}'", detected.size(), text);
        return detected;
    }

    /**
     * Classifies a canonical name as person or organization.
     */
    @NotNull
    public NodeKind classify(@NotNull String canonicalName) {
        for (String token : canonicalName.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (catalog.personSurnames().contains(token)) {
                return NodeKind.PERSON;
            }
        }
        return NodeKind.ORGANIZATION;
    }
}
