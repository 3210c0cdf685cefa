package br.edu.ifba.graphrag.query;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Closed vocabulary used by {@link EntityRecognizer}.
 *
 * <p>Holds the canonical names of known entities, short aliases that resolve to them,
 * and the surname roster that marks a canonical name as a person. All lookups are
 * lowercase; canonical names keep their display casing.</p>
 */
public final class EntityCatalog {

    // lowercase surface form -> canonical display name, catalog order
    private final Map<String, String> surfaceForms;
    private final Set<String> personSurnames;

    private EntityCatalog(Map<String, String> surfaceForms, Set<String> personSurnames) {
        this.surfaceForms = Collections.unmodifiableMap(surfaceForms);
        this.personSurnames = Collections.unmodifiableSet(personSurnames);
    }

    /**
     * The catalog matching the bundled seed graph.
     */
    @NotNull
    public static EntityCatalog defaultCatalog() {
        return builder()
                .person("Elon Musk", "elon", "musk")
                .person("Sam Altman", "sam", "altman")
                .person("Satya Nadella", "satya", "nadella")
                .person("Jensen Huang", "jensen", "huang")
                .person("Demis Hassabis", "demis", "hassabis")
                .entity("Tesla")
                .entity("SpaceX")
                .entity("OpenAI")
                .entity("Microsoft")
                .entity("NVIDIA")
                .entity("DeepMind")
                .entity("Google")
                .entity("Neuralink")
                .build();
    }

    /**
     * Surface forms mapped to their canonical names, in catalog order.
     */
    @NotNull
    public Map<String, String> surfaceForms() {
        return surfaceForms;
    }

    /**
     * Lowercase surname tokens that identify a person.
     */
    @NotNull
    public Set<String> personSurnames() {
        return personSurnames;
    }

    /**
     * Surface forms ordered longest first. The sort is stable, so forms of equal
     * length keep catalog order.
     */
    @NotNull
    public List<String> surfaceFormsByLengthDescending() {
        List<String> forms = new ArrayList<>(surfaceForms.keySet());
        forms.sort((a, b) -> Integer.compare(b.length(), a.length()));
        return forms;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for EntityCatalog instances.
     */
    public static class Builder {
        private final Map<String, String> surfaceForms = new LinkedHashMap<>();
        private final Set<String> personSurnames = new LinkedHashSet<>();

        /**
         * Adds an entity known only by its full name.
         */
        public Builder entity(@NotNull String canonicalName) {
            surfaceForms.put(canonicalName.toLowerCase(Locale.ROOT), canonicalName);
            return this;
        }

        /**
         * Adds an alias resolving to {@code canonicalName}.
         */
        public Builder alias(@NotNull String alias, @NotNull String canonicalName) {
            surfaceForms.put(alias.toLowerCase(Locale.ROOT), canonicalName);
            return this;
        }

        /**
         * Adds a person: full name plus aliases. The last alias is taken as the surname
         * and joins the person roster.
         */
        public Builder person(@NotNull String canonicalName, @NotNull String... aliases) {
            entity(canonicalName);
            for (String alias : aliases) {
                alias(alias, canonicalName);
            }
            if (aliases.length > 0) {
                personSurnames.add(aliases[aliases.length - 1].toLowerCase(Locale.ROOT));
            }
            return this;
        }

        public EntityCatalog build() {
            return new EntityCatalog(new LinkedHashMap<>(surfaceForms), new LinkedHashSet<>(personSurnames));
        }
    }
}
