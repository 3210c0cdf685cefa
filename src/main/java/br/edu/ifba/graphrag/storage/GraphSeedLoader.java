package br.edu.ifba.graphrag.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads {@link GraphSeed} JSON from the classpath and builds the graph from it.
 */
public final class GraphSeedLoader {

    private static final Logger logger = LoggerFactory.getLogger(GraphSeedLoader.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private GraphSeedLoader() {
    }

    /**
     * Loads seed data from a classpath resource.
     *
     * @param resource classpath location, e.g. {@code seed/knowledge-graph.json}
     * @return the parsed seed
     * @throws GraphConstructionException if the resource is missing or not valid seed JSON
     */
    @NotNull
    public static GraphSeed load(@NotNull String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = GraphSeedLoader.class.getClassLoader();
        }

        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new GraphConstructionException("Seed resource not found on classpath: " + resource);
            }
            GraphSeed seed = mapper.readValue(in, GraphSeed.class);
            logger.info("Loaded seed {}: {} people, {} organizations, {} relationships",
                    resource, seed.people().size(), seed.organizations().size(), seed.relationships().size());
            return seed;
        } catch (IOException e) {
            throw new GraphConstructionException("Failed to read seed resource " + resource, e);
        }
    }

    /**
     * Loads seed data and builds the graph, validating every edge endpoint.
     *
     * @throws GraphConstructionException if the seed cannot be read or references unknown nodes
     */
    @NotNull
    public static InMemoryGraphStore loadGraph(@NotNull String resource) {
        GraphSeed seed = load(resource);
        return InMemoryGraphStore.build(seed.toNodes(), seed.toRelationships());
    }
}
