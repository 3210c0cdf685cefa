package br.edu.ifba.graphrag.storage;

/**
 * Thrown when the knowledge graph cannot be built from its seed data.
 * The application cannot run without a graph, so this aborts startup.
 */
public class GraphConstructionException extends RuntimeException {

    public GraphConstructionException(String message) {
        super(message);
    }

    public GraphConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
