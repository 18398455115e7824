package com.copilot.exception;

/**
 * Thrown when the graph is mutated after {@code freeze()}.
 */
public class GraphFrozenException extends GraphException {

    public GraphFrozenException(String nodeId, String message) {
        super(nodeId, message);
    }
}
