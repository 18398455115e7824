package com.copilot.exception;

/**
 * Thrown when an edge references a node that is not in the graph.
 */
public class DanglingEdgeException extends GraphException {

    public DanglingEdgeException(String nodeId, String message) {
        super(nodeId, message);
    }
}
