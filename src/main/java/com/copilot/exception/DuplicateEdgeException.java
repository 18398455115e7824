package com.copilot.exception;

/**
 * Thrown when an edge with the same source, target and relation already exists.
 */
public class DuplicateEdgeException extends GraphException {

    public DuplicateEdgeException(String nodeId, String message) {
        super(nodeId, message);
    }
}
