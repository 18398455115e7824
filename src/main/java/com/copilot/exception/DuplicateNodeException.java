package com.copilot.exception;

/**
 * Thrown when a node id is added to the graph twice.
 */
public class DuplicateNodeException extends GraphException {

    public DuplicateNodeException(String nodeId, String message) {
        super(nodeId, message);
    }
}
