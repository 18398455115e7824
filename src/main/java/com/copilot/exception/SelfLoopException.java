package com.copilot.exception;

/**
 * Thrown when an edge would connect a node to itself.
 */
public class SelfLoopException extends GraphException {

    public SelfLoopException(String nodeId, String message) {
        super(nodeId, message);
    }
}
