package com.copilot.exception;

/**
 * Base exception for knowledge graph contract violations.
 * Carries the id of the node the violation was detected on.
 */
public class GraphException extends CopilotException {

    private final String nodeId;

    public GraphException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public String getNodeId() {
        return nodeId;
    }
}
