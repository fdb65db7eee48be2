package com.example.workflowdispatch.domain;

import lombok.Getter;

/**
 * Thrown when an update would move a node backwards in its status ordering
 * (e.g. COMPLETED to RUNNING). Mapped to HTTP 409.
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final int nodeId;
    private final NodeStatus from;
    private final NodeStatus to;

    public InvalidTransitionException(int nodeId, NodeStatus from, NodeStatus to) {
        super("Invalid status transition for node " + nodeId + ": " + from + " -> " + to);
        this.nodeId = nodeId;
        this.from = from;
        this.to = to;
    }
}
