package com.example.workflowdispatch.api;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a dispatch exists but has no node with the given id. Mapped to HTTP 404.
 */
@Getter
public class NodeNotFoundException extends RuntimeException {

    private final UUID dispatchId;
    private final int nodeId;

    public NodeNotFoundException(UUID dispatchId, int nodeId) {
        super("Node " + nodeId + " not found in dispatch " + dispatchId);
        this.dispatchId = dispatchId;
        this.nodeId = nodeId;
    }
}
