package com.example.workflowdispatch.api.v1.dto;

import com.example.workflowdispatch.domain.DispatchStatus;
import com.example.workflowdispatch.domain.NodeStatus;

/**
 * Acknowledgment of an applied node update with the node's and the dispatch's new status.
 */
public record UpdateAckResponse(
        String status,
        int nodeId,
        NodeStatus nodeStatus,
        DispatchStatus resultStatus
) {
    public static UpdateAckResponse updated(int nodeId, NodeStatus nodeStatus, DispatchStatus resultStatus) {
        return new UpdateAckResponse("updated", nodeId, nodeStatus, resultStatus);
    }
}
