package com.example.workflowdispatch.store;

import com.example.workflowdispatch.api.v1.dto.SublatticeResultDto;
import com.example.workflowdispatch.domain.NodeStatus;

import java.time.Instant;

/**
 * Partial update of one node as reported by a runner. Null fields keep their stored value.
 */
public record NodeUpdate(
        NodeStatus status,
        Object output,
        String error,
        String stdout,
        String stderr,
        Instant startTime,
        Instant endTime,
        SublatticeResultDto sublatticeResult
) {

    public static NodeUpdate status(NodeStatus status) {
        return new NodeUpdate(status, null, null, null, null, null, null, null);
    }
}
