package com.example.workflowdispatch.api.v1.dto;

import com.example.workflowdispatch.domain.NodeStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Request body for PUT /api/v1/results/{dispatchId}: a partial update of one node.
 * Null fields are left unchanged.
 */
public record NodeUpdateRequest(
        @NotNull Integer nodeId,
        NodeStatus status,
        Object output,
        String error,
        String stdout,
        String stderr,
        Instant startTime,
        Instant endTime,
        @Valid SublatticeResultDto sublatticeResult
) {}
