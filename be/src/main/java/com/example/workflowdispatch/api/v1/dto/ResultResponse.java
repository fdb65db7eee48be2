package com.example.workflowdispatch.api.v1.dto;

import com.example.workflowdispatch.domain.DispatchStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * Full result of a dispatch: status plus the node/link graph.
 */
public record ResultResponse(
        UUID dispatchId,
        String resultsDir,
        DispatchStatus status,
        String error,
        ResultGraphDto graph,
        Instant createdAt,
        Instant updatedAt
) {}
