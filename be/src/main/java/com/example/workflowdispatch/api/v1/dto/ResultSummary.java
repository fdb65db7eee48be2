package com.example.workflowdispatch.api.v1.dto;

import com.example.workflowdispatch.domain.DispatchStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * Result list item.
 */
public record ResultSummary(
        UUID dispatchId,
        DispatchStatus status,
        String resultsDir,
        int nodeCount,
        int completedCount,
        Instant updatedAt
) {}
