package com.example.workflowdispatch.api.v1.dto;

import com.example.workflowdispatch.domain.DispatchStatus;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

/**
 * Reference from a sub-workflow node to the dispatch that ran it.
 */
public record SublatticeResultDto(
        @NotNull UUID dispatchId,
        DispatchStatus status,
        String resultsDir
) {}
