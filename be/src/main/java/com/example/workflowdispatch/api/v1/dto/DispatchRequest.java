package com.example.workflowdispatch.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request body for POST /api/v1/dispatch. {@code edges} is accepted as an alias of {@code links}.
 */
public record DispatchRequest(
        @NotNull @NotEmpty @Valid List<NodeDto> nodes,
        @JsonAlias("edges") @Valid List<EdgeDto> links,
        String resultsDir
) {}
