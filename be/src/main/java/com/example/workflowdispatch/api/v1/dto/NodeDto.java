package com.example.workflowdispatch.api.v1.dto;

import com.example.workflowdispatch.domain.NodeStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One task node in a dispatch graph. On submission only id, name, metadata and function string
 * are meaningful; execution fields are filled in by runner updates.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeDto(
        @NotNull @PositiveOrZero Integer id,
        @NotBlank String name,
        Map<String, Object> metadata,
        String functionString,
        Instant startTime,
        Instant endTime,
        NodeStatus status,
        Object output,
        String error,
        @Valid SublatticeResultDto sublatticeResult,
        String stdout,
        String stderr
) {
    public NodeDto {
        Objects.requireNonNull(id, "id");
    }

    /**
     * Copy of this node reset to PENDING with no execution data.
     */
    public NodeDto asPending() {
        return new NodeDto(id, name, metadata, functionString, null, null, NodeStatus.PENDING,
                null, null, null, null, null);
    }
}
