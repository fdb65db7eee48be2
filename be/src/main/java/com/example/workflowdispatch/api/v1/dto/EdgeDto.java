package com.example.workflowdispatch.api.v1.dto;

import com.example.workflowdispatch.domain.ParamType;
import jakarta.validation.constraints.NotNull;
import java.util.Objects;

/**
 * Data dependency from the output of {@code source} into a parameter of {@code target}.
 */
public record EdgeDto(
        @NotNull Integer source,
        @NotNull Integer target,
        String edgeName,
        ParamType paramType
) {
    public EdgeDto {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }
}
