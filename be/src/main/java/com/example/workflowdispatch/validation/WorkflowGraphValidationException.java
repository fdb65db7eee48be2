package com.example.workflowdispatch.validation;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a submitted graph is malformed (duplicate ids, dangling edge references, cycles).
 * <p>
 * Mapped to HTTP 400 with {@link #getErrors()} in the response body by {@link com.example.workflowdispatch.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class WorkflowGraphValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public WorkflowGraphValidationException(List<ValidationError> errors) {
        super("Workflow graph validation failed: " + (errors != null ? errors.size() + " error(s)" : ""));
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
}
