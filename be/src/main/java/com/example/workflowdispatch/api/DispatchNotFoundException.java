package com.example.workflowdispatch.api;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when no result exists for a dispatch id.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class DispatchNotFoundException extends RuntimeException {

    private final UUID dispatchId;

    public DispatchNotFoundException(UUID dispatchId) {
        super("Dispatch not found: " + dispatchId);
        this.dispatchId = dispatchId;
    }
}
