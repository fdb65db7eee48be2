package com.example.workflowdispatch.store;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a store operation could not complete within its time bound. Mapped to HTTP 503.
 */
@Getter
public class StoreTimeoutException extends RuntimeException {

    private final UUID dispatchId;

    public StoreTimeoutException(UUID dispatchId, String message) {
        super(message);
        this.dispatchId = dispatchId;
    }

    public StoreTimeoutException(UUID dispatchId, String message, Throwable cause) {
        super(message, cause);
        this.dispatchId = dispatchId;
    }
}
