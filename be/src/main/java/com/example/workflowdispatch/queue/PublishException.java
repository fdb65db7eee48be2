package com.example.workflowdispatch.queue;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown when a message could not be enqueued (transport failure, full topic, or timeout).
 * Mapped to HTTP 503.
 */
@Getter
public class PublishException extends RuntimeException {

    private final UUID dispatchId;

    public PublishException(UUID dispatchId, String message) {
        super(message);
        this.dispatchId = dispatchId;
    }

    public PublishException(UUID dispatchId, String message, Throwable cause) {
        super(message, cause);
        this.dispatchId = dispatchId;
    }
}
