package com.example.workflowdispatch.queue;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Message handed to a runner: the dispatch id and the serialized workflow graph. The id makes
 * redelivered duplicates detectable on the consumer side.
 */
public record DispatchMessage(UUID dispatchId, String resultsDir, String payload, Instant publishedAt) {
    public DispatchMessage {
        Objects.requireNonNull(dispatchId, "dispatchId");
        Objects.requireNonNull(payload, "payload");
    }
}
