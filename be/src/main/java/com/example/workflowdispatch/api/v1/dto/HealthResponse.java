package com.example.workflowdispatch.api.v1.dto;

/**
 * Service health: overall status, result store status and, for the in-process queue, its backlog.
 */
public record HealthResponse(
        String status,
        String service,
        String store,
        Long dispatchCount,
        QueueHealth queue
) {
    public record QueueHealth(String topic, int depth, int inFlight) {}
}
