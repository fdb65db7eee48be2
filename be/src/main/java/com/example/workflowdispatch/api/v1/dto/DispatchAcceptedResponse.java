package com.example.workflowdispatch.api.v1.dto;

import java.util.UUID;

/**
 * Response after a submission was persisted and enqueued (202).
 */
public record DispatchAcceptedResponse(UUID dispatchId, String status) {

    public static DispatchAcceptedResponse accepted(UUID dispatchId) {
        return new DispatchAcceptedResponse(dispatchId, "accepted");
    }
}
