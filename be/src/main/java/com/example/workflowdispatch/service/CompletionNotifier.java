package com.example.workflowdispatch.service;

import com.example.workflowdispatch.domain.DispatchStatus;

import java.util.UUID;

/**
 * Sink for dispatch completion. Invoked once per transition of a dispatch into a terminal status;
 * implementations must not block the caller or throw.
 */
public interface CompletionNotifier {

    void dispatchCompleted(UUID dispatchId, DispatchStatus status);
}
