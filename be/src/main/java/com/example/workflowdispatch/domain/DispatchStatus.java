package com.example.workflowdispatch.domain;

/**
 * Overall status of a dispatch, derived from its node statuses.
 */
public enum DispatchStatus {

    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
