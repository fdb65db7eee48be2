package com.example.workflowdispatch.domain;

/**
 * Execution status of a single node.
 * <p>
 * Statuses are ranked PENDING &lt; RUNNING &lt; {COMPLETED, FAILED}; a node only ever moves up the ranking.
 * </p>
 */
public enum NodeStatus {

    PENDING(0),
    RUNNING(1),
    COMPLETED(2),
    FAILED(2);

    private final int rank;

    NodeStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 2;
    }

    /**
     * Returns true if a node in this status may be moved to {@code next}. Re-applying the
     * current status is allowed so that streamed output and redelivered updates are accepted.
     */
    public boolean canTransitionTo(NodeStatus next) {
        if (next == null || next == this) {
            return true;
        }
        return next.rank > rank;
    }
}
