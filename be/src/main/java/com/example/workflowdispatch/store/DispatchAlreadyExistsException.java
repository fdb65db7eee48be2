package com.example.workflowdispatch.store;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown by {@link ResultStore#create} when the dispatch id is already taken.
 */
@Getter
public class DispatchAlreadyExistsException extends RuntimeException {

    private final UUID dispatchId;

    public DispatchAlreadyExistsException(UUID dispatchId) {
        super("Dispatch already exists: " + dispatchId);
        this.dispatchId = dispatchId;
    }
}
