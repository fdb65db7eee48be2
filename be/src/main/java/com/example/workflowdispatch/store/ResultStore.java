package com.example.workflowdispatch.store;

import com.example.workflowdispatch.api.v1.dto.ResultGraphDto;
import com.example.workflowdispatch.api.v1.dto.ResultResponse;
import com.example.workflowdispatch.api.v1.dto.ResultSummary;

import java.util.List;
import java.util.UUID;

/**
 * Durable mapping from dispatch id to result state.
 * <p>
 * Mutations of one dispatch are serialized against each other; different dispatches proceed
 * independently. Reads never observe a partially applied update.
 * </p>
 */
public interface ResultStore {

    /**
     * Persists a new result with every node PENDING.
     *
     * @throws DispatchAlreadyExistsException if the id is taken
     */
    ResultResponse create(UUID dispatchId, String resultsDir, ResultGraphDto graph);

    /**
     * @throws com.example.workflowdispatch.api.DispatchNotFoundException if absent
     */
    ResultResponse get(UUID dispatchId);

    boolean exists(UUID dispatchId);

    /**
     * Applies a partial update to one node and recomputes the dispatch status.
     *
     * @throws com.example.workflowdispatch.api.DispatchNotFoundException if the dispatch is absent
     * @throws com.example.workflowdispatch.api.NodeNotFoundException if the node is absent
     * @throws com.example.workflowdispatch.domain.InvalidTransitionException if the status would regress
     */
    UpdatedResult updateNode(UUID dispatchId, int nodeId, NodeUpdate update);

    /**
     * Marks the whole dispatch FAILED with a dispatch-level error.
     */
    ResultResponse markFailed(UUID dispatchId, String error);

    List<ResultSummary> list();
}
