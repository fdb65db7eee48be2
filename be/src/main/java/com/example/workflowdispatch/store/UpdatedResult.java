package com.example.workflowdispatch.store;

import com.example.workflowdispatch.api.v1.dto.NodeDto;
import com.example.workflowdispatch.api.v1.dto.ResultResponse;
import com.example.workflowdispatch.domain.DispatchStatus;

/**
 * Outcome of {@link ResultStore#updateNode}: the updated node and result, plus the dispatch
 * status observed before the update under the same lock.
 */
public record UpdatedResult(NodeDto node, ResultResponse result, DispatchStatus previousStatus) {

    /**
     * True if this update moved the dispatch into COMPLETED or FAILED.
     */
    public boolean becameTerminal() {
        return result.status().isTerminal() && result.status() != previousStatus;
    }
}
