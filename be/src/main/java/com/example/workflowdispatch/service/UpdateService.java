package com.example.workflowdispatch.service;

import com.example.workflowdispatch.api.v1.dto.ResultResponse;
import com.example.workflowdispatch.api.v1.dto.UpdateAckResponse;
import com.example.workflowdispatch.logging.MdcContext;
import com.example.workflowdispatch.store.NodeUpdate;
import com.example.workflowdispatch.store.ResultStore;
import com.example.workflowdispatch.store.UpdatedResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Applies per-node progress reported by runners and signals dispatch completion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UpdateService {

    private final ResultStore store;
    private final CompletionNotifier completionNotifier;

    /**
     * Applies {@code update} to node {@code nodeId} of {@code dispatchId}.
     *
     * @throws com.example.workflowdispatch.api.DispatchNotFoundException     if the dispatch is unknown
     * @throws com.example.workflowdispatch.api.NodeNotFoundException         if the node is unknown
     * @throws com.example.workflowdispatch.domain.InvalidTransitionException if the node status would regress
     */
    public UpdateAckResponse applyUpdate(UUID dispatchId, int nodeId, NodeUpdate update) {
        MdcContext.setNode(dispatchId, nodeId);
        try {
            UpdatedResult outcome = store.updateNode(dispatchId, nodeId, update);
            ResultResponse result = outcome.result();
            log.info("Applied node update dispatchId={} nodeId={} nodeStatus={} resultStatus={}",
                    dispatchId, nodeId, outcome.node().status(), result.status());
            if (outcome.becameTerminal()) {
                log.info("Dispatch finished dispatchId={} status={}", dispatchId, result.status());
                completionNotifier.dispatchCompleted(dispatchId, result.status());
            }
            return UpdateAckResponse.updated(nodeId, outcome.node().status(), result.status());
        } finally {
            MdcContext.clear();
        }
    }
}
