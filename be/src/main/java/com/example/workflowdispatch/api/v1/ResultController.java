package com.example.workflowdispatch.api.v1;

import com.example.workflowdispatch.api.v1.dto.NodeUpdateRequest;
import com.example.workflowdispatch.api.v1.dto.ResultListResponse;
import com.example.workflowdispatch.api.v1.dto.ResultResponse;
import com.example.workflowdispatch.api.v1.dto.UpdateAckResponse;
import com.example.workflowdispatch.service.UpdateService;
import com.example.workflowdispatch.store.NodeUpdate;
import com.example.workflowdispatch.store.ResultStore;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for dispatch results.
 * <p>
 * Clients poll {@code GET /api/v1/results} and {@code GET /api/v1/results/{dispatchId}};
 * runners report per-node progress with {@code PUT /api/v1/results/{dispatchId}}.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/results")
@RequiredArgsConstructor
@Slf4j
public class ResultController {

    private final ResultStore resultStore;
    private final UpdateService updateService;

    @GetMapping
    public ResponseEntity<ResultListResponse> list() {
        log.debug("Listing all results");
        return ResponseEntity.ok(new ResultListResponse(resultStore.list()));
    }

    @GetMapping("/{dispatchId}")
    public ResponseEntity<ResultResponse> getById(@PathVariable UUID dispatchId) {
        log.info("Getting result dispatchId={}", dispatchId);
        return ResponseEntity.ok(resultStore.get(dispatchId));
    }

    @PutMapping("/{dispatchId}")
    public ResponseEntity<UpdateAckResponse> update(@PathVariable UUID dispatchId, @Valid @RequestBody NodeUpdateRequest request) {
        log.info("Updating node dispatchId={} nodeId={} status={}", dispatchId, request.nodeId(), request.status());
        NodeUpdate update = new NodeUpdate(
                request.status(),
                request.output(),
                request.error(),
                request.stdout(),
                request.stderr(),
                request.startTime(),
                request.endTime(),
                request.sublatticeResult()
        );
        return ResponseEntity.ok(updateService.applyUpdate(dispatchId, request.nodeId(), update));
    }
}
