package com.example.workflowdispatch.api.v1;

import com.example.workflowdispatch.api.v1.dto.DispatchAcceptedResponse;
import com.example.workflowdispatch.api.v1.dto.DispatchRequest;
import com.example.workflowdispatch.service.SubmissionService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Workflow submission endpoint.
 * <p>
 * POST /api/v1/dispatch answers 202 once the workflow is persisted and enqueued; execution has
 * not started at that point.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/dispatch")
@RequiredArgsConstructor
@Slf4j
public class DispatchController {

    private final SubmissionService submissionService;

    @PostMapping
    public ResponseEntity<DispatchAcceptedResponse> submit(@Valid @RequestBody DispatchRequest request) {
        log.info("Submitting workflow nodeCount={} linkCount={}",
                request.nodes() != null ? request.nodes().size() : 0,
                request.links() != null ? request.links().size() : 0);
        DispatchAcceptedResponse response = submissionService.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}
