package com.example.workflowdispatch.api.v1;

import com.example.workflowdispatch.api.v1.dto.HealthResponse;
import com.example.workflowdispatch.queue.InMemoryDispatchQueue;
import com.example.workflowdispatch.repository.DispatchRecordRepository;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health check endpoint.
 * <p>
 * GET /api/v1/health answers 200 while the result store can be queried and 503 otherwise. When
 * the in-process queue is in use its depth and in-flight count are included.
 * </p>
 */
@RestController
@RequestMapping("/api/v1")
@Slf4j
public class HealthController {

    private static final String SERVICE = "workflow-dispatch-be";

    private final DispatchRecordRepository repository;
    private final ObjectProvider<InMemoryDispatchQueue> queue;
    private final String topic;

    public HealthController(
            DispatchRecordRepository repository,
            ObjectProvider<InMemoryDispatchQueue> queue,
            @Value("${dispatch.queue.topic:dispatch}") String topic) {
        this.repository = repository;
        this.queue = queue;
        this.topic = topic;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        HealthResponse.QueueHealth queueHealth = queueHealth();
        try {
            long dispatchCount = repository.count();
            log.trace("Health check dispatchCount={}", dispatchCount);
            return ResponseEntity.ok(new HealthResponse("UP", SERVICE, "UP", dispatchCount, queueHealth));
        } catch (DataAccessException e) {
            log.warn("Health check: result store unavailable: {}", e.getMessage());
            return ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new HealthResponse("DOWN", SERVICE, "DOWN", null, queueHealth));
        }
    }

    private HealthResponse.QueueHealth queueHealth() {
        InMemoryDispatchQueue inMemory = queue.getIfAvailable();
        if (inMemory == null) {
            return null;
        }
        return new HealthResponse.QueueHealth(topic, inMemory.depth(topic), inMemory.inFlightCount());
    }
}
