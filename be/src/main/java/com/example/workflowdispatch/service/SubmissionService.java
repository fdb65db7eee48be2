package com.example.workflowdispatch.service;

import com.example.workflowdispatch.api.v1.dto.DispatchAcceptedResponse;
import com.example.workflowdispatch.api.v1.dto.DispatchRequest;
import com.example.workflowdispatch.api.v1.dto.ResultGraphDto;
import com.example.workflowdispatch.api.v1.dto.ResultResponse;
import com.example.workflowdispatch.logging.MdcContext;
import com.example.workflowdispatch.queue.DispatchMessage;
import com.example.workflowdispatch.queue.DispatchQueue;
import com.example.workflowdispatch.queue.PublishException;
import com.example.workflowdispatch.store.DispatchAlreadyExistsException;
import com.example.workflowdispatch.store.ResultStore;
import com.example.workflowdispatch.validation.ValidationError;
import com.example.workflowdispatch.validation.WorkflowGraphValidationException;
import com.example.workflowdispatch.validation.WorkflowGraphValidator;

import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Accepts workflow submissions.
 * <p>
 * Validates the graph via {@link WorkflowGraphValidator}, persists it with every node PENDING,
 * and waits (bounded by {@code dispatch.queue.publish-timeout}) until the work is enqueued.
 * If enqueueing fails the stored result is marked FAILED before the error is returned, so no
 * PENDING result is left behind without queued work.
 * </p>
 */
@Service
@Slf4j
public class SubmissionService {

    private static final int MAX_ID_ATTEMPTS = 2;

    private final ResultStore store;
    private final DispatchQueue queue;
    private final JsonMapper jsonMapper;
    private final Supplier<UUID> dispatchIdGenerator;
    private final Clock clock;
    private final String topic;
    private final Duration publishTimeout;
    private final Path resultsRoot;

    public SubmissionService(
            ResultStore store,
            DispatchQueue queue,
            JsonMapper jsonMapper,
            Supplier<UUID> dispatchIdGenerator,
            Clock clock,
            @Value("${dispatch.queue.topic:dispatch}") String topic,
            @Value("${dispatch.queue.publish-timeout:5s}") Duration publishTimeout,
            @Value("${dispatch.results-dir:./results}") String resultsRoot) {
        this.store = store;
        this.queue = queue;
        this.jsonMapper = jsonMapper;
        this.dispatchIdGenerator = dispatchIdGenerator;
        this.clock = clock;
        this.topic = topic;
        this.publishTimeout = publishTimeout;
        this.resultsRoot = Path.of(resultsRoot);
    }

    /**
     * Submits a workflow and returns its dispatch id once the work is enqueued.
     *
     * @throws WorkflowGraphValidationException if the graph is empty, has dangling edges or a cycle
     * @throws PublishException                 if the work could not be enqueued in time
     * @throws DispatchAlreadyExistsException   if freshly generated ids collided twice
     */
    public DispatchAcceptedResponse submit(DispatchRequest request) {
        if (request == null) {
            throw new WorkflowGraphValidationException(List.of(new ValidationError("body", "workflow payload is required")));
        }
        WorkflowGraphValidator.validate(request.nodes(), request.links());
        ResultGraphDto graph = new ResultGraphDto(request.nodes(), request.links());
        String payload = writePayload(graph);

        ResultResponse created = createResult(request.resultsDir(), graph);
        UUID dispatchId = created.dispatchId();
        MdcContext.setDispatch(dispatchId);
        try {
            publish(new DispatchMessage(dispatchId, created.resultsDir(), payload, clock.instant()));
            log.info("Dispatch accepted dispatchId={} nodes={} links={} topic={}",
                    dispatchId, graph.nodes().size(), graph.links().size(), topic);
            return DispatchAcceptedResponse.accepted(dispatchId);
        } finally {
            MdcContext.clear();
        }
    }

    private ResultResponse createResult(String requestedResultsDir, ResultGraphDto graph) {
        DispatchAlreadyExistsException collision = null;
        for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS; attempt++) {
            UUID candidate = dispatchIdGenerator.get();
            if (store.exists(candidate)) {
                log.warn("Generated dispatch id already in use dispatchId={} attempt={}", candidate, attempt);
                collision = new DispatchAlreadyExistsException(candidate);
                continue;
            }
            try {
                return store.create(candidate, resolveResultsDir(requestedResultsDir, candidate), graph);
            } catch (DispatchAlreadyExistsException e) {
                log.warn("Dispatch id taken during create dispatchId={} attempt={}", candidate, attempt);
                collision = e;
            }
        }
        throw collision;
    }

    private void publish(DispatchMessage message) {
        UUID dispatchId = message.dispatchId();
        CompletableFuture<Void> ack = null;
        try {
            ack = queue.publish(topic, message);
            ack.get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Publish acknowledged dispatchId={} topic={}", dispatchId, topic);
        } catch (TimeoutException e) {
            ack.cancel(false);
            throw failSubmission(dispatchId, "Timed out enqueuing dispatch after " + publishTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw failSubmission(dispatchId, "Failed to enqueue dispatch: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failSubmission(dispatchId, "Interrupted while enqueuing dispatch", e);
        } catch (RuntimeException e) {
            throw failSubmission(dispatchId, "Failed to enqueue dispatch: " + e.getMessage(), e);
        }
    }

    private PublishException failSubmission(UUID dispatchId, String message, Throwable cause) {
        log.error("Publish failed dispatchId={} topic={}: {}", dispatchId, topic, message);
        PublishException failure = new PublishException(dispatchId, message, cause);
        try {
            store.markFailed(dispatchId, "transport error: " + message);
        } catch (RuntimeException markError) {
            log.error("Could not mark dispatch failed dispatchId={}", dispatchId, markError);
            failure.addSuppressed(markError);
        }
        return failure;
    }

    private String resolveResultsDir(String requested, UUID dispatchId) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        return resultsRoot.resolve(dispatchId.toString()).toString();
    }

    private String writePayload(ResultGraphDto graph) {
        try {
            return jsonMapper.writeValueAsString(graph);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow payload", e);
        }
    }
}
