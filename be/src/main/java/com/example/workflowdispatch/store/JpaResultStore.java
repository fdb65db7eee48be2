package com.example.workflowdispatch.store;

import com.example.workflowdispatch.api.DispatchNotFoundException;
import com.example.workflowdispatch.api.NodeNotFoundException;
import com.example.workflowdispatch.api.v1.dto.NodeDto;
import com.example.workflowdispatch.api.v1.dto.ResultGraphDto;
import com.example.workflowdispatch.api.v1.dto.ResultResponse;
import com.example.workflowdispatch.api.v1.dto.ResultSummary;
import com.example.workflowdispatch.domain.DispatchRecord;
import com.example.workflowdispatch.domain.DispatchStatus;
import com.example.workflowdispatch.domain.InvalidTransitionException;
import com.example.workflowdispatch.domain.NodeStatus;
import com.example.workflowdispatch.domain.ResultStatusCalculator;
import com.example.workflowdispatch.repository.DispatchRecordRepository;

import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link ResultStore} backed by Spring Data JPA.
 * <p>
 * Every mutation runs in its own transaction inside the per-dispatch lock, so the transaction
 * has committed before the next writer for the same dispatch reads the row. The graph is kept
 * as JSON in {@link DispatchRecord#getGraphJson()}.
 * </p>
 */
@Service
@Slf4j
public class JpaResultStore implements ResultStore {

    private final DispatchRecordRepository repository;
    private final JsonMapper jsonMapper;
    private final DispatchLockRegistry locks;
    private final Clock clock;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;

    public JpaResultStore(
            DispatchRecordRepository repository,
            JsonMapper jsonMapper,
            DispatchLockRegistry locks,
            Clock clock,
            PlatformTransactionManager transactionManager,
            @Value("${dispatch.store.transaction-timeout:10s}") Duration transactionTimeout) {
        this.repository = repository;
        this.jsonMapper = jsonMapper;
        this.locks = locks;
        this.clock = clock;
        int timeoutSeconds = (int) Math.max(1, transactionTimeout.toSeconds());
        this.writeTx = new TransactionTemplate(transactionManager);
        this.writeTx.setTimeout(timeoutSeconds);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
        this.readTx.setTimeout(timeoutSeconds);
    }

    @Override
    public ResultResponse create(UUID dispatchId, String resultsDir, ResultGraphDto graph) {
        return locks.withLock(dispatchId, () -> inTransaction(dispatchId, writeTx, () -> {
            if (repository.existsById(dispatchId)) {
                throw new DispatchAlreadyExistsException(dispatchId);
            }
            List<NodeDto> pending = graph.nodes().stream().map(NodeDto::asPending).toList();
            ResultGraphDto stored = new ResultGraphDto(pending, graph.links());
            DispatchRecord record = new DispatchRecord(dispatchId, resultsDir, writeGraph(stored), pending.size(), clock.instant());
            repository.save(record);
            log.debug("Created result dispatchId={} nodes={} links={}", dispatchId, pending.size(), stored.links().size());
            return toResponse(record, stored);
        }));
    }

    @Override
    public ResultResponse get(UUID dispatchId) {
        return inTransaction(dispatchId, readTx, () -> {
            DispatchRecord record = repository.findById(dispatchId)
                    .orElseThrow(() -> new DispatchNotFoundException(dispatchId));
            return toResponse(record, readGraph(record.getGraphJson()));
        });
    }

    @Override
    public boolean exists(UUID dispatchId) {
        return Boolean.TRUE.equals(inTransaction(dispatchId, readTx, () -> repository.existsById(dispatchId)));
    }

    @Override
    public UpdatedResult updateNode(UUID dispatchId, int nodeId, NodeUpdate update) {
        return locks.withLock(dispatchId, () -> inTransaction(dispatchId, writeTx, () -> {
            DispatchRecord record = repository.findById(dispatchId)
                    .orElseThrow(() -> new DispatchNotFoundException(dispatchId));
            ResultGraphDto graph = readGraph(record.getGraphJson());
            DispatchStatus previousStatus = record.getStatus();

            List<NodeDto> nodes = new ArrayList<>(graph.nodes());
            int index = indexOf(nodes, nodeId);
            if (index < 0) {
                throw new NodeNotFoundException(dispatchId, nodeId);
            }
            Instant now = clock.instant();
            NodeDto updated = apply(nodes.get(index), update, now);
            nodes.set(index, updated);

            ResultGraphDto next = new ResultGraphDto(nodes, graph.links());
            DispatchStatus status = ResultStatusCalculator.compute(next.nodes(), next.links(), record.getError());
            record.applyGraph(writeGraph(next), status, ResultStatusCalculator.countCompleted(next.nodes()), now);
            repository.save(record);
            log.debug("Updated node dispatchId={} nodeId={} nodeStatus={} status {} -> {}",
                    dispatchId, nodeId, updated.status(), previousStatus, status);
            return new UpdatedResult(updated, toResponse(record, next), previousStatus);
        }));
    }

    @Override
    public ResultResponse markFailed(UUID dispatchId, String error) {
        return locks.withLock(dispatchId, () -> inTransaction(dispatchId, writeTx, () -> {
            DispatchRecord record = repository.findById(dispatchId)
                    .orElseThrow(() -> new DispatchNotFoundException(dispatchId));
            record.markFailed(error, clock.instant());
            repository.save(record);
            log.debug("Marked dispatch failed dispatchId={} error={}", dispatchId, error);
            return toResponse(record, readGraph(record.getGraphJson()));
        }));
    }

    @Override
    public List<ResultSummary> list() {
        List<ResultSummary> summaries = inTransaction(null, readTx, () -> repository.findAllByOrderByCreatedAtDesc().stream()
                .map(this::toSummary)
                .toList());
        log.debug("list returned {} results", summaries.size());
        return summaries;
    }

    private NodeDto apply(NodeDto node, NodeUpdate update, Instant now) {
        NodeStatus current = node.status() != null ? node.status() : NodeStatus.PENDING;
        NodeStatus next = update.status() != null ? update.status() : current;
        if (!current.canTransitionTo(next)) {
            throw new InvalidTransitionException(node.id(), current, next);
        }
        Instant startTime = orElse(update.startTime(), node.startTime());
        if (startTime == null && next != NodeStatus.PENDING) {
            startTime = now;
        }
        Instant endTime = orElse(update.endTime(), node.endTime());
        if (endTime == null && next.isTerminal()) {
            endTime = now;
        }
        return new NodeDto(
                node.id(),
                node.name(),
                node.metadata(),
                node.functionString(),
                startTime,
                endTime,
                next,
                orElse(update.output(), node.output()),
                orElse(update.error(), node.error()),
                orElse(update.sublatticeResult(), node.sublatticeResult()),
                orElse(update.stdout(), node.stdout()),
                orElse(update.stderr(), node.stderr())
        );
    }

    private static <T> T orElse(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static int indexOf(List<NodeDto> nodes, int nodeId) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id() == nodeId) {
                return i;
            }
        }
        return -1;
    }

    private <T> T inTransaction(UUID dispatchId, TransactionTemplate template, Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (TransactionTimedOutException | QueryTimeoutException e) {
            throw new StoreTimeoutException(dispatchId, "Store operation timed out for dispatch " + dispatchId, e);
        } catch (OptimisticLockingFailureException e) {
            throw new StoreTimeoutException(dispatchId, "Conflicting concurrent write for dispatch " + dispatchId, e);
        }
    }

    private ResultResponse toResponse(DispatchRecord record, ResultGraphDto graph) {
        return new ResultResponse(
                record.getDispatchId(),
                record.getResultsDir(),
                record.getStatus(),
                record.getError(),
                graph,
                record.getCreatedAt(),
                record.getUpdatedAt()
        );
    }

    private ResultSummary toSummary(DispatchRecord record) {
        return new ResultSummary(
                record.getDispatchId(),
                record.getStatus(),
                record.getResultsDir(),
                record.getNodeCount(),
                record.getCompletedCount(),
                record.getUpdatedAt()
        );
    }

    private String writeGraph(ResultGraphDto graph) {
        try {
            return jsonMapper.writeValueAsString(graph);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize result graph", e);
        }
    }

    private ResultGraphDto readGraph(String graphJson) {
        try {
            return jsonMapper.readValue(graphJson, ResultGraphDto.class);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize result graph", e);
        }
    }
}
