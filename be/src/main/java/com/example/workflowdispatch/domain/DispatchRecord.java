package com.example.workflowdispatch.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for the result state of one dispatch.
 * <p>
 * The node/edge graph is stored as JSON in {@code graph_json}; status and node counters are kept
 * in their own columns so that listing does not have to parse every graph.
 * </p>
 */
@Entity
@Table(name = "dispatch_result")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DispatchRecord {

    @Id
    @Column(name = "dispatch_id")
    private UUID dispatchId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private DispatchStatus status;

    @Column(name = "results_dir", nullable = false, length = 1024)
    private String resultsDir;

    @Column(name = "graph_json", nullable = false, columnDefinition = "CLOB")
    private String graphJson;

    @Column(length = 2000)
    private String error;

    @Column(name = "node_count", nullable = false)
    private int nodeCount;

    @Column(name = "completed_count", nullable = false)
    private int completedCount;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public DispatchRecord(UUID dispatchId, String resultsDir, String graphJson, int nodeCount, Instant createdAt) {
        this.dispatchId = Objects.requireNonNull(dispatchId, "dispatchId");
        this.resultsDir = Objects.requireNonNull(resultsDir, "resultsDir");
        this.graphJson = Objects.requireNonNull(graphJson, "graphJson");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
        this.nodeCount = nodeCount;
        this.completedCount = 0;
        this.status = DispatchStatus.PENDING;
    }

    /**
     * Replaces the stored graph with its updated form and the status recomputed from it.
     */
    public void applyGraph(String graphJson, DispatchStatus status, int completedCount, Instant now) {
        this.graphJson = Objects.requireNonNull(graphJson, "graphJson");
        this.status = Objects.requireNonNull(status, "status");
        this.completedCount = completedCount;
        this.updatedAt = Objects.requireNonNull(now, "now");
    }

    /**
     * Records a dispatch-level failure (e.g. the work could not be enqueued).
     */
    public void markFailed(String error, Instant now) {
        this.error = Objects.requireNonNull(error, "error");
        this.status = DispatchStatus.FAILED;
        this.updatedAt = Objects.requireNonNull(now, "now");
    }
}
