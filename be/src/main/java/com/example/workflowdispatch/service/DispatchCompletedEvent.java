package com.example.workflowdispatch.service;

import com.example.workflowdispatch.domain.DispatchStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Application event published when a dispatch reaches COMPLETED or FAILED.
 */
public record DispatchCompletedEvent(UUID dispatchId, DispatchStatus status, Instant completedAt) {}
