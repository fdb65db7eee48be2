package com.example.workflowdispatch.queue;

import java.time.Instant;
import java.util.UUID;

/**
 * A message taken from a topic but not yet acknowledged by its consumer. Unless acknowledged,
 * released or extended, it becomes visible again once {@code leaseExpiresAt} has passed.
 */
public record QueuedDelivery(UUID deliveryId, String topic, DispatchMessage message, int attempt, Instant leaseExpiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(leaseExpiresAt);
    }

    QueuedDelivery withLease(Instant leaseExpiresAt) {
        return new QueuedDelivery(deliveryId, topic, message, attempt, leaseExpiresAt);
    }
}
