package com.example.workflowdispatch.queue;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * In-process {@link DispatchQueue} with bounded FIFO topics.
 * <p>
 * Publishing enqueues on the caller's thread, so publish order is delivery order within a topic.
 * Consumers {@link #poll} a delivery under a lease of {@code visibilityTimeout} and must
 * {@link #acknowledge} it. A delivery that is {@link #release released}, or whose lease runs out,
 * goes back to the head of its topic and is redelivered with an incremented attempt count.
 * Long-running consumers keep their lease with {@link #extendLease}.
 * </p>
 */
@Slf4j
public class InMemoryDispatchQueue implements DispatchQueue {

    private final Map<String, LinkedBlockingDeque<Pending>> topics = new ConcurrentHashMap<>();
    private final Map<UUID, QueuedDelivery> inFlight = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int capacity;
    private final Duration visibilityTimeout;

    public InMemoryDispatchQueue(Clock clock, int capacity, Duration visibilityTimeout) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (visibilityTimeout.isNegative() || visibilityTimeout.isZero()) {
            throw new IllegalArgumentException("visibilityTimeout must be positive: " + visibilityTimeout);
        }
        this.capacity = capacity;
        this.visibilityTimeout = visibilityTimeout;
    }

    @Override
    public CompletableFuture<Void> publish(String topic, DispatchMessage message) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(message, "message");
        if (!topic(topic).offerLast(new Pending(message, 1))) {
            log.warn("Publish rejected dispatchId={} topic={} capacity={}", message.dispatchId(), topic, capacity);
            return CompletableFuture.failedFuture(
                    new PublishException(message.dispatchId(), "Topic " + topic + " is full (capacity " + capacity + ")"));
        }
        log.debug("Enqueued dispatchId={} topic={} depth={}", message.dispatchId(), topic, depth(topic));
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Takes the oldest message on {@code topic}, waiting up to {@code wait} for one to arrive.
     * Deliveries on the topic whose lease has expired are requeued first.
     */
    public Optional<QueuedDelivery> poll(String topic, Duration wait) throws InterruptedException {
        requeueExpired(topic);
        Pending pending = topic(topic).pollFirst(wait.toMillis(), TimeUnit.MILLISECONDS);
        if (pending == null) {
            return Optional.empty();
        }
        QueuedDelivery delivery = new QueuedDelivery(UUID.randomUUID(), topic, pending.message(), pending.attempt(),
                clock.instant().plus(visibilityTimeout));
        inFlight.put(delivery.deliveryId(), delivery);
        log.debug("Delivered dispatchId={} topic={} attempt={} leaseExpiresAt={}",
                pending.message().dispatchId(), topic, pending.attempt(), delivery.leaseExpiresAt());
        return Optional.of(delivery);
    }

    /**
     * Confirms a delivery was processed. Returns false for unknown, already settled or expired deliveries.
     */
    public boolean acknowledge(UUID deliveryId) {
        QueuedDelivery delivery = inFlight.remove(deliveryId);
        if (delivery == null) {
            return false;
        }
        log.debug("Acknowledged dispatchId={} topic={}", delivery.message().dispatchId(), delivery.topic());
        return true;
    }

    /**
     * Returns an unacknowledged delivery to the head of its topic for redelivery.
     */
    public boolean release(UUID deliveryId) {
        QueuedDelivery delivery = inFlight.get(deliveryId);
        if (delivery == null) {
            return false;
        }
        return requeue(delivery, "released");
    }

    /**
     * Restarts the lease of an in-flight delivery. Returns false if it is no longer in flight.
     */
    public boolean extendLease(UUID deliveryId) {
        Instant leaseExpiresAt = clock.instant().plus(visibilityTimeout);
        QueuedDelivery extended = inFlight.computeIfPresent(deliveryId, (id, delivery) -> delivery.withLease(leaseExpiresAt));
        return extended != null;
    }

    public int depth(String topic) {
        LinkedBlockingDeque<Pending> deque = topics.get(topic);
        return deque != null ? deque.size() : 0;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private void requeueExpired(String topic) {
        Instant now = clock.instant();
        List<QueuedDelivery> expired = inFlight.values().stream()
                .filter(d -> d.topic().equals(topic) && d.isExpired(now))
                .sorted(Comparator.comparing(QueuedDelivery::leaseExpiresAt).reversed())
                .toList();
        // newest first, so the oldest expired delivery ends up at the head
        for (QueuedDelivery delivery : expired) {
            requeue(delivery, "lease expired");
        }
    }

    private boolean requeue(QueuedDelivery delivery, String reason) {
        if (!inFlight.remove(delivery.deliveryId(), delivery)) {
            return false;
        }
        int nextAttempt = delivery.attempt() + 1;
        if (!topic(delivery.topic()).offerFirst(new Pending(delivery.message(), nextAttempt))) {
            inFlight.put(delivery.deliveryId(), delivery);
            log.warn("Cannot requeue dispatchId={} topic={}: topic full", delivery.message().dispatchId(), delivery.topic());
            return false;
        }
        log.info("Requeued dispatchId={} topic={} reason={} nextAttempt={}",
                delivery.message().dispatchId(), delivery.topic(), reason, nextAttempt);
        return true;
    }

    private LinkedBlockingDeque<Pending> topic(String topic) {
        return topics.computeIfAbsent(topic, t -> new LinkedBlockingDeque<>(capacity));
    }

    private record Pending(DispatchMessage message, int attempt) {}
}
