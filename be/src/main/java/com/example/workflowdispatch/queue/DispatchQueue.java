package com.example.workflowdispatch.queue;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous work queue between the dispatch API and the runners.
 * <p>
 * Delivery is at-least-once; messages on one topic are delivered in publish order, with no
 * ordering across topics.
 * </p>
 */
public interface DispatchQueue {

    /**
     * Enqueues {@code message} on {@code topic}. The returned future completes once the message is
     * durably enqueued, or exceptionally with {@link PublishException}.
     */
    CompletableFuture<Void> publish(String topic, DispatchMessage message);
}
