package com.example.workflowdispatch.service;

import com.example.workflowdispatch.domain.DispatchStatus;

import lombok.extern.slf4j.Slf4j;

import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Publishes {@link DispatchCompletedEvent} to Spring listeners on a separate executor.
 */
@Slf4j
public class EventPublishingCompletionNotifier implements CompletionNotifier {

    private final ApplicationEventPublisher publisher;
    private final Executor executor;
    private final Clock clock;

    public EventPublishingCompletionNotifier(ApplicationEventPublisher publisher, Executor executor, Clock clock) {
        this.publisher = publisher;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public void dispatchCompleted(UUID dispatchId, DispatchStatus status) {
        DispatchCompletedEvent event = new DispatchCompletedEvent(dispatchId, status, clock.instant());
        try {
            executor.execute(() -> {
                try {
                    publisher.publishEvent(event);
                    log.info("Completion notified dispatchId={} status={}", dispatchId, status);
                } catch (RuntimeException e) {
                    log.error("Completion listener failed dispatchId={} status={}", dispatchId, status, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Completion notification rejected dispatchId={} status={}", dispatchId, status, e);
        }
    }
}
