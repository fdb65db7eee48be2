package com.example.workflowdispatch.config;

import com.example.workflowdispatch.queue.InMemoryDispatchQueue;
import com.example.workflowdispatch.service.CompletionNotifier;
import com.example.workflowdispatch.service.EventPublishingCompletionNotifier;
import com.example.workflowdispatch.store.DispatchLockRegistry;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Wires the dispatch queue, per-dispatch locks and the completion notifier with its executor.
 */
@Configuration
public class DispatchConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Supplier<UUID> dispatchIdGenerator() {
        return UUID::randomUUID;
    }

    @Bean
    public DispatchLockRegistry dispatchLockRegistry(@Value("${dispatch.store.lock-timeout:5s}") Duration lockTimeout) {
        return new DispatchLockRegistry(lockTimeout);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService completionNotifierExecutor() {
        return Executors.newSingleThreadExecutor(namedThreads("dispatch-notify-"));
    }

    @Bean
    public InMemoryDispatchQueue dispatchQueue(
            Clock clock,
            @Value("${dispatch.queue.capacity:1000}") int capacity,
            @Value("${dispatch.queue.visibility-timeout:5m}") Duration visibilityTimeout) {
        return new InMemoryDispatchQueue(clock, capacity, visibilityTimeout);
    }

    @Bean
    public CompletionNotifier completionNotifier(
            ApplicationEventPublisher publisher,
            @Qualifier("completionNotifierExecutor") ExecutorService executor,
            Clock clock) {
        return new EventPublishingCompletionNotifier(publisher, executor, clock);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
