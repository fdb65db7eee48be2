package com.example.workflowdispatch.store;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per dispatch id, held only while some thread uses it.
 */
@Slf4j
public class DispatchLockRegistry {

    private final Map<UUID, LockHolder> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public DispatchLockRegistry(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Runs {@code action} while holding the lock for {@code dispatchId}.
     *
     * @throws StoreTimeoutException if the lock is not acquired within the configured timeout
     */
    public <T> T withLock(UUID dispatchId, Supplier<T> action) {
        LockHolder holder = locks.compute(dispatchId, (id, existing) -> {
            LockHolder h = existing != null ? existing : new LockHolder();
            h.users++;
            return h;
        });
        try {
            if (!holder.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Lock wait timed out dispatchId={} timeoutMs={}", dispatchId, timeout.toMillis());
                throw new StoreTimeoutException(dispatchId, "Timed out waiting for dispatch " + dispatchId);
            }
            try {
                return action.get();
            } finally {
                holder.lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreTimeoutException(dispatchId, "Interrupted waiting for dispatch " + dispatchId, e);
        } finally {
            locks.computeIfPresent(dispatchId, (id, h) -> --h.users == 0 ? null : h);
        }
    }

    int activeLocks() {
        return locks.size();
    }

    private static final class LockHolder {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by ConcurrentHashMap.compute on the owning key
        private int users;
    }
}
