package com.synapse.x.config.factory;

import lombok.Getter;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * One permit of a bounded fan-out. Releasing is idempotent, so the guard can be closed both by
 * the task that used the permit and by the code that gave up waiting for it.
 */
@Getter
public class SemaphoreGuard implements AutoCloseable {
    private final Semaphore semaphore;
    private final String semaphoreName;
    private volatile boolean acquired;

    private SemaphoreGuard(Semaphore semaphore, String semaphoreName) {
        this.semaphore = semaphore;
        this.semaphoreName = semaphoreName;
    }

    /**
     * @return a guard holding one permit, or empty guard ({@link #isAcquired()} false) when no
     *         permit became available in time
     */
    public static SemaphoreGuard tryAcquire(Semaphore semaphore, String semaphoreName, long timeoutMs)
            throws InterruptedException {
        SemaphoreGuard guard = new SemaphoreGuard(semaphore, semaphoreName);
        guard.acquired = timeoutMs > 0 && semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
        return guard;
    }

    @Override
    public synchronized void close() {
        if (acquired) {
            semaphore.release();
            acquired = false;
        }
    }
}
