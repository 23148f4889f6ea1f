package com.synapse.x.dto;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Absolute deadline carried through the ranking path. Based on {@link System#nanoTime()}.
 */
public final class RequestDeadline {

    private final long deadlineNanos;

    private RequestDeadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static RequestDeadline after(Duration timeout) {
        return new RequestDeadline(System.nanoTime() + timeout.toNanos());
    }

    public long remainingMillis() {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    public boolean isExpired() {
        return System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * The smaller of {@code bound} and the time left until the deadline.
     */
    public long boundedMillis(long bound) {
        return Math.min(bound, remainingMillis());
    }
}
