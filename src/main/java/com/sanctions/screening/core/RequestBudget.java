package com.sanctions.screening.core;

import java.time.Duration;

/**
 * Global latency budget of one request. Every backend timeout is derived from what is left of it.
 */
public final class RequestBudget {

    private final long startNanos;
    private final long deadlineNanos;

    private RequestBudget(long startNanos, Duration budget) {
        this.startNanos = startNanos;
        this.deadlineNanos = startNanos + budget.toNanos();
    }

    public static RequestBudget start(Duration budget) {
        return new RequestBudget(System.nanoTime(), budget);
    }

    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean exhausted() {
        return System.nanoTime() >= deadlineNanos;
    }

    public long elapsedMs() {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    /** The smaller of the tier's own timeout and the remaining budget; zero once the budget is spent. */
    public Duration timeoutFor(Duration tierTimeout) {
        Duration left = remaining();
        return tierTimeout.compareTo(left) <= 0 ? tierTimeout : left;
    }
}
