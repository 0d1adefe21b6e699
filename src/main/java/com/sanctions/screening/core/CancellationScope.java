package com.sanctions.screening.core;

import com.sanctions.screening.api.ScreeningCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * One per request. Tracks started backend calls so that cancelling the request aborts all of them.
 */
@Slf4j
public final class CancellationScope {

    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    public void register(Future<?> future) {
        inFlight.add(future);
        if (cancelled) {
            future.cancel(true);
        }
    }

    public void unregister(Future<?> future) {
        inFlight.remove(future);
    }

    public void cancel() {
        cancelled = true;
        int aborted = 0;
        for (Future<?> future : inFlight) {
            if (future.cancel(true)) {
                aborted++;
            }
        }
        inFlight.clear();
        log.debug("Cancellation scope closed: abortedCalls={}", aborted);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new ScreeningCancelledException("Screening cancelled by caller");
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}
