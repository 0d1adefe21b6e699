package com.sanctions.screening.core.tier;

import com.sanctions.screening.api.ScreeningCancelledException;
import com.sanctions.screening.core.CancellationScope;
import com.sanctions.screening.index.BackendUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs index calls off the request thread with a hard time limit and a per-operation circuit breaker.
 * Every started call is registered with the request's {@link CancellationScope}.
 * All failures except cancellation surface as {@link BackendUnavailableException}.
 */
@Slf4j
@Component
public class BackendCallExecutor {

    private final ExecutorService executor;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public BackendCallExecutor(@Qualifier("backendCallExecutorService") ExecutorService executor,
                               CircuitBreakerRegistry circuitBreakerRegistry) {
        this.executor = executor;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    public <T> T call(String operation, Duration timeout, CancellationScope scope, Callable<T> call) {
        if (scope != null) {
            scope.throwIfCancelled();
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new BackendUnavailableException(operation + ": latency budget exhausted");
        }

        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(operation);
        TimeLimiter limiter = TimeLimiter.of(operation, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());

        AtomicReference<Future<T>> started = new AtomicReference<>();
        try {
            return cb.executeCallable(() -> limiter.executeFutureSupplier(() -> {
                Future<T> future = executor.submit(call);
                started.set(future);
                if (scope != null) {
                    scope.register(future);
                }
                return future;
            }));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open for backend operation={}", operation);
            throw new BackendUnavailableException(operation + ": circuit open", e);
        } catch (TimeoutException e) {
            log.warn("Backend operation={} timed out after {}ms", operation, timeout.toMillis());
            throw new BackendUnavailableException(operation + ": timed out after " + timeout.toMillis() + "ms", e);
        } catch (CancellationException e) {
            if (scope != null && scope.isCancelled()) {
                throw new ScreeningCancelledException("Screening cancelled during " + operation, e);
            }
            throw new BackendUnavailableException(operation + ": call cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScreeningCancelledException("Interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            throw unwrap(operation, e.getCause() != null ? e.getCause() : e);
        } catch (BackendUnavailableException | ScreeningCancelledException e) {
            throw e;
        } catch (Exception e) {
            throw unwrap(operation, e);
        } finally {
            if (scope != null && started.get() != null) {
                scope.unregister(started.get());
            }
        }
    }

    private RuntimeException unwrap(String operation, Throwable cause) {
        if (cause instanceof BackendUnavailableException) {
            return (BackendUnavailableException) cause;
        }
        log.warn("Backend operation={} failed: {}", operation, cause.toString());
        return new BackendUnavailableException(operation + ": " + cause.getMessage(), cause);
    }
}
