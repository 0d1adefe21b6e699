package com.sanctions.screening.core.tier;

import com.sanctions.screening.api.ScreeningCancelledException;
import com.sanctions.screening.core.CancellationScope;
import com.sanctions.screening.index.BackendUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendCallExecutorTest {

    private ExecutorService pool;
    private CircuitBreakerRegistry registry;
    private BackendCallExecutor executor;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        registry = CircuitBreakerRegistry.ofDefaults();
        executor = new BackendCallExecutor(pool, registry);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void returnsValueAndReleasesScope() {
        CancellationScope scope = new CancellationScope();

        String value = executor.call("exactLookup", Duration.ofSeconds(1), scope, () -> "ok");

        assertThat(value).isEqualTo("ok");
        assertThat(scope.inFlightCount()).isZero();
    }

    @Test
    void slowCallTimesOutAsBackendUnavailable() {
        AtomicBoolean interrupted = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);

        assertThatThrownBy(() -> executor.call("vectorSearch", Duration.ofMillis(50), new CancellationScope(), () -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
            } finally {
                finished.countDown();
            }
            return "late";
        }))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("timed out");
        assertThat(awaitQuietly(finished)).isTrue();
        assertThat(interrupted).isTrue();
    }

    @Test
    void failureInsideCallIsWrapped() {
        assertThatThrownBy(() -> executor.call("blockingSearch", Duration.ofSeconds(1), null, () -> {
            throw new IllegalStateException("connection refused");
        }))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("connection refused")
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void spentBudgetFailsWithoutCalling() {
        AtomicBoolean called = new AtomicBoolean();

        assertThatThrownBy(() -> executor.call("blockingSearch", Duration.ZERO, null, () -> {
            called.set(true);
            return "x";
        })).isInstanceOf(BackendUnavailableException.class);
        assertThat(called).isFalse();
    }

    @Test
    void openCircuitRejectsCall() {
        registry.circuitBreaker("exactLookup").transitionToForcedOpenState();

        assertThatThrownBy(() -> executor.call("exactLookup", Duration.ofSeconds(1), null, () -> "x"))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("circuit open");
    }

    @Test
    void cancelledScopeRejectsNewCalls() {
        CancellationScope scope = new CancellationScope();
        scope.cancel();

        assertThatThrownBy(() -> executor.call("exactLookup", Duration.ofSeconds(1), scope, () -> "x"))
                .isInstanceOf(ScreeningCancelledException.class);
    }

    @Test
    void cancellingScopeAbortsRunningCall() throws Exception {
        CancellationScope scope = new CancellationScope();
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<String> caller = CompletableFuture.supplyAsync(() ->
                executor.call("vectorSearch", Duration.ofSeconds(10), scope, () -> {
                    started.countDown();
                    Thread.sleep(10_000);
                    return "never";
                }), pool);

        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        scope.cancel();

        assertThatThrownBy(() -> caller.get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ScreeningCancelledException.class);
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
