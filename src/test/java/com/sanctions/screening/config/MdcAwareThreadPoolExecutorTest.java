package com.sanctions.screening.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcAwareThreadPoolExecutorTest {

    private final MdcAwareThreadPoolExecutor executor =
            new MdcAwareThreadPoolExecutor("test-pool", 1, 1, new LinkedBlockingQueue<>());

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        MDC.clear();
    }

    @Test
    void workerSeesSubmittersRequestId() throws Exception {
        MDC.put("requestId", "req-42");

        String seen = executor.submit(() -> MDC.get("requestId")).get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo("req-42");
    }

    @Test
    void workerMdcIsClearedBetweenTasks() throws Exception {
        MDC.put("requestId", "req-1");
        executor.submit(() -> MDC.get("requestId")).get(5, TimeUnit.SECONDS);
        MDC.clear();

        String seen = executor.submit(() -> MDC.get("requestId")).get(5, TimeUnit.SECONDS);

        assertThat(seen).isNull();
    }

    @Test
    void threadsAreNamedDaemons() throws Exception {
        Thread worker = executor.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

        assertThat(worker.getName()).startsWith("test-pool-");
        assertThat(worker.isDaemon()).isTrue();
    }
}
