package com.sanctions.screening.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;

/**
 * Worker pools of the pipeline. Backend calls get a direct hand-off pool so a slow index never
 * queues behind the request budget; shadow runs and decision events get bounded queues and are
 * dropped when full.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Value("${screening.executor.backend-calls.max-threads:64}")
    private int backendCallThreads;

    @Value("${screening.executor.requests.threads:16}")
    private int requestThreads;

    @Value("${screening.executor.requests.queue-capacity:1000}")
    private int requestQueueCapacity;

    @Value("${screening.executor.shadow.threads:2}")
    private int shadowThreads;

    @Value("${screening.executor.shadow.queue-capacity:100}")
    private int shadowQueueCapacity;

    @Value("${screening.executor.events.threads:2}")
    private int eventThreads;

    @Value("${screening.executor.events.queue-capacity:10000}")
    private int eventQueueCapacity;

    @Bean(name = "backendCallExecutorService", destroyMethod = "shutdownNow")
    public ExecutorService backendCallExecutorService() {
        log.info("Backend call pool: maxThreads={}", backendCallThreads);
        return new MdcAwareThreadPoolExecutor("backend-call", 0, backendCallThreads, new SynchronousQueue<>());
    }

    @Bean(name = "screeningExecutorService", destroyMethod = "shutdownNow")
    public ExecutorService screeningExecutorService() {
        log.info("Screening request pool: threads={}, queueCapacity={}", requestThreads, requestQueueCapacity);
        return new MdcAwareThreadPoolExecutor("screening", requestThreads, requestThreads,
                new ArrayBlockingQueue<>(requestQueueCapacity));
    }

    @Bean(name = "shadowExecutor", destroyMethod = "shutdownNow")
    public ExecutorService shadowExecutor() {
        log.info("Shadow pool: threads={}, queueCapacity={}", shadowThreads, shadowQueueCapacity);
        return new MdcAwareThreadPoolExecutor("shadow", shadowThreads, shadowThreads,
                new ArrayBlockingQueue<>(shadowQueueCapacity));
    }

    @Bean(name = "eventPublishExecutor", destroyMethod = "shutdown")
    public ExecutorService eventPublishExecutor() {
        log.info("Event publish pool: threads={}, queueCapacity={}", eventThreads, eventQueueCapacity);
        return new MdcAwareThreadPoolExecutor("event-publish", eventThreads, eventThreads,
                new ArrayBlockingQueue<>(eventQueueCapacity));
    }
}
