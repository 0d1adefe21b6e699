package com.sanctions.screening;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the sanctions screening service. Enables:
 * <ul>
 *   <li>Tiered screening: exact automaton, phonetic blocking, n-gram vector search, rerank</li>
 *   <li>Result cache (Caffeine, or Redis with {@code screening.cache.backend=redis})</li>
 *   <li>Circuit breakers and time limits on index calls (Resilience4j)</li>
 *   <li>Kafka decision events and REST API docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class ScreeningServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScreeningServiceApplication.class, args);
    }
}
