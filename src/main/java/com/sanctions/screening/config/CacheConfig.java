package com.sanctions.screening.config;

import com.sanctions.screening.core.CaffeineScreeningCache;
import com.sanctions.screening.core.ScreeningCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * In-process result cache, the default. {@code screening.cache.backend=redis} switches to
 * {@link com.sanctions.screening.core.RedisConfig} instead.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "screening.cache.backend", havingValue = "caffeine", matchIfMissing = true)
public class CacheConfig {

    @Bean
    public ScreeningCache caffeineScreeningCache(@Value("${screening.cache.max-size:10000}") long maxSize,
                                                 @Value("${screening.cache.ttl:10m}") Duration ttl) {
        log.info("Screening cache: backend=caffeine, maxSize={}, ttl={}", maxSize, ttl);
        return new CaffeineScreeningCache(maxSize, ttl);
    }
}
