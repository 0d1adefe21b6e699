package com.sanctions.screening.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sanctions.screening.domain.ScreeningResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * Redis wiring for the shared result cache. Only active with {@code screening.cache.backend=redis}.
 * Values are plain JSON from the Boot-configured mapper builder, without an {@code @class} hint,
 * so stored entries always read back as {@link ScreeningResult}. Unknown fields are ignored.
 */
@Configuration
@ConditionalOnProperty(name = "screening.cache.backend", havingValue = "redis")
public class RedisConfig {

    @Bean
    public Jackson2JsonRedisSerializer<ScreeningResult> screeningResultRedisSerializer(
            Jackson2ObjectMapperBuilder objectMapperBuilder) {
        ObjectMapper mapper = objectMapperBuilder
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        return new Jackson2JsonRedisSerializer<>(mapper, ScreeningResult.class);
    }

    @Bean
    public RedisTemplate<String, ScreeningResult> screeningResultRedisTemplate(
            RedisConnectionFactory connectionFactory,
            Jackson2JsonRedisSerializer<ScreeningResult> screeningResultRedisSerializer) {
        RedisTemplate<String, ScreeningResult> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(screeningResultRedisSerializer);
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(screeningResultRedisSerializer);
        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public ScreeningCache redisScreeningCache(RedisTemplate<String, ScreeningResult> screeningResultRedisTemplate) {
        return new RedisScreeningCache(screeningResultRedisTemplate);
    }
}
