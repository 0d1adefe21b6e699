package com.sanctions.screening.core;

import com.sanctions.screening.domain.ScreeningResult;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class RedisConfigTest {

    private final Jackson2JsonRedisSerializer<ScreeningResult> serializer =
            new RedisConfig().screeningResultRedisSerializer(new Jackson2ObjectMapperBuilder());

    @Test
    void valueIsPlainJsonWithIsoTimestampAndNoTypeHint() {
        String json = new String(serializer.serialize(ScreeningResults.result("req-1")), StandardCharsets.UTF_8);

        assertThat(json).contains("\"screenedAt\":\"2024-01-01T00:00:00Z\"").doesNotContain("@class");
        assertThat(serializer.deserialize(json.getBytes(StandardCharsets.UTF_8)).getRequestId()).isEqualTo("req-1");
    }

    @Test
    void entriesWithUnknownFieldsStillRead() {
        String json = new String(serializer.serialize(ScreeningResults.result("req-2")), StandardCharsets.UTF_8);
        String newer = json.replaceFirst("\\{", "{\"addedLater\":42,");

        ScreeningResult read = serializer.deserialize(newer.getBytes(StandardCharsets.UTF_8));

        assertThat(read.getRequestId()).isEqualTo("req-2");
        assertThat(read.getDecision().getDecisionReasons()).containsExactly("risk_score=0.100", "risk_level=low");
    }
}
