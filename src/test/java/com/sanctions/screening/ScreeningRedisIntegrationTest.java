package com.sanctions.screening;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration test: screening API with the Redis result cache and Kafka decision events.
 * Uses Embedded Kafka and Testcontainers Redis. Requires Docker.
 * Excluded from the default build; run with {@code mvn test -Dtest.excludedGroups= -Dgroups=integration}.
 */
@Tag("integration")
@SpringBootTest(classes = ScreeningServiceApplication.class, properties = "screening.cache.backend=redis")
@AutoConfigureMockMvc
@EmbeddedKafka(partitions = 1, topics = { "screening-decisions" },
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
@Testcontainers
class ScreeningRedisIntegrationTest {

    private static final String PETROV = """
            {
              "tokens": ["ivan", "petrov"],
              "dateOfBirth": "1971-03-14",
              "identifiers": ["INN:1234567890"],
              "smartFilterConfidence": 0.9,
              "personConfidence": 0.95
            }
            """;

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @Autowired
    private MockMvc mockMvc;

    @DynamicPropertySource
    static void redisProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
    }

    @Test
    @DisplayName("Sanctioned person with matching INN is high risk without review")
    void sanctionedPersonIsHighRisk() throws Exception {
        mockMvc.perform(post("/api/v1/screening").contentType(MediaType.APPLICATION_JSON).content(PETROV))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.riskLevel").value("HIGH"))
                .andExpect(jsonPath("$.reviewRequired").value(false))
                .andExpect(jsonPath("$.decisionReasons", hasItem("id_exact_match")));
    }

    @Test
    @DisplayName("Repeated request is served from the Redis cache")
    void repeatedRequestHitsRedis() throws Exception {
        mockMvc.perform(post("/api/v1/screening").contentType(MediaType.APPLICATION_JSON).content(PETROV))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/v1/screening").contentType(MediaType.APPLICATION_JSON).content(PETROV))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cacheHit").value(true));

        mockMvc.perform(get("/api/v1/screening/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cache.backend").value("redis"));
    }
}
