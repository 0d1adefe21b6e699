package com.sanctions.screening.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sanctions.screening.messaging.ScreeningDecisionEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for screening decision events. JSON values so compliance tooling outside the JVM
 * can consume them.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    /** Upper bound on how long a send may block a publish thread when the broker is unreachable. */
    @Value("${screening.kafka.max-block-ms:500}")
    private int maxBlockMs;

    @Bean(name = "screeningEventObjectMapper")
    public ObjectMapper screeningEventObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ProducerFactory<String, ScreeningDecisionEvent> screeningEventProducerFactory(
            @Qualifier("screeningEventObjectMapper") ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);

        Serializer<ScreeningDecisionEvent> serializer = (topic, data) -> {
            if (data == null) {
                return null;
            }
            try {
                byte[] bytes = objectMapper.writeValueAsBytes(data);
                // body carries masked identifiers only, still not logged
                log.debug("Serialized ScreeningDecisionEvent (topic={}, length={}, eventId={})",
                        topic, bytes.length, data.getEventId());
                return bytes;
            } catch (Exception e) {
                log.error("Serialization failed for topic={}", topic, e);
                throw new SerializationException("Failed to serialize ScreeningDecisionEvent", e);
            }
        };
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, ScreeningDecisionEvent> screeningEventKafkaTemplate(
            ProducerFactory<String, ScreeningDecisionEvent> screeningEventProducerFactory) {
        return new KafkaTemplate<>(screeningEventProducerFactory);
    }
}
