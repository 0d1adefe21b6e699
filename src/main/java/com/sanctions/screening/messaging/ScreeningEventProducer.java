package com.sanctions.screening.messaging;

import com.sanctions.screening.compliance.IdentifierMasker;
import com.sanctions.screening.domain.Decision;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.ScreeningResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Publishes screening decisions to Kafka for audit and downstream case management.
 * Keyed by request key so repeated screenings of the same input land on one partition.
 */
@Slf4j
@Component
public class ScreeningEventProducer {

    static final String EVENT_TYPE_DECIDED = "SCREENING_DECIDED";

    private final KafkaTemplate<String, ScreeningDecisionEvent> kafkaTemplate;
    private final Executor publishExecutor;

    @Value("${screening.kafka.topic.decisions:screening-decisions}")
    private String topic;

    public ScreeningEventProducer(KafkaTemplate<String, ScreeningDecisionEvent> kafkaTemplate,
                                  @Qualifier("eventPublishExecutor") Executor publishExecutor) {
        this.kafkaTemplate = kafkaTemplate;
        this.publishExecutor = publishExecutor;
    }

    /**
     * Builds the event on the caller's thread and hands the send to the publish pool, so a slow or
     * unreachable broker never holds up the screening response. Events are dropped when the pool is full.
     */
    public void publishDecision(String requestKey, NormalizedEntity entity, ScreeningResult result) {
        Decision decision = result.getDecision();
        ScreeningDecisionEvent event = ScreeningDecisionEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .requestId(result.getRequestId())
                .requestKey(requestKey)
                .maskedName(IdentifierMasker.maskName(entity.getTokens()))
                .maskedIdentifiers(IdentifierMasker.maskIdentifiers(entity.identifiersOrEmpty()))
                .riskLevel(decision.getRiskLevel())
                .riskScore(decision.getRiskScore())
                .reviewRequired(decision.isReviewRequired())
                .requiredAdditionalFields(decision.getRequiredAdditionalFields())
                .decisionReasons(decision.getDecisionReasons())
                .decisiveTier(decision.getDecisiveTier())
                .topCandidateId(result.getCandidates().isEmpty() ? null : result.getCandidates().get(0).getId())
                .candidateCount(result.getCandidates().size())
                .tiersExecuted(result.getTiersExecuted())
                .earlyStopped(result.isEarlyStopped())
                .cacheHit(result.isCacheHit())
                .timestamp(Instant.now())
                .eventType(EVENT_TYPE_DECIDED)
                .build();
        String key = requestKey != null ? requestKey : result.getRequestId();
        try {
            publishExecutor.execute(() -> send(key, event));
        } catch (RejectedExecutionException e) {
            log.error("Screening event dropped, publish pool saturated: key={}, eventId={}, requestId={}",
                    key, event.getEventId(), event.getRequestId());
        }
    }

    private void send(String key, ScreeningDecisionEvent event) {
        log.info("Publishing screening event: key={}, eventId={}, requestId={}, riskLevel={}",
                key, event.getEventId(), event.getRequestId(), event.getRiskLevel());
        CompletableFuture<SendResult<String, ScreeningDecisionEvent>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            // the decision has already been made; a lost audit event must not fail the response
            log.error("Failed to hand screening event to producer key={} eventId={}", key, event.getEventId(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish screening event key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published screening event: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
