package com.sanctions.screening.messaging;

import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.Decision;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.RequiredField;
import com.sanctions.screening.domain.RiskLevel;
import com.sanctions.screening.domain.ScreeningResult;
import com.sanctions.screening.domain.ScreeningTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScreeningEventProducerTest {

    @Mock
    private KafkaTemplate<String, ScreeningDecisionEvent> kafkaTemplate;

    private ScreeningEventProducer producer;

    private final NormalizedEntity entity = NormalizedEntity.builder()
            .tokens(List.of("ivan", "petrov"))
            .identifiers(List.of("INN:1234567890"))
            .build();

    private final ScreeningResult result = ScreeningResult.builder()
            .requestId("req-1")
            .candidates(List.of(Candidate.builder().id("SDN-1001").build()))
            .decision(Decision.builder()
                    .riskLevel(RiskLevel.HIGH)
                    .riskScore(0.88)
                    .reviewRequired(true)
                    .requiredAdditionalFields(List.of(RequiredField.DOB))
                    .decisionReasons(List.of("additional_evidence_required", "risk_score=0.880", "risk_level=high"))
                    .decisiveTier(ScreeningTier.BLOCKING)
                    .build())
            .tiersExecuted(List.of(ScreeningTier.EXACT, ScreeningTier.BLOCKING, ScreeningTier.RERANK))
            .screenedAt(Instant.now())
            .build();

    @BeforeEach
    void setUp() {
        producer = new ScreeningEventProducer(kafkaTemplate, Runnable::run);
        ReflectionTestUtils.setField(producer, "topic", "screening-decisions");
    }

    @Test
    void publishesMaskedDecisionKeyedByRequestKey() {
        CompletableFuture<SendResult<String, ScreeningDecisionEvent>> sent = new CompletableFuture<>();
        when(kafkaTemplate.send(anyString(), anyString(), any(ScreeningDecisionEvent.class))).thenReturn(sent);

        producer.publishDecision("key-1", entity, result);

        ArgumentCaptor<ScreeningDecisionEvent> event = ArgumentCaptor.forClass(ScreeningDecisionEvent.class);
        verify(kafkaTemplate).send(eq("screening-decisions"), eq("key-1"), event.capture());
        ScreeningDecisionEvent published = event.getValue();
        assertThat(published.getEventType()).isEqualTo("SCREENING_DECIDED");
        assertThat(published.getMaskedName()).isEqualTo("i*** p*****");
        assertThat(published.getMaskedIdentifiers()).containsExactly("INN:********90");
        assertThat(published.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(published.isReviewRequired()).isTrue();
        assertThat(published.getRequiredAdditionalFields()).containsExactly(RequiredField.DOB);
        assertThat(published.getTopCandidateId()).isEqualTo("SDN-1001");
        assertThat(published.getCandidateCount()).isEqualTo(1);
    }

    @Test
    void fallsBackToRequestIdWhenKeyMissing() {
        when(kafkaTemplate.send(anyString(), anyString(), any(ScreeningDecisionEvent.class)))
                .thenReturn(new CompletableFuture<>());

        producer.publishDecision(null, entity, result);

        verify(kafkaTemplate).send(eq("screening-decisions"), eq("req-1"), any(ScreeningDecisionEvent.class));
    }

    @Test
    void brokerFailureDoesNotPropagate() {
        when(kafkaTemplate.send(anyString(), anyString(), any(ScreeningDecisionEvent.class)))
                .thenThrow(new KafkaException("metadata timeout"));

        assertThatCode(() -> producer.publishDecision("key-1", entity, result)).doesNotThrowAnyException();
    }

    @Test
    void sendRunsOnPublishPoolNotOnCallerThread() {
        List<Runnable> queued = new ArrayList<>();
        ScreeningEventProducer deferred = new ScreeningEventProducer(kafkaTemplate, queued::add);
        ReflectionTestUtils.setField(deferred, "topic", "screening-decisions");
        when(kafkaTemplate.send(anyString(), anyString(), any(ScreeningDecisionEvent.class)))
                .thenReturn(new CompletableFuture<>());

        deferred.publishDecision("key-1", entity, result);

        verifyNoInteractions(kafkaTemplate);
        assertThat(queued).hasSize(1);
        queued.get(0).run();
        verify(kafkaTemplate).send(eq("screening-decisions"), eq("key-1"), any(ScreeningDecisionEvent.class));
    }

    @Test
    void saturatedPublishPoolDropsEventWithoutFailingCaller() {
        ScreeningEventProducer saturated = new ScreeningEventProducer(kafkaTemplate, task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertThatCode(() -> saturated.publishDecision("key-1", entity, result)).doesNotThrowAnyException();
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    void failedSendIsOnlyLogged() {
        when(kafkaTemplate.send(anyString(), anyString(), any(ScreeningDecisionEvent.class)))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker down")));

        assertThatCode(() -> producer.publishDecision("key-1", entity, result)).doesNotThrowAnyException();
    }
}
