package com.sanctions.screening.config;

import com.sanctions.screening.core.tier.RerankWeights;
import com.sanctions.screening.core.tier.TierSettings;
import com.sanctions.screening.decision.DecisionWeights;
import com.sanctions.screening.text.NgramVectorizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Binds the {@code screening.*} tuning values into immutable settings beans.
 * Invalid values fail startup instead of the first request.
 */
@Slf4j
@Configuration
public class ScreeningConfig {

    @Value("${screening.request.budget-ms:250}")
    private long requestBudgetMs;

    @Value("${screening.tiers.exact.threshold:0.95}")
    private double exactThreshold;
    @Value("${screening.tiers.exact.timeout-ms:50}")
    private long exactTimeoutMs;

    @Value("${screening.tiers.blocking.enabled:true}")
    private boolean blockingEnabled;
    @Value("${screening.tiers.blocking.limit:300}")
    private int blockingLimit;
    @Value("${screening.tiers.blocking.birth-year-window:1}")
    private int birthYearWindow;
    @Value("${screening.tiers.blocking.escalation-threshold:0.7}")
    private double escalationThreshold;
    @Value("${screening.tiers.blocking.good-enough-threshold:0.9}")
    private double goodEnoughThreshold;
    @Value("${screening.tiers.blocking.timeout-ms:80}")
    private long blockingTimeoutMs;

    @Value("${screening.tiers.vector.enabled:true}")
    private boolean vectorEnabled;
    @Value("${screening.tiers.vector.top-k:25}")
    private int vectorTopK;
    @Value("${screening.tiers.vector.min-score:0.3}")
    private double vectorMinScore;
    @Value("${screening.tiers.vector.timeout-ms:60}")
    private long vectorTimeoutMs;
    @Value("${screening.tiers.vector.grace-ms:15}")
    private long vectorGraceMs;

    @Value("${screening.tiers.max-candidates:50}")
    private int maxCandidates;

    @Value("${screening.rerank.weights.edit-distance:0.35}")
    private double rerankEditDistance;
    @Value("${screening.rerank.weights.phonetic:0.15}")
    private double rerankPhonetic;
    @Value("${screening.rerank.weights.exact-rule:0.30}")
    private double rerankExactRule;
    @Value("${screening.rerank.weights.cosine:0.20}")
    private double rerankCosine;

    @Value("${screening.decision.weights.smartfilter:0.25}")
    private double smartfilterWeight;
    @Value("${screening.decision.weights.person:0.30}")
    private double personWeight;
    @Value("${screening.decision.weights.org:0.15}")
    private double orgWeight;
    @Value("${screening.decision.weights.similarity:0.25}")
    private double similarityWeight;
    @Value("${screening.decision.weights.bonus-dob:0.07}")
    private double bonusDob;
    @Value("${screening.decision.weights.bonus-id:0.15}")
    private double bonusId;
    @Value("${screening.decision.weights.bonus-exact-name:0.10}")
    private double bonusExactName;
    @Value("${screening.decision.thresholds.high:0.85}")
    private double thresholdHigh;
    @Value("${screening.decision.thresholds.medium:0.65}")
    private double thresholdMedium;

    @Value("${screening.vectorizer.char-min:3}")
    private int charMin;
    @Value("${screening.vectorizer.char-max:5}")
    private int charMax;
    @Value("${screening.vectorizer.word-min:1}")
    private int wordMin;
    @Value("${screening.vectorizer.word-max:2}")
    private int wordMax;
    @Value("${screening.vectorizer.char-weight:0.4}")
    private double charWeight;
    @Value("${screening.vectorizer.word-weight:0.3}")
    private double wordWeight;

    @Bean
    public TierSettings tierSettings() {
        TierSettings settings = TierSettings.builder()
                .requestBudget(Duration.ofMillis(requestBudgetMs))
                .exactThreshold(exactThreshold)
                .exactTimeout(Duration.ofMillis(exactTimeoutMs))
                .blockingEnabled(blockingEnabled)
                .blockingLimit(blockingLimit)
                .birthYearWindow(birthYearWindow)
                .escalationThreshold(escalationThreshold)
                .goodEnoughThreshold(goodEnoughThreshold)
                .blockingTimeout(Duration.ofMillis(blockingTimeoutMs))
                .vectorEnabled(vectorEnabled)
                .vectorTopK(vectorTopK)
                .vectorMinScore(vectorMinScore)
                .vectorTimeout(Duration.ofMillis(vectorTimeoutMs))
                .vectorGrace(Duration.ofMillis(vectorGraceMs))
                .maxCandidates(maxCandidates)
                .build();
        settings.validate();
        log.info("Tier settings: {}", settings);
        return settings;
    }

    @Bean
    public RerankWeights rerankWeights() {
        RerankWeights weights = RerankWeights.builder()
                .editDistance(rerankEditDistance)
                .phonetic(rerankPhonetic)
                .exactRule(rerankExactRule)
                .cosine(rerankCosine)
                .build();
        weights.validate();
        return weights;
    }

    @Bean
    public DecisionWeights decisionWeights() {
        DecisionWeights weights = DecisionWeights.builder()
                .smartfilter(smartfilterWeight)
                .person(personWeight)
                .org(orgWeight)
                .similarity(similarityWeight)
                .bonusDobMatch(bonusDob)
                .bonusIdMatch(bonusId)
                .bonusExactName(bonusExactName)
                .thresholdHigh(thresholdHigh)
                .thresholdMedium(thresholdMedium)
                .build();
        weights.validate();
        log.info("Decision weights: {}", weights);
        return weights;
    }

    @Bean
    public NgramVectorizer ngramVectorizer() {
        return new NgramVectorizer(charMin, charMax, wordMin, wordMax, charWeight, wordWeight);
    }
}
