package com.sanctions.screening.core.tier;

import com.sanctions.screening.domain.Candidate;
import com.sanctions.screening.domain.EntityType;
import com.sanctions.screening.domain.MatchedField;
import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.PolicyFlag;
import com.sanctions.screening.domain.PolicyFlags;
import com.sanctions.screening.domain.ScreeningTier;
import com.sanctions.screening.index.BackendUnavailableException;
import com.sanctions.screening.index.BlockingHit;
import com.sanctions.screening.index.BlockingKeys;
import com.sanctions.screening.index.WatchlistBackend;
import com.sanctions.screening.text.PhoneticEncoder;
import com.sanctions.screening.text.TextCanonicalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Tier1: cheap, recall-oriented candidate generation from coarse keys
 * (surname phonetic code, first initial, birth-year window). Confidence is the share of keys
 * a record matched, never text similarity.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlockingTier implements Tier {

    private final WatchlistBackend backend;
    private final BackendCallExecutor callExecutor;
    private final TierSettings settings;

    @Override
    public ScreeningTier tier() {
        return ScreeningTier.BLOCKING;
    }

    @Override
    public TierResult run(TierRequest request) {
        long start = System.currentTimeMillis();
        NormalizedEntity entity = request.getEntity();
        BlockingKeys keys = buildKeys(entity);
        if (keys == null) {
            log.debug("Tier1 no usable surname in tokens={}", entity.getTokens());
            return TierResult.builder()
                    .tier(tier())
                    .elapsedMs(System.currentTimeMillis() - start)
                    .escalate(true)
                    .build();
        }

        List<BlockingHit> hits;
        try {
            hits = callExecutor.call("blockingSearch",
                    request.getBudget().timeoutFor(settings.getBlockingTimeout()),
                    request.getScope(),
                    () -> backend.blockingSearch(keys, settings.getBlockingLimit()));
        } catch (BackendUnavailableException e) {
            log.warn("Tier1 blocking search unavailable: {}", e.getMessage());
            return TierResult.failed(tier(), System.currentTimeMillis() - start, e.getMessage());
        }

        int keyCount = keys.keyCount();
        List<Candidate> candidates = new ArrayList<>(Math.min(hits.size(), settings.getBlockingLimit()));
        for (BlockingHit hit : hits) {
            if (candidates.size() >= settings.getBlockingLimit()) {
                break;
            }
            int matched = 1 + (hit.isInitialMatched() ? 1 : 0) + (hit.isBirthYearMatched() ? 1 : 0);
            double confidence = (double) matched / keyCount;
            candidates.add(CandidateMapper.toCandidate(hit.getRecord(), tier(), confidence,
                    EnumSet.of(MatchedField.NAME)));
        }

        double best = candidates.stream().mapToDouble(Candidate::getRawScore).max().orElse(0.0);
        boolean escalate = candidates.isEmpty() || best < settings.getEscalationThreshold();
        long elapsed = System.currentTimeMillis() - start;
        log.debug("Tier1 keys={} candidates={} best={} escalate={} in {}ms",
                keys, candidates.size(), best, escalate, elapsed);
        return TierResult.builder()
                .tier(tier())
                .candidates(candidates)
                .elapsedMs(elapsed)
                .escalate(escalate)
                .build();
    }

    /**
     * @return the keys, or null when no surname phonetic code can be derived
     */
    BlockingKeys buildKeys(NormalizedEntity entity) {
        PolicyFlags flags = entity.flags();
        List<String> tokens = flags.has(PolicyFlag.STRICT_STOPWORDS)
                ? TextCanonicalizer.withoutStopwords(entity.getTokens())
                : entity.getTokens();
        if (tokens.isEmpty()) {
            return null;
        }

        boolean person = entity.typeOrDefault() == EntityType.PERSON;
        String surname = person ? tokens.get(tokens.size() - 1) : longest(tokens);
        boolean transliterate = !(flags.has(PolicyFlag.ASCII_FASTPATH) && TextCanonicalizer.isAscii(surname));
        String code = PhoneticEncoder.encode(TextCanonicalizer.canonicalToken(surname), transliterate);
        if (code.isEmpty()) {
            return null;
        }

        BlockingKeys.BlockingKeysBuilder builder = BlockingKeys.builder().surnameCode(code);
        if (person && tokens.size() >= 2) {
            builder.firstInitial(TextCanonicalizer.initial(tokens.get(0)));
        }
        if (entity.getDateOfBirth() != null) {
            int year = entity.getDateOfBirth().getYear();
            builder.birthYearFrom(year - settings.getBirthYearWindow())
                    .birthYearTo(year + settings.getBirthYearWindow());
        }
        return builder.build();
    }

    private static String longest(List<String> tokens) {
        String best = tokens.get(0);
        for (String t : tokens) {
            if (t.length() > best.length()) {
                best = t;
            }
        }
        return best;
    }
}
