package com.sanctions.screening.core;

import com.sanctions.screening.domain.NormalizedEntity;
import com.sanctions.screening.domain.UpstreamSignals;
import com.sanctions.screening.text.TextCanonicalizer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Cache key = SHA-256 of the entity's canonical form plus its sorted policy flags.
 * Token and identifier lists are length-prefixed, so ["ivan petrov"] and ["ivan", "petrov"] differ.
 * Two entities that screen identically always get the same key.
 */
@Component
public class ScreeningCacheKeyFactory {

    public String keyFor(NormalizedEntity entity) {
        return sha256(canonicalForm(entity));
    }

    String canonicalForm(NormalizedEntity entity) {
        List<String> tokens = entity.getTokens().stream()
                .map(TextCanonicalizer::canonicalToken)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toList());
        List<String> ids = entity.identifiersOrEmpty().stream()
                .map(TextCanonicalizer::canonicalIdentifier)
                .sorted()
                .collect(Collectors.toList());
        UpstreamSignals s = entity.signalsOrDefault();
        return "tokens=" + lengthPrefixed(tokens)
                + "|lang=" + lengthPrefixed(entity.getLanguage() == null
                        ? List.of() : List.of(entity.getLanguage().toLowerCase(Locale.ROOT)))
                + "|dob=" + (entity.getDateOfBirth() == null ? "" : entity.getDateOfBirth())
                + "|ids=" + lengthPrefixed(ids)
                + "|type=" + entity.typeOrDefault()
                + "|signals=" + String.format(Locale.ROOT, "%b,%.6f,%.6f,%.6f", s.isShouldProcess(),
                        s.getSmartFilterConfidence(), s.getPersonConfidence(), s.getOrgConfidence())
                + "|flags=" + entity.flags().canonical();
    }

    /** {@code <length>:<value>} per element, so no separator inside a value can merge or split elements. */
    static String lengthPrefixed(List<String> values) {
        StringBuilder sb = new StringBuilder();
        for (String value : values) {
            sb.append(value.length()).append(':').append(value);
        }
        return sb.toString();
    }

    private static String sha256(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
