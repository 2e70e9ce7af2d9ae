package com.field.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Canonicalizes OCR text for lexicon matching.
 * Input is lowercased and decomposed (NFD) so that diacritics become separate combining
 * marks, then rules run in priority order, then whitespace is collapsed and trimmed.
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(NormalizationRule::getPriority))
                .toList();
    }

    /**
     * Gets all rules in application order.
     */
    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes the given text. Null or blank input yields an empty string.
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);

        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return result.trim().replaceAll("\\s+", " ");
    }

    /**
     * Checks if two readings are the same after normalization.
     */
    public boolean areEquivalent(String text1, String text2) {
        return normalize(text1).equals(normalize(text2));
    }
}
