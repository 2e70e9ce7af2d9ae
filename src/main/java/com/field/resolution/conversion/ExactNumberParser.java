package com.field.resolution.conversion;

import com.field.resolution.core.model.LexiconEntry;
import com.field.resolution.lexicon.NumberLexicon;
import com.field.resolution.rules.DefaultNormalizationRules;
import com.field.resolution.rules.NormalizationEngine;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts correctly spelled Spanish number text (0-999) to an integer.
 * Tolerates case, accents and punctuation, but not spelling errors: every word of a
 * compound must be an exact lexicon hit.
 *
 * <pre>
 * "Quinientos cuarenta y cinco" -> 545
 * "veintitrés"                  -> 23
 * "cuatrocientos xyz"           -> null
 * </pre>
 */
public class ExactNumberParser {

    static final String CONNECTIVE = "y";
    public static final int MAX_VALUE = 999;

    private final NumberLexicon lexicon;
    private final NormalizationEngine normalizer;

    public ExactNumberParser() {
        this(NumberLexicon.spanish(), DefaultNormalizationRules.lexicalEngine());
    }

    public ExactNumberParser(NumberLexicon lexicon, NormalizationEngine normalizer) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
    }

    /**
     * Converts the text, or returns {@code null} if any word is unknown or the
     * sum falls outside 0-999.
     */
    public Integer convert(String text) {
        String normalized = normalizer.normalize(text);
        if (normalized.isEmpty()) {
            return null;
        }

        Optional<LexiconEntry> single = lexicon.find(normalized);
        if (single.isPresent()) {
            return single.get().value();
        }

        return parseCompound(words(normalized));
    }

    private Integer parseCompound(List<String> words) {
        if (words.isEmpty()) {
            return null;
        }
        int total = 0;
        for (String word : words) {
            Optional<LexiconEntry> entry = lexicon.find(word);
            if (entry.isEmpty()) {
                return null;
            }
            total += entry.get().value();
        }
        return inRange(total) ? total : null;
    }

    /**
     * Splits normalized text into number words, dropping the "y" connective.
     */
    static List<String> words(String normalized) {
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(normalized.split(" "))
                .filter(word -> !word.isEmpty() && !word.equals(CONNECTIVE))
                .toList();
    }

    static boolean inRange(int value) {
        return value >= 0 && value <= MAX_VALUE;
    }

    public NumberLexicon getLexicon() {
        return lexicon;
    }

    public NormalizationEngine getNormalizer() {
        return normalizer;
    }
}
