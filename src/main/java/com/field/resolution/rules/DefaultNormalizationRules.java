package com.field.resolution.rules;

import java.util.List;

/**
 * Built-in rules that reduce a reading to lowercase latin letters and single spaces.
 */
public final class DefaultNormalizationRules {

    private static final NormalizationEngine LEXICAL_ENGINE = new NormalizationEngine(getLexicalRules());

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Returns the shared engine used for lexicon matching.
     */
    public static NormalizationEngine lexicalEngine() {
        return LEXICAL_ENGINE;
    }

    /**
     * Rules applied to decomposed, lowercased text.
     */
    public static List<NormalizationRule> getLexicalRules() {
        return List.of(
                // Unicode spaces (NBSP, thin space) become plain spaces so words stay apart
                NormalizationRule.builder()
                        .name("unicode-spaces")
                        .pattern("[\\p{Z}\\t\\r\\n]+")
                        .replacement(" ")
                        .priority(10)
                        .build(),

                // Combining marks left behind by NFD: "tres" + U+0301 -> "tres"
                NormalizationRule.builder()
                        .name("combining-marks")
                        .pattern("\\p{M}+")
                        .replacement("")
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("letters-only")
                        .pattern("[^a-z ]")
                        .replacement("")
                        .priority(100)
                        .build()
        );
    }
}
