package com.field.resolution.core.model;

/**
 * Value recovered from possibly corrupted text, with the confidence of the recovery.
 * A {@code null} value always carries confidence 0.0.
 */
public record FuzzyMatch(Integer value, double confidence) {

    private static final FuzzyMatch NONE = new FuzzyMatch(null, 0.0);

    public FuzzyMatch {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (value == null && confidence != 0.0) {
            throw new IllegalArgumentException("A missing value cannot carry confidence");
        }
    }

    public static FuzzyMatch none() {
        return NONE;
    }

    public static FuzzyMatch of(int value, double confidence) {
        return new FuzzyMatch(value, confidence);
    }

    public boolean isPresent() {
        return value != null;
    }
}
