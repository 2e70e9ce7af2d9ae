package com.field.resolution.core.model;

import java.util.Locale;

/**
 * Three-level confidence reported by the external validator.
 * Labels arrive in Spanish ("alta", "media", "baja").
 */
public enum ConfidenceLabel {
    ALTA("alta", 0.90),
    MEDIA("media", 0.60),
    BAJA("baja", 0.30);

    private final String label;
    private final double score;

    ConfidenceLabel(String label, double score) {
        this.label = label;
        this.score = score;
    }

    public String label() {
        return label;
    }

    /**
     * Numeric confidence used for externally decided results.
     */
    public double score() {
        return score;
    }

    /**
     * Parses a label, treating unknown or missing labels as {@link #BAJA}.
     */
    public static ConfidenceLabel fromLabel(String label) {
        if (label == null) {
            return BAJA;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (ConfidenceLabel candidate : values()) {
            if (candidate.label.equals(normalized)) {
                return candidate;
            }
        }
        return BAJA;
    }
}
