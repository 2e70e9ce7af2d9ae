package com.field.resolution.core.model;

import java.util.Objects;

/**
 * Final or provisional decision for one field.
 * Produced once per {@link RawFieldCandidate} after the external answers are merged.
 */
public record ResolutionResult(
        String fieldId,
        int tableId,
        Integer value,
        double confidence,
        ResolutionMethod method,
        String rationale,
        ResolutionOrigin origin
) {
    public ResolutionResult {
        Objects.requireNonNull(fieldId, "fieldId is required");
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(origin, "origin is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (method == ResolutionMethod.EXTERNAL && origin != ResolutionOrigin.EXTERNAL) {
            throw new IllegalArgumentException("External method requires external origin");
        }
        rationale = rationale != null ? rationale : "";
    }

    /**
     * Creates a local decision.
     */
    public static ResolutionResult local(String fieldId, int tableId, Integer value, double confidence,
                                         ResolutionMethod method, String rationale) {
        return new ResolutionResult(fieldId, tableId, value, confidence, method, rationale,
                ResolutionOrigin.LOCAL);
    }

    /**
     * Creates a placeholder for a field nobody could decide.
     */
    public static ResolutionResult unresolved(String fieldId, int tableId, String rationale) {
        return local(fieldId, tableId, null, 0.0, ResolutionMethod.UNRESOLVED, rationale);
    }

    /**
     * Creates a result decided by the external validator.
     */
    public static ResolutionResult external(String fieldId, int tableId, Integer value,
                                            ConfidenceLabel label, String rationale) {
        return new ResolutionResult(fieldId, tableId, value, label.score(), ResolutionMethod.EXTERNAL,
                rationale, ResolutionOrigin.EXTERNAL);
    }

    /**
     * Returns a copy attached to the given field, keeping the decision.
     */
    public ResolutionResult forField(String fieldId, int tableId) {
        return new ResolutionResult(fieldId, tableId, value, confidence, method, rationale, origin);
    }

    public boolean hasValue() {
        return value != null;
    }
}
