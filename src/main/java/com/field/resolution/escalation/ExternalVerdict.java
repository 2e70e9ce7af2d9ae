package com.field.resolution.escalation;

import com.field.resolution.core.model.ConfidenceLabel;

import java.util.Objects;

/**
 * The external validator's answer for one field.
 */
public record ExternalVerdict(
        String fieldId,
        int tableId,
        Integer value,
        ConfidenceLabel confidence,
        String rationale
) {
    public ExternalVerdict {
        Objects.requireNonNull(fieldId, "fieldId is required");
        confidence = confidence != null ? confidence : ConfidenceLabel.BAJA;
        rationale = rationale != null ? rationale : "";
    }
}
