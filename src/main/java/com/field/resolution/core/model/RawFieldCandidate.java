package com.field.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Every OCR token read for one field, in reading order.
 * Field identity is assigned by the extraction step and is stable within a document.
 */
public record RawFieldCandidate(String fieldId, int tableId, List<String> contents) {

    public RawFieldCandidate {
        Objects.requireNonNull(fieldId, "fieldId is required");
        if (fieldId.isBlank()) {
            throw new IllegalArgumentException("fieldId must not be blank");
        }
        contents = contents != null ? List.copyOf(contents) : List.of();
    }

    public static RawFieldCandidate of(String fieldId, int tableId, String... contents) {
        return new RawFieldCandidate(fieldId, tableId, List.of(contents));
    }
}
