package com.field.resolution.core.model;

import java.util.Objects;

/**
 * Coarse signature of a word: its length plus its first and last letters.
 * Used as a secondary lexicon index when a word is too corrupted for edit distance.
 */
public record Fingerprint(int length, char firstChar, char lastChar) {

    public Fingerprint {
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive");
        }
    }

    /**
     * Computes the fingerprint of a non-empty word.
     */
    public static Fingerprint of(String word) {
        Objects.requireNonNull(word, "word is required");
        if (word.isEmpty()) {
            throw new IllegalArgumentException("word must not be empty");
        }
        return new Fingerprint(word.length(), word.charAt(0), word.charAt(word.length() - 1));
    }

    /**
     * Returns the fingerprint with the same boundary letters and a shifted length.
     */
    public Fingerprint withLengthDelta(int delta) {
        return new Fingerprint(length + delta, firstChar, lastChar);
    }
}
