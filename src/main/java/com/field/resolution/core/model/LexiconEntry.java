package com.field.resolution.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single Spanish number word and its value.
 * Words are stored lowercase, without accents and alphabetic only.
 */
public record LexiconEntry(String word, int value, Fingerprint fingerprint) {

    private static final Pattern LEXICAL_WORD = Pattern.compile("[a-z]+");

    public LexiconEntry {
        Objects.requireNonNull(word, "word is required");
        Objects.requireNonNull(fingerprint, "fingerprint is required");
        if (!LEXICAL_WORD.matcher(word).matches()) {
            throw new IllegalArgumentException("Lexicon word must be lowercase a-z: " + word);
        }
        if (value < 0 || value > 999) {
            throw new IllegalArgumentException("Lexicon value must be between 0 and 999");
        }
    }

    public static LexiconEntry of(String word, int value) {
        return new LexiconEntry(word, value, Fingerprint.of(word));
    }

    public int length() {
        return word.length();
    }

    public char firstChar() {
        return fingerprint.firstChar();
    }

    public char lastChar() {
        return fingerprint.lastChar();
    }
}
