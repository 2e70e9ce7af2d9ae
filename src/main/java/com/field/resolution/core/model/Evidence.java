package com.field.resolution.core.model;

import java.util.Optional;

/**
 * The spelled-out and digit readings selected from a field's raw tokens.
 * Either side may be absent.
 */
public record Evidence(String letterText, String digitText) {

    public static Evidence none() {
        return new Evidence(null, null);
    }

    public Optional<String> letter() {
        return Optional.ofNullable(letterText);
    }

    public Optional<String> digits() {
        return Optional.ofNullable(digitText);
    }

    public boolean isEmpty() {
        return letterText == null && digitText == null;
    }
}
