package com.field.resolution.rules;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A regex rewrite applied to OCR text before lexicon matching.
 * Rules run in priority order (lower number first). The replacement is inserted literally;
 * group references such as {@code $1} are not expanded.
 */
public final class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final int priority;

    private NormalizationRule(String name, Pattern pattern, String replacement, int priority) {
        this.name = name;
        this.pattern = pattern;
        this.replacement = Matcher.quoteReplacement(replacement);
        this.priority = priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Rewrites every match in the input. Null passes through.
     */
    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        /**
         * Compiles the rule.
         *
         * @throws IllegalArgumentException if the pattern is not a valid regex or matches the empty string
         */
        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");

            Pattern compiled;
            try {
                compiled = Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Rule '" + name + "' has an invalid pattern: " + e.getDescription(), e);
            }
            // An empty match would insert the replacement between every character
            if (compiled.matcher("").matches()) {
                throw new IllegalArgumentException("Rule '" + name + "' pattern matches the empty string");
            }
            return new NormalizationRule(name, compiled, replacement, priority);
        }
    }
}
