package com.field.resolution.api;

import com.field.resolution.decision.FieldArbitrator;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for field resolution.
 * Configures acceptance thresholds, confidence caps and the escalation call.
 */
public class ResolutionOptions {

    private static final double DEFAULT_ACCEPTANCE_THRESHOLD = 0.75;
    private static final double DEFAULT_FUZZY_ACCEPTANCE_THRESHOLD = FieldArbitrator.DEFAULT_FUZZY_ACCEPTANCE_THRESHOLD;
    private static final double DEFAULT_FUZZY_MATCH_CAP = FieldArbitrator.DEFAULT_FUZZY_MATCH_CAP;
    private static final double DEFAULT_FUZZY_PRIORITY_CAP = FieldArbitrator.DEFAULT_FUZZY_PRIORITY_CAP;
    private static final Duration DEFAULT_ESCALATION_TIMEOUT = Duration.ofSeconds(60);

    private final double acceptanceThreshold;
    private final double fuzzyAcceptanceThreshold;
    private final double fuzzyMatchCap;
    private final double fuzzyPriorityCap;
    private final Duration escalationTimeout;
    private final boolean escalationEnabled;

    private ResolutionOptions(Builder builder) {
        this.acceptanceThreshold = builder.acceptanceThreshold;
        this.fuzzyAcceptanceThreshold = builder.fuzzyAcceptanceThreshold;
        this.fuzzyMatchCap = builder.fuzzyMatchCap;
        this.fuzzyPriorityCap = builder.fuzzyPriorityCap;
        this.escalationTimeout = builder.escalationTimeout;
        this.escalationEnabled = builder.escalationEnabled;
    }

    /**
     * Minimum confidence for a local decision to be kept without escalation.
     */
    public double getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    /**
     * Minimum fuzzy confidence for the spelled-out reading to be used at all.
     */
    public double getFuzzyAcceptanceThreshold() {
        return fuzzyAcceptanceThreshold;
    }

    public double getFuzzyMatchCap() {
        return fuzzyMatchCap;
    }

    public double getFuzzyPriorityCap() {
        return fuzzyPriorityCap;
    }

    public Duration getEscalationTimeout() {
        return escalationTimeout;
    }

    public boolean isEscalationEnabled() {
        return escalationEnabled;
    }

    /**
     * Creates default options.
     */
    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that never call the external validator.
     * Fields below the acceptance threshold come back unresolved.
     */
    public static ResolutionOptions localOnly() {
        return builder().escalationEnabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double acceptanceThreshold = DEFAULT_ACCEPTANCE_THRESHOLD;
        private double fuzzyAcceptanceThreshold = DEFAULT_FUZZY_ACCEPTANCE_THRESHOLD;
        private double fuzzyMatchCap = DEFAULT_FUZZY_MATCH_CAP;
        private double fuzzyPriorityCap = DEFAULT_FUZZY_PRIORITY_CAP;
        private Duration escalationTimeout = DEFAULT_ESCALATION_TIMEOUT;
        private boolean escalationEnabled = true;

        public Builder acceptanceThreshold(double acceptanceThreshold) {
            validateThreshold(acceptanceThreshold, "acceptanceThreshold");
            this.acceptanceThreshold = acceptanceThreshold;
            return this;
        }

        public Builder fuzzyAcceptanceThreshold(double fuzzyAcceptanceThreshold) {
            validateThreshold(fuzzyAcceptanceThreshold, "fuzzyAcceptanceThreshold");
            this.fuzzyAcceptanceThreshold = fuzzyAcceptanceThreshold;
            return this;
        }

        public Builder fuzzyMatchCap(double fuzzyMatchCap) {
            validateThreshold(fuzzyMatchCap, "fuzzyMatchCap");
            this.fuzzyMatchCap = fuzzyMatchCap;
            return this;
        }

        public Builder fuzzyPriorityCap(double fuzzyPriorityCap) {
            validateThreshold(fuzzyPriorityCap, "fuzzyPriorityCap");
            this.fuzzyPriorityCap = fuzzyPriorityCap;
            return this;
        }

        public Builder escalationTimeout(Duration escalationTimeout) {
            Objects.requireNonNull(escalationTimeout, "escalationTimeout is required");
            if (escalationTimeout.isZero() || escalationTimeout.isNegative()) {
                throw new IllegalArgumentException("escalationTimeout must be positive");
            }
            this.escalationTimeout = escalationTimeout;
            return this;
        }

        public Builder escalationEnabled(boolean escalationEnabled) {
            this.escalationEnabled = escalationEnabled;
            return this;
        }

        public ResolutionOptions build() {
            if (fuzzyPriorityCap > fuzzyMatchCap) {
                throw new IllegalArgumentException("fuzzyPriorityCap must be <= fuzzyMatchCap");
            }
            return new ResolutionOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "acceptanceThreshold=" + acceptanceThreshold +
                ", fuzzyAcceptanceThreshold=" + fuzzyAcceptanceThreshold +
                ", fuzzyMatchCap=" + fuzzyMatchCap +
                ", fuzzyPriorityCap=" + fuzzyPriorityCap +
                ", escalationTimeout=" + escalationTimeout +
                ", escalationEnabled=" + escalationEnabled +
                '}';
    }
}
