package com.field.resolution.core.model;

/**
 * How a field's value was decided.
 */
public enum ResolutionMethod {
    /**
     * Word parsed exactly and the digits agree.
     */
    EXACT_MATCH,

    /**
     * Word parsed exactly; digits disagree or are missing. The word wins.
     */
    EXACT_PRIORITY,

    /**
     * Word recovered by fuzzy matching and the digits agree.
     */
    FUZZY_MATCH,

    /**
     * Word recovered by fuzzy matching; digits disagree or are missing.
     */
    FUZZY_PRIORITY,

    /**
     * Word could not be trusted. The value, if any, is the unconfirmed digit reading.
     */
    NEEDS_ESCALATION,

    /**
     * No usable evidence at all.
     */
    UNRESOLVED,

    /**
     * Decided by the external batch validator.
     */
    EXTERNAL;

    /**
     * Returns true if a local decision with this method can never be accepted without escalation.
     */
    public boolean requiresEscalation() {
        return this == NEEDS_ESCALATION || this == UNRESOLVED;
    }

    /**
     * Returns true if the value came from the spelled-out reading.
     */
    public boolean isWordDerived() {
        return switch (this) {
            case EXACT_MATCH, EXACT_PRIORITY, FUZZY_MATCH, FUZZY_PRIORITY -> true;
            case NEEDS_ESCALATION, UNRESOLVED, EXTERNAL -> false;
        };
    }
}
