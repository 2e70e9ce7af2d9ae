package com.field.resolution.escalation;

/**
 * External arbitration for fields that could not be trusted locally.
 *
 * <p>The engine calls {@link #validate(EscalationBatch)} at most once per document with every
 * escalated field of every table. How the validator derives its answers is its own business;
 * retries, if any, belong inside the implementation.</p>
 *
 * <p>Implementations should answer every submitted field with a value (or null), a
 * confidence label and a rationale.</p>
 */
public interface BatchValidator {

    /**
     * Validates a batch of escalated fields.
     *
     * @param batch escalated fields grouped by table
     * @return verdicts grouped by table
     * @throws EscalationException if the validator is unreachable or its answer cannot be used
     */
    EscalationResponse validate(EscalationBatch batch) throws EscalationException;

    /**
     * Returns the name of this validator.
     */
    String getValidatorName();
}
