package com.field.resolution.escalation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validator used when no external arbitration is configured.
 * Always fails, so escalated fields come back unresolved.
 */
public class NoOpBatchValidator implements BatchValidator {
    private static final Logger log = LoggerFactory.getLogger(NoOpBatchValidator.class);

    @Override
    public EscalationResponse validate(EscalationBatch batch) throws EscalationException {
        log.debug("NoOp validator called for {}", batch);
        throw new EscalationException("No batch validator configured");
    }

    @Override
    public String getValidatorName() {
        return "NoOp";
    }
}
