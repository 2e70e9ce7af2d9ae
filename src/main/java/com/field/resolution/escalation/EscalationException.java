package com.field.resolution.escalation;

/**
 * Thrown when the external validator cannot produce a usable answer for a batch.
 * The resolution pipeline recovers from it by returning partial results.
 */
public class EscalationException extends Exception {

    public EscalationException(String message) {
        super(message);
    }

    public EscalationException(String message, Throwable cause) {
        super(message, cause);
    }
}
