package com.field.resolution.tracing;

/**
 * Opens spans around document resolution and escalation calls.
 * The default {@link NoOpTracingService} records nothing.
 */
public interface TracingService {

    String DOCUMENT_SPAN = "field.document.resolve";
    String ESCALATION_SPAN = "field.escalation";

    /**
     * Starts the span covering a whole document.
     */
    Span startDocument(String documentId, int fieldCount);

    /**
     * Starts the span covering the single external validation call of a document.
     */
    Span startEscalation(String documentId, String validatorName, int fieldCount);
}
