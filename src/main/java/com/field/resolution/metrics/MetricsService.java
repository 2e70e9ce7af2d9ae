package com.field.resolution.metrics;

import com.field.resolution.core.model.ResolutionMethod;

import java.time.Duration;

/**
 * Records field resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without a
 * metrics backend.
 */
public interface MetricsService {

    /**
     * Outcome of one escalation call.
     */
    enum EscalationOutcome { SUCCESS, FAILURE, TIMEOUT }

    void recordFieldResolved(ResolutionMethod method, double confidence);

    void recordEscalationBatchSize(int size);

    void recordEscalation(EscalationOutcome outcome, Duration duration);

    void recordDocumentDuration(Duration duration);
}
