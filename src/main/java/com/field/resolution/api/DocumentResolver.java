package com.field.resolution.api;

import com.field.resolution.conversion.FuzzyNumberParser;
import com.field.resolution.core.model.Evidence;
import com.field.resolution.core.model.RawFieldCandidate;
import com.field.resolution.core.model.ResolutionResult;
import com.field.resolution.decision.EvidenceClassifier;
import com.field.resolution.decision.FieldArbitrator;
import com.field.resolution.escalation.BatchValidator;
import com.field.resolution.escalation.EscalationBatch;
import com.field.resolution.escalation.EscalationException;
import com.field.resolution.escalation.EscalationResponse;
import com.field.resolution.escalation.NoOpBatchValidator;
import com.field.resolution.logging.LogContext;
import com.field.resolution.metrics.MetricsService;
import com.field.resolution.metrics.MetricsService.EscalationOutcome;
import com.field.resolution.metrics.NoOpMetricsService;
import com.field.resolution.tracing.NoOpTracingService;
import com.field.resolution.tracing.Span;
import com.field.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Main entry point: resolves every numeric field of a document.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>Each field's raw tokens are classified into letter and digit evidence and arbitrated.</li>
 *   <li>Decisions below the acceptance threshold, or that need escalation, are collected into
 *       one {@link EscalationBatch}.</li>
 *   <li>The batch is sent to the {@link BatchValidator} in a single call.</li>
 *   <li>External verdicts are merged back in original field order.</li>
 * </ol>
 *
 * <p>A failed, timed-out or interrupted escalation never fails the document: locally accepted
 * decisions are returned and escalated fields come back unresolved.</p>
 *
 * <pre>
 * try (DocumentResolver resolver = DocumentResolver.builder()
 *         .batchValidator(validator)
 *         .build()) {
 *     DocumentResolution resolution = resolver.resolveDocument(candidates);
 *     if (!resolution.isComplete()) {
 *         log.warn("Partial results: {}", resolution.getFailureReason().orElse(""));
 *     }
 * }
 * </pre>
 *
 * <p>All local work is single-threaded and only shares the immutable lexicon, so one resolver
 * can serve concurrent documents.</p>
 */
public class DocumentResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DocumentResolver.class);

    private final EvidenceClassifier classifier;
    private final FieldArbitrator arbitrator;
    private final BatchValidator batchValidator;
    private final ResolutionOptions options;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private DocumentResolver(Builder builder) {
        this.options = builder.options;
        this.classifier = builder.classifier != null ? builder.classifier : new EvidenceClassifier();
        FuzzyNumberParser fuzzyParser = builder.fuzzyParser != null ? builder.fuzzyParser : new FuzzyNumberParser();
        this.arbitrator = new FieldArbitrator(fuzzyParser, options.getFuzzyAcceptanceThreshold(),
                options.getFuzzyMatchCap(), options.getFuzzyPriorityCap());
        this.batchValidator = builder.batchValidator != null ? builder.batchValidator : new NoOpBatchValidator();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newCachedThreadPool(runnable -> {
                Thread thread = new Thread(runnable, "field-escalation");
                thread.setDaemon(true);
                return thread;
            });
            this.ownsExecutor = true;
        }
    }

    /**
     * Resolves a document under a generated document id.
     */
    public DocumentResolution resolveDocument(List<RawFieldCandidate> candidates) {
        return resolveDocument(LogContext.generateDocumentId(), candidates);
    }

    /**
     * Resolves a document: local pass, at most one escalation call, merge.
     */
    public DocumentResolution resolveDocument(String documentId, List<RawFieldCandidate> candidates) {
        Objects.requireNonNull(documentId, "documentId is required");
        Objects.requireNonNull(candidates, "candidates is required");
        long start = System.nanoTime();

        try (LogContext logCtx = LogContext.forDocument(documentId);
             Span span = tracingService.startDocument(documentId, candidates.size())) {

            LocalResolution local = resolveLocally(documentId, candidates);
            DocumentResolution resolution = escalateAndMerge(local);

            for (ResolutionResult result : resolution.getResults()) {
                metricsService.recordFieldResolved(result.method(), result.confidence());
            }
            span.setAttribute("escalatedFields", resolution.getEscalatedCount());
            span.setAttribute("unresolvedFields", resolution.getUnresolvedCount());
            span.succeed();

            log.info("document.resolved documentId={} fields={} local={} external={} unresolved={} complete={}",
                    documentId, resolution.getResults().size(), resolution.getLocalCount(),
                    resolution.getExternalCount(), resolution.getUnresolvedCount(), resolution.isComplete());
            return resolution;
        } finally {
            metricsService.recordDocumentDuration(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Runs the local pass only: classification, arbitration and partitioning.
     * Callers that drive escalation themselves (or abort it) use the returned
     * {@link LocalResolution} to finish the document.
     */
    public LocalResolution resolveLocally(String documentId, List<RawFieldCandidate> candidates) {
        List<ResolutionResult> provisional = new ArrayList<>(candidates.size());
        List<Boolean> accepted = new ArrayList<>(candidates.size());
        EscalationBatch.Collector collector = EscalationBatch.collector();

        for (RawFieldCandidate candidate : candidates) {
            Evidence evidence = classifier.classify(candidate);
            ResolutionResult result = arbitrator.arbitrate(candidate.fieldId(), candidate.tableId(), evidence);
            boolean keep = isAccepted(result);
            if (!keep) {
                collector.add(candidate);
            }
            provisional.add(result);
            accepted.add(keep);
        }

        EscalationBatch batch = collector.flush();
        log.debug("Local pass for {}: {} fields, {} escalated", documentId, candidates.size(), batch.size());
        return new LocalResolution(documentId, candidates, provisional, accepted, batch);
    }

    /**
     * A local decision is kept when it came from the spelled-out reading with enough confidence.
     */
    public boolean isAccepted(ResolutionResult result) {
        return !result.method().requiresEscalation()
                && result.confidence() >= options.getAcceptanceThreshold();
    }

    private DocumentResolution escalateAndMerge(LocalResolution local) {
        EscalationBatch batch = local.getEscalationBatch();
        if (batch.isEmpty()) {
            return local.partial("Nothing to escalate");
        }
        if (!options.isEscalationEnabled()) {
            log.info("Escalation disabled, {} fields left unresolved", batch.size());
            return local.partial("Escalation disabled");
        }

        metricsService.recordEscalationBatchSize(batch.size());
        long start = System.nanoTime();

        try (LogContext logCtx = LogContext.forEscalation(local.getDocumentId(), batch.size());
             Span span = tracingService.startEscalation(local.getDocumentId(),
                     batchValidator.getValidatorName(), batch.size())) {

            log.info("escalation.started validator={} tables={} fields={}",
                    batchValidator.getValidatorName(), batch.tableIds().size(), batch.size());

            Map<String, String> mdc = MDC.getCopyOfContextMap();
            Future<EscalationResponse> future;
            try {
                future = executor.submit(() -> validateWithContext(batch, mdc));
            } catch (RejectedExecutionException e) {
                return failed(local, span, start, e);
            }
            try {
                EscalationResponse response = future.get(options.getEscalationTimeout().toMillis(),
                        TimeUnit.MILLISECONDS);
                if (response == null) {
                    throw new EscalationException("Validator returned no response");
                }
                recordEscalation(EscalationOutcome.SUCCESS, start);
                span.setAttribute("verdicts", response.size());
                span.succeed();
                log.info("escalation.completed verdicts={}", response.size());
                return local.complete(response);
            } catch (TimeoutException e) {
                future.cancel(true);
                recordEscalation(EscalationOutcome.TIMEOUT, start);
                span.fail(e);
                log.warn("escalation.timeout after {}", options.getEscalationTimeout());
                return local.partial("Escalation timed out after " + options.getEscalationTimeout());
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                recordEscalation(EscalationOutcome.FAILURE, start);
                span.fail(e);
                log.warn("escalation.interrupted, returning local results");
                return local.partial("Escalation interrupted");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                return failed(local, span, start, cause);
            } catch (EscalationException e) {
                return failed(local, span, start, e);
            }
        }
    }

    private EscalationResponse validateWithContext(EscalationBatch batch, Map<String, String> context)
            throws EscalationException {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        setContext(context);
        try {
            return batchValidator.validate(batch);
        } finally {
            setContext(previous);
        }
    }

    private static void setContext(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    private DocumentResolution failed(LocalResolution local, Span span, long start, Throwable cause) {
        recordEscalation(EscalationOutcome.FAILURE, start);
        span.fail(cause);
        log.error("escalation.failed reason={}", cause.getMessage(), cause);
        return local.partial("Escalation failed: " + cause.getMessage());
    }

    private void recordEscalation(EscalationOutcome outcome, long start) {
        metricsService.recordEscalation(outcome, Duration.ofNanos(System.nanoTime() - start));
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    public FieldArbitrator getArbitrator() {
        return arbitrator;
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private FuzzyNumberParser fuzzyParser;
        private EvidenceClassifier classifier;
        private BatchValidator batchValidator;
        private ResolutionOptions options = ResolutionOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private ExecutorService executor;

        /**
         * Sets a custom fuzzy parser (and through it the lexicon and normalizer).
         */
        public Builder fuzzyParser(FuzzyNumberParser fuzzyParser) {
            this.fuzzyParser = fuzzyParser;
            return this;
        }

        public Builder classifier(EvidenceClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        /**
         * Sets the external validator. Without one, escalated fields come back unresolved.
         */
        public Builder batchValidator(BatchValidator batchValidator) {
            this.batchValidator = batchValidator;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Executor that runs the escalation call. A resolver-owned pool is used if none is given.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public DocumentResolver build() {
            return new DocumentResolver(this);
        }
    }
}
