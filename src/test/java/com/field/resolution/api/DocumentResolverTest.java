package com.field.resolution.api;

import com.field.resolution.core.model.ConfidenceLabel;
import com.field.resolution.core.model.RawFieldCandidate;
import com.field.resolution.core.model.ResolutionMethod;
import com.field.resolution.core.model.ResolutionOrigin;
import com.field.resolution.core.model.ResolutionResult;
import com.field.resolution.escalation.BatchValidator;
import com.field.resolution.escalation.EscalationBatch;
import com.field.resolution.escalation.EscalationException;
import com.field.resolution.escalation.EscalationResponse;
import com.field.resolution.escalation.ExternalVerdict;
import com.field.resolution.metrics.MetricsService;
import com.field.resolution.metrics.MicrometerMetricsService;
import com.field.resolution.tracing.Span;
import com.field.resolution.tracing.TracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentResolverTest {

    // Table 1: exact, fuzzy above threshold, unreadable text. Table 2: fingerprint-only, exact.
    private static final List<RawFieldCandidate> DOCUMENT = List.of(
            RawFieldCandidate.of("1", 1, "Quinientos cuarenta y cinco", "545"),
            RawFieldCandidate.of("2", 1, "Calorce", "14"),
            RawFieldCandidate.of("3", 1, "xqzwkjv", "37"),
            RawFieldCandidate.of("1", 2, "cxxxxxxxa", "50"),
            RawFieldCandidate.of("2", 2, ":unselected:", "Ochenta", "80")
    );

    @Mock
    private BatchValidator validator;

    private DocumentResolver resolver;

    @BeforeEach
    void setUp() {
        lenient().when(validator.getValidatorName()).thenReturn("mock");
        resolver = DocumentResolver.builder().batchValidator(validator).build();
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    private static EscalationResponse answers(ExternalVerdict... verdicts) {
        return EscalationResponse.of(List.of(verdicts));
    }

    @Nested
    @DisplayName("Local pass")
    class LocalPass {

        @Test
        @DisplayName("Only weak or unusable decisions are escalated")
        void testPartition() {
            LocalResolution local = resolver.resolveLocally("doc-1", DOCUMENT);

            EscalationBatch batch = local.getEscalationBatch();
            assertEquals(2, batch.size());
            assertEquals("3", batch.fieldsFor(1).get(0).fieldId());
            assertEquals("1", batch.fieldsFor(2).get(0).fieldId());

            List<ResolutionResult> accepted = local.getAcceptedResults();
            assertEquals(3, accepted.size());
            assertTrue(accepted.stream().allMatch(r -> r.confidence() >= 0.75));
            assertEquals(5, local.getProvisionalResults().size());
            assertTrue(local.needsEscalation());
        }

        @Test
        @DisplayName("Acceptance requires confidence and a word-derived method")
        void testAcceptanceRule() {
            assertTrue(resolver.isAccepted(
                    ResolutionResult.local("A", 1, 5, 0.75, ResolutionMethod.FUZZY_MATCH, "")));
            assertFalse(resolver.isAccepted(
                    ResolutionResult.local("A", 1, 5, 0.74, ResolutionMethod.FUZZY_PRIORITY, "")));
            assertFalse(resolver.isAccepted(
                    ResolutionResult.local("A", 1, 5, 1.0, ResolutionMethod.NEEDS_ESCALATION, "")));
        }

        @Test
        @DisplayName("Local resolution is deterministic")
        void testIdempotent() {
            assertEquals(resolver.resolveLocally("doc-1", DOCUMENT).getProvisionalResults(),
                    resolver.resolveLocally("doc-1", DOCUMENT).getProvisionalResults());
        }
    }

    @Nested
    @DisplayName("Escalation")
    class Escalation {

        @Test
        @DisplayName("The validator is called exactly once with every escalated field")
        void testSingleCall() throws Exception {
            when(validator.validate(any())).thenReturn(answers(
                    new ExternalVerdict("3", 1, 37, ConfidenceLabel.ALTA, "digits"),
                    new ExternalVerdict("1", 2, 50, ConfidenceLabel.MEDIA, "fingerprint")));

            DocumentResolution resolution = resolver.resolveDocument("doc-1", DOCUMENT);

            ArgumentCaptor<EscalationBatch> captor = ArgumentCaptor.forClass(EscalationBatch.class);
            verify(validator, times(1)).validate(captor.capture());
            assertEquals(List.of(1, 2), List.copyOf(captor.getValue().tableIds()));
            assertEquals(2, captor.getValue().size());

            assertTrue(resolution.isComplete());
            assertEquals(2, resolution.getEscalatedCount());
            assertEquals(3, resolution.getLocalCount());
            assertEquals(2, resolution.getExternalCount());
            assertEquals(0, resolution.getUnresolvedCount());
        }

        @Test
        @DisplayName("Verdicts are merged back in original field order")
        void testMergeOrder() throws Exception {
            when(validator.validate(any())).thenReturn(answers(
                    new ExternalVerdict("1", 2, 50, ConfidenceLabel.MEDIA, "fingerprint"),
                    new ExternalVerdict("3", 1, 37, ConfidenceLabel.ALTA, "digits")));

            DocumentResolution resolution = resolver.resolveDocument("doc-1", DOCUMENT);

            List<String> order = resolution.getResults().stream()
                    .map(r -> r.tableId() + "/" + r.fieldId())
                    .toList();
            assertEquals(List.of("1/1", "1/2", "1/3", "2/1", "2/2"), order);

            ResolutionResult external = resolution.find(1, "3").orElseThrow();
            assertEquals(37, external.value());
            assertEquals(0.90, external.confidence());
            assertEquals(ResolutionMethod.EXTERNAL, external.method());
            assertEquals(ResolutionOrigin.EXTERNAL, external.origin());
            assertEquals(0.60, resolution.find(2, "1").orElseThrow().confidence());

            assertEquals(ResolutionMethod.EXACT_MATCH, resolution.find(1, "1").orElseThrow().method());
            assertEquals(14, resolution.find(1, "2").orElseThrow().value());
            assertEquals(80, resolution.find(2, "2").orElseThrow().value());
        }

        @Test
        @DisplayName("Unsolicited verdicts are appended after their table's fields")
        void testUnsolicitedVerdicts() throws Exception {
            when(validator.validate(any())).thenReturn(answers(
                    new ExternalVerdict("3", 1, 37, ConfidenceLabel.ALTA, ""),
                    new ExternalVerdict("9", 2, 7, ConfidenceLabel.BAJA, "extra"),
                    new ExternalVerdict("1", 2, 50, ConfidenceLabel.MEDIA, ""),
                    new ExternalVerdict("4", 5, 3, ConfidenceLabel.ALTA, "new table")));

            DocumentResolution resolution = resolver.resolveDocument("doc-1", DOCUMENT);

            List<String> order = resolution.getResults().stream()
                    .map(r -> r.tableId() + "/" + r.fieldId())
                    .toList();
            assertEquals(List.of("1/1", "1/2", "1/3", "2/1", "2/2", "2/9", "5/4"), order);
            assertEquals(0.30, resolution.find(2, "9").orElseThrow().confidence());
        }

        @Test
        @DisplayName("Verdicts never replace locally accepted decisions")
        void testAcceptedDecisionsKept() throws Exception {
            when(validator.validate(any())).thenReturn(answers(
                    new ExternalVerdict("1", 1, 999, ConfidenceLabel.ALTA, "wrong"),
                    new ExternalVerdict("3", 1, 37, ConfidenceLabel.ALTA, ""),
                    new ExternalVerdict("1", 2, 50, ConfidenceLabel.ALTA, "")));

            DocumentResolution resolution = resolver.resolveDocument("doc-1", DOCUMENT);

            assertEquals(545, resolution.find(1, "1").orElseThrow().value());
            assertEquals(5, resolution.getResults().size());
        }

        @Test
        @DisplayName("A field the validator skipped comes back unresolved")
        void testMissingVerdict() throws Exception {
            when(validator.validate(any())).thenReturn(answers(
                    new ExternalVerdict("3", 1, 37, ConfidenceLabel.ALTA, "")));

            DocumentResolution resolution = resolver.resolveDocument("doc-1", DOCUMENT);

            ResolutionResult missing = resolution.find(2, "1").orElseThrow();
            assertNull(missing.value());
            assertEquals(ResolutionMethod.UNRESOLVED, missing.method());
            assertTrue(missing.rationale().startsWith("Validator returned no answer."));
            assertTrue(resolution.isComplete());
        }

        @Test
        @DisplayName("Values outside 0-999 are not merged")
        void testOutOfRangeVerdicts() throws Exception {
            when(validator.validate(any())).thenReturn(answers(
                    new ExternalVerdict("3", 1, 5000, ConfidenceLabel.ALTA, "digits"),
                    new ExternalVerdict("1", 2, -7, ConfidenceLabel.ALTA, "fingerprint"),
                    new ExternalVerdict("9", 2, 1000, ConfidenceLabel.BAJA, "extra")));

            DocumentResolution resolution = resolver.resolveDocument("doc-1", DOCUMENT);

            for (ResolutionResult result : List.of(resolution.find(1, "3").orElseThrow(),
                    resolution.find(2, "1").orElseThrow(), resolution.find(2, "9").orElseThrow())) {
                assertNull(result.value());
                assertEquals(ResolutionMethod.UNRESOLVED, result.method());
                assertTrue(result.rationale().startsWith("Validator value "), result.rationale());
                assertTrue(result.rationale().contains("is outside 0-999"), result.rationale());
            }
            assertEquals(3, resolution.getUnresolvedCount());
            assertEquals(0, resolution.getExternalCount());
            assertEquals(545, resolution.find(1, "1").orElseThrow().value());
        }

        @Test
        @DisplayName("The range bounds themselves are accepted")
        void testRangeBounds() throws Exception {
            when(validator.validate(any())).thenReturn(answers(
                    new ExternalVerdict("3", 1, 0, ConfidenceLabel.ALTA, ""),
                    new ExternalVerdict("1", 2, 999, ConfidenceLabel.ALTA, "")));

            DocumentResolution resolution = resolver.resolveDocument("doc-1", DOCUMENT);

            assertEquals(0, resolution.find(1, "3").orElseThrow().value());
            assertEquals(999, resolution.find(2, "1").orElseThrow().value());
            assertEquals(0, resolution.getUnresolvedCount());
        }

        @Test
        @DisplayName("Resolving the same document twice gives the same results")
        void testResolveDocumentIdempotent() throws Exception {
            when(validator.validate(any())).thenAnswer(invocation -> answers(
                    new ExternalVerdict("1", 2, 50, ConfidenceLabel.MEDIA, "fingerprint"),
                    new ExternalVerdict("3", 1, 37, ConfidenceLabel.ALTA, "digits")));

            DocumentResolution first = resolver.resolveDocument("doc-1", DOCUMENT);
            DocumentResolution second = resolver.resolveDocument("doc-1", DOCUMENT);

            verify(validator, times(2)).validate(any());
            assertEquals(first.getResults(), second.getResults());
            assertEquals(first.getFailureReason(), second.getFailureReason());
            assertEquals(first.getEscalatedCount(), second.getEscalatedCount());
        }

        @Test
        @DisplayName("Nothing to escalate means no external call")
        void testNothingToEscalate() throws Exception {
            DocumentResolution resolution = resolver.resolveDocument("doc-1", List.of(DOCUMENT.get(0), DOCUMENT.get(1)));

            verify(validator, never()).validate(any());
            assertTrue(resolution.isComplete());
            assertEquals(0, resolution.getEscalatedCount());
        }

        @Test
        @DisplayName("An empty document resolves to nothing")
        void testEmptyDocument() throws Exception {
            DocumentResolution resolution = resolver.resolveDocument(List.of());

            verify(validator, never()).validate(any());
            assertTrue(resolution.getResults().isEmpty());
            assertTrue(resolution.isComplete());
        }
    }

    @Nested
    @DisplayName("Escalation failures")
    class EscalationFailures {

        private void assertPartial(DocumentResolution resolution, String reasonPrefix) {
            assertFalse(resolution.isComplete());
            assertTrue(resolution.getFailureReason().orElseThrow().startsWith(reasonPrefix),
                    resolution.getFailureReason().orElseThrow());
            assertEquals(5, resolution.getResults().size());
            assertEquals(545, resolution.find(1, "1").orElseThrow().value());
            assertEquals(14, resolution.find(1, "2").orElseThrow().value());
            assertEquals(80, resolution.find(2, "2").orElseThrow().value());

            ResolutionResult escalated = resolution.find(1, "3").orElseThrow();
            assertNull(escalated.value());
            assertEquals(ResolutionMethod.UNRESOLVED, escalated.method());
            assertTrue(escalated.rationale().startsWith(reasonPrefix));
            assertNull(resolution.find(2, "1").orElseThrow().value());
            assertEquals(2, resolution.getUnresolvedCount());
        }

        @Test
        @DisplayName("A validator error keeps local results")
        void testValidatorError() throws Exception {
            when(validator.validate(any())).thenThrow(new EscalationException("quota exceeded"));

            assertPartial(resolver.resolveDocument("doc-1", DOCUMENT), "Escalation failed: quota exceeded");
        }

        @Test
        @DisplayName("An unexpected runtime error keeps local results")
        void testRuntimeError() throws Exception {
            when(validator.validate(any())).thenThrow(new IllegalStateException("boom"));

            assertPartial(resolver.resolveDocument("doc-1", DOCUMENT), "Escalation failed: boom");
        }

        @Test
        @DisplayName("A null response is treated as a failure")
        void testNullResponse() throws Exception {
            when(validator.validate(any())).thenReturn(null);

            assertPartial(resolver.resolveDocument("doc-1", DOCUMENT), "Escalation failed");
        }

        @Test
        @DisplayName("A slow validator times out")
        void testTimeout() throws Exception {
            when(validator.validate(any())).thenAnswer(invocation -> {
                Thread.sleep(10_000);
                return EscalationResponse.empty();
            });

            try (DocumentResolver impatient = DocumentResolver.builder()
                    .batchValidator(validator)
                    .options(ResolutionOptions.builder().escalationTimeout(Duration.ofMillis(100)).build())
                    .build()) {
                assertPartial(impatient.resolveDocument("doc-1", DOCUMENT), "Escalation timed out");
            }
        }

        @Test
        @DisplayName("An interrupted caller gets local results and keeps its interrupt flag")
        void testInterrupted() throws Exception {
            // the call may be cancelled before it starts
            lenient().when(validator.validate(any())).thenAnswer(invocation -> {
                Thread.sleep(10_000);
                return EscalationResponse.empty();
            });

            Thread.currentThread().interrupt();
            DocumentResolution resolution;
            try {
                resolution = resolver.resolveDocument("doc-1", DOCUMENT);
            } finally {
                assertTrue(Thread.interrupted());
            }

            assertPartial(resolution, "Escalation interrupted");
        }

        @Test
        @DisplayName("A shut down executor keeps local results")
        void testRejectedByExecutor() throws Exception {
            ExecutorService executor = Executors.newSingleThreadExecutor();
            executor.shutdown();

            try (DocumentResolver rejecting = DocumentResolver.builder()
                    .batchValidator(validator)
                    .executor(executor)
                    .build()) {
                assertPartial(rejecting.resolveDocument("doc-1", DOCUMENT), "Escalation failed");
            }
            verify(validator, never()).validate(any());
        }

        @Test
        @DisplayName("A closed resolver still returns local results")
        void testResolveAfterClose() throws Exception {
            resolver.close();

            assertPartial(resolver.resolveDocument("doc-1", DOCUMENT), "Escalation failed");
            verify(validator, never()).validate(any());
        }

        @Test
        @DisplayName("Disabled escalation never calls the validator")
        void testLocalOnly() throws Exception {
            try (DocumentResolver localOnly = DocumentResolver.builder()
                    .batchValidator(validator)
                    .options(ResolutionOptions.localOnly())
                    .build()) {
                DocumentResolution resolution = localOnly.resolveDocument("doc-1", DOCUMENT);

                verify(validator, never()).validate(any());
                assertPartial(resolution, "Escalation disabled");
            }
        }

        @Test
        @DisplayName("Without a validator escalated fields are unresolved")
        void testDefaultValidator() {
            try (DocumentResolver noValidator = DocumentResolver.builder().build()) {
                assertPartial(noValidator.resolveDocument("doc-1", DOCUMENT),
                        "Escalation failed: No batch validator configured");
            }
        }
    }

    @Nested
    @DisplayName("Observability")
    class Observability {

        @Test
        @DisplayName("Metrics record every field and the escalation outcome")
        void testMetrics() throws Exception {
            when(validator.validate(any())).thenReturn(answers(
                    new ExternalVerdict("3", 1, 37, ConfidenceLabel.ALTA, ""),
                    new ExternalVerdict("1", 2, 50, ConfidenceLabel.MEDIA, "")));
            SimpleMeterRegistry registry = new SimpleMeterRegistry();

            try (DocumentResolver measured = DocumentResolver.builder()
                    .batchValidator(validator)
                    .metricsService(new MicrometerMetricsService(registry))
                    .build()) {
                measured.resolveDocument("doc-1", DOCUMENT);
            }

            assertEquals(2.0, registry.get("field.resolution.method").tag("method", "external").counter().count());
            assertEquals(2.0, registry.get("field.resolution.method").tag("method", "exact_match").counter().count());
            assertEquals(1L, registry.get("field.escalation.duration").tag("outcome", "success").timer().count());
            assertEquals(2.0, registry.get("field.escalation.batch.size").summary().totalAmount());
            assertEquals(1L, registry.get("field.document.duration").timer().count());
        }

        @Test
        @DisplayName("The document id stays in the MDC after escalation")
        void testDocumentIdAfterEscalation() throws Exception {
            when(validator.validate(any())).thenReturn(answers(
                    new ExternalVerdict("3", 1, 37, ConfidenceLabel.ALTA, ""),
                    new ExternalVerdict("1", 2, 50, ConfidenceLabel.MEDIA, "")));
            List<String> seen = new CopyOnWriteArrayList<>();
            MetricsService metrics = mock(MetricsService.class);
            doAnswer(invocation -> seen.add(MDC.get("documentId")))
                    .when(metrics).recordFieldResolved(any(), anyDouble());

            try (DocumentResolver measured = DocumentResolver.builder()
                    .batchValidator(validator)
                    .metricsService(metrics)
                    .build()) {
                measured.resolveDocument("doc-1", DOCUMENT);
            }

            assertEquals(Collections.nCopies(5, "doc-1"), seen);
            assertNull(MDC.get("documentId"));
        }

        @Test
        @DisplayName("The validator runs with the caller's MDC")
        void testMdcOnValidatorThread() throws Exception {
            AtomicReference<String> documentId = new AtomicReference<>();
            AtomicReference<String> escalatedFields = new AtomicReference<>();
            AtomicReference<String> thread = new AtomicReference<>();
            when(validator.validate(any())).thenAnswer(invocation -> {
                documentId.set(MDC.get("documentId"));
                escalatedFields.set(MDC.get("escalatedFields"));
                thread.set(Thread.currentThread().getName());
                return answers(new ExternalVerdict("3", 1, 37, ConfidenceLabel.ALTA, ""),
                        new ExternalVerdict("1", 2, 50, ConfidenceLabel.MEDIA, ""));
            });

            resolver.resolveDocument("doc-1", DOCUMENT);

            assertNotEquals(Thread.currentThread().getName(), thread.get());
            assertEquals("doc-1", documentId.get());
            assertEquals("2", escalatedFields.get());
        }

        @Test
        @DisplayName("Spans wrap the document and the escalation call")
        void testTracing() throws Exception {
            when(validator.validate(any())).thenThrow(new EscalationException("down"));
            TracingService tracing = mock(TracingService.class);
            Span documentSpan = mock(Span.class);
            Span escalationSpan = mock(Span.class);
            when(tracing.startDocument(anyString(), anyInt())).thenReturn(documentSpan);
            when(tracing.startEscalation(anyString(), anyString(), anyInt())).thenReturn(escalationSpan);

            try (DocumentResolver traced = DocumentResolver.builder()
                    .batchValidator(validator)
                    .tracingService(tracing)
                    .build()) {
                traced.resolveDocument("doc-1", DOCUMENT);
            }

            verify(tracing).startDocument("doc-1", 5);
            verify(tracing).startEscalation(eq("doc-1"), eq("mock"), eq(2));
            verify(escalationSpan).fail(any(EscalationException.class));
            verify(escalationSpan).close();
            verify(documentSpan).succeed();
            verify(documentSpan).close();
        }
    }
}
