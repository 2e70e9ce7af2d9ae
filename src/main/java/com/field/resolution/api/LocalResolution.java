package com.field.resolution.api;

import com.field.resolution.conversion.ExactNumberParser;
import com.field.resolution.core.model.RawFieldCandidate;
import com.field.resolution.core.model.ResolutionResult;
import com.field.resolution.escalation.EscalationBatch;
import com.field.resolution.escalation.EscalationResponse;
import com.field.resolution.escalation.ExternalVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of the local pass over a document: accepted decisions plus the escalation batch.
 *
 * <p>It can be completed with the external answer ({@link #complete(EscalationResponse)}) or,
 * if the external answer never arrives, turned into partial results
 * ({@link #partial(String)}) that keep every locally accepted decision.</p>
 */
public final class LocalResolution {
    private static final Logger log = LoggerFactory.getLogger(LocalResolution.class);

    private final String documentId;
    private final List<RawFieldCandidate> candidates;
    private final List<ResolutionResult> provisional;
    private final List<Boolean> accepted;
    private final EscalationBatch batch;

    LocalResolution(String documentId, List<RawFieldCandidate> candidates, List<ResolutionResult> provisional,
                    List<Boolean> accepted, EscalationBatch batch) {
        this.documentId = documentId;
        this.candidates = List.copyOf(candidates);
        this.provisional = List.copyOf(provisional);
        this.accepted = List.copyOf(accepted);
        this.batch = batch;
    }

    public String getDocumentId() {
        return documentId;
    }

    /**
     * Provisional decisions, one per candidate, in candidate order.
     */
    public List<ResolutionResult> getProvisionalResults() {
        return provisional;
    }

    /**
     * Decisions that passed the acceptance rule, in candidate order.
     */
    public List<ResolutionResult> getAcceptedResults() {
        List<ResolutionResult> result = new ArrayList<>();
        for (int i = 0; i < provisional.size(); i++) {
            if (accepted.get(i)) {
                result.add(provisional.get(i));
            }
        }
        return result;
    }

    public EscalationBatch getEscalationBatch() {
        return batch;
    }

    public boolean needsEscalation() {
        return !batch.isEmpty();
    }

    /**
     * Merges the external verdicts into the local decisions.
     * Within each table, fields keep their original order; verdicts for fields that were never
     * submitted are appended after them, and tables only known to the validator come last.
     * A verdict value outside 0-999 counts as no answer and leaves the field unresolved.
     */
    public DocumentResolution complete(EscalationResponse response) {
        List<ResolutionResult> merged = new ArrayList<>();
        Map<Integer, List<Integer>> tables = candidateIndexesByTable();

        for (Map.Entry<Integer, List<Integer>> table : tables.entrySet()) {
            int tableId = table.getKey();
            Set<String> seen = new HashSet<>();
            for (int index : table.getValue()) {
                RawFieldCandidate candidate = candidates.get(index);
                seen.add(candidate.fieldId());
                if (accepted.get(index)) {
                    merged.add(provisional.get(index));
                    continue;
                }
                Optional<ExternalVerdict> verdict = response.find(tableId, candidate.fieldId());
                merged.add(verdict.map(this::fromVerdict)
                        .orElseGet(() -> ResolutionResult.unresolved(candidate.fieldId(), tableId,
                                "Validator returned no answer. " + provisional.get(index).rationale())));
            }
            appendUnsolicited(merged, response.verdictsFor(tableId), seen);
        }

        for (Map.Entry<Integer, List<ExternalVerdict>> table : response.byTable().entrySet()) {
            if (!tables.containsKey(table.getKey())) {
                appendUnsolicited(merged, table.getValue(), new HashSet<>());
            }
        }

        return new DocumentResolution(documentId, merged, batch.size(), null);
    }

    /**
     * Keeps the accepted decisions and marks every escalated field unresolved.
     */
    public DocumentResolution partial(String reason) {
        List<ResolutionResult> merged = new ArrayList<>();
        for (List<Integer> indexes : candidateIndexesByTable().values()) {
            for (int index : indexes) {
                if (accepted.get(index)) {
                    merged.add(provisional.get(index));
                } else {
                    RawFieldCandidate candidate = candidates.get(index);
                    merged.add(ResolutionResult.unresolved(candidate.fieldId(), candidate.tableId(),
                            reason + ". " + provisional.get(index).rationale()));
                }
            }
        }
        return new DocumentResolution(documentId, merged, batch.size(), batch.isEmpty() ? null : reason);
    }

    private void appendUnsolicited(List<ResolutionResult> merged, List<ExternalVerdict> verdicts, Set<String> seen) {
        for (ExternalVerdict verdict : verdicts) {
            if (seen.add(verdict.fieldId())) {
                merged.add(fromVerdict(verdict));
            }
        }
    }

    private ResolutionResult fromVerdict(ExternalVerdict verdict) {
        Integer value = verdict.value();
        if (value != null && (value < 0 || value > ExactNumberParser.MAX_VALUE)) {
            log.warn("escalation.verdict_out_of_range table={} field={} value={}",
                    verdict.tableId(), verdict.fieldId(), value);
            return ResolutionResult.unresolved(verdict.fieldId(), verdict.tableId(),
                    "Validator value " + value + " is outside 0-" + ExactNumberParser.MAX_VALUE + ". "
                            + verdict.rationale());
        }
        return ResolutionResult.external(verdict.fieldId(), verdict.tableId(), verdict.value(),
                verdict.confidence(), verdict.rationale());
    }

    private Map<Integer, List<Integer>> candidateIndexesByTable() {
        Map<Integer, List<Integer>> tables = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            tables.computeIfAbsent(candidates.get(i).tableId(), k -> new ArrayList<>()).add(i);
        }
        return tables;
    }
}
