package com.field.resolution.api;

import com.field.resolution.core.model.ResolutionMethod;
import com.field.resolution.core.model.ResolutionOrigin;
import com.field.resolution.core.model.ResolutionResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Final results of a document, ordered by table and by original field order within a table.
 * A document is incomplete when the external validation could not be used; in that case the
 * escalated fields are unresolved and {@link #getFailureReason()} says why.
 */
public final class DocumentResolution {

    private final String documentId;
    private final List<ResolutionResult> results;
    private final int escalatedCount;
    private final String failureReason;

    DocumentResolution(String documentId, List<ResolutionResult> results, int escalatedCount, String failureReason) {
        this.documentId = documentId;
        this.results = List.copyOf(results);
        this.escalatedCount = escalatedCount;
        this.failureReason = failureReason;
    }

    public String getDocumentId() {
        return documentId;
    }

    /**
     * All results in output order.
     */
    public List<ResolutionResult> getResults() {
        return results;
    }

    /**
     * Results grouped by table, tables in output order.
     */
    public Map<Integer, List<ResolutionResult>> getResultsByTable() {
        Map<Integer, List<ResolutionResult>> byTable = new LinkedHashMap<>();
        for (ResolutionResult result : results) {
            byTable.computeIfAbsent(result.tableId(), k -> new ArrayList<>()).add(result);
        }
        byTable.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableMap(byTable);
    }

    public List<ResolutionResult> getResultsFor(int tableId) {
        return results.stream().filter(r -> r.tableId() == tableId).toList();
    }

    public Optional<ResolutionResult> find(int tableId, String fieldId) {
        return results.stream()
                .filter(r -> r.tableId() == tableId && r.fieldId().equals(fieldId))
                .findFirst();
    }

    /**
     * Returns true if every escalated field received an external answer (or none was needed).
     */
    public boolean isComplete() {
        return failureReason == null;
    }

    public Optional<String> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    /**
     * Number of fields that were sent (or would have been sent) for external validation.
     */
    public int getEscalatedCount() {
        return escalatedCount;
    }

    public long getLocalCount() {
        return results.stream()
                .filter(r -> r.origin() == ResolutionOrigin.LOCAL && r.method() != ResolutionMethod.UNRESOLVED)
                .count();
    }

    public long getExternalCount() {
        return results.stream().filter(r -> r.origin() == ResolutionOrigin.EXTERNAL).count();
    }

    public long getUnresolvedCount() {
        return results.stream().filter(r -> r.method() == ResolutionMethod.UNRESOLVED).count();
    }

    @Override
    public String toString() {
        return "DocumentResolution{" +
                "documentId='" + documentId + '\'' +
                ", fields=" + results.size() +
                ", local=" + getLocalCount() +
                ", external=" + getExternalCount() +
                ", unresolved=" + getUnresolvedCount() +
                ", complete=" + isComplete() +
                '}';
    }
}
