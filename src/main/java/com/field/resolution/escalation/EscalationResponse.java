package com.field.resolution.escalation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verdicts returned by the external validator, grouped by table in response order.
 */
public final class EscalationResponse {

    private final Map<Integer, List<ExternalVerdict>> verdicts;

    private EscalationResponse(Map<Integer, List<ExternalVerdict>> verdicts) {
        this.verdicts = verdicts;
    }

    /**
     * Groups verdicts by their table id, keeping their order.
     */
    public static EscalationResponse of(List<ExternalVerdict> verdicts) {
        Map<Integer, List<ExternalVerdict>> grouped = new LinkedHashMap<>();
        for (ExternalVerdict verdict : verdicts) {
            grouped.computeIfAbsent(verdict.tableId(), k -> new ArrayList<>()).add(verdict);
        }
        grouped.replaceAll((k, v) -> List.copyOf(v));
        return new EscalationResponse(Collections.unmodifiableMap(grouped));
    }

    public static EscalationResponse empty() {
        return new EscalationResponse(Map.of());
    }

    public Map<Integer, List<ExternalVerdict>> byTable() {
        return verdicts;
    }

    public List<ExternalVerdict> verdictsFor(int tableId) {
        return verdicts.getOrDefault(tableId, List.of());
    }

    /**
     * Finds the first verdict for a field.
     */
    public Optional<ExternalVerdict> find(int tableId, String fieldId) {
        return verdictsFor(tableId).stream()
                .filter(v -> v.fieldId().equals(fieldId))
                .findFirst();
    }

    public int size() {
        return verdicts.values().stream().mapToInt(List::size).sum();
    }
}
