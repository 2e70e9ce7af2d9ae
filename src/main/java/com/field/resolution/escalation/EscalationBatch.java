package com.field.resolution.escalation;

import com.field.resolution.core.model.RawFieldCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fields to be decided externally, grouped by table.
 * Tables keep the order in which their first field was collected and fields keep their
 * original order within the table.
 */
public final class EscalationBatch {

    private static final EscalationBatch EMPTY = new EscalationBatch(Map.of());

    private final Map<Integer, List<RawFieldCandidate>> tables;

    private EscalationBatch(Map<Integer, List<RawFieldCandidate>> tables) {
        this.tables = tables;
    }

    public static EscalationBatch empty() {
        return EMPTY;
    }

    public static Collector collector() {
        return new Collector();
    }

    /**
     * Escalated fields by table id.
     */
    public Map<Integer, List<RawFieldCandidate>> tables() {
        return tables;
    }

    public Set<Integer> tableIds() {
        return tables.keySet();
    }

    public List<RawFieldCandidate> fieldsFor(int tableId) {
        return tables.getOrDefault(tableId, List.of());
    }

    /**
     * Total number of escalated fields across all tables.
     */
    public int size() {
        return tables.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    @Override
    public String toString() {
        return "EscalationBatch{tables=" + tables.size() + ", fields=" + size() + '}';
    }

    /**
     * Accumulates escalated fields during local resolution; {@link #flush()} seals the batch
     * that is sent in the single external call.
     */
    public static final class Collector {
        private final Map<Integer, List<RawFieldCandidate>> pending = new LinkedHashMap<>();
        private boolean flushed = false;

        private Collector() {
        }

        public Collector add(RawFieldCandidate candidate) {
            if (flushed) {
                throw new IllegalStateException("Escalation batch already flushed");
            }
            pending.computeIfAbsent(candidate.tableId(), k -> new ArrayList<>()).add(candidate);
            return this;
        }

        public EscalationBatch flush() {
            if (flushed) {
                throw new IllegalStateException("Escalation batch already flushed");
            }
            flushed = true;
            if (pending.isEmpty()) {
                return EMPTY;
            }
            Map<Integer, List<RawFieldCandidate>> sealed = new LinkedHashMap<>();
            pending.forEach((tableId, fields) -> sealed.put(tableId, List.copyOf(fields)));
            return new EscalationBatch(Collections.unmodifiableMap(sealed));
        }
    }
}
