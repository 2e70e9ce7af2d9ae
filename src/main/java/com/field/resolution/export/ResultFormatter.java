package com.field.resolution.export;

import com.field.resolution.api.DocumentResolution;
import com.field.resolution.core.model.ResolutionResult;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders resolved documents as text.
 *
 * <p>{@link #formatValues(DocumentResolution)} produces the export form, one
 * {@code "<fieldId> : <value>"} line per field with a value:</p>
 * <pre>
 * --- TABLE 1 ---
 * 1 : 545
 * 2 : 14
 * </pre>
 *
 * <p>{@link #formatRawReading(DocumentResolution)} lists every field, including the unresolved
 * ones, with method, origin and rationale for review.</p>
 */
public final class ResultFormatter {

    private ResultFormatter() {
        // Utility class
    }

    /**
     * Formats fields with a value. Tables without any value are omitted.
     */
    public static String formatValues(DocumentResolution resolution) {
        StringJoiner out = new StringJoiner("\n");
        for (Map.Entry<Integer, List<ResolutionResult>> table : resolution.getResultsByTable().entrySet()) {
            List<String> lines = table.getValue().stream()
                    .filter(ResolutionResult::hasValue)
                    .map(ResultFormatter::valueLine)
                    .toList();
            if (lines.isEmpty()) {
                continue;
            }
            out.add("--- TABLE " + table.getKey() + " ---");
            lines.forEach(out::add);
            out.add("");
        }
        return out.toString();
    }

    /**
     * Formats one field as {@code "<fieldId> : <value>"}.
     */
    public static String valueLine(ResolutionResult result) {
        return result.fieldId() + " : " + result.value();
    }

    /**
     * Formats every field with its decision details.
     */
    public static String formatRawReading(DocumentResolution resolution) {
        StringJoiner out = new StringJoiner("\n");
        for (Map.Entry<Integer, List<ResolutionResult>> table : resolution.getResultsByTable().entrySet()) {
            out.add("=== TABLE " + table.getKey() + " ===");
            for (ResolutionResult result : table.getValue()) {
                out.add(String.format(Locale.ROOT, "  %-4s %-5s [%s/%s %.2f]",
                        result.fieldId(),
                        result.hasValue() ? result.value() : "NULL",
                        result.method().name().toLowerCase(Locale.ROOT),
                        result.origin().name().toLowerCase(Locale.ROOT),
                        result.confidence()));
                if (!result.rationale().isEmpty()) {
                    out.add("       " + result.rationale());
                }
            }
            out.add("");
        }
        resolution.getFailureReason().ifPresent(reason -> out.add("INCOMPLETE: " + reason));
        return out.toString();
    }
}
