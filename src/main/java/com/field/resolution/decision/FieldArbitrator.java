package com.field.resolution.decision;

import com.field.resolution.conversion.ExactNumberParser;
import com.field.resolution.conversion.FuzzyNumberParser;
import com.field.resolution.core.model.Evidence;
import com.field.resolution.core.model.FuzzyMatch;
import com.field.resolution.core.model.ResolutionMethod;
import com.field.resolution.core.model.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Decides one field from its spelled-out and digit readings.
 *
 * <p>Rules, first match wins:</p>
 * <ol>
 *   <li>Exact word parse: confidence 1.0; {@code EXACT_MATCH} if the digits agree,
 *       otherwise {@code EXACT_PRIORITY}.</li>
 *   <li>Fuzzy word parse at or above the fuzzy acceptance threshold: {@code FUZZY_MATCH}
 *       (capped at 0.95) if the digits agree, otherwise {@code FUZZY_PRIORITY} (capped at 0.85).</li>
 *   <li>Digits only: {@code NEEDS_ESCALATION} with the digit value and confidence 0.0.</li>
 *   <li>Nothing: {@code UNRESOLVED}.</li>
 * </ol>
 *
 * <p>Digits never override a parsed word. A misread digit is common and independent of letter
 * errors, so agreement raises confidence but disagreement does not change the value.</p>
 */
public class FieldArbitrator {
    private static final Logger log = LoggerFactory.getLogger(FieldArbitrator.class);

    public static final double DEFAULT_FUZZY_ACCEPTANCE_THRESHOLD = 0.60;
    public static final double DEFAULT_FUZZY_MATCH_CAP = 0.95;
    public static final double DEFAULT_FUZZY_PRIORITY_CAP = 0.85;

    static final String UNASSIGNED_FIELD = "?";
    static final int MAX_DIGITS = 9;

    private final FuzzyNumberParser fuzzyParser;
    private final ExactNumberParser exactParser;
    private final double fuzzyAcceptanceThreshold;
    private final double fuzzyMatchCap;
    private final double fuzzyPriorityCap;

    public FieldArbitrator() {
        this(new FuzzyNumberParser(), DEFAULT_FUZZY_ACCEPTANCE_THRESHOLD,
                DEFAULT_FUZZY_MATCH_CAP, DEFAULT_FUZZY_PRIORITY_CAP);
    }

    /**
     * @param fuzzyAcceptanceThreshold minimum fuzzy confidence for the text to be used at all
     * @param fuzzyMatchCap            confidence ceiling when the digits confirm a fuzzy value
     * @param fuzzyPriorityCap         confidence ceiling when they do not; at most {@code fuzzyMatchCap}
     */
    public FieldArbitrator(FuzzyNumberParser fuzzyParser, double fuzzyAcceptanceThreshold,
                           double fuzzyMatchCap, double fuzzyPriorityCap) {
        this.fuzzyParser = Objects.requireNonNull(fuzzyParser, "fuzzyParser is required");
        this.exactParser = fuzzyParser.getExactParser();
        if (fuzzyPriorityCap > fuzzyMatchCap) {
            throw new IllegalArgumentException("fuzzyPriorityCap must be <= fuzzyMatchCap");
        }
        this.fuzzyAcceptanceThreshold = fuzzyAcceptanceThreshold;
        this.fuzzyMatchCap = fuzzyMatchCap;
        this.fuzzyPriorityCap = fuzzyPriorityCap;
    }

    /**
     * Decides a field without identity; callers attach it with
     * {@link ResolutionResult#forField(String, int)}.
     */
    public ResolutionResult arbitrate(String letterText, String digitText) {
        return arbitrate(UNASSIGNED_FIELD, 0, new Evidence(letterText, digitText));
    }

    /**
     * Decides a field from classified evidence.
     */
    public ResolutionResult arbitrate(String fieldId, int tableId, Evidence evidence) {
        String letterText = evidence.letterText();
        String digitText = evidence.digitText();
        Integer digitValue = parseDigits(digitText);

        Integer exactValue = exactParser.convert(letterText);
        if (exactValue != null) {
            if (exactValue.equals(digitValue)) {
                return decided(fieldId, tableId, exactValue, 1.0, ResolutionMethod.EXACT_MATCH,
                        String.format(Locale.ROOT, "Text '%s' = %d, digits '%s' = %d. They agree.",
                                letterText, exactValue, digitText, digitValue));
            }
            String rationale = String.format(Locale.ROOT, "Text '%s' = %d.", letterText, exactValue);
            if (digitValue != null) {
                rationale += String.format(Locale.ROOT, " Digits say %d, text takes priority.", digitValue);
            }
            return decided(fieldId, tableId, exactValue, 1.0, ResolutionMethod.EXACT_PRIORITY, rationale);
        }

        FuzzyMatch fuzzy = fuzzyParser.convert(letterText);
        if (fuzzy.isPresent() && fuzzy.confidence() >= fuzzyAcceptanceThreshold) {
            int fuzzyValue = fuzzy.value();
            String rationale = String.format(Locale.ROOT, "Corrupted text '%s' ~ %d (confidence %.0f%%).",
                    letterText, fuzzyValue, fuzzy.confidence() * 100);
            if (digitValue != null && fuzzyValue == digitValue) {
                return decided(fieldId, tableId, fuzzyValue,
                        Math.min(fuzzy.confidence(), fuzzyMatchCap),
                        ResolutionMethod.FUZZY_MATCH, rationale + " Digits confirm.");
            }
            if (digitValue != null) {
                rationale += String.format(Locale.ROOT, " Digits say %d.", digitValue);
            }
            return decided(fieldId, tableId, fuzzyValue,
                    Math.min(fuzzy.confidence(), fuzzyPriorityCap),
                    ResolutionMethod.FUZZY_PRIORITY, rationale);
        }

        String hint = fingerprintHint(letterText);
        if (digitValue != null) {
            return decided(fieldId, tableId, digitValue, 0.0, ResolutionMethod.NEEDS_ESCALATION,
                    String.format(Locale.ROOT, "Could not convert text '%s'. Digits available: '%s'.", letterText, digitText)
                            + hint);
        }
        return decided(fieldId, tableId, null, 0.0, ResolutionMethod.UNRESOLVED,
                String.format(Locale.ROOT, "No usable reading (text '%s', digits '%s').", letterText, digitText) + hint);
    }

    private String fingerprintHint(String letterText) {
        if (letterText == null) {
            return "";
        }
        List<FuzzyMatch> candidates = fuzzyParser.fingerprintCandidates(letterText);
        if (candidates.isEmpty()) {
            return "";
        }
        return candidates.stream()
                .map(c -> String.valueOf(c.value()))
                .distinct()
                .collect(Collectors.joining(", ", " Fingerprint candidates: ", "."));
    }

    private ResolutionResult decided(String fieldId, int tableId, Integer value, double confidence,
                                     ResolutionMethod method, String rationale) {
        log.debug("field.arbitrated fieldId={} tableId={} value={} confidence={} method={}",
                fieldId, tableId, value, confidence, method);
        return ResolutionResult.local(fieldId, tableId, value, confidence, method, rationale);
    }

    /**
     * Extracts an integer from a digit reading by dropping every non-digit character.
     * Returns {@code null} if no digit remains or the number is too long to represent.
     */
    public static Integer parseDigits(String digitText) {
        if (digitText == null) {
            return null;
        }
        StringBuilder digits = new StringBuilder();
        for (int i = 0; i < digitText.length(); i++) {
            char c = digitText.charAt(i);
            if (c >= '0' && c <= '9') {
                if (digits.length() == 0 && c == '0') {
                    continue;
                }
                digits.append(c);
            }
        }
        if (digits.length() == 0) {
            return containsZero(digitText) ? 0 : null;
        }
        if (digits.length() > MAX_DIGITS) {
            return null;
        }
        return Integer.parseInt(digits.toString());
    }

    private static boolean containsZero(String text) {
        return text.indexOf('0') >= 0;
    }
}
