package com.field.resolution.conversion;

import com.field.resolution.core.model.Fingerprint;
import com.field.resolution.core.model.FuzzyMatch;
import com.field.resolution.core.model.LexiconEntry;
import com.field.resolution.lexicon.NumberLexicon;
import com.field.resolution.similarity.LevenshteinDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Recovers numbers from OCR-corrupted Spanish text.
 *
 * <p>Each word is matched against the lexicon by edit distance, restricted to words of
 * comparable length. When the closest word is still too far away, the word's fingerprint
 * (length, first letter, last letter) is tried as a last resort and accepted only if it
 * identifies a single lexicon entry.</p>
 *
 * <pre>
 * "calorce"    -> 14 (catorce, one substitution)
 * "veinisinco" -> 25 (veinticinco, two edits)
 * </pre>
 *
 * <p>A compound is as reliable as its weakest word: its confidence is the minimum over words.</p>
 */
public class FuzzyNumberParser {
    private static final Logger log = LoggerFactory.getLogger(FuzzyNumberParser.class);

    static final double MIN_LENGTH_RATIO = 0.65;
    static final double MAX_LENGTH_RATIO = 1.50;
    static final double DISTANCE_TOLERANCE = 0.35;
    static final int MIN_DISTANCE_THRESHOLD = 2;
    static final double MIN_EDIT_CONFIDENCE = 0.50;
    static final double FINGERPRINT_BONUS = 0.10;
    static final double FINGERPRINT_CONFIDENCE = 0.65;
    static final double NEAR_FINGERPRINT_CONFIDENCE = 0.50;

    private final ExactNumberParser exactParser;
    private final NumberLexicon lexicon;

    public FuzzyNumberParser() {
        this(new ExactNumberParser());
    }

    public FuzzyNumberParser(ExactNumberParser exactParser) {
        this.exactParser = Objects.requireNonNull(exactParser, "exactParser is required");
        this.lexicon = exactParser.getLexicon();
    }

    /**
     * Converts the text, tolerating recognition errors.
     * Exact conversions come back with confidence 1.0.
     */
    public FuzzyMatch convert(String text) {
        Integer exact = exactParser.convert(text);
        if (exact != null) {
            return FuzzyMatch.of(exact, 1.0);
        }

        List<String> words = ExactNumberParser.words(exactParser.getNormalizer().normalize(text));
        if (words.isEmpty()) {
            return FuzzyMatch.none();
        }
        if (words.size() == 1) {
            return matchWord(words.get(0));
        }

        int total = 0;
        double weakest = 1.0;
        for (String word : words) {
            Optional<LexiconEntry> entry = lexicon.find(word);
            if (entry.isPresent()) {
                total += entry.get().value();
                continue;
            }
            FuzzyMatch match = matchWord(word);
            if (!match.isPresent()) {
                log.debug("Compound '{}' failed on word '{}'", text, word);
                return FuzzyMatch.none();
            }
            total += match.value();
            weakest = Math.min(weakest, match.confidence());
        }

        if (!ExactNumberParser.inRange(total)) {
            log.debug("Compound '{}' sums to {} which is out of range", text, total);
            return FuzzyMatch.none();
        }
        return FuzzyMatch.of(total, weakest);
    }

    /**
     * Resolves a single normalized word that is not in the lexicon.
     */
    public FuzzyMatch matchWord(String word) {
        if (word == null || word.length() < 2) {
            return FuzzyMatch.none();
        }

        LexiconEntry best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (LexiconEntry entry : lexicon.entries()) {
            double lengthRatio = (double) word.length() / entry.length();
            if (lengthRatio < MIN_LENGTH_RATIO || lengthRatio > MAX_LENGTH_RATIO) {
                continue;
            }
            int distance = LevenshteinDistance.between(word, entry.word());
            // Strict comparison keeps the first entry in lexicon order on ties
            if (distance < bestDistance) {
                best = entry;
                bestDistance = distance;
            }
        }

        if (best == null) {
            return FuzzyMatch.none();
        }

        int threshold = Math.max(MIN_DISTANCE_THRESHOLD, (int) (best.length() * DISTANCE_TOLERANCE));
        if (bestDistance > threshold) {
            return matchFingerprint(word);
        }

        double confidence = Math.max(MIN_EDIT_CONFIDENCE,
                LevenshteinDistance.similarityTo(best.word(), bestDistance));
        if (Fingerprint.of(word).equals(best.fingerprint())) {
            confidence = Math.min(1.0, confidence + FINGERPRINT_BONUS);
        }

        log.debug("Word '{}' ~ '{}' (distance {}, confidence {})", word, best.word(), bestDistance, confidence);
        return FuzzyMatch.of(best.value(), confidence);
    }

    private FuzzyMatch matchFingerprint(String word) {
        return lexicon.uniqueForFingerprint(Fingerprint.of(word))
                .map(entry -> {
                    log.debug("Word '{}' resolved by fingerprint to '{}'", word, entry.word());
                    return FuzzyMatch.of(entry.value(), FINGERPRINT_CONFIDENCE);
                })
                .orElseGet(FuzzyMatch::none);
    }

    /**
     * Lists every value whose lexicon word shares the fingerprint of a single-word text.
     * If no entry shares it exactly, values whose fingerprint differs only by one letter of
     * length are returned at lower confidence. Multi-word text yields an empty list.
     */
    public List<FuzzyMatch> fingerprintCandidates(String text) {
        List<String> words = ExactNumberParser.words(exactParser.getNormalizer().normalize(text)).stream()
                .filter(w -> w.length() >= 2)
                .toList();
        if (words.size() != 1) {
            return List.of();
        }

        Fingerprint fingerprint = Fingerprint.of(words.get(0));
        List<FuzzyMatch> candidates = new ArrayList<>();
        for (LexiconEntry entry : lexicon.withFingerprint(fingerprint)) {
            candidates.add(FuzzyMatch.of(entry.value(), FINGERPRINT_CONFIDENCE));
        }
        if (!candidates.isEmpty()) {
            return candidates;
        }

        for (int delta : new int[]{-1, 1}) {
            if (fingerprint.length() + delta < 1) {
                continue;
            }
            for (LexiconEntry entry : lexicon.withFingerprint(fingerprint.withLengthDelta(delta))) {
                candidates.add(FuzzyMatch.of(entry.value(), NEAR_FINGERPRINT_CONFIDENCE));
            }
        }
        return candidates;
    }

    public ExactNumberParser getExactParser() {
        return exactParser;
    }
}
