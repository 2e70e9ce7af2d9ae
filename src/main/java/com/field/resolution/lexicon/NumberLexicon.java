package com.field.resolution.lexicon;

import com.field.resolution.core.model.Fingerprint;
import com.field.resolution.core.model.LexiconEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Spanish cardinal words for 0-999 with a fingerprint index.
 *
 * <p>Composition is strictly additive: hundreds + tens/teens/twenties + units, with
 * "y" joining tens and units ("doscientos treinta y seis" = 200 + 30 + 6).
 * Entries keep their declaration order (units, teens, twenties, tens, hundreds), which is
 * also the tie-break order for fuzzy matching.</p>
 *
 * <p>The lexicon is immutable once built and is shared across threads and documents.</p>
 */
public final class NumberLexicon {
    private static final Logger log = LoggerFactory.getLogger(NumberLexicon.class);

    private static final NumberLexicon SPANISH = buildSpanish();

    private final List<LexiconEntry> entries;
    private final Map<String, LexiconEntry> byWord;
    private final Map<Fingerprint, List<LexiconEntry>> byFingerprint;

    private NumberLexicon(List<LexiconEntry> entries) {
        Map<String, LexiconEntry> words = new LinkedHashMap<>();
        Map<Fingerprint, List<LexiconEntry>> fingerprints = new LinkedHashMap<>();
        for (LexiconEntry entry : entries) {
            if (words.putIfAbsent(entry.word(), entry) != null) {
                throw new IllegalArgumentException("Duplicate lexicon word: " + entry.word());
            }
            fingerprints.computeIfAbsent(entry.fingerprint(), k -> new ArrayList<>()).add(entry);
        }
        fingerprints.replaceAll((k, v) -> List.copyOf(v));

        this.entries = List.copyOf(entries);
        this.byWord = Collections.unmodifiableMap(words);
        this.byFingerprint = Collections.unmodifiableMap(fingerprints);
    }

    /**
     * Returns the process-wide Spanish lexicon.
     */
    public static NumberLexicon spanish() {
        return SPANISH;
    }

    /**
     * Creates a lexicon over the given entries. Intended for tests and alternative vocabularies.
     */
    public static NumberLexicon of(List<LexiconEntry> entries) {
        return new NumberLexicon(entries);
    }

    /**
     * All entries in declaration order.
     */
    public List<LexiconEntry> entries() {
        return entries;
    }

    /**
     * Exact lookup of a normalized word.
     */
    public Optional<LexiconEntry> find(String word) {
        return Optional.ofNullable(byWord.get(word));
    }

    public boolean contains(String word) {
        return byWord.containsKey(word);
    }

    /**
     * All entries sharing the given fingerprint, in declaration order.
     */
    public List<LexiconEntry> withFingerprint(Fingerprint fingerprint) {
        return byFingerprint.getOrDefault(fingerprint, List.of());
    }

    /**
     * The entry owning the fingerprint, if it is the only one.
     */
    public Optional<LexiconEntry> uniqueForFingerprint(Fingerprint fingerprint) {
        List<LexiconEntry> matches = withFingerprint(fingerprint);
        return matches.size() == 1 ? Optional.of(matches.get(0)) : Optional.empty();
    }

    public int size() {
        return entries.size();
    }

    public int fingerprintCount() {
        return byFingerprint.size();
    }

    public int uniqueFingerprintCount() {
        return (int) byFingerprint.values().stream().filter(v -> v.size() == 1).count();
    }

    /**
     * One-line summary for diagnostics.
     */
    public String describe() {
        return "NumberLexicon{words=" + size() +
                ", fingerprints=" + fingerprintCount() +
                ", uniqueFingerprints=" + uniqueFingerprintCount() +
                '}';
    }

    private static NumberLexicon buildSpanish() {
        List<LexiconEntry> entries = new ArrayList<>();

        // Units
        add(entries, 0, "cero");
        add(entries, 1, "uno", "una");
        add(entries, 2, "dos");
        add(entries, 3, "tres");
        add(entries, 4, "cuatro");
        add(entries, 5, "cinco");
        add(entries, 6, "seis");
        add(entries, 7, "siete");
        add(entries, 8, "ocho");
        add(entries, 9, "nueve");

        // 10-19
        add(entries, 10, "diez");
        add(entries, 11, "once");
        add(entries, 12, "doce");
        add(entries, 13, "trece");
        add(entries, 14, "catorce");
        add(entries, 15, "quince");
        add(entries, 16, "dieciseis");
        add(entries, 17, "diecisiete");
        add(entries, 18, "dieciocho");
        add(entries, 19, "diecinueve");

        // 20-29 are single words
        add(entries, 20, "veinte");
        add(entries, 21, "veintiuno", "veintiuna");
        add(entries, 22, "veintidos");
        add(entries, 23, "veintitres");
        add(entries, 24, "veinticuatro");
        add(entries, 25, "veinticinco");
        add(entries, 26, "veintiseis");
        add(entries, 27, "veintisiete");
        add(entries, 28, "veintiocho");
        add(entries, 29, "veintinueve");

        // Tens
        add(entries, 30, "treinta");
        add(entries, 40, "cuarenta");
        add(entries, 50, "cincuenta");
        add(entries, 60, "sesenta");
        add(entries, 70, "setenta");
        add(entries, 80, "ochenta");
        add(entries, 90, "noventa");

        // Hundreds; "cien" stands alone, "ciento" takes a complement
        add(entries, 100, "cien", "ciento");
        add(entries, 200, "doscientos", "doscientas");
        add(entries, 300, "trescientos", "trescientas");
        add(entries, 400, "cuatrocientos", "cuatrocientas");
        add(entries, 500, "quinientos", "quinientas");
        add(entries, 600, "seiscientos", "seiscientas");
        add(entries, 700, "setecientos", "setecientas");
        add(entries, 800, "ochocientos", "ochocientas");
        add(entries, 900, "novecientos", "novecientas");

        NumberLexicon lexicon = new NumberLexicon(entries);
        log.info("lexicon.built {}", lexicon.describe());
        return lexicon;
    }

    private static void add(List<LexiconEntry> entries, int value, String... words) {
        for (String word : words) {
            entries.add(LexiconEntry.of(word, value));
        }
    }
}
