package com.field.resolution.decision;

import com.field.resolution.core.model.Evidence;
import com.field.resolution.core.model.RawFieldCandidate;
import com.field.resolution.rules.OcrNoiseCleaner;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the digit reading and the spelled-out reading from a field's raw OCR tokens.
 *
 * <p>Best-effort heuristic: the digit reading is the first token whose non-space characters
 * are at least 70% digits; the letter reading is the longest remaining token with at least
 * three letters (first one wins on ties). Fields with several competing tokens can be
 * misclassified.</p>
 */
public class EvidenceClassifier {

    static final double MIN_DIGIT_RATIO = 0.70;
    static final int MIN_LETTERS = 3;

    /**
     * Classifies the tokens of a candidate.
     */
    public Evidence classify(RawFieldCandidate candidate) {
        return classify(candidate.contents());
    }

    /**
     * Classifies raw tokens, in reading order.
     */
    public Evidence classify(List<String> contents) {
        List<String> tokens = new ArrayList<>();
        for (String raw : contents) {
            String cleaned = OcrNoiseCleaner.clean(raw);
            if (!cleaned.isEmpty()) {
                tokens.add(cleaned);
            }
        }

        int digitIndex = -1;
        for (int i = 0; i < tokens.size(); i++) {
            if (digitRatio(tokens.get(i)) >= MIN_DIGIT_RATIO) {
                digitIndex = i;
                break;
            }
        }

        String letterText = null;
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (i == digitIndex || letterCount(token) < MIN_LETTERS) {
                continue;
            }
            if (letterText == null || token.length() > letterText.length()) {
                letterText = token;
            }
        }

        return new Evidence(letterText, digitIndex >= 0 ? tokens.get(digitIndex) : null);
    }

    static double digitRatio(String token) {
        int significant = 0;
        int digits = 0;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            significant++;
            if (c >= '0' && c <= '9') {
                digits++;
            }
        }
        return significant == 0 ? 0.0 : (double) digits / significant;
    }

    static int letterCount(String token) {
        int letters = 0;
        for (int i = 0; i < token.length(); i++) {
            if (Character.isLetter(token.charAt(i))) {
                letters++;
            }
        }
        return letters;
    }
}
