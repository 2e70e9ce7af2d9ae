package com.field.resolution.rules;

import java.util.List;

/**
 * Light cleanup of raw OCR tokens before evidence classification.
 * Removes selection-mark artefacts emitted by the layout service and keeps everything else,
 * including case and accents.
 */
public final class OcrNoiseCleaner {

    private static final List<String> NOISE = List.of(
            ":unselected:", ":selected:",
            "\u25CB", // ○
            "\u25A1", // □
            "\u2713", // ✓
            "\u2014", // —
            "@"
    );

    private OcrNoiseCleaner() {
        // Utility class
    }

    /**
     * Returns the token without noise markers, trimmed. Null yields an empty string.
     */
    public static String clean(String token) {
        if (token == null) {
            return "";
        }
        String result = token;
        // ":unselected:" must go before ":selected:", which it contains
        for (String marker : NOISE) {
            result = result.replace(marker, "");
        }
        return result.strip();
    }
}
