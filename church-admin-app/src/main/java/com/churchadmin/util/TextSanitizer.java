package com.churchadmin.util;

import org.jsoup.Jsoup;

import java.util.Locale;

/**
 * Strips markup from free-text values before they are persisted.
 */
public final class TextSanitizer {

    private TextSanitizer() {
    }

    /**
     * Plain text of {@code raw} with tags removed and entities decoded, or null when nothing is left.
     */
    public static String sanitizeText(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = Jsoup.parse(raw).text().trim();
        return text.isEmpty() ? null : text;
    }

    public static String sanitizeEmail(String raw) {
        String text = sanitizeText(raw);
        return text == null ? null : text.toLowerCase(Locale.ROOT);
    }
}
