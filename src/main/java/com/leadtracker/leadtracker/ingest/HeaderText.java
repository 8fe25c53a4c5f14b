package com.leadtracker.leadtracker.ingest;

import java.util.Locale;

/**
 * Header normalization shared by column resolution and row extraction.
 */
public final class HeaderText {

    private HeaderText() {
    }

    /**
     * Lowercases and strips every non-alphanumeric character.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    /**
     * Uppercase form used by the literal fallback scans ({@code CAN}, {@code ADDRSTRING}).
     */
    public static String normalizeUpper(String value) {
        return normalize(value).toUpperCase(Locale.ROOT);
    }

    public static boolean isPlaceholder(String header) {
        return header == null || header.isBlank() || header.startsWith(IngestConstants.EMPTY_HEADER_PREFIX);
    }
}
