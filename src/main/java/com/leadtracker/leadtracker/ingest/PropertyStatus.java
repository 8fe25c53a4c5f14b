package com.leadtracker.leadtracker.ingest;

import java.util.Locale;

/**
 * Legal status of a delinquent account. Closed set; anything unrecognized is {@link #UNKNOWN}.
 */
public enum PropertyStatus {
    PENDING,
    ACTIVE,
    JUDGMENT,
    UNKNOWN;

    /**
     * Maps a raw {@code LEGALSTATUS} cell by its first character: P, A or J.
     */
    public static PropertyStatus fromLegalStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        char first = raw.trim().toUpperCase(Locale.ROOT).charAt(0);
        return switch (first) {
            case 'P' -> PENDING;
            case 'A' -> ACTIVE;
            case 'J' -> JUDGMENT;
            default -> UNKNOWN;
        };
    }

    /**
     * Parses a stored status name, falling back to {@link #UNKNOWN} for anything else.
     */
    public static PropertyStatus fromStored(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return UNKNOWN;
        }
    }
}
