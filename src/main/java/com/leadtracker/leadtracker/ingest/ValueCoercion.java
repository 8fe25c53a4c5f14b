package com.leadtracker.leadtracker.ingest;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient cell coercion. Malformed input never throws; it degrades to {@code null}, zero or an
 * empty list depending on the field.
 */
public final class ValueCoercion {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern LEADING_INTEGER = Pattern.compile("^[+-]?\\d+");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yy"),
            DateTimeFormatter.ofPattern("M-d-yyyy")
    );

    private ValueCoercion() {
    }

    /**
     * Strips {@code $} and {@code ,} and parses the leading decimal number, so {@code "12.5%"} is 12.5.
     */
    public static Double parseNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replace("$", "").replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        Matcher matcher = LEADING_NUMBER.matcher(cleaned);
        if (!matcher.find()) {
            return null;
        }
        try {
            double value = Double.parseDouble(matcher.group());
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Number for additive fields that default to zero.
     */
    public static double parseNumberOrZero(String raw) {
        Double value = parseNumber(raw);
        return value == null ? 0d : value;
    }

    public static Integer parseInteger(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = LEADING_INTEGER.matcher(raw.replace(",", "").trim());
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    public static LocalDate parseDate(String raw) {
        String value = emptyToNull(raw);
        if (value == null) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate date = tryParseDate(value, format);
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    private static LocalDate tryParseDate(String value, DateTimeFormatter format) {
        try {
            return LocalDate.parse(value, format);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    /**
     * Splits a comma separated cell, trimming entries and dropping blanks. Never returns null.
     */
    public static List<String> splitList(String raw) {
        List<String> items = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return items;
        }
        for (String part : raw.split(",")) {
            String item = part.trim();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    public static String emptyToNull(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
