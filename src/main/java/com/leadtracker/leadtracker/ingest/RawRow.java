package com.leadtracker.leadtracker.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row of a source sheet: its zero-based sheet position and header to cell text values.
 */
public record RawRow(int rowIndex, Map<String, String> values) {

    public RawRow {
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Trimmed cell text for a header, empty when the header or value is absent.
     */
    public String value(String header) {
        if (header == null) {
            return "";
        }
        String value = values.get(header);
        return value == null ? "" : value.trim();
    }
}
