package com.leadtracker.leadtracker.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable canonical field to source header mapping built once per file.
 */
public final class ColumnMap {

    private final List<String> headers;
    private final Map<CanonicalField, ColumnMatch> matches;

    public ColumnMap(List<String> headers, Map<CanonicalField, ColumnMatch> matches) {
        this.headers = headers == null ? List.of() : List.copyOf(headers);
        EnumMap<CanonicalField, ColumnMatch> copy = new EnumMap<>(CanonicalField.class);
        if (matches != null) {
            copy.putAll(matches);
        }
        this.matches = Collections.unmodifiableMap(copy);
    }

    /**
     * Headers of the file in source order, including blank-cell placeholders.
     */
    public List<String> headers() {
        return headers;
    }

    public Optional<ColumnMatch> match(CanonicalField field) {
        return Optional.ofNullable(matches.get(field));
    }

    /**
     * Returns the resolved source header for a field, or {@code null} when unresolved.
     */
    public String header(CanonicalField field) {
        ColumnMatch match = matches.get(field);
        return match == null ? null : match.header();
    }

    public boolean isResolved(CanonicalField field) {
        return matches.containsKey(field);
    }

    public Map<CanonicalField, ColumnMatch> matches() {
        return matches;
    }

    /**
     * Required fields that did not resolve to any header, in declaration order.
     */
    public List<CanonicalField> unresolvedRequired() {
        List<CanonicalField> missing = new ArrayList<>();
        for (CanonicalField field : CanonicalField.values()) {
            if (CanonicalField.REQUIRED.contains(field) && !matches.containsKey(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    @Override
    public String toString() {
        return "ColumnMap" + matches;
    }
}
