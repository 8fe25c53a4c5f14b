package com.leadtracker.leadtracker.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves canonical fields to source headers with a layered heuristic: exact, normalized, then
 * substring match. The first match for a field is final; a weaker tier is only tried when every
 * alias failed the stronger one. Substring matches never take a header that some field matched
 * exactly or after normalization.
 */
@Component
public class SchemaResolver {

    private static final Logger log = LoggerFactory.getLogger(SchemaResolver.class);

    /**
     * Builds the column map for one header row. Never throws; unresolved fields are simply absent.
     */
    public ColumnMap resolve(List<String> headers) {
        List<String> candidates = new ArrayList<>();
        if (headers != null) {
            for (String header : headers) {
                candidates.add(header == null ? "" : header.trim());
            }
        }

        Map<CanonicalField, ColumnMatch> matches = new EnumMap<>(CanonicalField.class);
        Set<String> claimed = new HashSet<>();
        for (CanonicalField field : CanonicalField.values()) {
            ColumnMatch match = resolveStrong(field, candidates);
            if (match != null) {
                matches.put(field, match);
                claimed.add(match.header());
            }
        }
        for (CanonicalField field : CanonicalField.values()) {
            if (matches.containsKey(field) || field.exactOnly()) {
                continue;
            }
            ColumnMatch match = matchSubstring(field, candidates, claimed);
            if (match != null) {
                matches.put(field, match);
            }
        }
        for (Map.Entry<CanonicalField, ColumnMatch> entry : matches.entrySet()) {
            ColumnMatch match = entry.getValue();
            log.debug("Matched \"{}\" -> {} ({} on alias \"{}\")",
                    match.header(), entry.getKey().key(), match.tier(), match.alias());
        }

        ColumnMap columnMap = new ColumnMap(candidates, matches);
        List<CanonicalField> missing = columnMap.unresolvedRequired();
        if (missing.contains(CanonicalField.ACCOUNT_NUMBER)) {
            log.warn("No header resolved to accountNumber; extraction will rely on the CAN fallback scan. headers={}",
                    candidates);
        }
        return columnMap;
    }

    private ColumnMatch resolveStrong(CanonicalField field, List<String> headers) {
        ColumnMatch exact = matchExact(field, headers);
        if (exact != null || field.exactOnly()) {
            return exact;
        }
        return matchNormalized(field, headers);
    }

    private ColumnMatch matchExact(CanonicalField field, List<String> headers) {
        for (String alias : field.aliases()) {
            for (String header : headers) {
                if (HeaderText.isPlaceholder(header)) {
                    continue;
                }
                if (header.toLowerCase(Locale.ROOT).equals(alias)) {
                    return new ColumnMatch(header, alias, MatchTier.EXACT);
                }
            }
        }
        return null;
    }

    private ColumnMatch matchNormalized(CanonicalField field, List<String> headers) {
        for (String alias : field.aliases()) {
            String normalizedAlias = HeaderText.normalize(alias);
            if (normalizedAlias.isEmpty()) {
                continue;
            }
            for (String header : headers) {
                if (HeaderText.isPlaceholder(header)) {
                    continue;
                }
                if (HeaderText.normalize(header).equals(normalizedAlias)) {
                    return new ColumnMatch(header, alias, MatchTier.NORMALIZED);
                }
            }
        }
        return null;
    }

    /**
     * Takes the first unclaimed header, in file order, that contains or is contained in one of the
     * field's aliases.
     */
    private ColumnMatch matchSubstring(CanonicalField field, List<String> headers, Set<String> claimed) {
        for (String header : headers) {
            if (HeaderText.isPlaceholder(header) || claimed.contains(header)) {
                continue;
            }
            String normalizedHeader = HeaderText.normalize(header);
            if (normalizedHeader.isEmpty()) {
                continue;
            }
            for (String alias : field.aliases()) {
                String normalizedAlias = HeaderText.normalize(alias);
                if (normalizedAlias.isEmpty()) {
                    continue;
                }
                if (normalizedHeader.contains(normalizedAlias) || normalizedAlias.contains(normalizedHeader)) {
                    return new ColumnMatch(header, alias, MatchTier.SUBSTRING);
                }
            }
        }
        return null;
    }
}
