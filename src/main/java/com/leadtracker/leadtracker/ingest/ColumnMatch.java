package com.leadtracker.leadtracker.ingest;

/**
 * Source header resolved for a canonical field and the tier that matched it.
 */
public record ColumnMatch(String header, String alias, MatchTier tier) {
}
