package com.leadtracker.leadtracker.ingest;

/**
 * Header match strength, strongest first.
 */
public enum MatchTier {
    EXACT,
    NORMALIZED,
    SUBSTRING
}
