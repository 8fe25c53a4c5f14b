package com.leadtracker.leadtracker.diff;

/**
 * Untruncated counts of a comparison. Totals count distinct accounts after duplicate resolution.
 */
public record DiffSummary(
        int totalCurrent,
        int totalPrevious,
        int newProperties,
        int newLeads,
        int removedProperties,
        int deadLeads,
        int unchangedProperties,
        int statusChanges,
        int percentageChanges,
        int escalations,
        int criticalChanges,
        int duplicateCurrentAccounts,
        int duplicatePreviousAccounts
) {
}
