package com.leadtracker.leadtracker.diff;

import com.leadtracker.leadtracker.ingest.CanonicalProperty;

import java.util.List;

/**
 * Account-keyed partition of two snapshots. Every distinct current account is in exactly one of
 * new, unchanged or changed; every distinct previous account not in current is removed.
 */
public record SnapshotComparison(
        List<CanonicalProperty> newProperties,
        List<CanonicalProperty> removedProperties,
        List<CanonicalProperty> unchangedProperties,
        List<ChangedProperty> changedProperties,
        int duplicateCurrentAccounts,
        int duplicatePreviousAccounts
) {

    public SnapshotComparison {
        newProperties = newProperties == null ? List.of() : List.copyOf(newProperties);
        removedProperties = removedProperties == null ? List.of() : List.copyOf(removedProperties);
        unchangedProperties = unchangedProperties == null ? List.of() : List.copyOf(unchangedProperties);
        changedProperties = changedProperties == null ? List.of() : List.copyOf(changedProperties);
    }

    public int totalCurrent() {
        return newProperties.size() + unchangedProperties.size() + changedProperties.size();
    }

    public int totalPrevious() {
        return removedProperties.size() + unchangedProperties.size() + changedProperties.size();
    }
}
