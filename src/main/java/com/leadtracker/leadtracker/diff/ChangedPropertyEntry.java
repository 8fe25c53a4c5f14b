package com.leadtracker.leadtracker.diff;

import com.leadtracker.leadtracker.ingest.PropertyStatus;

/**
 * Report row for a changed account. Flags are computed at diff time and never stored on the record.
 */
public record ChangedPropertyEntry(
        String accountNumber,
        String ownerName,
        String propertyAddress,
        PropertyStatus previousStatus,
        PropertyStatus status,
        double previousPercentageDue,
        double percentageDue,
        boolean statusChanged,
        boolean percentageChanged,
        boolean escalation,
        boolean critical
) {

    public static ChangedPropertyEntry from(ChangedProperty change) {
        TransitionKind kind = change.statusChanged()
                ? TransitionKind.of(change.previousStatus(), change.current().status())
                : TransitionKind.ORDINARY;
        return new ChangedPropertyEntry(
                change.accountNumber(),
                change.current().ownerName(),
                change.current().propertyAddress(),
                change.previousStatus(),
                change.current().status(),
                change.previous().percentageDue(),
                change.current().percentageDue(),
                change.statusChanged(),
                change.percentageChanged(),
                kind == TransitionKind.ESCALATION,
                kind == TransitionKind.CRITICAL
        );
    }
}
