package com.leadtracker.leadtracker.diff;

import com.leadtracker.leadtracker.ingest.PropertyStatus;

import java.util.List;

/**
 * Count of accounts that moved between two statuses, with a capped sample of their account numbers.
 */
public record StatusTransition(
        PropertyStatus from,
        PropertyStatus to,
        TransitionKind kind,
        int count,
        List<String> sampleAccountNumbers
) {

    public StatusTransition {
        sampleAccountNumbers = sampleAccountNumbers == null ? List.of() : List.copyOf(sampleAccountNumbers);
    }
}
