package com.leadtracker.leadtracker.diff;

import java.util.List;

/**
 * Classified outcome of a snapshot comparison. Sample lists are sorted by account number and capped;
 * the summary always carries the full counts.
 */
public record DiffReport(
        DiffSummary summary,
        List<StatusTransition> statusTransitions,
        List<NewPropertyEntry> newProperties,
        List<RemovedPropertyEntry> removedProperties,
        List<ChangedPropertyEntry> changedProperties
) {

    public DiffReport {
        statusTransitions = statusTransitions == null ? List.of() : List.copyOf(statusTransitions);
        newProperties = newProperties == null ? List.of() : List.copyOf(newProperties);
        removedProperties = removedProperties == null ? List.of() : List.copyOf(removedProperties);
        changedProperties = changedProperties == null ? List.of() : List.copyOf(changedProperties);
    }
}
