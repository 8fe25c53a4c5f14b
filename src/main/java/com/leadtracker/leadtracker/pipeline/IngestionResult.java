package com.leadtracker.leadtracker.pipeline;

import com.leadtracker.leadtracker.diff.DiffSummary;

import java.util.List;

/**
 * API/service response for one ingested file. {@code summary} is null when there was no earlier
 * completed snapshot to compare against.
 */
public record IngestionResult(
        long snapshotId,
        String fileName,
        int rowsRead,
        int recordsExtracted,
        int rowsDropped,
        List<String> unresolvedRequiredFields,
        boolean comparisonAvailable,
        Long previousSnapshotId,
        DiffSummary summary
) {

    public IngestionResult {
        unresolvedRequiredFields = unresolvedRequiredFields == null ? List.of() : List.copyOf(unresolvedRequiredFields);
    }
}
