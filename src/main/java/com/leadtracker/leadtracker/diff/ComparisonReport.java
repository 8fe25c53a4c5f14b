package com.leadtracker.leadtracker.diff;

import java.time.Instant;

/**
 * Persisted comparison of one completed snapshot against the completed snapshot before it.
 */
public record ComparisonReport(
        long currentSnapshotId,
        long previousSnapshotId,
        String currentFileName,
        String previousFileName,
        Instant generatedAt,
        DiffReport diff
) {
}
