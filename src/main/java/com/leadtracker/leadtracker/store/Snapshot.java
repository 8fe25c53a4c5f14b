package com.leadtracker.leadtracker.store;

import java.time.Instant;

/**
 * One ingested source file. Only {@link SnapshotStatus#COMPLETED} snapshots take part in comparisons.
 */
public record Snapshot(
        long snapshotId,
        String fileName,
        Instant createdAt,
        SnapshotStatus status,
        int propertyCount,
        int rowsRead,
        int rowsDropped,
        String errorMessage
) {
}
