package com.leadtracker.leadtracker.ingest;

import java.util.List;

/**
 * Extracted canonical records plus the diagnostics of the extraction run.
 */
public record ExtractionResult(List<CanonicalProperty> properties, ExtractionDiagnostics diagnostics) {

    public ExtractionResult {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }
}
