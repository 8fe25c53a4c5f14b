package com.leadtracker.leadtracker.ingest;

import java.util.List;

/**
 * Row-level counters produced alongside extracted records.
 */
public record ExtractionDiagnostics(
        int rowsRead,
        int recordsExtracted,
        int rowsDroppedMissingAccount,
        int accountNumbersFromFallback,
        int unknownStatusRows,
        List<String> unresolvedRequiredFields
) {

    public ExtractionDiagnostics {
        unresolvedRequiredFields = unresolvedRequiredFields == null ? List.of() : List.copyOf(unresolvedRequiredFields);
    }

    public static ExtractionDiagnostics empty(List<String> unresolvedRequiredFields) {
        return new ExtractionDiagnostics(0, 0, 0, 0, 0, unresolvedRequiredFields);
    }

    /**
     * Sums the counters of two chunks of the same file.
     */
    public ExtractionDiagnostics plus(ExtractionDiagnostics other) {
        return new ExtractionDiagnostics(
                rowsRead + other.rowsRead,
                recordsExtracted + other.recordsExtracted,
                rowsDroppedMissingAccount + other.rowsDroppedMissingAccount,
                accountNumbersFromFallback + other.accountNumbersFromFallback,
                unknownStatusRows + other.unknownStatusRows,
                unresolvedRequiredFields
        );
    }
}
