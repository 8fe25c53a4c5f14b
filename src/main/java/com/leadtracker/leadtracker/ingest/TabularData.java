package com.leadtracker.leadtracker.ingest;

import java.util.List;

/**
 * Sheet content after header detection: header names, the sheet row they were found on and the
 * non-blank data rows below it.
 */
public record TabularData(List<String> headers, int headerRowIndex, List<RawRow> rows) {

    public TabularData {
        headers = headers == null ? List.of() : List.copyOf(headers);
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
