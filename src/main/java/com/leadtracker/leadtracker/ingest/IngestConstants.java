package com.leadtracker.leadtracker.ingest;

/**
 * Shared constants for the property ingestion flow.
 */
public final class IngestConstants {

    private IngestConstants() {
    }

    public static final String DEFAULT_SOURCE_PATTERN = "file:./inbox/*.*";
    public static final String DEFAULT_CRON = "0 0 2 * * *";
    public static final int DEFAULT_SAMPLE_SIZE = 100;
    public static final int DEFAULT_EXTRACTION_CHUNK_SIZE = 5000;
    public static final int DEFAULT_EXTRACTION_THREADS = 4;
    public static final int DEFAULT_INSERT_BATCH_SIZE = 500;
    public static final int DEFAULT_EXPORT_HEADER_ROW = 2;
    public static final int DEFAULT_FIRST_HEADER_ROW = 0;

    public static final String UNKNOWN_VALUE = "Unknown";
    public static final String EMPTY_HEADER_PREFIX = "__EMPTY_";
    public static final String LEGAL_STATUS_HEADER = "LEGALSTATUS";
    public static final String ACCOUNT_FALLBACK_TOKEN = "CAN";
    public static final String ADDRESS_STRING_FALLBACK_TOKEN = "ADDRSTRING";
    public static final String ADDRESS_FALLBACK_TOKEN = "ADDRESS";
    public static final String DEAD_LEAD_REASON = "Property no longer on delinquent list";
    public static final String AWAITING_SIGNAL_REASON = "Matched a foreclosure or sale record";

    public static final String FILE_EXT_CSV = ".csv";
    public static final String FILE_EXT_TXT = ".txt";
    public static final String FILE_EXT_XLSX = ".xlsx";
    public static final String FILE_EXT_XLS = ".xls";

    public static final String SNAPSHOT_TABLE = "property_snapshot";
    public static final String SNAPSHOT_PROPERTY_TABLE = "snapshot_property";
    public static final String COMPARISON_REPORT_TABLE = "comparison_report";
    public static final String FORECLOSURE_RECORD_TABLE = "foreclosure_record";

    public static final String MSG_FILE_NAME_REQUIRED = "File name is required";
    public static final String MSG_FILE_EMPTY = "Uploaded file is empty: %s";
    public static final String MSG_UNSUPPORTED_FILE = "Unsupported file type: %s (expected .csv, .xlsx or .xls)";
    public static final String MSG_HEADER_NOT_FOUND = "No header row found in rows %s of %s";
    public static final String MSG_CSV_READ_FAILED = "Unable to parse CSV content of %s";
    public static final String MSG_WORKBOOK_READ_FAILED = "Unable to read workbook %s";
    public static final String MSG_WORKBOOK_NO_SHEETS = "Workbook has no sheets: %s";
    public static final String MSG_NO_DATA_ROWS = "File has no data rows: %s";
    public static final String MSG_NO_RECORDS_EXTRACTED = "No property records could be extracted from %s";
    public static final String MSG_SNAPSHOT_ID_NOT_GENERATED = "Unable to generate unique snapshot id";
    public static final String MSG_REPORT_NOT_FOUND = "No comparison report for snapshot %d";
    public static final String MSG_NO_REPORT = "No comparison report available";
    public static final String MSG_REPORT_SERIALIZE_FAILED = "Unable to serialize comparison report for snapshot %d";
    public static final String MSG_REPORT_READ_FAILED = "Unable to read comparison report for snapshot %d";
    public static final String MSG_SOURCE_LIST_FAILED = "Failed to list source files from pattern: %s";
    public static final String MSG_SOURCE_READ_FAILED = "Failed to read source file: %s";
    public static final String MSG_NEED_TWO_SNAPSHOTS = "Need at least two completed snapshots to generate a comparison";
}
