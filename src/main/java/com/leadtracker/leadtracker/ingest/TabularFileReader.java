package com.leadtracker.leadtracker.ingest;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads CSV and Excel exports into header-keyed rows. County exports carry two title rows above the
 * header, hand-made files usually start with it, so the header row is probed from the configured
 * candidates.
 */
@Component
public class TabularFileReader {

    private static final Logger log = LoggerFactory.getLogger(TabularFileReader.class);

    private final IngestProperties ingestProperties;

    public TabularFileReader(IngestProperties ingestProperties) {
        this.ingestProperties = ingestProperties;
    }

    public TabularData read(String fileName, byte[] content) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException(IngestConstants.MSG_FILE_NAME_REQUIRED);
        }
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException(IngestConstants.MSG_FILE_EMPTY.formatted(fileName));
        }

        List<List<String>> grid;
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(IngestConstants.FILE_EXT_CSV) || lower.endsWith(IngestConstants.FILE_EXT_TXT)) {
            grid = readCsvGrid(fileName, content);
        } else if (lower.endsWith(IngestConstants.FILE_EXT_XLSX) || lower.endsWith(IngestConstants.FILE_EXT_XLS)) {
            grid = readWorkbookGrid(fileName, content);
        } else {
            throw new IllegalArgumentException(IngestConstants.MSG_UNSUPPORTED_FILE.formatted(fileName));
        }

        TabularData data = toTabularData(fileName, grid);
        log.info("Read {}: header row {}, {} columns, {} data rows",
                fileName, data.headerRowIndex(), data.headers().size(), data.rows().size());
        return data;
    }

    /**
     * Parses every CSV line as a plain record; header handling is done on the grid so CSV and Excel
     * share one probing path.
     */
    private List<List<String>> readCsvGrid(String fileName, byte[] content) {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setTrim(true)
                .setIgnoreEmptyLines(false)
                .build();

        List<List<String>> grid = new ArrayList<>();
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(stripBom(content)), StandardCharsets.UTF_8);
             CSVParser parser = csvFormat.parse(reader)) {
            for (CSVRecord record : parser) {
                List<String> cells = new ArrayList<>(record.size());
                for (String value : record) {
                    cells.add(value == null ? "" : value);
                }
                grid.add(cells);
            }
        } catch (IOException | UncheckedIOException ex) {
            throw new IllegalStateException(IngestConstants.MSG_CSV_READ_FAILED.formatted(fileName), ex);
        }
        return grid;
    }

    /**
     * Reads the first sheet using display text, so numbers and dates come through as the export shows them.
     */
    private List<List<String>> readWorkbookGrid(String fileName, byte[] content) {
        DataFormatter formatter = new DataFormatter();
        List<List<String>> grid = new ArrayList<>();

        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IllegalStateException(IngestConstants.MSG_WORKBOOK_NO_SHEETS.formatted(fileName));
            }
            Sheet sheet = workbook.getSheetAt(0);
            int lastRow = sheet.getLastRowNum();
            for (int r = 0; r <= lastRow; r++) {
                Row row = sheet.getRow(r);
                List<String> cells = new ArrayList<>();
                if (row != null && row.getLastCellNum() > 0) {
                    for (int c = 0; c < row.getLastCellNum(); c++) {
                        Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                        cells.add(cell == null ? "" : formatter.formatCellValue(cell).trim());
                    }
                }
                grid.add(cells);
            }
        } catch (IOException ex) {
            throw new IllegalStateException(IngestConstants.MSG_WORKBOOK_READ_FAILED.formatted(fileName), ex);
        }
        return grid;
    }

    private TabularData toTabularData(String fileName, List<List<String>> grid) {
        int width = 0;
        for (List<String> row : grid) {
            width = Math.max(width, row.size());
        }

        List<Integer> candidates = ingestProperties.getHeaderRowCandidates();
        int headerRowIndex = -1;
        for (Integer candidate : candidates) {
            if (candidate != null && candidate >= 0 && candidate < grid.size() && isHeaderCandidate(grid, candidate)) {
                headerRowIndex = candidate;
                break;
            }
        }
        if (headerRowIndex < 0) {
            throw new IllegalStateException(IngestConstants.MSG_HEADER_NOT_FOUND.formatted(candidates, fileName));
        }

        List<String> headers = buildHeaders(grid.get(headerRowIndex), width);
        List<RawRow> rows = new ArrayList<>();
        for (int r = headerRowIndex + 1; r < grid.size(); r++) {
            List<String> cells = grid.get(r);
            if (isBlankRow(cells)) {
                continue;
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                values.put(headers.get(c), c < cells.size() ? cells.get(c) : "");
            }
            rows.add(new RawRow(r, values));
        }

        if (rows.isEmpty()) {
            throw new IllegalStateException(IngestConstants.MSG_NO_DATA_ROWS.formatted(fileName));
        }
        return new TabularData(headers, headerRowIndex, rows);
    }

    /**
     * Keeps header text as-is (trimmed) for alias matching; blank cells become positional placeholders
     * and repeated names get a numeric suffix so every column stays addressable.
     */
    private List<String> buildHeaders(List<String> headerCells, int width) {
        List<String> headers = new ArrayList<>(width);
        Map<String, Integer> seen = new LinkedHashMap<>();

        for (int c = 0; c < width; c++) {
            String header = c < headerCells.size() && headerCells.get(c) != null ? headerCells.get(c).trim() : "";
            if (header.isEmpty()) {
                header = IngestConstants.EMPTY_HEADER_PREFIX + c;
            }

            int count = seen.getOrDefault(header, 0);
            seen.put(header, count + 1);
            headers.add(count == 0 ? header : header + "_" + (count + 1));
        }
        return headers;
    }

    /**
     * A candidate row qualifies when it has content and every row above it is sparser (title rows).
     */
    private boolean isHeaderCandidate(List<List<String>> grid, int candidate) {
        int filled = countFilled(grid.get(candidate));
        if (filled == 0) {
            return false;
        }
        for (int r = 0; r < candidate; r++) {
            if (countFilled(grid.get(r)) >= filled) {
                return false;
            }
        }
        return true;
    }

    private int countFilled(List<String> cells) {
        int filled = 0;
        for (String cell : cells) {
            if (cell != null && !cell.isBlank()) {
                filled++;
            }
        }
        return filled;
    }

    private boolean isBlankRow(List<String> cells) {
        for (String cell : cells) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private byte[] stripBom(byte[] content) {
        if (content.length >= 3 && (content[0] & 0xFF) == 0xEF && (content[1] & 0xFF) == 0xBB && (content[2] & 0xFF) == 0xBF) {
            byte[] stripped = new byte[content.length - 3];
            System.arraycopy(content, 3, stripped, 0, stripped.length);
            return stripped;
        }
        return content;
    }
}
