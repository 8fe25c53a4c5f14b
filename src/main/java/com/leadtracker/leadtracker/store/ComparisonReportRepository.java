package com.leadtracker.leadtracker.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadtracker.leadtracker.diff.ComparisonReport;
import com.leadtracker.leadtracker.ingest.IngestConstants;
import jakarta.annotation.PostConstruct;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Stores comparison reports as JSON documents keyed by the current snapshot id.
 */
@Repository
public class ComparisonReportRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public ComparisonReportRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void initializeSchema() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + IngestConstants.COMPARISON_REPORT_TABLE + " ("
                + "current_snapshot_id BIGINT PRIMARY KEY, "
                + "previous_snapshot_id BIGINT NOT NULL, "
                + "generated_at BIGINT NOT NULL, "
                + "report_json TEXT NOT NULL"
                + ")");
    }

    /**
     * Saves a report, replacing any earlier report for the same current snapshot.
     */
    public void save(ComparisonReport report) {
        String json;
        try {
            json = objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException(
                    IngestConstants.MSG_REPORT_SERIALIZE_FAILED.formatted(report.currentSnapshotId()), ex);
        }

        jdbcTemplate.update("DELETE FROM " + IngestConstants.COMPARISON_REPORT_TABLE + " WHERE current_snapshot_id = ?",
                report.currentSnapshotId());
        jdbcTemplate.update("INSERT INTO " + IngestConstants.COMPARISON_REPORT_TABLE
                        + " (current_snapshot_id, previous_snapshot_id, generated_at, report_json) VALUES (?, ?, ?, ?)",
                report.currentSnapshotId(),
                report.previousSnapshotId(),
                report.generatedAt().toEpochMilli(),
                json);
    }

    public Optional<ComparisonReport> findByCurrentSnapshotId(long snapshotId) {
        List<String> rows = jdbcTemplate.queryForList(
                "SELECT report_json FROM " + IngestConstants.COMPARISON_REPORT_TABLE + " WHERE current_snapshot_id = ?",
                String.class,
                snapshotId
        );
        return rows.stream().findFirst().map(json -> readReport(snapshotId, json));
    }

    public Optional<ComparisonReport> findLatest() {
        List<Long> ids = jdbcTemplate.queryForList(
                "SELECT current_snapshot_id FROM " + IngestConstants.COMPARISON_REPORT_TABLE
                        + " ORDER BY current_snapshot_id DESC LIMIT 1",
                Long.class
        );
        return ids.stream().findFirst().flatMap(this::findByCurrentSnapshotId);
    }

    private ComparisonReport readReport(long snapshotId, String json) {
        try {
            return objectMapper.readValue(json, ComparisonReport.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException(IngestConstants.MSG_REPORT_READ_FAILED.formatted(snapshotId), ex);
        }
    }
}
