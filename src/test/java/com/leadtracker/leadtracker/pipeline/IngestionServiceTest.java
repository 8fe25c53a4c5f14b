package com.leadtracker.leadtracker.pipeline;

import com.leadtracker.leadtracker.diff.ChangedPropertyEntry;
import com.leadtracker.leadtracker.diff.ComparisonReport;
import com.leadtracker.leadtracker.diff.DiffReport;
import com.leadtracker.leadtracker.diff.RemovalResolution;
import com.leadtracker.leadtracker.diff.TransitionKind;
import com.leadtracker.leadtracker.ingest.IngestConstants;
import com.leadtracker.leadtracker.store.Snapshot;
import com.leadtracker.leadtracker.store.SnapshotStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class IngestionServiceTest {

    private static final String JANUARY = "delinquent_2025_01.csv";
    private static final String FEBRUARY = "delinquent_2025_02.csv";

    @Autowired
    private IngestionService ingestionService;

    @Autowired
    private SourceFileProvider sourceFileProvider;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetTables() {
        jdbcTemplate.execute("DELETE FROM " + IngestConstants.COMPARISON_REPORT_TABLE);
        jdbcTemplate.execute("DELETE FROM " + IngestConstants.SNAPSHOT_PROPERTY_TABLE);
        jdbcTemplate.execute("DELETE FROM " + IngestConstants.SNAPSHOT_TABLE);
        jdbcTemplate.execute("DELETE FROM " + IngestConstants.FORECLOSURE_RECORD_TABLE);
    }

    @Test
    void shouldReportComparisonUnavailableForFirstSnapshot() {
        IngestionResult result = ingest(JANUARY);

        assertFalse(result.comparisonAvailable());
        assertNull(result.previousSnapshotId());
        assertNull(result.summary());
        assertEquals(3, result.recordsExtracted());
        assertTrue(ingestionService.findLatestReport().isEmpty());
        assertEquals(SnapshotStatus.COMPLETED, ingestionService.listSnapshots().get(0).status());
    }

    @Test
    void shouldCompareConsecutiveExports() {
        IngestionResult first = ingest(JANUARY);
        IngestionResult second = ingest(FEBRUARY);

        assertTrue(second.comparisonAvailable());
        assertEquals(first.snapshotId(), second.previousSnapshotId());

        ComparisonReport report = ingestionService.findReport(second.snapshotId()).orElseThrow();
        assertEquals(JANUARY, report.previousFileName());
        DiffReport diff = report.diff();
        assertEquals(3, diff.summary().totalCurrent());
        assertEquals(3, diff.summary().totalPrevious());
        assertEquals(1, diff.summary().unchangedProperties());

        assertEquals(1, diff.newProperties().size());
        assertEquals("555", diff.newProperties().get(0).property().accountNumber());
        assertTrue(diff.newProperties().get(0).newLead());

        assertEquals(1, diff.removedProperties().size());
        assertEquals("777", diff.removedProperties().get(0).property().accountNumber());
        assertEquals(RemovalResolution.PRESUMED_DEAD_LEAD, diff.removedProperties().get(0).resolution());

        assertEquals(1, diff.changedProperties().size());
        ChangedPropertyEntry changed = diff.changedProperties().get(0);
        assertEquals("900", changed.accountNumber());
        assertEquals(1, diff.statusTransitions().size());
        assertEquals(TransitionKind.ESCALATION, diff.statusTransitions().get(0).kind());
        assertEquals(List.of("900"), diff.statusTransitions().get(0).sampleAccountNumbers());
    }

    @Test
    void shouldHoldRemovalUnresolvedWhenForeclosureRecordExists() {
        jdbcTemplate.update("INSERT INTO " + IngestConstants.FORECLOSURE_RECORD_TABLE
                + " (account_number, property_address) VALUES (?, ?)", null, "7 Elm Avenue");
        ingest(JANUARY);
        IngestionResult second = ingest(FEBRUARY);

        DiffReport diff = ingestionService.findReport(second.snapshotId()).orElseThrow().diff();
        assertEquals(RemovalResolution.UNRESOLVED, diff.removedProperties().get(0).resolution());
        assertEquals(0, diff.summary().deadLeads());
    }

    @Test
    void shouldIngestPendingSourcesOnceInNameOrder() {
        assertEquals(List.of(JANUARY, FEBRUARY), sourceFileProvider.listSourceNames());

        List<IngestionResult> results = ingestionService.ingestPendingSources();
        assertEquals(2, results.size());
        assertEquals(JANUARY, results.get(0).fileName());
        assertFalse(results.get(0).comparisonAvailable());
        assertTrue(results.get(1).comparisonAvailable());
        assertEquals(1, results.get(1).summary().escalations());

        assertTrue(ingestionService.ingestPendingSources().isEmpty());
    }

    @Test
    void shouldMarkFailedIngestionAsErrorAndSkipItForComparison() {
        IngestionResult first = ingest(JANUARY);

        assertThrows(IllegalArgumentException.class,
                () -> ingestionService.ingestFile("roll.pdf", "CAN\n1\n".getBytes(StandardCharsets.UTF_8)));
        assertThrows(IllegalStateException.class,
                () -> ingestionService.ingestFile("owners.csv",
                        "OWNER NAME\nAlice\n".getBytes(StandardCharsets.UTF_8)));

        List<Snapshot> snapshots = ingestionService.listSnapshots();
        assertEquals(3, snapshots.size());
        assertEquals(SnapshotStatus.ERROR, snapshots.get(0).status());
        assertEquals(SnapshotStatus.ERROR, snapshots.get(1).status());
        assertTrue(snapshots.get(0).errorMessage().contains("owners.csv"));

        IngestionResult second = ingest(FEBRUARY);
        assertEquals(first.snapshotId(), second.previousSnapshotId());
    }

    @Test
    void shouldStoreLongAccountNumbers() {
        String account = "R" + "0123456789".repeat(7);
        String csv = "CAN,ADDRSTRING,LEGALSTATUS\n" + account + ",1 Oak St,P\n";

        IngestionResult result = ingestionService.ingestFile("long.csv", csv.getBytes(StandardCharsets.UTF_8));

        assertEquals(1, result.recordsExtracted());
        assertEquals(SnapshotStatus.COMPLETED, ingestionService.listSnapshots().get(0).status());
        String stored = jdbcTemplate.queryForObject("SELECT account_number FROM "
                + IngestConstants.SNAPSHOT_PROPERTY_TABLE + " WHERE snapshot_id = ?", String.class, result.snapshotId());
        assertEquals(account, stored);
    }

    @Test
    void shouldRejectBlankFileNameWithoutCreatingSnapshot() {
        assertThrows(IllegalArgumentException.class, () -> ingestionService.ingestFile(" ", new byte[] {1}));
        assertTrue(ingestionService.listSnapshots().isEmpty());
    }

    @Test
    void shouldRegenerateLatestComparison() {
        ingest(JANUARY);
        assertTrue(ingestionService.regenerateLatestComparison().isEmpty());

        IngestionResult second = ingest(FEBRUARY);
        ComparisonReport stored = ingestionService.findReport(second.snapshotId()).orElseThrow();
        ComparisonReport regenerated = ingestionService.regenerateLatestComparison().orElseThrow();

        assertEquals(second.snapshotId(), regenerated.currentSnapshotId());
        assertEquals(stored.diff(), regenerated.diff());
        assertEquals(regenerated, ingestionService.findLatestReport().orElseThrow());
    }

    private IngestionResult ingest(String fileName) {
        SourceFile sourceFile = sourceFileProvider.fetch(fileName);
        return ingestionService.ingestFile(sourceFile.fileName(), sourceFile.content());
    }
}
