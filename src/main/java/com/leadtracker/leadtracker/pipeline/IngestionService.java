package com.leadtracker.leadtracker.pipeline;

import com.leadtracker.leadtracker.diff.ComparisonReport;
import com.leadtracker.leadtracker.diff.DiffReport;
import com.leadtracker.leadtracker.diff.ForeclosureSignalSource;
import com.leadtracker.leadtracker.diff.SnapshotComparator;
import com.leadtracker.leadtracker.diff.SnapshotComparison;
import com.leadtracker.leadtracker.diff.TransitionClassifier;
import com.leadtracker.leadtracker.ingest.CanonicalField;
import com.leadtracker.leadtracker.ingest.CanonicalProperty;
import com.leadtracker.leadtracker.ingest.ColumnMap;
import com.leadtracker.leadtracker.ingest.ExtractionDiagnostics;
import com.leadtracker.leadtracker.ingest.ExtractionResult;
import com.leadtracker.leadtracker.ingest.IngestConstants;
import com.leadtracker.leadtracker.ingest.RecordExtractor;
import com.leadtracker.leadtracker.ingest.SchemaResolver;
import com.leadtracker.leadtracker.ingest.TabularData;
import com.leadtracker.leadtracker.ingest.TabularFileReader;
import com.leadtracker.leadtracker.store.ComparisonReportRepository;
import com.leadtracker.leadtracker.store.Snapshot;
import com.leadtracker.leadtracker.store.SnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Orchestrates one ingestion: read the file, resolve its columns, extract canonical records, persist
 * them as a snapshot and compare against the previous completed snapshot.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final TabularFileReader tabularFileReader;
    private final SchemaResolver schemaResolver;
    private final RecordExtractor recordExtractor;
    private final SnapshotComparator snapshotComparator;
    private final TransitionClassifier transitionClassifier;
    private final SnapshotRepository snapshotRepository;
    private final ComparisonReportRepository comparisonReportRepository;
    private final ForeclosureSignalSource foreclosureSignalSource;
    private final SourceFileProvider sourceFileProvider;

    public IngestionService(TabularFileReader tabularFileReader,
                            SchemaResolver schemaResolver,
                            RecordExtractor recordExtractor,
                            SnapshotComparator snapshotComparator,
                            TransitionClassifier transitionClassifier,
                            SnapshotRepository snapshotRepository,
                            ComparisonReportRepository comparisonReportRepository,
                            ForeclosureSignalSource foreclosureSignalSource,
                            SourceFileProvider sourceFileProvider) {
        this.tabularFileReader = tabularFileReader;
        this.schemaResolver = schemaResolver;
        this.recordExtractor = recordExtractor;
        this.snapshotComparator = snapshotComparator;
        this.transitionClassifier = transitionClassifier;
        this.snapshotRepository = snapshotRepository;
        this.comparisonReportRepository = comparisonReportRepository;
        this.foreclosureSignalSource = foreclosureSignalSource;
        this.sourceFileProvider = sourceFileProvider;
    }

    /**
     * Ingests one file. A failure before the snapshot completes leaves it in ERROR and is rethrown.
     * Without an earlier completed snapshot no report is produced.
     */
    public IngestionResult ingestFile(String fileName, byte[] content) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException(IngestConstants.MSG_FILE_NAME_REQUIRED);
        }

        long snapshotId = snapshotRepository.createSnapshot(fileName);
        log.info("Ingesting {} as snapshot {}", fileName, snapshotId);

        List<CanonicalProperty> properties;
        ExtractionDiagnostics diagnostics;
        try {
            TabularData data = tabularFileReader.read(fileName, content);
            ColumnMap columnMap = schemaResolver.resolve(data.headers());
            for (CanonicalField field : columnMap.unresolvedRequired()) {
                log.warn("Required field {} not found in headers of {}", field.key(), fileName);
            }

            ExtractionResult extraction = recordExtractor.extract(data.rows(), columnMap);
            properties = extraction.properties();
            diagnostics = extraction.diagnostics();
            if (diagnostics.rowsDroppedMissingAccount() > 0) {
                log.warn("{}: {} row(s) dropped without an account number",
                        fileName, diagnostics.rowsDroppedMissingAccount());
            }
            if (properties.isEmpty()) {
                throw new IllegalStateException(IngestConstants.MSG_NO_RECORDS_EXTRACTED.formatted(fileName));
            }

            snapshotRepository.saveProperties(snapshotId, properties);
            snapshotRepository.markCompleted(snapshotId, properties.size(), diagnostics.rowsRead(),
                    diagnostics.rowsDroppedMissingAccount());
        } catch (RuntimeException ex) {
            snapshotRepository.markError(snapshotId, ex.getMessage());
            log.error("Ingestion of {} failed; snapshot {} marked ERROR", fileName, snapshotId, ex);
            throw ex;
        }

        Optional<Snapshot> previous = snapshotRepository.findLatestCompletedBefore(snapshotId);
        if (previous.isEmpty()) {
            log.info("Snapshot {} completed with {} records; comparison not available", snapshotId, properties.size());
            return new IngestionResult(snapshotId, fileName, diagnostics.rowsRead(), properties.size(),
                    diagnostics.rowsDroppedMissingAccount(), diagnostics.unresolvedRequiredFields(),
                    false, null, null);
        }

        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Ingestion of " + fileName + " cancelled before comparison");
        }

        ComparisonReport report = compareAndStore(snapshotId, fileName, properties, previous.get());
        return new IngestionResult(snapshotId, fileName, diagnostics.rowsRead(), properties.size(),
                diagnostics.rowsDroppedMissingAccount(), diagnostics.unresolvedRequiredFields(),
                true, report.previousSnapshotId(), report.diff().summary());
    }

    /**
     * Ingests every source file that has no completed snapshot yet, oldest name first. A file that
     * fails is logged and left for the next run.
     */
    public List<IngestionResult> ingestPendingSources() {
        List<IngestionResult> results = new ArrayList<>();
        for (String fileName : sourceFileProvider.listSourceNames()) {
            if (snapshotRepository.hasCompletedSnapshotForFile(fileName)) {
                log.debug("Skipping {}; already ingested", fileName);
                continue;
            }
            try {
                SourceFile sourceFile = sourceFileProvider.fetch(fileName);
                results.add(ingestFile(sourceFile.fileName(), sourceFile.content()));
            } catch (CancellationException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                log.warn("Skipping source file {}: {}", fileName, ex.getMessage());
            }
        }
        return results;
    }

    /**
     * Recomputes the report for the latest completed snapshot against the one before it.
     * Empty when fewer than two completed snapshots exist.
     */
    public Optional<ComparisonReport> regenerateLatestComparison() {
        List<Snapshot> latest = snapshotRepository.findLatestCompleted(2);
        if (latest.size() < 2) {
            return Optional.empty();
        }
        Snapshot current = latest.get(0);
        List<CanonicalProperty> currentProperties = snapshotRepository.loadProperties(current.snapshotId());
        return Optional.of(compareAndStore(current.snapshotId(), current.fileName(), currentProperties, latest.get(1)));
    }

    public List<Snapshot> listSnapshots() {
        return snapshotRepository.listSnapshots();
    }

    public Optional<ComparisonReport> findReport(long snapshotId) {
        return comparisonReportRepository.findByCurrentSnapshotId(snapshotId);
    }

    public Optional<ComparisonReport> findLatestReport() {
        return comparisonReportRepository.findLatest();
    }

    private ComparisonReport compareAndStore(long currentSnapshotId, String currentFileName,
                                             List<CanonicalProperty> currentProperties, Snapshot previous) {
        List<CanonicalProperty> previousProperties = snapshotRepository.loadProperties(previous.snapshotId());
        SnapshotComparison comparison = snapshotComparator.compare(currentProperties, previousProperties);
        DiffReport diff = transitionClassifier.classify(comparison, foreclosureSignalSource.load());

        ComparisonReport report = new ComparisonReport(
                currentSnapshotId,
                previous.snapshotId(),
                currentFileName,
                previous.fileName(),
                Instant.now(),
                diff
        );
        comparisonReportRepository.save(report);
        log.info("Stored comparison {} -> {}: new={}, removed={}, statusChanges={}",
                previous.snapshotId(), currentSnapshotId, diff.summary().newProperties(),
                diff.summary().removedProperties(), diff.summary().statusChanges());
        return report;
    }
}
