package com.leadtracker.leadtracker.pipeline;

import com.leadtracker.leadtracker.diff.ComparisonReport;
import com.leadtracker.leadtracker.ingest.IngestConstants;
import com.leadtracker.leadtracker.store.Snapshot;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;

/**
 * Upload and on-demand ingestion endpoints plus read access to snapshots and comparison reports.
 */
@RestController
@RequestMapping("/api")
public class IngestController {

    private final IngestionService ingestionService;

    public IngestController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping(value = "/ingest/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestionResult> upload(@RequestParam("file") MultipartFile file) {
        try {
            return ResponseEntity.ok(ingestionService.ingestFile(file.getOriginalFilename(), file.getBytes()));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (IOException | RuntimeException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to ingest uploaded file", ex);
        }
    }

    /**
     * Ingests every configured source file that has not been ingested yet.
     */
    @PostMapping("/ingest/load")
    public ResponseEntity<List<IngestionResult>> loadPending() {
        return ResponseEntity.ok(ingestionService.ingestPendingSources());
    }

    @GetMapping("/snapshots")
    public ResponseEntity<List<Snapshot>> listSnapshots() {
        return ResponseEntity.ok(ingestionService.listSnapshots());
    }

    @GetMapping("/reports/latest")
    public ResponseEntity<ComparisonReport> latestReport() {
        return ingestionService.findLatestReport()
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, IngestConstants.MSG_NO_REPORT));
    }

    @GetMapping("/reports/{snapshotId}")
    public ResponseEntity<ComparisonReport> report(@PathVariable long snapshotId) {
        return ingestionService.findReport(snapshotId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, IngestConstants.MSG_REPORT_NOT_FOUND.formatted(snapshotId)));
    }

    /**
     * Rebuilds the report for the latest completed snapshot against the one before it.
     */
    @PostMapping("/reports/generate")
    public ResponseEntity<ComparisonReport> generateReport() {
        return ingestionService.regenerateLatestComparison()
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, IngestConstants.MSG_NEED_TWO_SNAPSHOTS));
    }
}
