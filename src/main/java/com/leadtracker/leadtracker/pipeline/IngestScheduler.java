package com.leadtracker.leadtracker.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks up new delinquency exports on the cron expression in configuration.
 */
@Component
public class IngestScheduler {

    private static final Logger log = LoggerFactory.getLogger(IngestScheduler.class);

    private final IngestionService ingestionService;

    public IngestScheduler(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @Scheduled(cron = "${ingest.cron}")
    public void scheduledIngest() {
        List<IngestionResult> results = ingestionService.ingestPendingSources();
        int records = results.stream().mapToInt(IngestionResult::recordsExtracted).sum();
        log.info("Scheduled ingestion complete. files={}, records={}", results.size(), records);
    }
}
