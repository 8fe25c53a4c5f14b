package com.leadtracker.leadtracker.ingest;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Externalized ingestion configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {

    private String sourcePattern = IngestConstants.DEFAULT_SOURCE_PATTERN;
    private String cron = IngestConstants.DEFAULT_CRON;
    private int sampleSize = IngestConstants.DEFAULT_SAMPLE_SIZE;
    private int extractionChunkSize = IngestConstants.DEFAULT_EXTRACTION_CHUNK_SIZE;
    private int extractionThreads = IngestConstants.DEFAULT_EXTRACTION_THREADS;
    private int insertBatchSize = IngestConstants.DEFAULT_INSERT_BATCH_SIZE;
    private List<Integer> headerRowCandidates = new ArrayList<>(List.of(
            IngestConstants.DEFAULT_EXPORT_HEADER_ROW,
            IngestConstants.DEFAULT_FIRST_HEADER_ROW
    ));

    public String getSourcePattern() {
        return sourcePattern;
    }

    public void setSourcePattern(String sourcePattern) {
        this.sourcePattern = sourcePattern;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public int getExtractionChunkSize() {
        return extractionChunkSize;
    }

    public void setExtractionChunkSize(int extractionChunkSize) {
        this.extractionChunkSize = extractionChunkSize;
    }

    public int getExtractionThreads() {
        return extractionThreads;
    }

    public void setExtractionThreads(int extractionThreads) {
        this.extractionThreads = extractionThreads;
    }

    public int getInsertBatchSize() {
        return insertBatchSize;
    }

    public void setInsertBatchSize(int insertBatchSize) {
        this.insertBatchSize = insertBatchSize;
    }

    public List<Integer> getHeaderRowCandidates() {
        return headerRowCandidates;
    }

    public void setHeaderRowCandidates(List<Integer> headerRowCandidates) {
        this.headerRowCandidates = headerRowCandidates;
    }
}
