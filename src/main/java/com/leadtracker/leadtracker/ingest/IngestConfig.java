package com.leadtracker.leadtracker.ingest;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Enables binding of ingestion configuration properties and provides the extraction worker pool.
 */
@Configuration
@EnableConfigurationProperties(IngestProperties.class)
public class IngestConfig {

    /**
     * Bounded pool used to extract row chunks in parallel.
     */
    @Bean(name = "extractionExecutor")
    public ThreadPoolTaskExecutor extractionExecutor(IngestProperties ingestProperties) {
        int threads = Math.max(1, ingestProperties.getExtractionThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("extract-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
