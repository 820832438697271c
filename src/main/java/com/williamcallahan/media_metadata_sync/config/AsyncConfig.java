/**
 * Configuration for the library processing worker pool
 *
 * @author William Callahan
 *
 * Features:
 * - Bounded pool sized from app.workers.concurrency
 * - Unbounded queue so a whole batch can be submitted up front
 * - Custom thread naming for easier debugging
 */

package com.williamcallahan.media_metadata_sync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    /**
     * Creates the executor that runs per-item work
     *
     * @param properties application properties
     * @return executor with core and max size equal to the configured concurrency
     */
    @Bean("syncTaskExecutor")
    public ThreadPoolTaskExecutor syncTaskExecutor(MetadataSyncProperties properties) {
        int concurrency = Math.max(1, properties.getWorkers().getConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setThreadNamePrefix("sync-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        logger.info("Sync worker pool initialized with concurrency {}", concurrency);
        return executor;
    }
}
