/**
 * Main application class for Media Metadata Sync
 *
 * @author William Callahan
 *
 * Features:
 * - Runs as a non-web Spring Boot process driven by schedule or startup trigger
 * - Enables scheduling for the twice-daily sync trigger
 */

package com.williamcallahan.media_metadata_sync;

import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.scheduler.MetadataSyncRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(MetadataSyncProperties.class)
@EnableScheduling
public class MediaMetadataSyncApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(MediaMetadataSyncApplication.class);

    private final MetadataSyncProperties properties;
    private final MetadataSyncRunner metadataSyncRunner;

    public MediaMetadataSyncApplication(MetadataSyncProperties properties, MetadataSyncRunner metadataSyncRunner) {
        this.properties = properties;
        this.metadataSyncRunner = metadataSyncRunner;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(MediaMetadataSyncApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (properties.getSettings().isDryRun()) {
            log.info("[Dry Run] Dry run enabled - no cache, metadata or asset writes will be performed");
        }
        if (!properties.getSettings().isRunOnStartup()) {
            log.info("Startup run disabled; waiting for schedule '{}' (enabled={})",
                properties.getSettings().getScheduleCron(), properties.getSettings().isScheduleEnabled());
            return;
        }
        log.info("Startup run requested - starting metadata sync");
        metadataSyncRunner.runOnce("startup");
    }
}
