package com.williamcallahan.media_metadata_sync.scheduler;

import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers sync runs on the configured cron schedule
 * - Twice daily by default
 * - Disabled via app.settings.schedule-enabled=false
 *
 * @author William Callahan
 */
@Component
@Slf4j
public class MetadataSyncScheduler {

    private final MetadataSyncRunner runner;
    private final MetadataSyncProperties properties;

    public MetadataSyncScheduler(MetadataSyncRunner runner, MetadataSyncProperties properties) {
        this.runner = runner;
        this.properties = properties;
    }

    @Scheduled(cron = "${app.settings.schedule-cron:0 0 6,18 * * *}")
    public void scheduledSync() {
        if (!properties.getSettings().isScheduleEnabled()) {
            log.debug("Scheduled sync disabled via configuration.");
            return;
        }
        log.info("Scheduled sync triggered");
        runner.runOnce("schedule");
    }
}
