/**
 * Runs one full synchronization pass over the configured libraries
 *
 * @author William Callahan
 *
 * Features:
 * - Rejects a run requested while another is active
 * - Libraries processed one after another, items in parallel within each
 * - Orphan reconciliation after all libraries, never alongside item processing
 * - Reconciliation skipped when any library could not be listed in full
 */
package com.williamcallahan.media_metadata_sync.scheduler;

import com.williamcallahan.media_metadata_sync.client.LibraryListing;
import com.williamcallahan.media_metadata_sync.client.MediaServerClient;
import com.williamcallahan.media_metadata_sync.client.MediaServerException;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.MediaItem;
import com.williamcallahan.media_metadata_sync.service.cleanup.LiveItemIndex;
import com.williamcallahan.media_metadata_sync.service.cleanup.OrphanReconciler;
import com.williamcallahan.media_metadata_sync.service.library.LibraryProcessingService;
import com.williamcallahan.media_metadata_sync.types.LibraryRunSummary;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import com.williamcallahan.media_metadata_sync.types.ReconciliationSummary;
import com.williamcallahan.media_metadata_sync.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
@Component
public class MetadataSyncRunner {

    private final MediaServerClient mediaServerClient;
    private final LibraryProcessingService libraryProcessingService;
    private final OrphanReconciler orphanReconciler;
    private final MetadataSyncProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    // item processing holds the read side, reconciliation the write side
    private final ReadWriteLock storeLock = new ReentrantReadWriteLock();

    public MetadataSyncRunner(MediaServerClient mediaServerClient,
                              LibraryProcessingService libraryProcessingService,
                              OrphanReconciler orphanReconciler,
                              MetadataSyncProperties properties) {
        this.mediaServerClient = mediaServerClient;
        this.libraryProcessingService = libraryProcessingService;
        this.orphanReconciler = orphanReconciler;
        this.properties = properties;
    }

    /**
     * @param trigger label for logs
     * @return the run report, empty when another run was already active
     */
    public Optional<RunReport> runOnce(String trigger) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Sync run ({}) skipped: a previous run is still active", trigger);
            return Optional.empty();
        }
        try {
            return Optional.of(execute(trigger));
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private RunReport execute(String trigger) {
        Instant started = Instant.now();
        boolean dryRun = properties.getSettings().isDryRun();
        log.info(LoggingUtils.dryRun(dryRun, "Starting sync run ({}) for libraries {}"), trigger,
            properties.getPlex().getLibraries());

        Set<Path> justWritten = ConcurrentHashMap.newKeySet();
        List<MediaItem> liveItems = new ArrayList<>();
        Set<String> libraryTypes = new LinkedHashSet<>();
        List<LibraryRunSummary> summaries = new ArrayList<>();
        boolean allListed = true;

        storeLock.readLock().lock();
        try {
            for (String libraryName : properties.getPlex().getLibraries()) {
                try {
                    MediaType libraryType = mediaServerClient.libraryType(libraryName);
                    LibraryListing listing = mediaServerClient.listItems(libraryName);
                    liveItems.addAll(listing.items());
                    libraryTypes.add(libraryType.getValue());
                    LibraryRunSummary summary = libraryProcessingService.processLibrary(libraryName, libraryType,
                        listing.items(), justWritten);
                    if (!listing.isComplete()) {
                        allListed = false;
                        listing.skipped().forEach(title -> summary.recordFailure(title, "not listed"));
                    }
                    summaries.add(summary);
                } catch (MediaServerException e) {
                    allListed = false;
                    LoggingUtils.error(log, e, "Failed to list library '{}'", libraryName);
                    LibraryRunSummary failed = new LibraryRunSummary(libraryName);
                    failed.recordFailure(libraryName, LoggingUtils.rootCauseMessage(e));
                    summaries.add(failed);
                }
            }
        } finally {
            storeLock.readLock().unlock();
        }

        ReconciliationSummary reconciliation = null;
        if (properties.getCleanup().isRunProcess()) {
            if (allListed) {
                storeLock.writeLock().lock();
                try {
                    reconciliation = orphanReconciler.reconcile(LiveItemIndex.of(liveItems), libraryTypes, justWritten);
                } finally {
                    storeLock.writeLock().unlock();
                }
            } else {
                log.warn("Skipping orphan reconciliation: not every library could be listed in full");
            }
        }

        Duration elapsed = Duration.between(started, Instant.now());
        RunReport report = new RunReport(trigger, summaries, reconciliation, elapsed);
        logReport(report, dryRun);
        return report;
    }

    private void logReport(RunReport report, boolean dryRun) {
        int items = report.libraries().stream().mapToInt(LibraryRunSummary::getItemsProcessed).sum();
        int failures = report.libraries().stream().mapToInt(s -> s.getFailures().size()).sum();
        log.info(LoggingUtils.dryRun(dryRun, "Sync run ({}) finished in {}s: {} item(s), {} failure(s), {} orphan(s) removed"),
            report.trigger(), report.elapsed().toSeconds(), items, failures,
            report.reconciliationResult().map(ReconciliationSummary::getRemovedCount).orElse(0));
        report.libraries().forEach(summary -> summary.getFailures()
            .forEach((item, reason) -> log.warn("  {} / {}: {}", summary.getLibraryName(), item, reason)));
    }
}
