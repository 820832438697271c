/**
 * Processes the items of one library on the bounded worker pool
 *
 * @author William Callahan
 *
 * Features:
 * - Items run in parallel, each item's steps run in order: metadata, then assets
 * - Per-item failures are isolated and aggregated into the run summary
 * - Outstanding items are interrupted and reported once the batch timeout elapses
 * - Abandoned items make no further store writes, and the library waits for them to stop
 * - Metadata document persisted once per library, only when records changed
 */
package com.williamcallahan.media_metadata_sync.service.library;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.MediaItem;
import com.williamcallahan.media_metadata_sync.model.MetadataDocument;
import com.williamcallahan.media_metadata_sync.model.MetadataRecord;
import com.williamcallahan.media_metadata_sync.repository.MetadataDocumentRepository;
import com.williamcallahan.media_metadata_sync.repository.MetadataStoreException;
import com.williamcallahan.media_metadata_sync.service.catalog.CatalogImages;
import com.williamcallahan.media_metadata_sync.service.catalog.TmdbCatalogService;
import com.williamcallahan.media_metadata_sync.service.image.AssetProcessor;
import com.williamcallahan.media_metadata_sync.service.metadata.BuiltMetadata;
import com.williamcallahan.media_metadata_sync.service.metadata.MetadataDiffer;
import com.williamcallahan.media_metadata_sync.service.metadata.MovieMetadataBuilder;
import com.williamcallahan.media_metadata_sync.service.metadata.ShowMetadataBuilder;
import com.williamcallahan.media_metadata_sync.service.resolve.IdentifierResolver;
import com.williamcallahan.media_metadata_sync.types.AssetAction;
import com.williamcallahan.media_metadata_sync.types.BatchGuard;
import com.williamcallahan.media_metadata_sync.types.FetchResult;
import com.williamcallahan.media_metadata_sync.types.IdentifierResolution;
import com.williamcallahan.media_metadata_sync.types.LibraryRunSummary;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import com.williamcallahan.media_metadata_sync.types.MetadataAction;
import com.williamcallahan.media_metadata_sync.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Service
public class LibraryProcessingService {

    private final IdentifierResolver resolver;
    private final TmdbCatalogService catalogService;
    private final MovieMetadataBuilder movieBuilder;
    private final ShowMetadataBuilder showBuilder;
    private final MetadataDiffer differ;
    private final MetadataDocumentRepository documentRepository;
    private final AssetProcessor assetProcessor;
    private final AsyncTaskExecutor executor;
    private final MetadataSyncProperties properties;

    public LibraryProcessingService(IdentifierResolver resolver,
                                    TmdbCatalogService catalogService,
                                    MovieMetadataBuilder movieBuilder,
                                    ShowMetadataBuilder showBuilder,
                                    MetadataDiffer differ,
                                    MetadataDocumentRepository documentRepository,
                                    AssetProcessor assetProcessor,
                                    @Qualifier("syncTaskExecutor") AsyncTaskExecutor executor,
                                    MetadataSyncProperties properties) {
        this.resolver = resolver;
        this.catalogService = catalogService;
        this.movieBuilder = movieBuilder;
        this.showBuilder = showBuilder;
        this.differ = differ;
        this.documentRepository = documentRepository;
        this.assetProcessor = assetProcessor;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * Processes a library's items and persists its metadata document
     *
     * @param libraryName  configured library name
     * @param libraryType  movie or tv, selects the metadata document
     * @param items        live items of the library
     * @param justWritten  run-scoped set receiving asset paths written
     * @return per-library summary
     */
    public LibraryRunSummary processLibrary(String libraryName, MediaType libraryType, List<MediaItem> items,
                                            Set<Path> justWritten) {
        boolean dryRun = properties.getSettings().isDryRun();
        LibraryRunSummary summary = new LibraryRunSummary(libraryName);
        MetadataDocument document = documentRepository.load(libraryType.getValue());
        log.info(LoggingUtils.dryRun(dryRun, "Processing {} item(s) in library '{}'"), items.size(), libraryName);

        BatchGuard guard = new BatchGuard();
        CountDownLatch finished = new CountDownLatch(items.size());
        List<PendingItem> pending = new ArrayList<>();
        for (MediaItem item : items) {
            PendingItem task = new PendingItem(item);
            task.future = executor.submit(() -> {
                if (!task.claim()) {
                    return;
                }
                try {
                    processItemSafely(item, document, summary, justWritten, guard);
                } finally {
                    finished.countDown();
                }
            });
            pending.add(task);
        }
        awaitBatch(pending, finished, summary, guard);

        if (document.isDirty()) {
            try {
                documentRepository.save(document);
            } catch (MetadataStoreException e) {
                LoggingUtils.error(log, e, "Failed to save metadata document for library '{}'", libraryName);
                summary.recordFailure(document.getLocation().getFileName().toString(), LoggingUtils.rootCauseMessage(e));
            }
        } else {
            log.info("No metadata changes for library '{}'", libraryName);
        }
        log.info(LoggingUtils.dryRun(dryRun, "Library '{}' done: {}"), libraryName, summary);
        return summary;
    }

    private void awaitBatch(List<PendingItem> pending, CountDownLatch finished, LibraryRunSummary summary,
                            BatchGuard guard) {
        Duration timeout = properties.getWorkers().getBatchTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            for (PendingItem task : pending) {
                try {
                    task.future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } catch (ExecutionException e) {
                    // per-item failures are caught in processItemSafely, this is a worker-level fault
                    LoggingUtils.error(log, e, "Unexpected failure processing '{}'", task.item.titleYear());
                }
            }
            return;
        } catch (TimeoutException e) {
            log.error("Batch timed out after {}, abandoning unfinished items", timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for library batch, abandoning unfinished items");
        }
        abandon(pending, finished, summary, guard);
    }

    /**
     * Flags the batch, interrupts unfinished items and waits for their workers to stop
     */
    private void abandon(List<PendingItem> pending, CountDownLatch finished, LibraryRunSummary summary,
                         BatchGuard guard) {
        guard.abandon();
        for (PendingItem task : pending) {
            if (task.future.isDone()) {
                continue;
            }
            if (task.claim()) {
                // never started, its worker will not count it down
                finished.countDown();
            }
            if (task.future.cancel(true)) {
                summary.recordTimedOut(task.item.titleYear());
            }
        }
        Duration grace = properties.getWorkers().getAbandonGrace();
        boolean interrupted = Thread.interrupted();
        try {
            if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("{} abandoned item(s) still running after {}", finished.getCount(), grace);
            }
        } catch (InterruptedException e) {
            interrupted = true;
            log.warn("Interrupted while waiting for abandoned items to stop");
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void processItemSafely(MediaItem item, MetadataDocument document, LibraryRunSummary summary,
                                   Set<Path> justWritten, BatchGuard guard) {
        try {
            processItem(item, document, summary, justWritten, guard);
        } catch (CancellationException e) {
            log.info("Stopped abandoned item '{}': {}", item.titleYear(), e.getMessage());
        } catch (RuntimeException e) {
            if (guard.isAbandoned()) {
                // failure caused by the interrupt, already reported as timed out
                log.info("Stopped abandoned item '{}': {}", item.titleYear(), LoggingUtils.rootCauseMessage(e));
                return;
            }
            LoggingUtils.error(log, e, "Failed to process '{}'", item.titleYear());
            summary.recordFailure(item.titleYear(), LoggingUtils.rootCauseMessage(e));
        } finally {
            summary.recordItemDone();
        }
    }

    void processItem(MediaItem item, MetadataDocument document, LibraryRunSummary summary, Set<Path> justWritten,
                     BatchGuard guard) {
        IdentifierResolution resolution = resolver.resolve(item, guard);
        if (!resolution.isFound()) {
            log.warn("No catalog match for '{}' ({})", item.titleYear(), resolution.source());
            summary.recordMetadata(MetadataAction.SKIPPED, 0);
            summary.recordFailure(item.titleYear(), "no catalog match");
            return;
        }
        String externalId = resolution.externalId();

        FetchResult<JsonNode> details = catalogService.details(externalId, item.mediaType());
        if (!details.isSuccess()) {
            log.warn("Failed to fetch details for '{}' (id {}): {} {}", item.titleYear(), externalId,
                details.failure(), details.detail());
            summary.recordMetadata(MetadataAction.FAILED, 0);
            summary.recordFailure(item.titleYear(), "details: " + details.failure()
                + (details.failure().isRetryable() ? " after " + details.attempts() + " attempt(s)" : ""));
            return;
        }
        Map<Integer, Optional<JsonNode>> seasons = item.isShow() ? fetchSeasons(item, externalId) : Map.of();

        updateMetadata(item, externalId, details.value(), seasons, document, summary, guard);

        CatalogImages images = TmdbCatalogService.readImages(details.value().path("images"));
        List<AssetAction> actions = assetProcessor.processItem(item, externalId, images,
            n -> seasons.getOrDefault(n, Optional.empty())
                .map(season -> TmdbCatalogService.readImages(season.path("images")))
                .orElse(CatalogImages.EMPTY),
            justWritten, guard);
        actions.forEach(summary::recordAsset);
    }

    private void updateMetadata(MediaItem item, String externalId, JsonNode details,
                                Map<Integer, Optional<JsonNode>> seasons, MetadataDocument document,
                                LibraryRunSummary summary, BatchGuard guard) {
        if (!movieBuilder.isEnabled()) {
            summary.recordMetadata(MetadataAction.SKIPPED, 0);
            return;
        }
        BuiltMetadata built = item.isShow()
            ? showBuilder.build(item, externalId, details, n -> seasons.getOrDefault(n, Optional.empty()))
            : movieBuilder.build(item, externalId, details);

        String titleKey = item.titleYear();
        Optional<MetadataRecord> existing = document.get(titleKey);
        List<String> changed = differ.diff(existing.orElse(null), built.record());
        boolean dryRun = properties.getSettings().isDryRun();
        MetadataAction action;
        if (existing.isEmpty()) {
            action = MetadataAction.CREATED;
            guard.ensureActive("metadata for '" + titleKey + "'");
            document.put(titleKey, built.record());
            log.info(LoggingUtils.dryRun(dryRun, "Created metadata for '{}' ({}% complete)"), titleKey,
                built.completenessPercent());
        } else if (!changed.isEmpty()) {
            action = MetadataAction.UPDATED;
            guard.ensureActive("metadata for '" + titleKey + "'");
            document.put(titleKey, built.record());
            log.info(LoggingUtils.dryRun(dryRun, "Updated metadata for '{}', changed fields {}"), titleKey, changed);
        } else {
            action = MetadataAction.UNCHANGED;
            log.debug("Metadata for '{}' unchanged", titleKey);
        }
        summary.recordMetadata(action, built.completenessPercent());
    }

    private Map<Integer, Optional<JsonNode>> fetchSeasons(MediaItem item, String showId) {
        Map<Integer, Optional<JsonNode>> seasons = new LinkedHashMap<>();
        for (Integer seasonNumber : item.seasonsEpisodes().keySet()) {
            if (seasonNumber == null || seasonNumber <= 0) {
                continue;
            }
            FetchResult<JsonNode> season = catalogService.seasonDetails(showId, seasonNumber);
            if (!season.isSuccess()) {
                log.warn("Failed to fetch season {} of '{}': {}", seasonNumber, item.titleYear(), season.failure());
            }
            seasons.put(seasonNumber, season.toOptional());
        }
        return seasons;
    }

    /**
     * One submitted item; whichever of its worker or the abandoning thread claims it first owns it
     */
    private static final class PendingItem {
        private final MediaItem item;
        private final AtomicBoolean claimed = new AtomicBoolean(false);
        private Future<?> future;

        private PendingItem(MediaItem item) {
            this.item = item;
        }

        private boolean claim() {
            return claimed.compareAndSet(false, true);
        }
    }
}
