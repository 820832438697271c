/**
 * Removes cache entries, metadata records and asset files no live item references
 *
 * @author William Callahan
 *
 * Features:
 * - Cache and failed-lookup entries checked against live composite keys
 * - Metadata documents of the configured libraries checked against live titles
 * - Asset files matched by name pattern and checked against live directory names
 * - Disabled asset types have all their files removed, except files written in this run
 * - Empty item directories removed after their last asset
 * - Dry-run logs and counts every removal without touching any store
 * - Best effort: a failure on one entry never stops the pass
 */
package com.williamcallahan.media_metadata_sync.service.cleanup;

import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.MetadataDocument;
import com.williamcallahan.media_metadata_sync.monitoring.SyncMetricsService;
import com.williamcallahan.media_metadata_sync.repository.IdentifierCacheStore;
import com.williamcallahan.media_metadata_sync.repository.MetadataDocumentRepository;
import com.williamcallahan.media_metadata_sync.service.image.AssetPathResolver;
import com.williamcallahan.media_metadata_sync.types.AssetType;
import com.williamcallahan.media_metadata_sync.types.ReconciliationSummary;
import com.williamcallahan.media_metadata_sync.util.CompositeKeys;
import com.williamcallahan.media_metadata_sync.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
public class OrphanReconciler {

    private static final Map<AssetType, String> ASSET_PATTERNS = Map.of(
        AssetType.POSTER, AssetPathResolver.POSTER_FILE,
        AssetType.SEASON_POSTER, "Season*.jpg",
        AssetType.BACKGROUND, AssetPathResolver.BACKGROUND_FILE
    );
    private static final List<AssetType> ASSET_ORDER = List.of(AssetType.POSTER, AssetType.SEASON_POSTER, AssetType.BACKGROUND);

    private final IdentifierCacheStore cacheStore;
    private final MetadataDocumentRepository documentRepository;
    private final AssetPathResolver paths;
    private final SyncMetricsService metrics;
    private final MetadataSyncProperties properties;

    public OrphanReconciler(IdentifierCacheStore cacheStore, MetadataDocumentRepository documentRepository,
                            AssetPathResolver paths, SyncMetricsService metrics, MetadataSyncProperties properties) {
        this.cacheStore = cacheStore;
        this.documentRepository = documentRepository;
        this.paths = paths;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Runs one pass over all three stores
     *
     * @param live          live item index built once for this pass
     * @param libraryTypes  library types whose metadata documents are reconciled, e.g. "movie", "tv"
     * @param justWritten   absolute asset paths written earlier in this run
     * @return what was removed, or would have been in dry-run
     */
    public ReconciliationSummary reconcile(LiveItemIndex live, Collection<String> libraryTypes, Set<Path> justWritten) {
        boolean dryRun = properties.getSettings().isDryRun();
        ReconciliationSummary summary = new ReconciliationSummary(dryRun);
        if (live.isEmpty()) {
            log.warn("No live items known, skipping reconciliation to avoid wiping every store");
            summary.recordFailure("no live items");
            return summary;
        }
        log.info(LoggingUtils.dryRun(dryRun, "Starting orphan reconciliation against {} live key(s)"), live.cacheKeys().size());

        reconcileCache(live, summary, dryRun);
        reconcileDocuments(live, libraryTypes, summary, dryRun);
        reconcileAssets(live, justWritten, summary, dryRun);

        metrics.recordOrphansRemoved("cache", summary.getCacheEntriesRemoved() + summary.getFailedEntriesRemoved());
        metrics.recordOrphansRemoved("metadata", summary.getMetadataRecordsRemoved());
        metrics.recordOrphansRemoved("assets", summary.getAssetFilesRemoved());
        if (!summary.getRemovedByTitle().isEmpty()) {
            log.info(LoggingUtils.dryRun(dryRun, "Removed orphans by title: {}"), summary.getRemovedByTitle());
        }
        log.info(LoggingUtils.dryRun(dryRun, "Reconciliation finished: {}"), summary);
        return summary;
    }

    void reconcileCache(LiveItemIndex live, ReconciliationSummary summary, boolean dryRun) {
        Set<String> orphanKeys = cacheStore.keys().stream()
            .filter(key -> !live.cacheKeys().contains(key))
            .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> orphanFailed = cacheStore.failedKeys().stream()
            .filter(key -> !live.cacheKeys().contains(key))
            .collect(Collectors.toCollection(LinkedHashSet::new));

        for (String key : orphanKeys) {
            log.info(LoggingUtils.dryRun(dryRun, "Removing orphaned cache entry {}"), key);
            summary.recordCacheEntry(titleOf(key));
        }
        for (String key : orphanFailed) {
            log.info(LoggingUtils.dryRun(dryRun, "Removing orphaned failed lookup {}"), key);
            summary.recordFailedEntry(titleOf(key));
        }
        if (dryRun) {
            return;
        }
        try {
            cacheStore.removeAll(orphanKeys);
            cacheStore.removeFailed(orphanFailed);
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Failed to persist cache after removing {} orphan(s)", orphanKeys.size());
            summary.recordFailure("cache: " + LoggingUtils.rootCauseMessage(e));
        }
    }

    void reconcileDocuments(LiveItemIndex live, Collection<String> libraryTypes, ReconciliationSummary summary,
                            boolean dryRun) {
        for (String libraryType : new LinkedHashSet<>(libraryTypes)) {
            Path file = documentRepository.pathFor(libraryType);
            if (!Files.exists(file)) {
                log.debug("No metadata document at {}", file);
                continue;
            }
            try {
                MetadataDocument document = documentRepository.loadFile(file);
                List<String> orphanTitles = document.titles().stream()
                    .filter(title -> !live.titles().contains(title))
                    .toList();
                if (orphanTitles.isEmpty()) {
                    continue;
                }
                orphanTitles.forEach(title -> {
                    log.info(LoggingUtils.dryRun(dryRun, "Removing orphaned metadata record '{}' from {}"), title, file.getFileName());
                    summary.recordMetadataRecord(title);
                });
                if (!dryRun) {
                    document.retainTitles(live.titles()::contains);
                    documentRepository.save(document);
                }
            } catch (RuntimeException e) {
                LoggingUtils.error(log, e, "Failed to reconcile metadata document {}", file);
                summary.recordFailure(file.getFileName() + ": " + LoggingUtils.rootCauseMessage(e));
            }
        }
    }

    void reconcileAssets(LiveItemIndex live, Set<Path> justWritten, ReconciliationSummary summary, boolean dryRun) {
        Path root = paths.getAssetsRoot();
        if (root == null || !Files.isDirectory(root)) {
            log.debug("Asset root {} does not exist, nothing to reconcile", root);
            return;
        }
        MetadataSyncProperties.Assets assets = properties.getAssets();
        for (AssetType type : ASSET_ORDER) {
            boolean strict = switch (type) {
                case POSTER -> assets.isRunPoster();
                case SEASON_POSTER -> assets.isRunSeason();
                case BACKGROUND -> assets.isRunBackground();
            };
            for (Path file : findAssets(root, ASSET_PATTERNS.get(type))) {
                removeIfOrphaned(file, type, strict, live, justWritten, summary, dryRun);
            }
        }
    }

    private void removeIfOrphaned(Path file, AssetType type, boolean strict, LiveItemIndex live, Set<Path> justWritten,
                                  ReconciliationSummary summary, boolean dryRun) {
        String owner = AssetPathResolver.owningDirectoryName(file);
        if (strict && live.directoryNames().contains(owner)) {
            return;
        }
        if (justWritten.contains(file.toAbsolutePath().normalize())) {
            log.debug("Keeping {} written during this run: {}", type.getLabel(), file);
            return;
        }
        log.info(LoggingUtils.dryRun(dryRun, "Removing orphaned {} {}"), type.getLabel(), file);
        if (dryRun) {
            summary.recordAssetFile(owner, type.getLabel());
            return;
        }
        try {
            Files.deleteIfExists(file);
            summary.recordAssetFile(owner, type.getLabel());
            Path parent = file.getParent();
            if (parent != null && isEmptyDirectory(parent)) {
                log.info("Removing empty directory {}", parent);
                Files.delete(parent);
                summary.recordDirectory();
            }
        } catch (IOException e) {
            LoggingUtils.warn(log, e, "Failed to remove {} {}", type.getLabel(), file);
            summary.recordFailure(file + ": " + LoggingUtils.rootCauseMessage(e));
        }
    }

    private static List<Path> findAssets(Path root, String glob) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        try (Stream<Path> files = Files.walk(root)) {
            return files
                .filter(Files::isRegularFile)
                .filter(path -> matcher.matches(path.getFileName()))
                .sorted()
                .toList();
        } catch (IOException e) {
            LoggingUtils.warn(log, e, "Failed to scan asset tree {} for {}", root, glob);
            return List.of();
        }
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    private static String titleOf(String key) {
        return CompositeKeys.parse(key).map(CompositeKeys.ParsedKey::titleYear).orElse(key);
    }
}
