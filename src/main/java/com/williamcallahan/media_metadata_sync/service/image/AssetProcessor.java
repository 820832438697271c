/**
 * Maintains the poster, background and season poster files of one item
 *
 * @author William Callahan
 *
 * Features:
 * - Slots processed in order: poster, background, then each local season
 * - Candidate downloaded to a temporary file before the upgrade decision
 * - Identical content (MD5) is never rewritten
 * - Saved vote average and upgrade time recorded on the cache entry
 * - Written paths registered so a later reconciliation keeps them
 * - Temporary files removed whatever the outcome
 */
package com.williamcallahan.media_metadata_sync.service.image;

import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.CacheEntry;
import com.williamcallahan.media_metadata_sync.model.MediaItem;
import com.williamcallahan.media_metadata_sync.monitoring.SyncMetricsService;
import com.williamcallahan.media_metadata_sync.service.cache.IdentifierCacheService;
import com.williamcallahan.media_metadata_sync.service.catalog.CatalogImages;
import com.williamcallahan.media_metadata_sync.service.catalog.TmdbCatalogService;
import com.williamcallahan.media_metadata_sync.types.AssetAction;
import com.williamcallahan.media_metadata_sync.types.AssetCandidate;
import com.williamcallahan.media_metadata_sync.types.AssetQualityPolicy;
import com.williamcallahan.media_metadata_sync.types.AssetType;
import com.williamcallahan.media_metadata_sync.types.BatchGuard;
import com.williamcallahan.media_metadata_sync.types.FetchResult;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import com.williamcallahan.media_metadata_sync.types.UpgradeDecision;
import com.williamcallahan.media_metadata_sync.util.CompositeKeys;
import com.williamcallahan.media_metadata_sync.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.IntFunction;

@Slf4j
@Service
public class AssetProcessor {

    private final AssetSelector selector;
    private final AssetUpgradeDecider decider;
    private final AssetPathResolver paths;
    private final TmdbCatalogService catalogService;
    private final IdentifierCacheService cacheService;
    private final SyncMetricsService metrics;
    private final MetadataSyncProperties properties;

    public AssetProcessor(AssetSelector selector, AssetUpgradeDecider decider, AssetPathResolver paths,
                          TmdbCatalogService catalogService, IdentifierCacheService cacheService,
                          SyncMetricsService metrics, MetadataSyncProperties properties) {
        this.selector = selector;
        this.decider = decider;
        this.paths = paths;
        this.catalogService = catalogService;
        this.cacheService = cacheService;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Processes every enabled asset slot of an item
     *
     * @param item         local item
     * @param externalId   resolved catalog id
     * @param images       item images from the details payload
     * @param seasonImages season number to that season's images
     * @param justWritten  run-scoped set receiving every path written
     * @param guard        batch the item belongs to, checked before any file or cache write
     * @return one action per slot considered
     * @throws java.util.concurrent.CancellationException when the batch was abandoned before a write
     */
    public List<AssetAction> processItem(MediaItem item, String externalId, CatalogImages images,
                                         IntFunction<CatalogImages> seasonImages, Set<Path> justWritten,
                                         BatchGuard guard) {
        MetadataSyncProperties.Assets assets = properties.getAssets();
        String language = properties.getTmdb().getImageLanguage();
        List<String> fallbacks = properties.getTmdb().getFallbackLanguages();
        String itemKey = CompositeKeys.forItem(item.mediaType(), item.title(), item.year());
        List<AssetAction> actions = new ArrayList<>();

        if (assets.isRunPoster()) {
            actions.add(processSlot(item, AssetType.POSTER, paths.posterPath(item), images.posters(),
                language, fallbacks, properties.getPosterSet().toPolicy(),
                template(itemKey, externalId, item, item.mediaType()), justWritten, guard));
        }
        if (assets.isRunBackground()) {
            actions.add(processSlot(item, AssetType.BACKGROUND, paths.backgroundPath(item), images.backdrops(),
                null, List.of(), properties.getBackgroundSet().toPolicy(),
                template(itemKey, externalId, item, item.mediaType()), justWritten, guard));
        }
        if (assets.isRunSeason() && item.isShow()) {
            for (Integer seasonNumber : item.seasonsEpisodes().keySet()) {
                if (seasonNumber == null || seasonNumber <= 0) {
                    continue;
                }
                String seasonKey = CompositeKeys.season(item.title(), item.year(), seasonNumber);
                CatalogImages season = seasonImages.apply(seasonNumber);
                actions.add(processSlot(item, AssetType.SEASON_POSTER, paths.seasonPosterPath(item, seasonNumber),
                    season == null ? List.of() : season.posters(), language, fallbacks,
                    properties.getSeasonSet().toPolicy(),
                    template(seasonKey, externalId, item, MediaType.TV_SEASON), justWritten, guard));
            }
        }
        return actions;
    }

    AssetAction processSlot(MediaItem item, AssetType type, Optional<Path> targetPath, List<AssetCandidate> candidates,
                            String language, List<String> fallbacks, AssetQualityPolicy policy,
                            CacheEntry cacheTemplate, Set<Path> justWritten, BatchGuard guard) {
        if (targetPath.isEmpty()) {
            log.warn("No {} location for '{}', item directory unknown", type.getLabel(), item.titleYear());
            return AssetAction.skipped(type, null, "no asset location");
        }
        Path target = targetPath.get();
        Optional<AssetCandidate> selected = selector.selectBest(candidates, language, fallbacks, policy);
        if (selected.isEmpty()) {
            log.info("No {} available for '{}'", type.getLabel(), item.titleYear());
            return AssetAction.skipped(type, target, "no candidate");
        }
        AssetCandidate candidate = selected.get();

        FetchResult<byte[]> download = catalogService.download(candidate.filePath());
        if (!download.isSuccess()) {
            log.warn("Failed to download {} for '{}': {} ({})", type.getLabel(), item.titleYear(),
                download.failure(), download.detail());
            return AssetAction.skipped(type, target, "download failed: " + download.failure());
        }
        byte[] content = download.value();

        Path temp = null;
        try {
            temp = writeTemp(item.libraryName(), content);
            double cachedQuality = cacheService.cachedQuality(cacheTemplate.key(), type);
            UpgradeDecision decision = decider.shouldUpgrade(target, candidate, temp, cachedQuality, policy.voteThreshold());
            metrics.recordAssetDecision(type, decision.status(), decision.dryRun());

            if (!decision.upgrade()) {
                log.info("Keeping existing {} for '{}' ({})", type.getLabel(), item.titleYear(), decision.status());
                return new AssetAction(type, target, decision.status(), false, 0L, "kept existing");
            }
            if (!decision.shouldWrite()) {
                log.info(LoggingUtils.dryRun(true, "Would save {} for '{}' ({}, vote {})"),
                    type.getLabel(), item.titleYear(), decision.status(), candidate.voteAverage());
                return new AssetAction(type, target, decision.status(), false, 0L, "dry run");
            }

            guard.ensureActive(type.getLabel() + " for '" + item.titleYear() + "'");
            boolean written = false;
            if (Files.exists(target) && md5(Files.readAllBytes(target)).equals(md5(content))) {
                log.info("No changes detected for {} of '{}', skipping save", type.getLabel(), item.titleYear());
            } else {
                Files.createDirectories(target.getParent());
                moveInto(temp, target);
                temp = null;
                written = true;
                log.info("Saved {} for '{}' ({}, vote {})", type.getLabel(), item.titleYear(),
                    decision.status(), candidate.voteAverage());
            }
            justWritten.add(target.toAbsolutePath().normalize());
            cacheService.recordAssetUpgrade(cacheTemplate, type, candidate.voteAverage());
            return new AssetAction(type, target, decision.status(), written, written ? content.length : 0L,
                written ? null : "identical content");
        } catch (CancellationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            LoggingUtils.warn(log, e, "Failed to save {} for '{}'", type.getLabel(), item.titleYear());
            return new AssetAction(type, target, null, false, 0L, "save failed: " + LoggingUtils.rootCauseMessage(e));
        } finally {
            deleteQuietly(temp);
        }
    }

    private CacheEntry template(String key, String externalId, MediaItem item, MediaType mediaType) {
        return cacheService.find(key)
            .orElseGet(() -> CacheEntry.resolved(key, externalId, item.title(), item.year(), mediaType, cacheService.now()));
    }

    private Path writeTemp(String libraryName, byte[] content) throws IOException {
        Path temp;
        if (decider.isDryRun()) {
            // keep the asset tree untouched in dry-run
            temp = Files.createTempFile(AssetPathResolver.TEMP_PREFIX, ".jpg");
        } else {
            temp = paths.tempFile(libraryName);
            Files.createDirectories(temp.getParent());
        }
        Files.write(temp, content);
        return temp;
    }

    private static void moveInto(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }

    static String md5(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
