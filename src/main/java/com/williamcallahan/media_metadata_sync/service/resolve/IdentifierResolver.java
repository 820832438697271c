/**
 * Resolves local media items to catalog identifiers
 *
 * @author William Callahan
 *
 * Features:
 * - Order: identifier cache, failed-lookup cache, embedded ids, remote search
 * - Whole resolution for one key runs under that key's lock, so a key is searched at most once at a time
 * - Search tries the title and its cleaned form, each with and without the year
 * - A failed-lookup marker is written only when every search variant answered with no results
 * - Nothing is written to the cache once the calling batch has been abandoned
 */
package com.williamcallahan.media_metadata_sync.service.resolve;

import com.williamcallahan.media_metadata_sync.model.CacheEntry;
import com.williamcallahan.media_metadata_sync.model.MediaItem;
import com.williamcallahan.media_metadata_sync.monitoring.SyncMetricsService;
import com.williamcallahan.media_metadata_sync.service.cache.IdentifierCacheService;
import com.williamcallahan.media_metadata_sync.service.catalog.TmdbCatalogService;
import com.williamcallahan.media_metadata_sync.types.BatchGuard;
import com.williamcallahan.media_metadata_sync.types.FetchResult;
import com.williamcallahan.media_metadata_sync.types.IdentifierResolution;
import com.williamcallahan.media_metadata_sync.types.IdentifierResolution.Source;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import com.williamcallahan.media_metadata_sync.types.SearchHit;
import com.williamcallahan.media_metadata_sync.util.CompositeKeys;
import com.williamcallahan.media_metadata_sync.util.LoggingUtils;
import com.williamcallahan.media_metadata_sync.util.TitleUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
public class IdentifierResolver {

    static final String EMBEDDED_SCHEME = "tmdb";

    /**
     * One remote search attempt
     */
    record SearchVariant(String title, Integer year) {
    }

    private final IdentifierCacheService cacheService;
    private final TmdbCatalogService catalogService;
    private final SyncMetricsService metricsService;

    public IdentifierResolver(IdentifierCacheService cacheService, TmdbCatalogService catalogService,
                              SyncMetricsService metricsService) {
        this.cacheService = cacheService;
        this.catalogService = catalogService;
        this.metricsService = metricsService;
    }

    public IdentifierResolution resolve(MediaItem item, BatchGuard guard) {
        return resolve(item.title(), item.year(), item.mediaType(), item.guids(), guard);
    }

    /**
     * Resolves a title to its catalog identifier
     *
     * @param title     local title
     * @param year      local year, may be null
     * @param mediaType movie or show
     * @param guids     scheme-prefixed identifiers embedded in the local item
     * @param guard     batch the lookup belongs to, checked before every cache write
     * @return the identifier and where it came from, or a not-found outcome
     * @throws java.util.concurrent.CancellationException when the batch was abandoned before a cache write
     */
    public IdentifierResolution resolve(String title, Integer year, MediaType mediaType, List<String> guids,
                                        BatchGuard guard) {
        String key = CompositeKeys.forItem(mediaType, title, year);
        IdentifierResolution resolution = cacheService.withKeyLock(key,
            () -> resolveLocked(key, title, year, mediaType, guids, guard));
        metricsService.recordResolution(resolution.source());
        return resolution;
    }

    private IdentifierResolution resolveLocked(String key, String title, Integer year, MediaType mediaType,
                                               List<String> guids, BatchGuard guard) {
        Optional<CacheEntry> cached = cacheService.find(key);
        if (cached.isPresent()) {
            log.debug("Identifier for '{}' found in cache: {}", key, cached.get().externalId());
            return IdentifierResolution.resolved(cached.get().externalId(), Source.CACHE);
        }
        if (cacheService.isFailed(key)) {
            log.debug("Skipping repeated failed lookup for '{}'", key);
            return IdentifierResolution.notFound(Source.FAILED_CACHED);
        }

        Optional<String> embedded = embeddedId(guids);
        if (embedded.isPresent()) {
            log.debug("Identifier for '{}' taken from embedded id {}", key, embedded.get());
            persist(key, embedded.get(), title, year, mediaType, guard);
            return IdentifierResolution.resolved(embedded.get(), Source.EMBEDDED_ID);
        }

        boolean anyFailure = false;
        for (SearchVariant variant : searchVariants(title, year)) {
            FetchResult<List<SearchHit>> result = catalogService.search(mediaType, variant.title(), variant.year());
            if (!result.isSuccess()) {
                anyFailure = true;
                log.warn("Search for '{}' ({}) failed: {} {}", variant.title(), variant.year(), result.failure(), result.detail());
                continue;
            }
            List<SearchHit> hits = result.value();
            if (!hits.isEmpty()) {
                SearchHit best = hits.get(0);
                log.info("Resolved '{}' to {} via search '{}' ({})", key, best.id(), variant.title(), variant.year());
                persist(key, best.id(), title, year, mediaType, guard);
                return IdentifierResolution.resolved(best.id(), Source.SEARCH);
            }
        }

        if (anyFailure) {
            log.warn("Could not resolve '{}'; some searches failed, not recording a failed lookup", key);
            return IdentifierResolution.notFound(Source.NOT_FOUND);
        }
        log.warn("Could not resolve '{}' after all search variants, recording failed lookup", key);
        guard.ensureActive("failed lookup for '" + key + "'");
        try {
            cacheService.markFailed(key);
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Failed to record failed lookup for '{}'", key);
        }
        return IdentifierResolution.notFound(Source.NOT_FOUND);
    }

    private void persist(String key, String externalId, String title, Integer year, MediaType mediaType,
                         BatchGuard guard) {
        guard.ensureActive("identifier for '" + key + "'");
        CacheEntry entry = cacheService.find(key)
            .map(existing -> existing.withExternalId(externalId, cacheService.now()))
            .orElseGet(() -> CacheEntry.resolved(key, externalId, title, year, mediaType, cacheService.now()));
        try {
            cacheService.put(entry);
        } catch (RuntimeException e) {
            // in-memory entry stands; the next successful flush writes it
            LoggingUtils.error(log, e, "Failed to save identifier cache after resolving '{}'", key);
        }
    }

    /**
     * Search attempts in order: (title, year), (title, any), (cleaned, year), (cleaned, any)
     * Duplicate variants are dropped
     */
    static List<SearchVariant> searchVariants(String title, Integer year) {
        String cleaned = TitleUtils.cleanTitle(title);
        Set<SearchVariant> variants = new LinkedHashSet<>();
        variants.add(new SearchVariant(title, year));
        variants.add(new SearchVariant(title, null));
        variants.add(new SearchVariant(cleaned, year));
        variants.add(new SearchVariant(cleaned, null));
        return new ArrayList<>(variants);
    }

    /**
     * Extracts the catalog id from guids like "tmdb://603" or "tmdb://603?lang=en"
     */
    static Optional<String> embeddedId(List<String> guids) {
        if (guids == null) {
            return Optional.empty();
        }
        for (String guid : guids) {
            if (guid == null) {
                continue;
            }
            int separator = guid.indexOf("://");
            if (separator <= 0 || !guid.substring(0, separator).toLowerCase(Locale.ROOT).equals(EMBEDDED_SCHEME)) {
                continue;
            }
            String id = guid.substring(separator + 3);
            int query = id.indexOf('?');
            if (query >= 0) {
                id = id.substring(0, query);
            }
            id = id.trim();
            if (!id.isEmpty()) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }
}
