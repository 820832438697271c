/**
 * Persistent identifier cache entry for one movie, show or season
 *
 * @author William Callahan
 *
 * Features:
 * - Immutable; every update produces a whole new entry
 * - Carries per-asset quality hints and upgrade timestamps
 * - Legacy bare-identifier entries load with empty metrics
 */
package com.williamcallahan.media_metadata_sync.model;

import com.williamcallahan.media_metadata_sync.types.AssetType;
import com.williamcallahan.media_metadata_sync.types.MediaType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CacheEntry(
    String key,
    String externalId,
    String title,
    Integer year,
    MediaType mediaType,
    Map<String, Double> qualityMetrics,
    Map<String, Instant> assetUpgradedAt,
    Instant lastUpdated
) {

    public CacheEntry {
        qualityMetrics = qualityMetrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(qualityMetrics));
        assetUpgradedAt = assetUpgradedAt == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(assetUpgradedAt));
    }

    public static CacheEntry resolved(String key, String externalId, String title, Integer year, MediaType mediaType, Instant now) {
        return new CacheEntry(key, externalId, title, year, mediaType, Map.of(), Map.of(), now);
    }

    /**
     * Cached quality score for an asset slot, 0 when nothing is recorded
     */
    public double qualityFor(AssetType assetType) {
        Double value = qualityMetrics.get(assetType.getQualityMetric());
        return value == null ? 0.0 : value;
    }

    public CacheEntry withExternalId(String newExternalId, Instant now) {
        return new CacheEntry(key, newExternalId, title, year, mediaType, qualityMetrics, assetUpgradedAt, now);
    }

    /**
     * Records the vote average of a freshly saved asset together with its upgrade time
     */
    public CacheEntry withAssetUpgrade(AssetType assetType, double voteAverage, Instant now) {
        Map<String, Double> metrics = new LinkedHashMap<>(qualityMetrics);
        metrics.put(assetType.getQualityMetric(), voteAverage);
        Map<String, Instant> upgraded = new LinkedHashMap<>(assetUpgradedAt);
        upgraded.put(assetType.getQualityMetric(), now);
        return new CacheEntry(key, externalId, title, year, mediaType, metrics, upgraded, now);
    }
}
