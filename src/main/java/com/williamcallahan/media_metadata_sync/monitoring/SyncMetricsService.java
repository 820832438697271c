/**
 * Service for tracking sync metrics
 * Provides counters for remote traffic, resolution outcomes, asset decisions and cleanup
 *
 * @author William Callahan
 */

package com.williamcallahan.media_metadata_sync.monitoring;

import com.williamcallahan.media_metadata_sync.types.AssetType;
import com.williamcallahan.media_metadata_sync.types.IdentifierResolution;
import com.williamcallahan.media_metadata_sync.types.UpgradeStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Service
public class SyncMetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter remoteFetches;
    private final Counter remoteRetries;
    private final Counter rateLimitHits;
    private final Counter responseCacheHits;
    private final Counter responseCacheMisses;

    // Timers
    private final Timer remoteFetchTimer;

    public SyncMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.remoteFetches = Counter.builder("catalog.fetches")
            .description("Number of catalog transport attempts")
            .register(meterRegistry);

        this.remoteRetries = Counter.builder("catalog.retries")
            .description("Number of catalog attempts that were retried")
            .register(meterRegistry);

        this.rateLimitHits = Counter.builder("catalog.rate_limits")
            .description("Number of HTTP 429 responses from the catalog")
            .register(meterRegistry);

        this.responseCacheHits = Counter.builder("catalog.response_cache.hits")
            .description("Catalog requests served from the run-scoped response cache")
            .register(meterRegistry);

        this.responseCacheMisses = Counter.builder("catalog.response_cache.misses")
            .description("Catalog requests not found in the response cache")
            .register(meterRegistry);

        this.remoteFetchTimer = Timer.builder("catalog.fetch.duration")
            .description("Duration of catalog transport attempts")
            .register(meterRegistry);
    }

    public void incrementRemoteFetch() {
        remoteFetches.increment();
    }

    public void incrementRetry() {
        remoteRetries.increment();
    }

    public void incrementRateLimit() {
        rateLimitHits.increment();
    }

    public void incrementResponseCacheHit() {
        responseCacheHits.increment();
    }

    public void incrementResponseCacheMiss() {
        responseCacheMisses.increment();
    }

    public void recordFetchTime(long millis) {
        remoteFetchTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordResolution(IdentifierResolution.Source source) {
        meterRegistry.counter("identifier.resolutions", "source", source.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void recordAssetDecision(AssetType assetType, UpgradeStatus status, boolean dryRun) {
        meterRegistry.counter("assets.decisions",
            "type", assetType.name().toLowerCase(Locale.ROOT),
            "status", status.name().toLowerCase(Locale.ROOT),
            "dry_run", Boolean.toString(dryRun)).increment();
    }

    public void recordOrphansRemoved(String store, int count) {
        if (count > 0) {
            meterRegistry.counter("cleanup.orphans_removed", "store", store).increment(count);
        }
    }

    public double getCount(String name, String... tags) {
        Counter counter = meterRegistry.find(name).tags(tags).counter();
        return counter == null ? 0.0 : counter.count();
    }
}
