/**
 * Guarded access to the persistent identifier cache
 * Every read-modify-write of an entry runs under that entry's key lock
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.service.cache;

import com.williamcallahan.media_metadata_sync.model.CacheEntry;
import com.williamcallahan.media_metadata_sync.repository.IdentifierCacheStore;
import com.williamcallahan.media_metadata_sync.types.AssetType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Service
public class IdentifierCacheService {

    private final IdentifierCacheStore store;
    private final KeyedLockRegistry locks;
    private final Clock clock;

    @Autowired
    public IdentifierCacheService(IdentifierCacheStore store, KeyedLockRegistry identifierLockRegistry) {
        this(store, identifierLockRegistry, Clock.systemUTC());
    }

    IdentifierCacheService(IdentifierCacheStore store, KeyedLockRegistry locks, Clock clock) {
        this.store = store;
        this.locks = locks;
        this.clock = clock;
    }

    public <T> T withKeyLock(String key, Supplier<T> action) {
        return locks.withLock(key, action);
    }

    public Optional<CacheEntry> find(String key) {
        return store.find(key);
    }

    public boolean isFailed(String key) {
        return store.isFailed(key);
    }

    public void put(CacheEntry entry) {
        store.put(entry);
    }

    public void markFailed(String key) {
        store.markFailed(key);
    }

    public void clearFailed(String key) {
        store.clearFailed(key);
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Cached quality score for an asset slot, 0 when nothing is recorded
     */
    public double cachedQuality(String key, AssetType assetType) {
        return store.find(key).map(entry -> entry.qualityFor(assetType)).orElse(0.0);
    }

    /**
     * Records a saved asset's vote average on the entry, creating it from the template when absent
     *
     * @param template entry to start from when the key has no entry yet
     */
    public CacheEntry recordAssetUpgrade(CacheEntry template, AssetType assetType, double voteAverage) {
        return locks.withLock(template.key(), () -> {
            CacheEntry current = store.find(template.key()).orElse(template);
            CacheEntry updated = current.withAssetUpgrade(assetType, voteAverage, clock.instant());
            store.put(updated);
            log.debug("Recorded {} quality {} for {}", assetType.getLabel(), voteAverage, template.key());
            return updated;
        });
    }
}
