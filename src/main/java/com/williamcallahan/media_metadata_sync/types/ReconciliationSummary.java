/**
 * Summary of one orphan reconciliation pass across the three stores
 * Tracks what was (or in dry-run, would have been) removed per store
 *
 * @author William Callahan
 *
 * Features:
 * - Counts removals per store and in total
 * - Keeps a per-title breakdown for the consolidated log line
 * - Collects failures without aborting the pass
 */

package com.williamcallahan.media_metadata_sync.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class ReconciliationSummary {
    private final boolean dryRun;
    private int cacheEntriesRemoved;
    private int failedEntriesRemoved;
    private int metadataRecordsRemoved;
    private int assetFilesRemoved;
    private int directoriesRemoved;
    private final Map<String, List<String>> removedByTitle = new TreeMap<>();
    private final List<String> failures = new ArrayList<>();

    public ReconciliationSummary(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public synchronized void recordCacheEntry(String titleYear) {
        cacheEntriesRemoved++;
        note(titleYear, "cache");
    }

    public synchronized void recordFailedEntry(String titleYear) {
        failedEntriesRemoved++;
        note(titleYear, "failed-lookup");
    }

    public synchronized void recordMetadataRecord(String titleYear) {
        metadataRecordsRemoved++;
        note(titleYear, "metadata");
    }

    public synchronized void recordAssetFile(String titleYear, String description) {
        assetFilesRemoved++;
        note(titleYear, description);
    }

    public synchronized void recordDirectory() {
        directoriesRemoved++;
    }

    public synchronized void recordFailure(String failure) {
        failures.add(failure);
    }

    private void note(String titleYear, String what) {
        if (titleYear != null) {
            removedByTitle.computeIfAbsent(titleYear, k -> new ArrayList<>()).add(what);
        }
    }

    public boolean isDryRun() { return dryRun; }
    public synchronized int getCacheEntriesRemoved() { return cacheEntriesRemoved; }
    public synchronized int getFailedEntriesRemoved() { return failedEntriesRemoved; }
    public synchronized int getMetadataRecordsRemoved() { return metadataRecordsRemoved; }
    public synchronized int getAssetFilesRemoved() { return assetFilesRemoved; }
    public synchronized int getDirectoriesRemoved() { return directoriesRemoved; }

    /**
     * Total removed across cache entries, metadata records and asset files
     * Failed-lookup markers and emptied directories are reported separately
     */
    public synchronized int getRemovedCount() {
        return cacheEntriesRemoved + metadataRecordsRemoved + assetFilesRemoved;
    }

    public synchronized Map<String, List<String>> getRemovedByTitle() {
        Map<String, List<String>> copy = new TreeMap<>();
        removedByTitle.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    public synchronized List<String> getFailures() {
        return List.copyOf(failures);
    }

    @Override
    public synchronized String toString() {
        return String.format("ReconciliationSummary{dryRun=%s, cache=%d, failedLookups=%d, metadata=%d, assets=%d, dirs=%d, failures=%d}",
            dryRun, cacheEntriesRemoved, failedEntriesRemoved, metadataRecordsRemoved, assetFilesRemoved,
            directoriesRemoved, failures.size());
    }
}
