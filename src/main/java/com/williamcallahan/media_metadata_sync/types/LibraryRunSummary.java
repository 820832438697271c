/**
 * Aggregated outcome of processing one library
 * Workers record into it concurrently; it is read once the batch is done
 *
 * @author William Callahan
 *
 * Features:
 * - Metadata created/updated/unchanged counters
 * - Asset outcomes per type and status, with written byte totals
 * - Average metadata completeness across built records
 * - Per-item failures and timed-out items
 */

package com.williamcallahan.media_metadata_sync.types;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class LibraryRunSummary {
    private final String libraryName;
    private final Map<MetadataAction, Integer> metadataActions = new EnumMap<>(MetadataAction.class);
    private final Map<AssetType, Map<String, Integer>> assetOutcomes = new EnumMap<>(AssetType.class);
    private final Map<AssetType, Long> bytesWritten = new EnumMap<>(AssetType.class);
    private final Map<String, String> failures = new LinkedHashMap<>();
    private final List<String> timedOut = new ArrayList<>();
    private double completenessTotal;
    private int completenessSamples;
    private int itemsProcessed;

    public LibraryRunSummary(String libraryName) {
        this.libraryName = libraryName;
    }

    public synchronized void recordMetadata(MetadataAction action, double completenessPercent) {
        metadataActions.merge(action, 1, Integer::sum);
        if (action != MetadataAction.FAILED && action != MetadataAction.SKIPPED) {
            completenessTotal += completenessPercent;
            completenessSamples++;
        }
    }

    public synchronized void recordAsset(AssetAction action) {
        String outcome = action.status() != null ? action.status().name() : "SKIPPED";
        assetOutcomes.computeIfAbsent(action.type(), k -> new LinkedHashMap<>()).merge(outcome, 1, Integer::sum);
        if (action.written()) {
            bytesWritten.merge(action.type(), action.bytes(), Long::sum);
        }
    }

    public synchronized void recordItemDone() {
        itemsProcessed++;
    }

    public synchronized void recordFailure(String item, String reason) {
        failures.put(item, reason);
    }

    public synchronized void recordTimedOut(String item) {
        timedOut.add(item);
        failures.put(item, "timed out");
    }

    public String getLibraryName() { return libraryName; }

    public synchronized int getMetadataCount(MetadataAction action) {
        return metadataActions.getOrDefault(action, 0);
    }

    public synchronized int getAssetCount(AssetType type, String outcome) {
        return assetOutcomes.getOrDefault(type, Map.of()).getOrDefault(outcome, 0);
    }

    public synchronized long getBytesWritten(AssetType type) {
        return bytesWritten.getOrDefault(type, 0L);
    }

    public synchronized double getAverageCompleteness() {
        return completenessSamples == 0 ? 0.0 : completenessTotal / completenessSamples;
    }

    public synchronized int getItemsProcessed() { return itemsProcessed; }

    public synchronized Map<String, String> getFailures() {
        return Map.copyOf(failures);
    }

    public synchronized List<String> getTimedOut() {
        return List.copyOf(timedOut);
    }

    @Override
    public synchronized String toString() {
        return String.format("LibraryRunSummary{library='%s', items=%d, metadata=%s, assets=%s, bytes=%s, completeness=%.1f%%, failures=%d, timedOut=%d}",
            libraryName, itemsProcessed, metadataActions, assetOutcomes, bytesWritten, getAverageCompleteness(),
            failures.size(), timedOut.size());
    }
}
