/**
 * In-memory copy of one library's metadata document
 * Records are keyed by "Title (Year)" and keep insertion order
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.model;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

public class MetadataDocument {
    private final Path location;
    private final Map<String, Map<String, Object>> records;
    private boolean dirty;

    public MetadataDocument(Path location, Map<String, Map<String, Object>> records) {
        this.location = location;
        this.records = records == null ? new LinkedHashMap<>() : new LinkedHashMap<>(records);
    }

    public Path getLocation() {
        return location;
    }

    public synchronized Optional<MetadataRecord> get(String titleKey) {
        return Optional.ofNullable(MetadataRecord.fromDocument(records.get(titleKey)));
    }

    /**
     * Replaces the whole record for a title
     */
    public synchronized void put(String titleKey, MetadataRecord record) {
        records.put(titleKey, record.toDocumentMap());
        dirty = true;
    }

    /**
     * Removes every record whose title key fails the predicate
     *
     * @return the removed title keys
     */
    public synchronized List<String> retainTitles(Predicate<String> keep) {
        List<String> removed = records.keySet().stream().filter(keep.negate()).toList();
        removed.forEach(records::remove);
        if (!removed.isEmpty()) {
            dirty = true;
        }
        return removed;
    }

    public synchronized List<String> titles() {
        return List.copyOf(records.keySet());
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized Map<String, Map<String, Object>> snapshot() {
        return new LinkedHashMap<>(records);
    }

    public synchronized boolean isDirty() {
        return dirty;
    }

    public synchronized void markClean() {
        dirty = false;
    }
}
