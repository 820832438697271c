/**
 * Decides whether a freshly built record changes the persisted one
 *
 * @author William Callahan
 *
 * Features:
 * - Lists compare as sorted string forms, so order never matters
 * - Maps recurse and flag the parent field when any nested field differs
 * - Scalars compare as trimmed strings, null reading as empty
 * - Only candidate fields are checked; fields the build did not produce never count
 */
package com.williamcallahan.media_metadata_sync.service.metadata;

import com.williamcallahan.media_metadata_sync.model.MetadataRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class MetadataDiffer {

    /**
     * Names of top-level fields (including "match") whose values differ
     *
     * @param existing persisted record, may be null
     * @param candidate freshly built record
     * @return changed field names in candidate order; empty means skip the write
     */
    public List<String> diff(MetadataRecord existing, MetadataRecord candidate) {
        Map<String, Object> existingMap = existing == null ? Map.of() : existing.toDocumentMap();
        return diffMaps(existingMap, candidate.toDocumentMap());
    }

    public List<String> diffMaps(Map<?, ?> existing, Map<?, ?> candidate) {
        Map<String, Object> normalizedExisting = normalizeKeys(existing);
        List<String> changed = new ArrayList<>();
        for (Map.Entry<?, ?> entry : candidate.entrySet()) {
            String field = String.valueOf(entry.getKey());
            if (!valuesEqual(normalizedExisting.get(field), entry.getValue())) {
                changed.add(field);
            }
        }
        return changed;
    }

    private boolean valuesEqual(Object existing, Object candidate) {
        if (candidate instanceof Collection<?> candidateList) {
            if (!(existing instanceof Collection<?> existingList)) {
                return existing == null && candidateList.isEmpty();
            }
            return sortedStrings(existingList).equals(sortedStrings(candidateList));
        }
        if (candidate instanceof Map<?, ?> candidateMap) {
            if (!(existing instanceof Map<?, ?> existingMap)) {
                return existing == null && candidateMap.isEmpty();
            }
            return diffMaps(existingMap, candidateMap).isEmpty();
        }
        return scalar(existing).equals(scalar(candidate));
    }

    private static List<String> sortedStrings(Collection<?> values) {
        List<String> strings = new ArrayList<>(values.size());
        for (Object value : values) {
            strings.add(String.valueOf(value));
        }
        strings.sort(null);
        return strings;
    }

    private static String scalar(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }

    private static Map<String, Object> normalizeKeys(Map<?, ?> map) {
        Map<String, Object> normalized = new HashMap<>();
        if (map != null) {
            map.forEach((k, v) -> normalized.put(String.valueOf(k), v));
        }
        return normalized;
    }
}
