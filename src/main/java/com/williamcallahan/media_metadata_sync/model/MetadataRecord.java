/**
 * One title's entry in a library metadata document
 *
 * @author William Callahan
 *
 * Features:
 * - Typed match block (title, year, mapping identifier)
 * - Ordered field map holding scalars, lists and nested maps (seasons, episodes)
 * - Converts to and from the plain map shape stored in the YAML document
 */
package com.williamcallahan.media_metadata_sync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record MetadataRecord(Match match, Map<String, Object> fields) {

    public static final String MATCH_KEY = "match";

    public record Match(String title, Integer year, String mappingId) {

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("title", title);
            if (year != null) {
                map.put("year", year);
            }
            if (mappingId != null) {
                // numeric ids are written as numbers
                map.put("mapping_id", mappingId.matches("\\d{1,18}") ? (Object) Long.valueOf(mappingId) : mappingId);
            }
            return map;
        }

        static Match fromMap(Object raw) {
            if (!(raw instanceof Map<?, ?> map)) {
                return null;
            }
            Object title = map.get("title");
            Object year = map.get("year");
            Object mappingId = map.get("mapping_id");
            Integer parsedYear = null;
            if (year instanceof Number n) {
                parsedYear = n.intValue();
            } else if (year != null) {
                try {
                    parsedYear = Integer.parseInt(year.toString().trim());
                } catch (NumberFormatException ignored) {
                    parsedYear = null;
                }
            }
            return new Match(title == null ? null : title.toString(), parsedYear,
                mappingId == null ? null : mappingId.toString());
        }
    }

    public MetadataRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Document shape: match block first, then fields in build order
     */
    public Map<String, Object> toDocumentMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (match != null) {
            map.put(MATCH_KEY, match.toMap());
        }
        map.putAll(fields);
        return map;
    }

    public static MetadataRecord fromDocument(Map<String, Object> raw) {
        if (raw == null) {
            return null;
        }
        Map<String, Object> fields = new LinkedHashMap<>(raw);
        Object match = fields.remove(MATCH_KEY);
        return new MetadataRecord(Match.fromMap(match), fields);
    }
}
