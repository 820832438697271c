/**
 * Shared extraction helpers for movie and show metadata builders
 *
 * @author William Callahan
 *
 * Features:
 * - Crew job groupings for directors, writers and producers
 * - Null-safe text and number extraction from catalog JSON
 * - Country codes rendered as English country names
 * - Completeness scoring over expected fields minus ignored ones
 */
package com.williamcallahan.media_metadata_sync.service.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public abstract class MetadataBuilderSupport {

    protected static final Set<String> DIRECTOR_JOBS = Set.of("Director", "Co-Director", "Assistant Director");
    protected static final Set<String> WRITER_JOBS = Set.of("Writer", "Screenplay", "Story", "Creator", "Co-Writer",
        "Author", "Adaptation");
    protected static final Set<String> PRODUCER_JOBS = Set.of("Producer", "Executive Producer", "Associate Producer",
        "Co-Producer", "Line Producer", "Co-Executive Producer");
    protected static final int TOP_CAST = 10;
    protected static final int TOP_GUESTS = 5;

    protected final MetadataSyncProperties.Metadata settings;

    protected MetadataBuilderSupport(MetadataSyncProperties properties) {
        this.settings = properties.getMetadata();
    }

    public boolean isEnabled() {
        return settings.isRunBasic() || settings.isRunEnhanced();
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? "" : value.asText("");
    }

    protected static Integer integer(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() || !value.canConvertToInt() ? null : value.asInt();
    }

    protected static List<String> names(JsonNode array, int limit) {
        List<String> names = new ArrayList<>();
        if (array == null) {
            return names;
        }
        for (JsonNode member : array) {
            if (names.size() >= limit) {
                break;
            }
            names.add(text(member, "name"));
        }
        return names;
    }

    protected static List<String> crewNames(JsonNode crew, Set<String> jobs) {
        List<String> names = new ArrayList<>();
        if (crew == null) {
            return names;
        }
        for (JsonNode member : crew) {
            if (jobs.contains(text(member, "job"))) {
                names.add(text(member, "name"));
            }
        }
        return names;
    }

    /**
     * English display names for ISO 3166-1 alpha-2 codes; unknown codes are dropped
     */
    protected static List<String> countryNames(List<String> codes) {
        List<String> countries = new ArrayList<>();
        for (String code : codes) {
            if (code == null || code.length() != 2) {
                continue;
            }
            String name = new Locale("", code.toUpperCase(Locale.ROOT)).getDisplayCountry(Locale.ENGLISH);
            if (!name.isBlank() && !name.equalsIgnoreCase(code)) {
                countries.add(name);
            }
        }
        return countries;
    }

    protected static boolean nonEmpty(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode() && !(node.isContainerNode() && node.isEmpty());
    }

    /**
     * Percentage of expected fields carrying a value, ignored fields excluded
     * Returns 100 when nothing is left to check
     */
    protected int completeness(Map<String, Object> values, Collection<String> expectedFields) {
        Set<String> ignored = settings.getIgnoredFields() == null ? Set.of() : settings.getIgnoredFields();
        int expected = 0;
        int filled = 0;
        for (String field : expectedFields) {
            String baseName = field.contains(".") ? field.substring(field.lastIndexOf('.') + 1) : field;
            if (ignored.contains(baseName)) {
                continue;
            }
            expected++;
            if (isFilled(values.get(field))) {
                filled++;
            }
        }
        return expected == 0 ? 100 : (int) Math.round(filled * 100.0 / expected);
    }

    private static boolean isFilled(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        return !String.valueOf(value).isEmpty();
    }
}
