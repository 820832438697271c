/**
 * Builds movie records from catalog details
 *
 * @author William Callahan
 *
 * Features:
 * - Basic fields: titles, release date, US certification, studio, runtime, tagline, summary, country, genre
 * - Enhanced fields: top cast, directors, writers, producers, collection
 * - Match block maps the record to its catalog id
 */
package com.williamcallahan.media_metadata_sync.service.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.MediaItem;
import com.williamcallahan.media_metadata_sync.model.MetadataRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class MovieMetadataBuilder extends MetadataBuilderSupport {

    private static final String CERTIFICATION_COUNTRY = "US";

    public MovieMetadataBuilder(MetadataSyncProperties properties) {
        super(properties);
    }

    public BuiltMetadata build(MediaItem item, String externalId, JsonNode details) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (settings.isRunBasic()) {
            fields.put("sort_title", item.title());
            String originalTitle = text(details, "original_title");
            fields.put("original_title", originalTitle.isEmpty() ? item.title() : originalTitle);
            fields.put("originally_available", text(details, "release_date"));
            fields.put("content_rating", certification(details));
            fields.put("studio", String.join(", ", names(details.path("production_companies"), Integer.MAX_VALUE)
                .stream().filter(name -> !name.isEmpty()).toList()));
            fields.put("runtime", integer(details, "runtime"));
            fields.put("tagline", text(details, "tagline"));
            fields.put("summary", text(details, "overview"));
            List<String> codes = new ArrayList<>();
            details.path("production_countries").forEach(country -> codes.add(text(country, "iso_3166_1")));
            fields.put("country", countryNames(codes));
            fields.put("genre", names(details.path("genres"), Integer.MAX_VALUE));
        }
        if (settings.isRunEnhanced()) {
            JsonNode credits = details.path("credits");
            fields.put("cast", names(credits.path("cast"), TOP_CAST));
            fields.put("director", crewNames(credits.path("crew"), DIRECTOR_JOBS));
            fields.put("writer", crewNames(credits.path("crew"), WRITER_JOBS));
            fields.put("producer", crewNames(credits.path("crew"), PRODUCER_JOBS));
            JsonNode collection = details.path("belongs_to_collection");
            fields.put("collection", nonEmpty(collection) ? text(collection, "name") : "");
        }

        List<String> expected = fields.keySet().stream().filter(field -> !"collection".equals(field)).toList();
        int percent = completeness(fields, expected);
        log.debug("Movie metadata for {} is {}% complete", item.titleYear(), percent);

        MetadataRecord record = new MetadataRecord(new MetadataRecord.Match(item.title(), item.year(), externalId), fields);
        return new BuiltMetadata(record, percent, details);
    }

    /**
     * First non-empty US certification across release dates
     */
    static String certification(JsonNode details) {
        for (JsonNode country : details.path("release_dates").path("results")) {
            if (!CERTIFICATION_COUNTRY.equals(text(country, "iso_3166_1"))) {
                continue;
            }
            for (JsonNode release : country.path("release_dates")) {
                String certification = text(release, "certification");
                if (!certification.isEmpty()) {
                    return certification;
                }
            }
        }
        return "";
    }
}
