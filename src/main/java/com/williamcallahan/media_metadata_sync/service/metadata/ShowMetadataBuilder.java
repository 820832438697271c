/**
 * Builds show records, including seasons and episodes present in the media server
 *
 * @author William Callahan
 *
 * Features:
 * - Show fields: titles, first air date, US rating, networks, summary, country, genre, tagline
 * - Seasons and episodes limited to what exists locally; specials (season 0) skipped
 * - Episode credits fall back to season, then show credits
 * - Completeness scored across show, season and episode fields
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
import java.util.Optional;
import java.util.function.IntFunction;

@Slf4j
@Component
public class ShowMetadataBuilder extends MetadataBuilderSupport {

    private static final String RATING_COUNTRY = "US";

    public ShowMetadataBuilder(MetadataSyncProperties properties) {
        super(properties);
    }

    /**
     * @param item         local show with its seasons and episodes
     * @param externalId   catalog show id
     * @param details      show details payload
     * @param seasonLookup season number to season details, empty when the catalog has none
     */
    public BuiltMetadata build(MediaItem item, String externalId, JsonNode details, IntFunction<Optional<JsonNode>> seasonLookup) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (settings.isRunBasic()) {
            fields.put("sort_title", item.title());
            String originalName = text(details, "original_name");
            fields.put("original_title", originalName.isEmpty() ? item.title() : originalName);
            fields.put("originally_available", text(details, "first_air_date"));
            fields.put("content_rating", rating(details));
            fields.put("studio", String.join(", ", names(details.path("networks"), Integer.MAX_VALUE)
                .stream().filter(name -> !name.isEmpty()).toList()));
            fields.put("summary", text(details, "overview"));
            List<String> codes = new ArrayList<>();
            details.path("origin_country").forEach(code -> codes.add(code.asText()));
            fields.put("country", countryNames(codes));
            fields.put("genre", names(details.path("genres"), Integer.MAX_VALUE));
        }
        if (settings.isRunEnhanced()) {
            fields.put("tagline", text(details, "tagline"));
        }

        Map<String, Object> flattened = new LinkedHashMap<>(fields);
        Map<Integer, Object> seasons = new LinkedHashMap<>();
        for (JsonNode seasonInfo : details.path("seasons")) {
            Integer seasonNumber = integer(seasonInfo, "season_number");
            if (seasonNumber == null || seasonNumber == 0 || !item.seasonsEpisodes().containsKey(seasonNumber)) {
                continue;
            }
            Optional<JsonNode> seasonDetails = seasonLookup.apply(seasonNumber);
            if (seasonDetails.isEmpty()) {
                log.warn("No catalog data for season {} of {}, skipping", seasonNumber, item.titleYear());
                continue;
            }
            Map<String, Object> season = buildSeason(item, seasonNumber, details, seasonDetails.get(), flattened);
            seasons.put(seasonNumber, season);
        }
        fields.put("seasons", seasons);

        List<String> expected = new ArrayList<>(flattened.keySet());
        int percent = completeness(flattened, expected);
        log.debug("Show metadata for {} is {}% complete", item.titleYear(), percent);

        String tvdbId = text(details.path("external_ids"), "tvdb_id");
        MetadataRecord record = new MetadataRecord(new MetadataRecord.Match(item.title(), item.year(), tvdbId), fields);
        return new BuiltMetadata(record, percent, details);
    }

    private Map<String, Object> buildSeason(MediaItem item, int seasonNumber, JsonNode show, JsonNode seasonDetails,
                                            Map<String, Object> flattened) {
        List<Integer> localEpisodes = item.seasonsEpisodes().getOrDefault(seasonNumber, List.of());
        JsonNode showCrew = show.path("credits").path("crew");
        JsonNode showCast = show.path("credits").path("cast");
        JsonNode seasonCrew = seasonDetails.path("credits").path("crew");
        JsonNode seasonCast = seasonDetails.path("credits").path("cast");

        Map<Integer, Object> episodes = new LinkedHashMap<>();
        for (JsonNode episode : seasonDetails.path("episodes")) {
            Integer episodeNumber = integer(episode, "episode_number");
            if (episodeNumber == null || !localEpisodes.contains(episodeNumber)) {
                continue;
            }
            JsonNode crew = firstNonEmpty(episode.path("crew"), seasonCrew, showCrew);
            JsonNode cast = firstNonEmpty(episode.path("credits").path("cast"), seasonCast, showCast);

            Map<String, Object> episodeFields = new LinkedHashMap<>();
            String name = text(episode, "name");
            if (settings.isRunBasic()) {
                episodeFields.put("title", name);
                episodeFields.put("sort_title", name);
                episodeFields.put("originally_available", text(episode, "air_date"));
                episodeFields.put("runtime", integer(episode, "runtime"));
                episodeFields.put("summary", text(episode, "overview"));
            }
            if (settings.isRunEnhanced()) {
                episodeFields.put("cast", names(cast, TOP_CAST));
                JsonNode guests = nonEmpty(episode.path("credits").path("guest_stars"))
                    ? episode.path("credits").path("guest_stars")
                    : episode.path("guest_stars");
                episodeFields.put("guest", names(guests, TOP_GUESTS));
                episodeFields.put("director", crewNames(crew, DIRECTOR_JOBS));
                episodeFields.put("writer", crewNames(crew, WRITER_JOBS));
            }
            episodeFields.forEach((field, value) ->
                flattened.put("season" + seasonNumber + ".ep" + episodeNumber + "." + field, value));
            episodes.put(episodeNumber, episodeFields);
        }

        Map<String, Object> season = new LinkedHashMap<>();
        String airDate = text(seasonDetails, "air_date");
        season.put("originally_available", airDate);
        season.put("episodes", episodes);
        flattened.put("season" + seasonNumber + ".originally_available", airDate);
        return season;
    }

    private static JsonNode firstNonEmpty(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (nonEmpty(candidate)) {
                return candidate;
            }
        }
        return candidates[candidates.length - 1];
    }

    static String rating(JsonNode details) {
        for (JsonNode rating : details.path("content_ratings").path("results")) {
            if (RATING_COUNTRY.equals(text(rating, "iso_3166_1"))) {
                return text(rating, "rating");
            }
        }
        return "";
    }
}
