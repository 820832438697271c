/**
 * Typed operations against the TMDb v3 API
 *
 * @author William Callahan
 *
 * Features:
 * - Title search ranked by vote count, then popularity
 * - Movie and show details with credits, ratings, external ids and images appended
 * - Season details with episodes and season posters
 * - Image downloads through the same retry policy
 */
package com.williamcallahan.media_metadata_sync.service.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.types.AssetCandidate;
import com.williamcallahan.media_metadata_sync.types.FetchResult;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import com.williamcallahan.media_metadata_sync.types.SearchHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class TmdbCatalogService {

    private static final String MOVIE_APPENDS = "credits,release_dates,external_ids,images";
    private static final String TV_APPENDS = "credits,content_ratings,external_ids,images";

    private final RetryingCatalogClient client;
    private final MetadataSyncProperties.Tmdb tmdb;

    public TmdbCatalogService(RetryingCatalogClient client, MetadataSyncProperties properties) {
        this.client = client;
        this.tmdb = properties.getTmdb();
    }

    /**
     * Searches titles of one media kind
     *
     * @param mediaType movie or show
     * @param query     title to search for
     * @param year      release year, or null to search all years
     * @return hits ordered best first; an empty list when nothing matched
     */
    public FetchResult<List<SearchHit>> search(MediaType mediaType, String query, Integer year) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("include_adult", "false");
        if (year != null) {
            params.put(mediaType == MediaType.MOVIE ? "year" : "first_air_date_year", year.toString());
        }
        return client.fetch("/search/" + mediaType.getCatalogPath(), params).map(TmdbCatalogService::toHits);
    }

    public FetchResult<JsonNode> details(String externalId, MediaType mediaType) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("append_to_response", mediaType == MediaType.MOVIE ? MOVIE_APPENDS : TV_APPENDS);
        params.put("include_image_language", imageLanguages());
        return client.fetch("/" + mediaType.getCatalogPath() + "/" + externalId, params);
    }

    public FetchResult<JsonNode> seasonDetails(String showId, int seasonNumber) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("append_to_response", "credits,images");
        params.put("include_image_language", imageLanguages());
        return client.fetch("/tv/" + showId + "/season/" + seasonNumber, params);
    }

    /**
     * Images for a title, taken from a details payload when it already carries them
     */
    public FetchResult<CatalogImages> images(String externalId, MediaType mediaType) {
        return details(externalId, mediaType).map(details -> readImages(details.path("images")));
    }

    public FetchResult<byte[]> download(String imagePath) {
        return client.download(imagePath);
    }

    /**
     * Two-letter language list passed as include_image_language, always ending with "null"
     */
    String imageLanguages() {
        Set<String> languages = new LinkedHashSet<>();
        languages.add(tmdb.getImageLanguage());
        if (tmdb.getFallbackLanguages() != null) {
            tmdb.getFallbackLanguages().stream()
                .filter(lang -> lang != null && !lang.isBlank())
                .forEach(languages::add);
        }
        languages.add("null");
        return String.join(",", languages);
    }

    static List<SearchHit> toHits(JsonNode response) {
        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode result : response.path("results")) {
            JsonNode id = result.get("id");
            if (id == null || id.isNull()) {
                continue;
            }
            hits.add(new SearchHit(id.asText(), result.path("vote_count").asLong(0),
                result.path("popularity").asDouble(0.0)));
        }
        hits.sort(SearchHit.BEST_FIRST);
        return hits;
    }

    public static CatalogImages readImages(JsonNode images) {
        if (images == null || images.isMissingNode() || images.isNull()) {
            return CatalogImages.EMPTY;
        }
        return new CatalogImages(readCandidates(images.path("posters")), readCandidates(images.path("backdrops")));
    }

    private static List<AssetCandidate> readCandidates(JsonNode array) {
        List<AssetCandidate> candidates = new ArrayList<>();
        for (JsonNode image : array) {
            String filePath = image.path("file_path").asText(null);
            if (filePath == null || filePath.isBlank()) {
                continue;
            }
            JsonNode language = image.get("iso_639_1");
            candidates.add(new AssetCandidate(filePath,
                language == null || language.isNull() ? null : language.asText(),
                image.path("vote_average").asDouble(0.0),
                image.path("width").asInt(0),
                image.path("height").asInt(0)));
        }
        return candidates;
    }
}
