package com.williamcallahan.media_metadata_sync.client.plex;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.media_metadata_sync.client.LibraryListing;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.MediaItem;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PlexMediaServerClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void mapsPlexSectionTypes() {
        assertThat(PlexMediaServerClient.sectionType("movie")).contains(MediaType.MOVIE);
        assertThat(PlexMediaServerClient.sectionType("show")).contains(MediaType.TV);
        assertThat(PlexMediaServerClient.sectionType("artist")).isEmpty();
    }

    @Test
    void movieDirectoryIsParentOfFirstPart() throws Exception {
        JsonNode metadata = objectMapper.readTree("""
            {"ratingKey": "101", "title": "Dune", "year": 2021,
             "Guid": [{"id": "imdb://tt1160419"}, {"id": "tmdb://438631"}, {"id": ""}],
             "Media": [{"Part": [{"file": "/media/movies/Dune (2021)/Dune.mkv"}]}]}
            """);

        MediaItem movie = PlexMediaServerClient.toMovie(metadata, "Movies");

        assertThat(movie.ratingKey()).isEqualTo("101");
        assertThat(movie.year()).isEqualTo(2021);
        assertThat(movie.mediaType()).isEqualTo(MediaType.MOVIE);
        assertThat(movie.guids()).containsExactly("imdb://tt1160419", "tmdb://438631");
        assertThat(movie.itemDirectory()).isEqualTo(Paths.get("/media/movies/Dune (2021)"));
        assertThat(movie.directoryName()).isEqualTo("Dune (2021)");
    }

    @Test
    void movieWithoutFilesFallsBackToTitleYear() throws Exception {
        JsonNode metadata = objectMapper.readTree("{\"ratingKey\": \"5\", \"title\": \"Alien\"}");

        MediaItem movie = PlexMediaServerClient.toMovie(metadata, "Movies");

        assertThat(movie.year()).isNull();
        assertThat(movie.itemDirectory()).isNull();
        assertThat(movie.directoryName()).isEqualTo("Alien");
    }

    @Test
    void showCollectsSeasonsFromLeaves() throws Exception {
        JsonNode metadata = objectMapper.readTree("""
            {"ratingKey": "7", "title": "Severance", "year": 2022, "Guid": [{"id": "tvdb://371980"}]}
            """);
        JsonNode leaves = objectMapper.readTree("""
            {"MediaContainer": {"Metadata": [
              {"parentIndex": 1, "index": 1,
               "Media": [{"Part": [{"file": "/media/tv/Severance (2022)/Season 01/S01E01.mkv"}]}]},
              {"parentIndex": 1, "index": 2},
              {"parentIndex": 2, "index": 1},
              {"index": 9}
            ]}}
            """);

        MediaItem show = PlexMediaServerClient.toShow(metadata, leaves, "TV Shows");

        assertThat(show.isShow()).isTrue();
        assertThat(show.seasonsEpisodes()).containsOnlyKeys(1, 2);
        assertThat(show.seasonsEpisodes().get(1)).isEqualTo(List.of(1, 2));
        assertThat(show.itemDirectory()).isEqualTo(Paths.get("/media/tv/Severance (2022)"));
    }

    @Test
    void showWhoseLeavesFailIsReportedAsSkipped() {
        Map<String, String> responses = Map.of(
            "/library/sections", """
                {"MediaContainer": {"Directory": [{"key": "2", "title": "TV Shows", "type": "show"}]}}
                """,
            "/library/sections/2/all", """
                {"MediaContainer": {"Metadata": [
                  {"ratingKey": "10", "title": "Severance", "year": 2022},
                  {"ratingKey": "11", "title": "Andor", "year": 2022}
                ]}}
                """,
            "/library/metadata/10/allLeaves", """
                {"MediaContainer": {"Metadata": [{"parentIndex": 1, "index": 1}]}}
                """);
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            String body = responses.get(request.url().getPath());
            if (body == null) {
                return Mono.just(ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR).build());
            }
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body)
                .build());
        });
        MetadataSyncProperties properties = new MetadataSyncProperties();
        properties.getPlex().setUrl("http://plex.local:32400");

        LibraryListing listing = new PlexMediaServerClient(builder, properties).listItems("TV Shows");

        assertThat(listing.items()).extracting(MediaItem::title).containsExactly("Severance");
        assertThat(listing.skipped()).containsExactly("Andor");
        assertThat(listing.isComplete()).isFalse();
    }
}
