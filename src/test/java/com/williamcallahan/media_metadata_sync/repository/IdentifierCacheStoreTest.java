package com.williamcallahan.media_metadata_sync.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.media_metadata_sync.model.CacheEntry;
import com.williamcallahan.media_metadata_sync.types.AssetType;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierCacheStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private Path cacheFile;
    private Path failedFile;

    @BeforeEach
    void setUp() {
        cacheFile = tempDir.resolve("tmdb_cache.json");
        failedFile = tempDir.resolve("failed_items.json");
    }

    private IdentifierCacheStore store(boolean dryRun) {
        IdentifierCacheStore store = new IdentifierCacheStore(cacheFile, failedFile, dryRun, mapper);
        store.load();
        return store;
    }

    @Test
    void missingFilesLoadAsEmptyStore() {
        IdentifierCacheStore store = store(false);

        assertThat(store.size()).isZero();
        assertThat(store.failedKeys()).isEmpty();
    }

    @Test
    void readsEveryLegacyShape() throws IOException {
        Files.writeString(cacheFile, """
            {
              "movie:The Matrix:1999": 603,
              "movie:Heat:1995": "949",
              "movie:Nowhere:2000": true,
              "tv:Severance:2022": {"tmdb_id": 95396, "poster_average": 6.2, "bg_average": 5.1,
                                    "poster_last_upgraded": "2024-03-01T10:15:30"},
              "tv:Severance:2022:season1": {"id": 95396, "season_average": 4.4},
              "movie:Dune:2021": {"tmdb_id": 438631, "title": "Dune", "year": 2021, "media_type": "movie",
                                  "quality_metrics": {"poster_average": 7.5},
                                  "last_updated": "2024-05-01T00:00:00Z"}
            }
            """);

        IdentifierCacheStore store = store(false);

        assertThat(store.find("movie:The Matrix:1999")).hasValueSatisfying(entry -> {
            assertThat(entry.externalId()).isEqualTo("603");
            assertThat(entry.title()).isEqualTo("The Matrix");
            assertThat(entry.year()).isEqualTo(1999);
            assertThat(entry.mediaType()).isEqualTo(MediaType.MOVIE);
        });
        assertThat(store.find("movie:Heat:1995")).hasValueSatisfying(entry -> assertThat(entry.externalId()).isEqualTo("949"));
        assertThat(store.find("movie:Nowhere:2000")).isEmpty();
        assertThat(store.isFailed("movie:Nowhere:2000")).isTrue();
        assertThat(store.find("tv:Severance:2022")).hasValueSatisfying(entry -> {
            assertThat(entry.qualityFor(AssetType.POSTER)).isEqualTo(6.2);
            assertThat(entry.qualityFor(AssetType.BACKGROUND)).isEqualTo(5.1);
            assertThat(entry.assetUpgradedAt()).containsKey("poster_average");
        });
        assertThat(store.find("tv:Severance:2022:season1")).hasValueSatisfying(entry -> {
            assertThat(entry.mediaType()).isEqualTo(MediaType.TV_SEASON);
            assertThat(entry.qualityFor(AssetType.SEASON_POSTER)).isEqualTo(4.4);
        });
        assertThat(store.find("movie:Dune:2021")).hasValueSatisfying(entry -> {
            assertThat(entry.qualityFor(AssetType.POSTER)).isEqualTo(7.5);
            assertThat(entry.lastUpdated()).isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
        });
    }

    @Test
    void handEditedKeyWithHugeSeasonStillLoads() throws IOException {
        Files.writeString(cacheFile, """
            {"tv:X:2020:season99999999999": {"tmdb_id": 1}, "movie:Heat:1995": "949"}
            """);

        IdentifierCacheStore store = store(false);

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.find("movie:Heat:1995")).isPresent();
    }

    @Test
    void writesOnlyTheStructuredShape() throws IOException {
        Files.writeString(cacheFile, "{\"movie:The Matrix:1999\": 603}");
        IdentifierCacheStore store = store(false);

        store.put(CacheEntry.resolved("movie:Heat:1995", "949", "Heat", 1995, MediaType.MOVIE, Instant.EPOCH));

        JsonNode root = mapper.readTree(cacheFile.toFile());
        JsonNode matrix = root.path("movie:The Matrix:1999");
        assertThat(matrix.isObject()).isTrue();
        assertThat(matrix.path("tmdb_id").asLong()).isEqualTo(603L);
        assertThat(matrix.path("media_type").asText()).isEqualTo("movie");
        assertThat(root.path("movie:Heat:1995").path("title").asText()).isEqualTo("Heat");
    }

    @Test
    void entriesSurviveAReload() {
        IdentifierCacheStore store = store(false);
        CacheEntry entry = CacheEntry.resolved("movie:Heat:1995", "949", "Heat", 1995, MediaType.MOVIE, Instant.EPOCH)
            .withAssetUpgrade(AssetType.POSTER, 6.8, Instant.parse("2024-01-01T00:00:00Z"));
        store.put(entry);
        store.markFailed("movie:Nowhere:2000");

        IdentifierCacheStore reloaded = store(false);

        assertThat(reloaded.find("movie:Heat:1995")).contains(entry);
        assertThat(reloaded.isFailed("movie:Nowhere:2000")).isTrue();
    }

    @Test
    void dryRunNeverWritesFiles() {
        IdentifierCacheStore store = store(true);

        store.put(CacheEntry.resolved("movie:Heat:1995", "949", "Heat", 1995, MediaType.MOVIE, Instant.EPOCH));
        store.markFailed("movie:Nowhere:2000");

        assertThat(store.find("movie:Heat:1995")).isPresent();
        assertThat(cacheFile).doesNotExist();
        assertThat(failedFile).doesNotExist();
    }

    @Test
    void corruptFileLoadsAsEmpty() throws IOException {
        Files.writeString(cacheFile, "{not json");

        assertThat(store(false).size()).isZero();
    }

    @Test
    void removeAllCountsOnlyPresentKeys() {
        IdentifierCacheStore store = store(false);
        store.put(CacheEntry.resolved("movie:Heat:1995", "949", "Heat", 1995, MediaType.MOVIE, Instant.EPOCH));

        int removed = store.removeAll(java.util.List.of("movie:Heat:1995", "movie:Other:2000"));

        assertThat(removed).isEqualTo(1);
        assertThat(store.size()).isZero();
    }
}
