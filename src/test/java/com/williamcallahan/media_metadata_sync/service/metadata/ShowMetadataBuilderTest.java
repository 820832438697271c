package com.williamcallahan.media_metadata_sync.service.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.MediaItem;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ShowMetadataBuilderTest {

    private static final String SHOW = """
        {
          "id": 95396,
          "name": "Severance",
          "original_name": "Severance",
          "first_air_date": "2022-02-17",
          "overview": "Mark leads a team of office workers.",
          "tagline": "Work is a mystery.",
          "networks": [{"name": "Apple TV+"}],
          "origin_country": ["US"],
          "genres": [{"name": "Drama"}],
          "external_ids": {"tvdb_id": 371980},
          "content_ratings": {"results": [{"iso_3166_1": "DE", "rating": "16"}, {"iso_3166_1": "US", "rating": "TV-MA"}]},
          "credits": {
            "cast": [{"name": "Adam Scott"}],
            "crew": [{"name": "Dan Erickson", "job": "Creator"}, {"name": "Ben Stiller", "job": "Director"}]
          },
          "seasons": [{"season_number": 0}, {"season_number": 1}, {"season_number": 2}]
        }
        """;

    private static final String SEASON_ONE = """
        {
          "season_number": 1,
          "air_date": "2022-02-17",
          "episodes": [
            {"episode_number": 1, "name": "Good News About Hell", "air_date": "2022-02-17", "runtime": 57,
             "overview": "Mark is promoted.",
             "crew": [{"name": "Ben Stiller", "job": "Director"}, {"name": "Dan Erickson", "job": "Writer"}],
             "guest_stars": [{"name": "Yul Vazquez"}]},
            {"episode_number": 2, "name": "Half Loop", "air_date": "2022-02-18", "runtime": 53,
             "overview": "Helly tries to quit."},
            {"episode_number": 3, "name": "In Perpetuity", "air_date": "2022-02-25"}
          ]
        }
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MetadataSyncProperties properties;
    private MediaItem severance;
    private List<Integer> lookedUp;

    @BeforeEach
    void setUp() {
        properties = new MetadataSyncProperties();
        severance = new MediaItem("7", "Severance", 2022, MediaType.TV, "TV Shows", List.of(), null,
            Map.of(0, List.of(1), 1, List.of(1, 2)));
        lookedUp = new ArrayList<>();
    }

    private BuiltMetadata build() throws Exception {
        JsonNode seasonOne = objectMapper.readTree(SEASON_ONE);
        return new ShowMetadataBuilder(properties).build(severance, "95396", objectMapper.readTree(SHOW), number -> {
            lookedUp.add(number);
            return number == 1 ? Optional.of(seasonOne) : Optional.empty();
        });
    }

    @Test
    void buildsShowFieldsWithTvdbMapping() throws Exception {
        BuiltMetadata built = build();

        Map<String, Object> fields = built.record().fields();
        assertThat(built.record().match().mappingId()).isEqualTo("371980");
        assertThat(fields.get("content_rating")).isEqualTo("TV-MA");
        assertThat(fields.get("studio")).isEqualTo("Apple TV+");
        assertThat(fields.get("country")).isEqualTo(List.of("United States"));
        assertThat(fields.get("tagline")).isEqualTo("Work is a mystery.");
    }

    @Test
    @SuppressWarnings("unchecked")
    void onlyLocalSeasonsAndEpisodesAreIncluded() throws Exception {
        BuiltMetadata built = build();

        Map<Integer, Object> seasons = (Map<Integer, Object>) built.record().fields().get("seasons");
        assertThat(seasons).containsOnlyKeys(1);
        assertThat(lookedUp).containsExactly(1);

        Map<String, Object> season = (Map<String, Object>) seasons.get(1);
        assertThat(season.get("originally_available")).isEqualTo("2022-02-17");
        Map<Integer, Object> episodes = (Map<Integer, Object>) season.get("episodes");
        assertThat(episodes).containsOnlyKeys(1, 2);
    }

    @Test
    @SuppressWarnings("unchecked")
    void episodeCrewFallsBackToShowCredits() throws Exception {
        BuiltMetadata built = build();

        Map<Integer, Object> seasons = (Map<Integer, Object>) built.record().fields().get("seasons");
        Map<Integer, Object> episodes = (Map<Integer, Object>) ((Map<String, Object>) seasons.get(1)).get("episodes");
        Map<String, Object> pilot = (Map<String, Object>) episodes.get(1);
        Map<String, Object> second = (Map<String, Object>) episodes.get(2);

        assertThat(pilot.get("writer")).isEqualTo(List.of("Dan Erickson"));
        assertThat(pilot.get("guest")).isEqualTo(List.of("Yul Vazquez"));
        assertThat(second.get("director")).isEqualTo(List.of("Ben Stiller"));
        assertThat(second.get("writer")).isEqualTo(List.of("Dan Erickson"));
        assertThat(second.get("cast")).isEqualTo(List.of("Adam Scott"));
    }

    @Test
    void basicOnlySkipsCredits() throws Exception {
        properties.getMetadata().setRunEnhanced(false);

        BuiltMetadata built = build();

        assertThat(built.record().fields()).doesNotContainKey("tagline");
        assertThat(built.completenessPercent()).isEqualTo(100);
    }

    @Test
    void seasonWithoutCatalogDataIsSkipped() throws Exception {
        severance = new MediaItem("7", "Severance", 2022, MediaType.TV, "TV Shows", List.of(), null,
            Map.of(2, List.of(1)));

        BuiltMetadata built = build();

        assertThat(lookedUp).containsExactly(2);
        assertThat((Map<?, ?>) built.record().fields().get("seasons")).isEmpty();
    }
}
