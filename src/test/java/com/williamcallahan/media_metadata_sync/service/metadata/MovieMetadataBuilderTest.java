package com.williamcallahan.media_metadata_sync.service.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.MediaItem;
import com.williamcallahan.media_metadata_sync.model.MetadataRecord;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MovieMetadataBuilderTest {

    private static final String DETAILS = """
        {
          "id": 438631,
          "title": "Dune",
          "original_title": "Dune",
          "release_date": "2021-09-15",
          "runtime": 155,
          "tagline": "Beyond fear, destiny awaits.",
          "overview": "Paul Atreides travels to Arrakis.",
          "production_companies": [{"name": "Legendary Pictures"}, {"name": ""}, {"name": "Villeneuve Films"}],
          "production_countries": [{"iso_3166_1": "US"}, {"iso_3166_1": "CA"}],
          "genres": [{"name": "Science Fiction"}, {"name": "Adventure"}],
          "belongs_to_collection": {"name": "Dune Collection"},
          "release_dates": {"results": [
            {"iso_3166_1": "GB", "release_dates": [{"certification": "12A"}]},
            {"iso_3166_1": "US", "release_dates": [{"certification": ""}, {"certification": "PG-13"}]}
          ]},
          "credits": {
            "cast": [{"name": "Timothée Chalamet"}, {"name": "Rebecca Ferguson"}],
            "crew": [
              {"name": "Denis Villeneuve", "job": "Director"},
              {"name": "Jon Spaihts", "job": "Screenplay"},
              {"name": "Mary Parent", "job": "Producer"},
              {"name": "Hans Zimmer", "job": "Original Music Composer"}
            ]
          }
        }
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MetadataSyncProperties properties;
    private MediaItem dune;

    @BeforeEach
    void setUp() {
        properties = new MetadataSyncProperties();
        dune = new MediaItem("1", "Dune", 2021, MediaType.MOVIE, "Movies", List.of("tmdb://438631"), null, Map.of());
    }

    @Test
    void buildsBasicAndEnhancedFields() throws Exception {
        BuiltMetadata built = new MovieMetadataBuilder(properties).build(dune, "438631", objectMapper.readTree(DETAILS));

        Map<String, Object> fields = built.record().fields();
        assertThat(built.record().match()).isEqualTo(new MetadataRecord.Match("Dune", 2021, "438631"));
        assertThat(fields.get("content_rating")).isEqualTo("PG-13");
        assertThat(fields.get("studio")).isEqualTo("Legendary Pictures, Villeneuve Films");
        assertThat(fields.get("country")).isEqualTo(List.of("United States", "Canada"));
        assertThat(fields.get("genre")).isEqualTo(List.of("Science Fiction", "Adventure"));
        assertThat(fields.get("runtime")).isEqualTo(155);
        assertThat(fields.get("director")).isEqualTo(List.of("Denis Villeneuve"));
        assertThat(fields.get("writer")).isEqualTo(List.of("Jon Spaihts"));
        assertThat(fields.get("producer")).isEqualTo(List.of("Mary Parent"));
        assertThat(fields.get("collection")).isEqualTo("Dune Collection");
        assertThat(built.completenessPercent()).isEqualTo(100);
    }

    @Test
    void fieldsFollowBuildOrder() throws Exception {
        BuiltMetadata built = new MovieMetadataBuilder(properties).build(dune, "438631", objectMapper.readTree(DETAILS));

        assertThat(built.record().fields().keySet()).startsWith("sort_title", "original_title", "originally_available");
        assertThat(built.record().toDocumentMap().keySet()).first().isEqualTo("match");
    }

    @Test
    void enhancedOnlySkipsBasicFields() throws Exception {
        properties.getMetadata().setRunBasic(false);

        BuiltMetadata built = new MovieMetadataBuilder(properties).build(dune, "438631", objectMapper.readTree(DETAILS));

        assertThat(built.record().fields()).doesNotContainKey("summary").containsKeys("cast", "collection");
    }

    @Test
    void missingValuesLowerCompleteness() throws Exception {
        JsonNode sparse = objectMapper.readTree("{\"title\": \"Dune\", \"overview\": \"Spice.\"}");

        BuiltMetadata built = new MovieMetadataBuilder(properties).build(dune, "438631", sparse);

        assertThat(built.record().fields().get("original_title")).isEqualTo("Dune");
        assertThat(built.record().fields().get("content_rating")).isEqualTo("");
        assertThat(built.completenessPercent()).isBetween(1, 99);
    }

    @Test
    void ignoredFieldsDoNotCountAgainstCompleteness() throws Exception {
        JsonNode noRuntime = objectMapper.readTree(DETAILS.replace("\"runtime\": 155,", ""));

        BuiltMetadata built = new MovieMetadataBuilder(properties).build(dune, "438631", noRuntime);

        assertThat(built.record().fields().get("runtime")).isNull();
        assertThat(built.completenessPercent()).isEqualTo(100);
    }

    @Test
    void certificationIgnoresOtherCountries() throws Exception {
        JsonNode gbOnly = objectMapper.readTree(
            "{\"release_dates\": {\"results\": [{\"iso_3166_1\": \"GB\", \"release_dates\": [{\"certification\": \"15\"}]}]}}");

        assertThat(MovieMetadataBuilder.certification(gbOnly)).isEmpty();
    }
}
