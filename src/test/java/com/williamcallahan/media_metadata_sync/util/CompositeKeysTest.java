package com.williamcallahan.media_metadata_sync.util;

import com.williamcallahan.media_metadata_sync.types.MediaType;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CompositeKeysTest {

    @Test
    void buildsKeysWithMediaPrefix() {
        assertThat(CompositeKeys.forItem(MediaType.MOVIE, "Dune", 2021)).isEqualTo("movie:Dune:2021");
        assertThat(CompositeKeys.show("Severance", 2022)).isEqualTo("tv:Severance:2022");
        assertThat(CompositeKeys.season("Severance", 2022, 2)).isEqualTo("tv:Severance:2022:season2");
    }

    @Test
    void missingYearLeavesTrailingSegmentEmpty() {
        assertThat(CompositeKeys.forItem(MediaType.MOVIE, "Alien", null)).isEqualTo("movie:Alien:");
    }

    @Test
    void parsesTitlesContainingColons() {
        Optional<CompositeKeys.ParsedKey> parsed = CompositeKeys.parse("movie:Mission: Impossible:1996");

        assertThat(parsed).isPresent();
        assertThat(parsed.get().prefix()).isEqualTo("movie");
        assertThat(parsed.get().title()).isEqualTo("Mission: Impossible");
        assertThat(parsed.get().year()).isEqualTo("1996");
        assertThat(parsed.get().season()).isNull();
        assertThat(parsed.get().titleYear()).isEqualTo("Mission: Impossible (1996)");
    }

    @Test
    void parsesSeasonSuffix() {
        CompositeKeys.ParsedKey parsed = CompositeKeys.parse("tv:Severance:2022:season2").orElseThrow();

        assertThat(parsed.title()).isEqualTo("Severance");
        assertThat(parsed.year()).isEqualTo("2022");
        assertThat(parsed.season()).isEqualTo(2);
    }

    @Test
    void titleYearOmitsBlankYear() {
        assertThat(CompositeKeys.parse("movie:Alien:").orElseThrow().titleYear()).isEqualTo("Alien");
    }

    @Test
    void rejectsKeysWithoutPrefix() {
        assertThat(CompositeKeys.parse(null)).isEmpty();
        assertThat(CompositeKeys.parse("no-prefix")).isEmpty();
        assertThat(CompositeKeys.parse(":Dune:2021")).isEmpty();
    }

    @Test
    void oversizedSeasonSuffixIsNotTreatedAsSeason() {
        CompositeKeys.ParsedKey parsed = CompositeKeys.parse("tv:X:2020:season99999999999").orElseThrow();

        assertThat(parsed.season()).isNull();
        assertThat(parsed.title()).isEqualTo("X:2020");
    }
}
