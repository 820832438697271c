package com.williamcallahan.media_metadata_sync.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCacheTest {

    @Test
    void signatureIgnoresParameterOrder() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("query", "Dune");
        first.put("year", "2021");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("year", "2021");
        second.put("query", "Dune");

        assertThat(ResponseCache.signature("/search/movie", first))
            .isEqualTo(ResponseCache.signature("/search/movie", second));
    }

    @Test
    void signatureDistinguishesEndpointsAndValues() {
        Map<String, String> params = Map.of("query", "Dune");

        assertThat(ResponseCache.signature("/search/movie", params))
            .isNotEqualTo(ResponseCache.signature("/search/tv", params))
            .isNotEqualTo(ResponseCache.signature("/search/movie", Map.of("query", "Dune Part Two")));
    }

    @Test
    void signatureDropsNullValues() {
        Map<String, String> withNull = new HashMap<>();
        withNull.put("query", "Dune");
        withNull.put("year", null);

        assertThat(ResponseCache.signature("/search/movie", withNull))
            .isEqualTo(ResponseCache.signature("/search/movie", Map.of("query", "Dune")));
    }

    @Test
    void storesAndReturnsResponses() {
        ResponseCache cache = new ResponseCache(Caffeine.newBuilder().<String, JsonNode>build());
        String signature = ResponseCache.signature("/movie/603", Map.of());

        assertThat(cache.get(signature)).isEmpty();
        cache.put(signature, JsonNodeFactory.instance.objectNode().put("id", 603));

        assertThat(cache.get(signature)).hasValueSatisfying(node -> assertThat(node.path("id").asInt()).isEqualTo(603));
        assertThat(cache.size()).isEqualTo(1);

        cache.clear();
        assertThat(cache.get(signature)).isEmpty();
    }
}
