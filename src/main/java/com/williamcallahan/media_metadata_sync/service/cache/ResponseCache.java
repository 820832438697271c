/**
 * Run-scoped memo of catalog responses keyed by request signature
 *
 * @author William Callahan
 *
 * Features:
 * - Signature is SHA-256 over the endpoint and its sorted query parameters
 * - In memory only, never persisted, no eviction
 */
package com.williamcallahan.media_metadata_sync.service.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Component
public class ResponseCache {

    private final Cache<String, JsonNode> cache;

    public ResponseCache(Cache<String, JsonNode> catalogResponseCache) {
        this.cache = catalogResponseCache;
    }

    public Optional<JsonNode> get(String signature) {
        return Optional.ofNullable(cache.getIfPresent(signature));
    }

    public void put(String signature, JsonNode response) {
        cache.put(signature, response);
    }

    public long size() {
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
    }

    /**
     * Deterministic request signature; parameter order does not matter, null values are dropped
     */
    public static String signature(String endpoint, Map<String, String> params) {
        StringBuilder canonical = new StringBuilder(endpoint == null ? "" : endpoint);
        if (params != null && !params.isEmpty()) {
            TreeMap<String, String> sorted = new TreeMap<>();
            params.forEach((k, v) -> {
                if (k != null && v != null) {
                    sorted.put(k, v);
                }
            });
            char separator = '?';
            for (Map.Entry<String, String> entry : sorted.entrySet()) {
                canonical.append(separator).append(entry.getKey()).append('=').append(entry.getValue());
                separator = '&';
            }
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
