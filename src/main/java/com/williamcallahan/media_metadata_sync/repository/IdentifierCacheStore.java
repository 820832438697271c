/**
 * File-backed store for resolved identifiers and failed lookups
 * Holds both JSON files in memory and rewrites them whole on every change
 *
 * @author William Callahan
 *
 * Features:
 * - Reads legacy shapes: bare identifiers, boolean markers and flat metric fields
 * - Writes only the structured entry shape
 * - Atomic rewrite via temp file and move, serialized by a store-level lock
 * - Dry-run keeps every change in memory and writes nothing
 */

package com.williamcallahan.media_metadata_sync.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.CacheEntry;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import com.williamcallahan.media_metadata_sync.util.CompositeKeys;
import com.williamcallahan.media_metadata_sync.util.LoggingUtils;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

@Slf4j
@Repository
public class IdentifierCacheStore {

    private static final Pattern NUMERIC = Pattern.compile("\\d+");
    // checked in order, first match wins per metric
    private static final List<Map.Entry<String, String>> LEGACY_METRIC_FIELDS = List.of(
        Map.entry("poster_average", "poster_average"),
        Map.entry("bg_average", "bg_average"),
        Map.entry("season_average", "poster_average"),
        Map.entry("vote_average", "poster_average"));
    private static final Map<String, String> LEGACY_UPGRADE_FIELDS = Map.of(
        "poster_last_upgraded", "poster_average",
        "background_last_upgraded", "bg_average",
        "season_last_upgraded", "poster_average");

    private final Path cacheFile;
    private final Path failedFile;
    private final boolean dryRun;
    private final ObjectMapper objectMapper;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Set<String> failedKeys = ConcurrentHashMap.newKeySet();
    private final Object saveLock = new Object();

    @Autowired
    public IdentifierCacheStore(MetadataSyncProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getCache().getDirectory()).resolve(properties.getCache().getIdentifierFile()),
            Paths.get(properties.getCache().getDirectory()).resolve(properties.getCache().getFailedFile()),
            properties.getSettings().isDryRun(),
            objectMapper);
    }

    public IdentifierCacheStore(Path cacheFile, Path failedFile, boolean dryRun, ObjectMapper objectMapper) {
        this.cacheFile = cacheFile;
        this.failedFile = failedFile;
        this.dryRun = dryRun;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Loads both files; missing or empty files load as empty stores
     */
    @PostConstruct
    public void load() {
        entries.clear();
        failedKeys.clear();
        JsonNode cacheRoot = readJson(cacheFile);
        if (cacheRoot != null && cacheRoot.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = cacheRoot.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                readEntry(field.getKey(), field.getValue());
            }
        }
        JsonNode failedRoot = readJson(failedFile);
        if (failedRoot != null && failedRoot.isObject()) {
            failedRoot.fieldNames().forEachRemaining(failedKeys::add);
        }
        log.info("Loaded {} identifier cache entries and {} failed lookups from {}", entries.size(), failedKeys.size(),
            cacheFile.getParent());
    }

    public Optional<CacheEntry> find(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Replaces the whole entry for its key and flushes the cache file
     */
    public void put(CacheEntry entry) {
        entries.put(entry.key(), entry);
        flushCache();
    }

    public Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    /**
     * Removes the given keys and flushes once
     *
     * @return number of entries actually removed
     */
    public int removeAll(Iterable<String> keys) {
        int removed = 0;
        for (String key : keys) {
            if (entries.remove(key) != null) {
                removed++;
            }
        }
        if (removed > 0) {
            flushCache();
        }
        return removed;
    }

    public boolean isFailed(String key) {
        return failedKeys.contains(key);
    }

    public void markFailed(String key) {
        if (failedKeys.add(key)) {
            flushFailed();
        }
    }

    public void clearFailed(String key) {
        if (failedKeys.remove(key)) {
            flushFailed();
        }
    }

    public Set<String> failedKeys() {
        return Set.copyOf(failedKeys);
    }

    public int removeFailed(Iterable<String> keys) {
        int removed = 0;
        for (String key : keys) {
            if (failedKeys.remove(key)) {
                removed++;
            }
        }
        if (removed > 0) {
            flushFailed();
        }
        return removed;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    private void readEntry(String key, JsonNode value) {
        Optional<CompositeKeys.ParsedKey> parsed = CompositeKeys.parse(key);
        String title = parsed.map(CompositeKeys.ParsedKey::title).orElse(null);
        Integer year = parsed.map(p -> parseYear(p.year())).orElse(null);
        MediaType mediaType = parsed.map(p -> p.season() != null ? MediaType.TV_SEASON : MediaType.fromValue(p.prefix()))
            .orElse(null);

        if (value == null || value.isNull()) {
            return;
        }
        if (value.isBoolean()) {
            // legacy negative marker stored alongside resolved ids
            if (value.booleanValue()) {
                failedKeys.add(key);
            }
            return;
        }
        if (value.isValueNode()) {
            String id = value.asText().trim();
            if (!id.isEmpty()) {
                entries.put(key, new CacheEntry(key, id, title, year, mediaType, Map.of(), Map.of(), null));
            }
            return;
        }
        if (!value.isObject()) {
            log.warn("Ignoring identifier cache entry '{}' with unsupported shape {}", key, value.getNodeType());
            return;
        }

        String externalId = text(value.get("tmdb_id"));
        if (externalId == null) {
            externalId = text(value.get("id"));
        }
        if (externalId == null) {
            log.warn("Ignoring identifier cache entry '{}' without an identifier", key);
            return;
        }
        String storedTitle = text(value.get("title"));
        Integer storedYear = value.hasNonNull("year") ? parseYear(value.get("year").asText()) : null;
        MediaType storedType = MediaType.fromValue(text(value.get("media_type")));
        if (parsed.map(p -> p.season() != null).orElse(false)) {
            storedType = MediaType.TV_SEASON;
        }

        Map<String, Double> metrics = new LinkedHashMap<>();
        JsonNode qualityNode = value.get("quality_metrics");
        if (qualityNode != null && qualityNode.isObject()) {
            qualityNode.fields().forEachRemaining(f -> {
                if (f.getValue().isNumber()) {
                    metrics.put(f.getKey(), f.getValue().asDouble());
                }
            });
        }
        for (Map.Entry<String, String> legacy : LEGACY_METRIC_FIELDS) {
            JsonNode legacyNode = value.get(legacy.getKey());
            if (legacyNode != null && legacyNode.isNumber()) {
                metrics.putIfAbsent(legacy.getValue(), legacyNode.asDouble());
            }
        }

        Map<String, Instant> upgraded = new LinkedHashMap<>();
        JsonNode upgradedNode = value.get("asset_upgraded_at");
        if (upgradedNode != null && upgradedNode.isObject()) {
            upgradedNode.fields().forEachRemaining(f -> {
                Instant at = parseInstant(f.getValue().asText());
                if (at != null) {
                    upgraded.put(f.getKey(), at);
                }
            });
        }
        LEGACY_UPGRADE_FIELDS.forEach((legacyField, metric) -> {
            Instant at = value.hasNonNull(legacyField) ? parseInstant(value.get(legacyField).asText()) : null;
            if (at != null) {
                upgraded.putIfAbsent(metric, at);
            }
        });

        Instant lastUpdated = value.hasNonNull("last_updated") ? parseInstant(value.get("last_updated").asText()) : null;
        entries.put(key, new CacheEntry(key, externalId,
            storedTitle != null ? storedTitle : title,
            storedYear != null ? storedYear : year,
            storedType != null ? storedType : mediaType,
            metrics, upgraded, lastUpdated));
    }

    private ObjectNode toJson(CacheEntry entry) {
        ObjectNode node = objectMapper.createObjectNode();
        if (NUMERIC.matcher(entry.externalId()).matches() && entry.externalId().length() < 18) {
            node.put("tmdb_id", Long.parseLong(entry.externalId()));
        } else {
            node.put("tmdb_id", entry.externalId());
        }
        node.put("title", entry.title());
        if (entry.year() != null) {
            node.put("year", entry.year());
        } else {
            node.putNull("year");
        }
        node.put("media_type", entry.mediaType() != null ? entry.mediaType().getValue() : null);
        ObjectNode metrics = node.putObject("quality_metrics");
        entry.qualityMetrics().forEach(metrics::put);
        ObjectNode upgraded = node.putObject("asset_upgraded_at");
        entry.assetUpgradedAt().forEach((k, v) -> upgraded.put(k, v.toString()));
        if (entry.lastUpdated() != null) {
            node.put("last_updated", entry.lastUpdated().toString());
        }
        return node;
    }

    private void flushCache() {
        if (dryRun) {
            log.debug(LoggingUtils.dryRun(true, "Skipping write of {}"), cacheFile);
            return;
        }
        synchronized (saveLock) {
            ObjectNode root = objectMapper.createObjectNode();
            entries.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> root.set(e.getKey(), toJson(e.getValue())));
            writeAtomically(cacheFile, root);
        }
    }

    private void flushFailed() {
        if (dryRun) {
            log.debug(LoggingUtils.dryRun(true, "Skipping write of {}"), failedFile);
            return;
        }
        synchronized (saveLock) {
            ObjectNode root = objectMapper.createObjectNode();
            new LinkedHashSet<>(failedKeys).stream().sorted().forEach(k -> root.put(k, true));
            writeAtomically(failedFile, root);
        }
    }

    private void writeAtomically(Path target, JsonNode content) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), content);
                try {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new MetadataStoreException("Failed to write " + target, e);
        }
    }

    private JsonNode readJson(Path file) {
        try {
            if (!Files.exists(file) || Files.size(file) == 0) {
                return null;
            }
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            LoggingUtils.error(log, e, "Unable to read {}, starting with an empty store", file);
            return null;
        }
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static Integer parseYear(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                // naive local timestamps written by older versions
                return LocalDateTime.parse(raw).atZone(ZoneId.systemDefault()).toInstant();
            } catch (DateTimeParseException nested) {
                return null;
            }
        }
    }
}
