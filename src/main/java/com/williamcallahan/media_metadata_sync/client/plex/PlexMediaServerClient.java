/**
 * Media server client for the Plex HTTP API
 *
 * @author William Callahan
 *
 * Features:
 * - Library sections resolved by title once and remembered
 * - Items listed with their guids, e.g. "tmdb://603"
 * - Movie directory taken from the first media part, show directory from the first episode
 * - Seasons and episode numbers collected from the show's leaves
 * - Shows whose leaves fail to load are reported as skipped, marking the listing incomplete
 */
package com.williamcallahan.media_metadata_sync.client.plex;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.media_metadata_sync.client.LibraryListing;
import com.williamcallahan.media_metadata_sync.client.MediaServerClient;
import com.williamcallahan.media_metadata_sync.client.MediaServerException;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.MediaItem;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import com.williamcallahan.media_metadata_sync.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class PlexMediaServerClient implements MediaServerClient {

    static final String TOKEN_HEADER = "X-Plex-Token";

    record Section(String key, String title, MediaType type) {
    }

    private final WebClient webClient;
    private final Duration timeout;
    private final Map<String, Section> sections = new ConcurrentHashMap<>();

    public PlexMediaServerClient(WebClient.Builder webClientBuilder, MetadataSyncProperties properties) {
        MetadataSyncProperties.Plex plex = properties.getPlex();
        WebClient.Builder builder = webClientBuilder.clone()
            .baseUrl(plex.getUrl() == null ? "" : plex.getUrl())
            .defaultHeader(HttpHeaders.ACCEPT, "application/json");
        if (plex.getToken() != null) {
            builder.defaultHeader(TOKEN_HEADER, plex.getToken());
        }
        this.webClient = builder.build();
        this.timeout = properties.getNetwork().getTimeout();
    }

    @Override
    public MediaType libraryType(String libraryName) {
        return section(libraryName).type();
    }

    @Override
    public LibraryListing listItems(String libraryName) {
        Section section = section(libraryName);
        JsonNode container = get("/library/sections/" + section.key() + "/all?includeGuids=1");
        List<MediaItem> items = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (JsonNode metadata : container.path("MediaContainer").path("Metadata")) {
            try {
                if (section.type().isShow()) {
                    JsonNode leaves = get("/library/metadata/" + metadata.path("ratingKey").asText() + "/allLeaves");
                    items.add(toShow(metadata, leaves, libraryName));
                } else {
                    items.add(toMovie(metadata, libraryName));
                }
            } catch (MediaServerException e) {
                LoggingUtils.warn(log, e, "Skipping '{}' in library '{}'", metadata.path("title").asText(), libraryName);
                skipped.add(metadata.path("title").asText());
            }
        }
        if (skipped.isEmpty()) {
            log.info("Listed {} item(s) from Plex library '{}'", items.size(), libraryName);
        } else {
            log.warn("Listed {} item(s) from Plex library '{}', {} skipped: {}", items.size(), libraryName,
                skipped.size(), skipped);
        }
        return new LibraryListing(items, skipped);
    }

    private Section section(String libraryName) {
        Section cached = sections.get(libraryName);
        if (cached != null) {
            return cached;
        }
        JsonNode response = get("/library/sections");
        for (JsonNode directory : response.path("MediaContainer").path("Directory")) {
            sectionType(directory.path("type").asText()).ifPresent(type -> {
                Section section = new Section(directory.path("key").asText(), directory.path("title").asText(), type);
                sections.put(section.title(), section);
            });
        }
        Section section = sections.get(libraryName);
        if (section == null) {
            throw new MediaServerException("Plex library '" + libraryName + "' not found");
        }
        return section;
    }

    private JsonNode get(String path) {
        try {
            JsonNode body = webClient.get()
                .uri(path)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(timeout);
            if (body == null) {
                throw new MediaServerException("Empty response from Plex for " + path);
            }
            return body;
        } catch (MediaServerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MediaServerException("Plex request failed for " + path, e);
        }
    }

    static Optional<MediaType> sectionType(String plexType) {
        return switch (plexType) {
            case "movie" -> Optional.of(MediaType.MOVIE);
            case "show" -> Optional.of(MediaType.TV);
            default -> Optional.empty();
        };
    }

    static MediaItem toMovie(JsonNode metadata, String libraryName) {
        Path directory = firstFile(metadata).map(Path::getParent).orElse(null);
        return new MediaItem(
            metadata.path("ratingKey").asText(),
            metadata.path("title").asText(),
            year(metadata),
            MediaType.MOVIE,
            libraryName,
            guids(metadata),
            directory,
            Map.of());
    }

    static MediaItem toShow(JsonNode metadata, JsonNode leaves, String libraryName) {
        Map<Integer, List<Integer>> seasons = new TreeMap<>();
        Path directory = null;
        for (JsonNode episode : leaves.path("MediaContainer").path("Metadata")) {
            if (!episode.hasNonNull("parentIndex") || !episode.hasNonNull("index")) {
                continue;
            }
            seasons.computeIfAbsent(episode.path("parentIndex").asInt(), k -> new ArrayList<>())
                .add(episode.path("index").asInt());
            if (directory == null) {
                // show folder sits above the season folder
                directory = firstFile(episode)
                    .map(Path::getParent)
                    .map(Path::getParent)
                    .orElse(null);
            }
        }
        return new MediaItem(
            metadata.path("ratingKey").asText(),
            metadata.path("title").asText(),
            year(metadata),
            MediaType.TV,
            libraryName,
            guids(metadata),
            directory,
            seasons);
    }

    private static Integer year(JsonNode metadata) {
        return metadata.hasNonNull("year") ? metadata.path("year").asInt() : null;
    }

    private static List<String> guids(JsonNode metadata) {
        List<String> guids = new ArrayList<>();
        for (JsonNode guid : metadata.path("Guid")) {
            String id = guid.path("id").asText("");
            if (!id.isEmpty()) {
                guids.add(id);
            }
        }
        return guids;
    }

    private static Optional<Path> firstFile(JsonNode metadata) {
        for (JsonNode media : metadata.path("Media")) {
            for (JsonNode part : media.path("Part")) {
                String file = part.path("file").asText("");
                if (!file.isEmpty()) {
                    return Optional.of(Paths.get(file));
                }
            }
        }
        return Optional.empty();
    }
}
