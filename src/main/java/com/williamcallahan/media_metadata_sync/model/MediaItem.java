/**
 * Media-server item as seen by the sync engine
 * Populated by a {@link com.williamcallahan.media_metadata_sync.client.MediaServerClient}
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.model;

import com.williamcallahan.media_metadata_sync.types.MediaType;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * @param ratingKey       stable local identifier assigned by the media server
 * @param title           display title
 * @param year            release year, may be null
 * @param mediaType       {@link MediaType#MOVIE} or {@link MediaType#TV}
 * @param libraryName     owning library
 * @param guids           scheme-prefixed external identifiers, e.g. "tmdb://603"
 * @param itemDirectory   directory holding the item's media files, may be null
 * @param seasonsEpisodes season number to episode numbers present locally (shows only)
 */
public record MediaItem(
    String ratingKey,
    String title,
    Integer year,
    MediaType mediaType,
    String libraryName,
    List<String> guids,
    Path itemDirectory,
    Map<Integer, List<Integer>> seasonsEpisodes
) {

    public MediaItem {
        guids = guids == null ? List.of() : List.copyOf(guids);
        seasonsEpisodes = seasonsEpisodes == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(seasonsEpisodes));
    }

    /**
     * Human-readable record key, "Title (Year)"
     */
    public String titleYear() {
        return year == null ? title : title + " (" + year + ")";
    }

    /**
     * Name of the item's on-disk directory, falling back to "Title (Year)"
     */
    public String directoryName() {
        if (itemDirectory != null && itemDirectory.getFileName() != null) {
            return itemDirectory.getFileName().toString();
        }
        return titleYear();
    }

    public boolean isShow() {
        return mediaType != null && mediaType.isShow();
    }
}
