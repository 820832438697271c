/**
 * Media unit kinds tracked by the identifier cache
 *
 * @author William Callahan
 *
 * Features:
 * - Maps media-server library types onto catalog media paths
 * - Supplies the prefix used in composite cache keys
 * - Season entries share the show prefix so keys read "tv:Title:Year:seasonN"
 */
package com.williamcallahan.media_metadata_sync.types;

import java.util.Locale;

public enum MediaType {
    MOVIE("movie", "movie"),
    TV("tv", "tv"),
    TV_SEASON("tv_season", "tv");

    private final String value;
    private final String catalogPath;

    MediaType(String value, String catalogPath) {
        this.value = value;
        this.catalogPath = catalogPath;
    }

    /**
     * Serialized name used in cache entries ("movie", "tv", "tv_season")
     */
    public String getValue() {
        return value;
    }

    /**
     * Path segment the catalog uses for this media kind ("movie" or "tv")
     */
    public String getCatalogPath() {
        return catalogPath;
    }

    public String getKeyPrefix() {
        return catalogPath;
    }

    public boolean isShow() {
        return this != MOVIE;
    }

    /**
     * Parses serialized and media-server spellings ("show" is an alias for "tv")
     *
     * @param raw value to parse
     * @return matching media type, or null when unrecognized
     */
    public static MediaType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "movie":
                return MOVIE;
            case "tv":
            case "show":
                return TV;
            case "tv_season":
            case "season":
                return TV_SEASON;
            default:
                return null;
        }
    }
}
