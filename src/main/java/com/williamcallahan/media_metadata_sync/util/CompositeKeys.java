/**
 * Builds and parses composite cache keys
 * Format: "{prefix}:{title}:{year}" with an optional ":season{n}" suffix for seasons
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.util;

import com.williamcallahan.media_metadata_sync.types.MediaType;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class CompositeKeys {

    private static final Pattern SEASON_SUFFIX = Pattern.compile("^(.*):season(\\d{1,9})$");

    /**
     * Parsed form of a composite key; season is null for movies and shows
     */
    public record ParsedKey(String prefix, String title, String year, Integer season) {

        public String titleYear() {
            return year == null || year.isEmpty() ? title : title + " (" + year + ")";
        }
    }

    private CompositeKeys() {
    }

    public static String forItem(MediaType mediaType, String title, Integer year) {
        return mediaType.getKeyPrefix() + ":" + title + ":" + (year == null ? "" : year);
    }

    public static String show(String title, Integer year) {
        return forItem(MediaType.TV, title, year);
    }

    public static String season(String title, Integer year, int seasonNumber) {
        return show(title, year) + ":season" + seasonNumber;
    }

    /**
     * Parses a key; titles may themselves contain colons, the year is the last segment
     */
    public static Optional<ParsedKey> parse(String key) {
        if (key == null) {
            return Optional.empty();
        }
        int firstColon = key.indexOf(':');
        if (firstColon <= 0) {
            return Optional.empty();
        }
        String prefix = key.substring(0, firstColon);
        String rest = key.substring(firstColon + 1);
        Integer season = null;
        Matcher seasonMatcher = SEASON_SUFFIX.matcher(rest);
        if (seasonMatcher.matches()) {
            rest = seasonMatcher.group(1);
            season = Integer.parseInt(seasonMatcher.group(2));
        }
        int lastColon = rest.lastIndexOf(':');
        if (lastColon < 0) {
            return Optional.of(new ParsedKey(prefix, rest.trim(), null, season));
        }
        return Optional.of(new ParsedKey(prefix, rest.substring(0, lastColon).trim(),
            rest.substring(lastColon + 1).trim(), season));
    }
}
