/**
 * Title helpers used when building catalog search variants
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.util;

import java.util.regex.Pattern;

public final class TitleUtils {

    private static final Pattern TRAILING_PARENTHETICAL = Pattern.compile("\\s*\\([^)]*\\)\\s*$");

    private TitleUtils() {
    }

    /**
     * Strips one trailing parenthetical, e.g. "Movie (Extended Cut)" becomes "Movie"
     * Returns the trimmed input when nothing would remain
     */
    public static String cleanTitle(String title) {
        if (title == null) {
            return null;
        }
        String cleaned = TRAILING_PARENTHETICAL.matcher(title).replaceFirst("").trim();
        return cleaned.isEmpty() ? title.trim() : cleaned;
    }
}
