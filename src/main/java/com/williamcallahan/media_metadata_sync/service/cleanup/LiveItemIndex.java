/**
 * Everything a reconciliation pass treats as still referenced
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.service.cleanup;

import com.williamcallahan.media_metadata_sync.model.MediaItem;
import com.williamcallahan.media_metadata_sync.util.CompositeKeys;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * @param cacheKeys      composite keys of live movies, shows and their local seasons
 * @param titles         "Title (Year)" keys of live items
 * @param directoryNames on-disk directory names of live items
 */
public record LiveItemIndex(Set<String> cacheKeys, Set<String> titles, Set<String> directoryNames) {

    public LiveItemIndex {
        cacheKeys = Set.copyOf(cacheKeys);
        titles = Set.copyOf(titles);
        directoryNames = Set.copyOf(directoryNames);
    }

    public static LiveItemIndex of(Collection<MediaItem> items) {
        Set<String> keys = new HashSet<>();
        Set<String> titles = new HashSet<>();
        Set<String> directories = new HashSet<>();
        for (MediaItem item : items) {
            if (item.title() == null || item.title().isBlank()) {
                continue;
            }
            keys.add(CompositeKeys.forItem(item.mediaType(), item.title(), item.year()));
            if (item.isShow()) {
                for (Integer season : item.seasonsEpisodes().keySet()) {
                    keys.add(CompositeKeys.season(item.title(), item.year(), season));
                }
            }
            titles.add(item.titleYear());
            directories.add(item.directoryName());
        }
        return new LiveItemIndex(keys, titles, directories);
    }

    /**
     * Index holding only composite keys, deriving titles from them
     */
    public static LiveItemIndex ofKeys(Collection<String> keys) {
        Set<String> titles = new HashSet<>();
        for (String key : keys) {
            CompositeKeys.parse(key).ifPresent(parsed -> titles.add(parsed.titleYear()));
        }
        return new LiveItemIndex(Set.copyOf(keys), titles, titles);
    }

    public boolean isEmpty() {
        return cacheKeys.isEmpty();
    }
}
