/**
 * Items listed from one library, with the titles that could not be listed
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.client;

import com.williamcallahan.media_metadata_sync.model.MediaItem;

import java.util.List;

/**
 * @param items   items listed in full
 * @param skipped titles dropped because their details failed to load
 */
public record LibraryListing(List<MediaItem> items, List<String> skipped) {

    public LibraryListing {
        items = items == null ? List.of() : List.copyOf(items);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public static LibraryListing complete(List<MediaItem> items) {
        return new LibraryListing(items, List.of());
    }

    /**
     * An incomplete listing must not be used as the live set for reconciliation
     */
    public boolean isComplete() {
        return skipped.isEmpty();
    }
}
