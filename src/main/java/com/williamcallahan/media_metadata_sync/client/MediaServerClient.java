/**
 * Source of live media items
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.client;

import com.williamcallahan.media_metadata_sync.types.MediaType;

public interface MediaServerClient {

    /**
     * Every item of a library, shows carrying their local seasons and episodes
     * Items whose details fail to load are reported as skipped rather than silently dropped
     *
     * @throws MediaServerException when the library cannot be listed
     */
    LibraryListing listItems(String libraryName);

    /**
     * Kind of items the library holds, {@link MediaType#MOVIE} or {@link MediaType#TV}
     *
     * @throws MediaServerException when the library does not exist
     */
    MediaType libraryType(String libraryName);
}
