/**
 * Raised when a persistent store (identifier cache, metadata document) cannot be read or written
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.repository;

public class MetadataStoreException extends RuntimeException {

    public MetadataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
