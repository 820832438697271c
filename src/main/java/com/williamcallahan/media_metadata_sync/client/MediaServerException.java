package com.williamcallahan.media_metadata_sync.client;

/**
 * Raised when the media server cannot be reached or does not know a library
 *
 * @author William Callahan
 */
public class MediaServerException extends RuntimeException {

    public MediaServerException(String message) {
        super(message);
    }

    public MediaServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
