/**
 * Transport-level failure (connect, timeout, reset) raised by a {@link CatalogTransport}
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.service.catalog;

public class CatalogTransportException extends RuntimeException {

    public CatalogTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
