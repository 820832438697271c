/**
 * Base type for catalog failures the retry policy may retry
 * Never escapes the retrying client; callers see a FetchResult instead
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.service.catalog;

import com.williamcallahan.media_metadata_sync.types.FetchFailure;

public class RetryableCatalogException extends RuntimeException {

    private final FetchFailure failure;

    public RetryableCatalogException(FetchFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public RetryableCatalogException(FetchFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public FetchFailure getFailure() {
        return failure;
    }
}
