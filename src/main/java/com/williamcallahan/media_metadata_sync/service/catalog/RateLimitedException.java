/**
 * HTTP 429 from the catalog, carrying the wait the server asked for
 *
 * @author William Callahan
 */
package com.williamcallahan.media_metadata_sync.service.catalog;

import com.williamcallahan.media_metadata_sync.types.FetchFailure;

import java.time.Duration;

public class RateLimitedException extends RetryableCatalogException {

    private final Duration retryAfter;

    public RateLimitedException(Duration retryAfter, String message) {
        super(FetchFailure.RATE_LIMITED, message);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
