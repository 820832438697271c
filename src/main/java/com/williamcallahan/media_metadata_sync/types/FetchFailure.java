/**
 * Terminal failure kinds reported by the retrying catalog client
 *
 * @author William Callahan
 *
 * Features:
 * - Separates "nothing there" from "could not ask"
 * - Retryable kinds only surface here once the retry budget is spent
 */
package com.williamcallahan.media_metadata_sync.types;

public enum FetchFailure {
    TRANSIENT_NETWORK(true),
    RATE_LIMITED(true),
    NOT_FOUND(false),
    MALFORMED_RESPONSE(true),
    CLIENT_ERROR(false);

    private final boolean retryable;

    FetchFailure(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
