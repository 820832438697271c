package com.williamcallahan.media_metadata_sync.util;

import org.slf4j.Logger;

/**
 * Centralized logging for outbound catalog and media-server calls.
 *
 * Every line carries the same prefix so a run's external traffic can be grepped:
 * - attempt lines at DEBUG
 * - success lines at DEBUG with the payload size
 * - retry and failure lines at WARN
 */
public class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String endpoint, int attempt) {
        if (log.isDebugEnabled()) {
            log.debug(String.format("%s [%s] ATTEMPT #%d: %s", PREFIX, apiName, attempt, endpoint));
        }
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String endpoint, int bytes) {
        if (log.isDebugEnabled()) {
            log.debug(String.format("%s [%s] SUCCESS: %s returned %d byte(s)", PREFIX, apiName, endpoint, bytes));
        }
    }

    /**
     * Log a failed attempt that will be retried
     */
    public static void logApiCallRetry(Logger log, String apiName, String endpoint, int attempt, String reason) {
        log.warn(String.format("%s [%s] RETRY after attempt #%d: %s - %s", PREFIX, apiName, attempt, endpoint, reason));
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String endpoint, String reason) {
        log.warn(String.format("%s [%s] FAILURE: %s - %s", PREFIX, apiName, endpoint, reason));
    }

    /**
     * Log a request answered from the response cache
     */
    public static void logCacheHit(Logger log, String apiName, String endpoint) {
        if (log.isDebugEnabled()) {
            log.debug(String.format("%s [%s] CACHE-HIT: %s", PREFIX, apiName, endpoint));
        }
    }
}
