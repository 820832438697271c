/**
 * Retrying front door for every catalog call
 *
 * @author William Callahan
 *
 * Features:
 * - Bounded attempts with exponential backoff from the catalog RetryTemplate
 * - Honours HTTP 429 Retry-After hints
 * - Treats empty 200 payloads as retryable malformed responses
 * - Serves repeated JSON requests from the run-scoped response cache
 * - Returns explicit FetchResult values; no exception leaves this class
 */
package com.williamcallahan.media_metadata_sync.service.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.monitoring.SyncMetricsService;
import com.williamcallahan.media_metadata_sync.service.cache.ResponseCache;
import com.williamcallahan.media_metadata_sync.types.FetchFailure;
import com.williamcallahan.media_metadata_sync.types.FetchResult;
import com.williamcallahan.media_metadata_sync.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.RecoveryCallback;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

@Slf4j
@Service
public class RetryingCatalogClient {

    private static final String API_NAME = "TMDB";

    private final CatalogTransport transport;
    private final RetryTemplate retryTemplate;
    private final ResponseCache responseCache;
    private final ObjectMapper objectMapper;
    private final SyncMetricsService metricsService;
    private final Duration defaultRetryAfter;

    public RetryingCatalogClient(CatalogTransport transport,
                                 @Qualifier("catalogRetryTemplate") RetryTemplate retryTemplate,
                                 ResponseCache responseCache,
                                 ObjectMapper objectMapper,
                                 SyncMetricsService metricsService,
                                 MetadataSyncProperties properties) {
        this.transport = transport;
        this.retryTemplate = retryTemplate;
        this.responseCache = responseCache;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.defaultRetryAfter = properties.getNetwork().getDelay();
    }

    /**
     * Fetches a JSON endpoint, consulting the response cache first
     *
     * @param endpoint catalog path, e.g. "/search/movie"
     * @param params   query parameters
     * @return the parsed body, or the terminal failure once retries are spent
     */
    public FetchResult<JsonNode> fetch(String endpoint, Map<String, String> params) {
        String signature = ResponseCache.signature(endpoint, params);
        Optional<JsonNode> cached = responseCache.get(signature);
        if (cached.isPresent()) {
            metricsService.incrementResponseCacheHit();
            ExternalApiLogger.logCacheHit(log, API_NAME, endpoint);
            return FetchResult.success(cached.get(), 0);
        }
        metricsService.incrementResponseCacheMiss();
        FetchResult<JsonNode> result = execute(endpoint, () -> transport.fetch(endpoint, params), this::parseJson);
        if (result.isSuccess()) {
            responseCache.put(signature, result.value());
        }
        return result;
    }

    /**
     * Downloads image bytes; downloads are never cached
     */
    public FetchResult<byte[]> download(String imagePath) {
        return execute(imagePath, () -> transport.download(imagePath), this::requireBytes);
    }

    private <T> FetchResult<T> execute(String endpoint, Supplier<CatalogResponse> call, Function<CatalogResponse, T> bodyReader) {
        RetryCallback<FetchResult<T>, RuntimeException> attempt = context -> {
            int attemptNumber = context.getRetryCount() + 1;
            if (attemptNumber > 1) {
                metricsService.incrementRetry();
                Throwable previous = context.getLastThrowable();
                ExternalApiLogger.logApiCallRetry(log, API_NAME, endpoint, attemptNumber - 1,
                    previous != null ? previous.getMessage() : "unknown");
            }
            ExternalApiLogger.logApiCallAttempt(log, API_NAME, endpoint, attemptNumber);
            metricsService.incrementRemoteFetch();

            CatalogResponse response;
            long start = System.currentTimeMillis();
            try {
                response = call.get();
            } catch (CatalogTransportException e) {
                throw new RetryableCatalogException(FetchFailure.TRANSIENT_NETWORK, e.getMessage(), e);
            } finally {
                metricsService.recordFetchTime(System.currentTimeMillis() - start);
            }

            int status = response.statusCode();
            if (status == 429) {
                metricsService.incrementRateLimit();
                Duration wait = parseRetryAfter(response.retryAfter());
                log.warn("Catalog rate limited {} (HTTP 429), retry after {}s", endpoint, wait.toSeconds());
                throw new RateLimitedException(wait, "HTTP 429 for " + endpoint);
            }
            if (status >= 500) {
                throw new RetryableCatalogException(FetchFailure.TRANSIENT_NETWORK, "HTTP " + status + " for " + endpoint);
            }
            if (status == 404) {
                ExternalApiLogger.logApiCallFailure(log, API_NAME, endpoint, "HTTP 404");
                return FetchResult.failure(FetchFailure.NOT_FOUND, attemptNumber, "HTTP 404");
            }
            if (!response.isSuccess()) {
                ExternalApiLogger.logApiCallFailure(log, API_NAME, endpoint, "HTTP " + status);
                return FetchResult.failure(FetchFailure.CLIENT_ERROR, attemptNumber, "HTTP " + status);
            }
            T value = bodyReader.apply(response);
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, endpoint, response.body().length);
            return FetchResult.success(value, attemptNumber);
        };

        RecoveryCallback<FetchResult<T>> exhausted = context -> {
            Throwable last = context.getLastThrowable();
            FetchFailure failure = last instanceof RetryableCatalogException retryable
                ? retryable.getFailure()
                : FetchFailure.TRANSIENT_NETWORK;
            String detail = last != null ? last.getMessage() : "unknown failure";
            ExternalApiLogger.logApiCallFailure(log, API_NAME, endpoint,
                "giving up after " + context.getRetryCount() + " attempt(s): " + detail);
            return FetchResult.failure(failure, context.getRetryCount(), detail);
        };

        return retryTemplate.execute(attempt, exhausted);
    }

    private JsonNode parseJson(CatalogResponse response) {
        if (response.body().length == 0) {
            throw new RetryableCatalogException(FetchFailure.MALFORMED_RESPONSE, "Empty response body");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new RetryableCatalogException(FetchFailure.MALFORMED_RESPONSE, "Unparseable response body", e);
        }
        if (node == null || node.isNull() || node.isMissingNode() || (node.isContainerNode() && node.isEmpty())) {
            throw new RetryableCatalogException(FetchFailure.MALFORMED_RESPONSE, "Empty JSON payload");
        }
        return node;
    }

    private byte[] requireBytes(CatalogResponse response) {
        if (response.body().length == 0) {
            throw new RetryableCatalogException(FetchFailure.MALFORMED_RESPONSE, "Empty image body");
        }
        return response.body();
    }

    /**
     * Retry-After is either delta seconds or an HTTP date; falls back to the configured delay
     */
    Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return defaultRetryAfter;
        }
        String value = header.trim();
        try {
            return Duration.ofSeconds(Math.max(0L, Long.parseLong(value)));
        } catch (NumberFormatException e) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration until = Duration.between(ZonedDateTime.now(at.getZone()), at);
                return until.isNegative() ? Duration.ZERO : until;
            } catch (DateTimeParseException nested) {
                log.debug("Unrecognized Retry-After '{}', using default delay", value);
                return defaultRetryAfter;
            }
        }
    }
}
