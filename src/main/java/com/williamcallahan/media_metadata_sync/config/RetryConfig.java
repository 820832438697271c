/**
 * Configuration for catalog retry behavior
 *
 * @author William Callahan
 *
 * Features:
 * - Retries transient network failures, 5xx, empty payloads and 429 responses
 * - Exponential backoff: delay * factor^(n-1) for the n-th non-rate-limit failure
 * - Rate-limited attempts sleep exactly the server's Retry-After hint without growing the multiplier
 * - Sleeping goes through an injectable Sleeper so tests can record delays
 */

package com.williamcallahan.media_metadata_sync.config;

import com.williamcallahan.media_metadata_sync.service.catalog.RateLimitedException;
import com.williamcallahan.media_metadata_sync.service.catalog.RetryableCatalogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Configuration
public class RetryConfig {

    /**
     * Backoff policy that honours rate-limit hints carried on the last failure
     */
    public static class CatalogBackOffPolicy implements BackOffPolicy {
        private static final Logger logger = LoggerFactory.getLogger(CatalogBackOffPolicy.class);
        private final long initialIntervalMillis;
        private final double multiplier;
        private final Sleeper sleeper;

        public CatalogBackOffPolicy(Duration initialInterval, double multiplier, Sleeper sleeper) {
            this.initialIntervalMillis = Math.max(0L, initialInterval.toMillis());
            this.multiplier = multiplier;
            this.sleeper = sleeper;
        }

        private static class CatalogBackOffContext implements BackOffContext {
            private final RetryContext retryContext;
            private int backoffFailures;

            CatalogBackOffContext(RetryContext retryContext) {
                this.retryContext = retryContext;
            }
        }

        @Override
        public BackOffContext start(RetryContext context) {
            return new CatalogBackOffContext(context);
        }

        @Override
        public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
            CatalogBackOffContext ctx = (CatalogBackOffContext) backOffContext;
            Throwable last = ctx.retryContext != null ? ctx.retryContext.getLastThrowable() : null;
            long sleepTime;
            if (last instanceof RateLimitedException rateLimited) {
                Duration retryAfter = rateLimited.getRetryAfter();
                sleepTime = retryAfter != null ? retryAfter.toMillis() : initialIntervalMillis;
                logger.debug("Rate limited, waiting {}ms as requested by the catalog", sleepTime);
            } else {
                ctx.backoffFailures++;
                sleepTime = (long) (initialIntervalMillis * Math.pow(multiplier, ctx.backoffFailures - 1));
                logger.debug("Backing off for {}ms after failure #{}", sleepTime, ctx.backoffFailures);
            }
            try {
                sleeper.sleep(Math.max(0L, sleepTime));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackOffInterruptedException("Thread interrupted while backing off", e);
            }
        }
    }

    /**
     * Builds the catalog retry template from network settings
     *
     * @param network network settings (attempts, delay, factor)
     * @param sleeper sleeper used between attempts
     * @return RetryTemplate retrying only {@link RetryableCatalogException}s
     */
    public static RetryTemplate buildCatalogRetryTemplate(MetadataSyncProperties.Network network, Sleeper sleeper) {
        RetryTemplate retryTemplate = new RetryTemplate();

        Map<Class<? extends Throwable>, Boolean> retryableExceptions = new HashMap<>();
        retryableExceptions.put(RetryableCatalogException.class, true);

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(Math.max(1, network.getMaxRetries()), retryableExceptions, true);
        retryTemplate.setRetryPolicy(retryPolicy);
        retryTemplate.setBackOffPolicy(new CatalogBackOffPolicy(network.getDelay(), network.getBackoffFactor(), sleeper));
        return retryTemplate;
    }

    @Bean
    public Sleeper retrySleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean("catalogRetryTemplate")
    public RetryTemplate catalogRetryTemplate(MetadataSyncProperties properties, Sleeper retrySleeper) {
        return buildCatalogRetryTemplate(properties.getNetwork(), retrySleeper);
    }
}
