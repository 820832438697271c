package com.williamcallahan.media_metadata_sync.service.resolve;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.media_metadata_sync.model.CacheEntry;
import com.williamcallahan.media_metadata_sync.monitoring.SyncMetricsService;
import com.williamcallahan.media_metadata_sync.repository.IdentifierCacheStore;
import com.williamcallahan.media_metadata_sync.service.cache.IdentifierCacheService;
import com.williamcallahan.media_metadata_sync.service.cache.KeyedLockRegistry;
import com.williamcallahan.media_metadata_sync.service.catalog.TmdbCatalogService;
import com.williamcallahan.media_metadata_sync.types.BatchGuard;
import com.williamcallahan.media_metadata_sync.types.FetchFailure;
import com.williamcallahan.media_metadata_sync.types.FetchResult;
import com.williamcallahan.media_metadata_sync.types.IdentifierResolution;
import com.williamcallahan.media_metadata_sync.types.IdentifierResolution.Source;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import com.williamcallahan.media_metadata_sync.types.SearchHit;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;


class IdentifierResolverTest {

    @TempDir
    Path tempDir;

    private IdentifierCacheStore store;
    private TmdbCatalogService catalog;
    private SyncMetricsService metrics;
    private IdentifierResolver resolver;

    @BeforeEach
    void setUp() {
        store = new IdentifierCacheStore(tempDir.resolve("tmdb_cache.json"), tempDir.resolve("failed_items.json"),
            false, new ObjectMapper());
        store.load();
        catalog = mock(TmdbCatalogService.class);
        metrics = new SyncMetricsService(new SimpleMeterRegistry());
        resolver = new IdentifierResolver(new IdentifierCacheService(store, new KeyedLockRegistry()), catalog, metrics);
    }

    private IdentifierResolution resolve(String title, Integer year, MediaType mediaType, List<String> guids) {
        return resolver.resolve(title, year, mediaType, guids, new BatchGuard());
    }

    private static FetchResult<List<SearchHit>> hits(SearchHit... hits) {
        return FetchResult.success(List.of(hits), 1);
    }

    @Test
    void secondResolveIsServedFromCacheWithoutRemoteCalls() {
        when(catalog.search(MediaType.MOVIE, "Dune", 2021)).thenReturn(hits(new SearchHit("438631", 12000, 80.0)));

        IdentifierResolution first = resolve("Dune", 2021, MediaType.MOVIE, List.of());
        IdentifierResolution second = resolve("Dune", 2021, MediaType.MOVIE, List.of());

        assertThat(first.externalId()).isEqualTo("438631");
        assertThat(first.source()).isEqualTo(Source.SEARCH);
        assertThat(second.externalId()).isEqualTo("438631");
        assertThat(second.source()).isEqualTo(Source.CACHE);
        verify(catalog, times(1)).search(any(), anyString(), any());
    }

    @Test
    void legacyBareIdentifierEntryIsACacheHit() {
        store.put(new CacheEntry("movie:The Matrix:1999", "603", "The Matrix", 1999, MediaType.MOVIE,
            null, null, Instant.EPOCH));

        IdentifierResolution resolution = resolve("The Matrix", 1999, MediaType.MOVIE, List.of());

        assertThat(resolution.externalId()).isEqualTo("603");
        assertThat(resolution.source()).isEqualTo(Source.CACHE);
        verifyNoInteractions(catalog);
    }

    @Test
    void failedLookupIsNotSearchedAgain() {
        store.markFailed("movie:Unknown Film:1970");

        IdentifierResolution resolution = resolve("Unknown Film", 1970, MediaType.MOVIE, List.of());

        assertThat(resolution.isFound()).isFalse();
        assertThat(resolution.source()).isEqualTo(Source.FAILED_CACHED);
        verifyNoInteractions(catalog);
    }

    @Test
    void embeddedIdentifierWinsOverSearch() {
        IdentifierResolution resolution = resolve("Severance", 2022, MediaType.TV,
            List.of("imdb://tt11280740", "tmdb://95396?lang=en", "tvdb://371980"));

        assertThat(resolution.externalId()).isEqualTo("95396");
        assertThat(resolution.source()).isEqualTo(Source.EMBEDDED_ID);
        assertThat(store.find("tv:Severance:2022")).hasValueSatisfying(entry ->
            assertThat(entry.externalId()).isEqualTo("95396"));
        verifyNoInteractions(catalog);
    }

    @Test
    void fallsBackToCleanedTitleWithYearAsThirdVariant() {
        when(catalog.search(eq(MediaType.MOVIE), eq("Movie (Extended Cut)"), any())).thenReturn(hits());
        when(catalog.search(MediaType.MOVIE, "Movie", 2010)).thenReturn(hits(new SearchHit("42", 10, 1.0)));

        IdentifierResolution resolution = resolve("Movie (Extended Cut)", 2010, MediaType.MOVIE, List.of());

        assertThat(resolution.externalId()).isEqualTo("42");
        InOrder order = inOrder(catalog);
        order.verify(catalog).search(MediaType.MOVIE, "Movie (Extended Cut)", 2010);
        order.verify(catalog).search(eq(MediaType.MOVIE), eq("Movie (Extended Cut)"), isNull());
        order.verify(catalog).search(MediaType.MOVIE, "Movie", 2010);
        verify(catalog, never()).search(eq(MediaType.MOVIE), eq("Movie"), isNull());
    }

    @Test
    void exhaustedSearchRecordsFailedLookup() {
        when(catalog.search(any(), anyString(), any())).thenReturn(hits());

        IdentifierResolution resolution = resolve("Nothing Here", 2001, MediaType.MOVIE, List.of());

        assertThat(resolution.isFound()).isFalse();
        assertThat(resolution.source()).isEqualTo(Source.NOT_FOUND);
        assertThat(store.isFailed("movie:Nothing Here:2001")).isTrue();
        // title has no parenthetical, so only two distinct variants are tried
        verify(catalog, times(2)).search(any(), anyString(), any());
    }

    @Test
    void transientSearchFailureDoesNotRecordFailedLookup() {
        when(catalog.search(any(), anyString(), any()))
            .thenReturn(FetchResult.failure(FetchFailure.TRANSIENT_NETWORK, 3, "HTTP 503"));

        IdentifierResolution resolution = resolve("Arrival", 2016, MediaType.MOVIE, List.of());

        assertThat(resolution.isFound()).isFalse();
        assertThat(store.isFailed("movie:Arrival:2016")).isFalse();
    }

    @Test
    void concurrentResolutionsOfOneKeySearchOnce() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        when(catalog.search(MediaType.MOVIE, "Heat", 1995)).thenAnswer(invocation -> {
            Thread.sleep(20);
            return hits(new SearchHit("949", 5000, 30.0));
        });
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<IdentifierResolution>> futures = List.of(
                pool.submit(() -> { start.await(); return resolve("Heat", 1995, MediaType.MOVIE, List.of()); }),
                pool.submit(() -> { start.await(); return resolve("Heat", 1995, MediaType.MOVIE, List.of()); }),
                pool.submit(() -> { start.await(); return resolve("Heat", 1995, MediaType.MOVIE, List.of()); }),
                pool.submit(() -> { start.await(); return resolve("Heat", 1995, MediaType.MOVIE, List.of()); }));
            start.countDown();
            for (Future<IdentifierResolution> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS).externalId()).isEqualTo("949");
            }
        } finally {
            pool.shutdownNow();
        }
        verify(catalog, times(1)).search(MediaType.MOVIE, "Heat", 1995);
    }

    @Test
    void searchVariantsDropDuplicates() {
        assertThat(IdentifierResolver.searchVariants("Alien", 1979)).containsExactly(
            new IdentifierResolver.SearchVariant("Alien", 1979),
            new IdentifierResolver.SearchVariant("Alien", null));
        assertThat(IdentifierResolver.searchVariants("Alien (Director's Cut)", 1979)).hasSize(4);
    }

    @Test
    void embeddedIdIgnoresOtherSchemes() {
        assertThat(IdentifierResolver.embeddedId(List.of("imdb://tt0133093"))).isEmpty();
        assertThat(IdentifierResolver.embeddedId(List.of("com.plexapp.agents.themoviedb://603?lang=en"))).isEmpty();
        assertThat(IdentifierResolver.embeddedId(List.of("tmdb://603"))).contains("603");
    }

    @Test
    void embeddedIdRequiresExactScheme() {
        assertThat(IdentifierResolver.embeddedId(List.of("xtmdb://603"))).isEmpty();
        assertThat(IdentifierResolver.embeddedId(List.of("TMDB://603"))).contains("603");
    }

    @Test
    void abandonedBatchLeavesCachesUntouched() {
        when(catalog.search(MediaType.MOVIE, "Dune", 2021)).thenReturn(hits(new SearchHit("438631", 12000, 80.0)));
        when(catalog.search(MediaType.MOVIE, "Nothing Here", 2001)).thenReturn(hits());
        when(catalog.search(MediaType.MOVIE, "Nothing Here", null)).thenReturn(hits());
        BatchGuard guard = new BatchGuard();
        guard.abandon();

        assertThatThrownBy(() -> resolver.resolve("Dune", 2021, MediaType.MOVIE, List.of(), guard))
            .isInstanceOf(CancellationException.class);
        assertThatThrownBy(() -> resolver.resolve("Nothing Here", 2001, MediaType.MOVIE, List.of(), guard))
            .isInstanceOf(CancellationException.class);

        assertThat(store.find("movie:Dune:2021")).isEmpty();
        assertThat(store.isFailed("movie:Nothing Here:2001")).isFalse();
    }
}
