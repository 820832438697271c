package com.williamcallahan.media_metadata_sync.scheduler;

import com.williamcallahan.media_metadata_sync.client.LibraryListing;
import com.williamcallahan.media_metadata_sync.client.MediaServerClient;
import com.williamcallahan.media_metadata_sync.client.MediaServerException;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.MediaItem;
import com.williamcallahan.media_metadata_sync.service.cleanup.LiveItemIndex;
import com.williamcallahan.media_metadata_sync.service.cleanup.OrphanReconciler;
import com.williamcallahan.media_metadata_sync.service.library.LibraryProcessingService;
import com.williamcallahan.media_metadata_sync.types.LibraryRunSummary;
import com.williamcallahan.media_metadata_sync.types.MediaType;
import com.williamcallahan.media_metadata_sync.types.ReconciliationSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MetadataSyncRunnerTest {

    private MetadataSyncProperties properties;
    private MediaServerClient mediaServerClient;
    private LibraryProcessingService libraryProcessingService;
    private OrphanReconciler orphanReconciler;
    private MetadataSyncRunner runner;

    private final MediaItem dune = new MediaItem("1", "Dune", 2021, MediaType.MOVIE, "Movies", List.of(), null, Map.of());
    private final MediaItem severance = new MediaItem("7", "Severance", 2022, MediaType.TV, "TV Shows", List.of(), null,
        Map.of(1, List.of(1)));

    @BeforeEach
    void setUp() {
        properties = new MetadataSyncProperties();
        properties.getPlex().setLibraries(List.of("Movies", "TV Shows"));
        properties.getCleanup().setRunProcess(true);
        mediaServerClient = mock(MediaServerClient.class);
        libraryProcessingService = mock(LibraryProcessingService.class);
        orphanReconciler = mock(OrphanReconciler.class);
        runner = new MetadataSyncRunner(mediaServerClient, libraryProcessingService, orphanReconciler, properties);

        when(mediaServerClient.libraryType("Movies")).thenReturn(MediaType.MOVIE);
        when(mediaServerClient.libraryType("TV Shows")).thenReturn(MediaType.TV);
        when(mediaServerClient.listItems("Movies")).thenReturn(LibraryListing.complete(List.of(dune)));
        when(mediaServerClient.listItems("TV Shows")).thenReturn(LibraryListing.complete(List.of(severance)));
        when(libraryProcessingService.processLibrary(anyString(), any(), anyList(), anySet()))
            .thenAnswer(invocation -> new LibraryRunSummary(invocation.getArgument(0)));
        when(orphanReconciler.reconcile(any(), anyCollection(), anySet())).thenReturn(new ReconciliationSummary(false));
    }

    @Test
    @SuppressWarnings("unchecked")
    void reconcilesAgainstEveryLiveItemAfterProcessing() {
        Optional<RunReport> report = runner.runOnce("test");

        assertThat(report).isPresent();
        assertThat(report.get().libraries()).extracting(LibraryRunSummary::getLibraryName)
            .containsExactly("Movies", "TV Shows");
        assertThat(report.get().reconciliationResult()).isPresent();

        ArgumentCaptor<LiveItemIndex> live = ArgumentCaptor.forClass(LiveItemIndex.class);
        ArgumentCaptor<Collection<String>> types = ArgumentCaptor.forClass(Collection.class);
        verify(orphanReconciler).reconcile(live.capture(), types.capture(), anySet());
        assertThat(live.getValue().cacheKeys()).contains("movie:Dune:2021", "tv:Severance:2022", "tv:Severance:2022:season1");
        assertThat(types.getValue()).containsExactly("movie", "tv");
    }

    @Test
    void listingFailureSkipsReconciliation() {
        when(mediaServerClient.listItems("TV Shows")).thenThrow(new MediaServerException("connection refused"));

        RunReport report = runner.runOnce("test").orElseThrow();

        assertThat(report.reconciliationResult()).isEmpty();
        assertThat(report.libraries().get(1).getFailures()).containsKey("TV Shows");
        verify(orphanReconciler, never()).reconcile(any(), anyCollection(), anySet());
    }

    @Test
    void partialListingProcessesListedItemsButSkipsReconciliation() {
        when(mediaServerClient.listItems("TV Shows"))
            .thenReturn(new LibraryListing(List.of(severance), List.of("Andor")));

        RunReport report = runner.runOnce("test").orElseThrow();

        assertThat(report.reconciliationResult()).isEmpty();
        verify(libraryProcessingService).processLibrary(eq("TV Shows"), eq(MediaType.TV), eq(List.of(severance)), anySet());
        assertThat(report.libraries().get(1).getFailures()).containsEntry("Andor", "not listed");
        verify(orphanReconciler, never()).reconcile(any(), anyCollection(), anySet());
    }

    @Test
    void cleanupDisabledSkipsReconciliation() {
        properties.getCleanup().setRunProcess(false);

        RunReport report = runner.runOnce("test").orElseThrow();

        assertThat(report.reconciliation()).isNull();
        verify(orphanReconciler, never()).reconcile(any(), anyCollection(), anySet());
    }

    @Test
    void overlappingRunIsRejected() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(libraryProcessingService.processLibrary(eq("Movies"), any(), anyList(), anySet())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new LibraryRunSummary("Movies");
        });

        CompletableFuture<Optional<RunReport>> first = CompletableFuture.supplyAsync(() -> runner.runOnce("first"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(runner.isRunning()).isTrue();
        assertThat(runner.runOnce("second")).isEmpty();

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isPresent();
        assertThat(runner.isRunning()).isFalse();
        assertThat(runner.runOnce("third")).isPresent();
    }
}
