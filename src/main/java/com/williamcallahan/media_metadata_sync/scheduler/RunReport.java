package com.williamcallahan.media_metadata_sync.scheduler;

import com.williamcallahan.media_metadata_sync.types.LibraryRunSummary;
import com.williamcallahan.media_metadata_sync.types.ReconciliationSummary;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one complete sync run
 *
 * @param trigger        what started the run, e.g. "startup" or "schedule"
 * @param libraries      per-library summaries in processing order
 * @param reconciliation orphan reconciliation result, null when it did not run
 * @param elapsed        wall time of the run
 */
public record RunReport(String trigger, List<LibraryRunSummary> libraries, ReconciliationSummary reconciliation,
                        Duration elapsed) {

    public RunReport {
        libraries = List.copyOf(libraries);
    }

    public Optional<ReconciliationSummary> reconciliationResult() {
        return Optional.ofNullable(reconciliation);
    }
}
