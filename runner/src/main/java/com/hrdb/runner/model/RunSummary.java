package com.hrdb.runner.model;

import java.util.List;

/**
 * Finalized, immutable summary of one batch run. Entries are in execution
 * order; the counters are the ones the {@link ResultAggregator} kept while
 * the run progressed.
 */
public record RunSummary(List<StatementOutcome> results, int successCount, int failureCount, long durationMs) {

    public RunSummary {
        results = List.copyOf(results);
        if (successCount < 0 || failureCount < 0 || successCount + failureCount != results.size()) {
            throw new IllegalArgumentException("Counters " + successCount + "/" + failureCount
                    + " do not match " + results.size() + " results");
        }
    }

    public int totalCount() {
        return results.size();
    }

    public boolean hasFailures() {
        return failureCount > 0;
    }

    public List<StatementOutcome> failures() {
        return results.stream().filter(r -> !r.success()).toList();
    }
}
