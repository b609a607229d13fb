package com.qanun.document.model;

import java.util.List;

/**
 * Ordered per-file outcomes of a batch run with counters computed over all entries
 */
public class BatchResult {
    private final List<BatchEntry> results;
    private final BatchStatistics statistics;

    public BatchResult(List<BatchEntry> results) {
        this.results = results != null ? List.copyOf(results) : List.of();
        int successful = (int) this.results.stream().filter(BatchEntry::isSuccess).count();
        this.statistics = new BatchStatistics(this.results.size(), successful, this.results.size() - successful);
    }

    public List<BatchEntry> getResults() {
        return results;
    }

    public BatchStatistics getStatistics() {
        return statistics;
    }

    public boolean isFullySuccessful() {
        return statistics.getFailed() == 0;
    }

    @Override
    public String toString() {
        return String.format("BatchResult{%s}", statistics);
    }
}
