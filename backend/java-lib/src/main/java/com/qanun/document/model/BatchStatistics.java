package com.qanun.document.model;

/**
 * Aggregate counters of a batch run
 */
public class BatchStatistics {
    private final int totalFiles;
    private final int successful;
    private final int failed;

    public BatchStatistics(int totalFiles, int successful, int failed) {
        this.totalFiles = totalFiles;
        this.successful = successful;
        this.failed = failed;
    }

    public int getTotalFiles() {
        return totalFiles;
    }

    public int getSuccessful() {
        return successful;
    }

    public int getFailed() {
        return failed;
    }

    @Override
    public String toString() {
        return String.format("BatchStatistics{total=%d, successful=%d, failed=%d}", totalFiles, successful, failed);
    }
}
