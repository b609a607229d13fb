package com.qanun.document.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Figures collected while processing one document
 */
public class ProcessingStatistics {
    private final int totalArticles;
    private final long totalCharacters;
    private final Instant processingTime;
    private final String filePath;
    private final String language;
    private final String extractionBackend;

    public ProcessingStatistics(int totalArticles, long totalCharacters, Instant processingTime,
            String filePath, String language, String extractionBackend) {
        this.totalArticles = Math.max(0, totalArticles);
        this.totalCharacters = Math.max(0, totalCharacters);
        this.processingTime = Objects.requireNonNull(processingTime, "processingTime");
        this.filePath = filePath != null ? filePath : "";
        this.language = language != null ? language : "ar";
        this.extractionBackend = extractionBackend != null ? extractionBackend : "unknown";
    }

    public int getTotalArticles() {
        return totalArticles;
    }

    public long getTotalCharacters() {
        return totalCharacters;
    }

    public Instant getProcessingTime() {
        return processingTime;
    }

    public String getFilePath() {
        return filePath;
    }

    public String getLanguage() {
        return language;
    }

    public String getExtractionBackend() {
        return extractionBackend;
    }

    @Override
    public String toString() {
        return String.format(
                "ProcessingStatistics{articles=%d, characters=%d, language='%s', backend='%s', file='%s'}",
                totalArticles, totalCharacters, language, extractionBackend, filePath);
    }
}
