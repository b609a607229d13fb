package com.qanun.document.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the legal document pipeline
 */
public class ProcessorConfig {
    public static final int DEFAULT_MAX_KEYWORDS = 10;
    public static final int DEFAULT_MIN_ARTICLE_LENGTH = 11;
    public static final int DEFAULT_DESCRIPTION_WINDOW = 500;
    public static final int DEFAULT_BATCH_WORKERS = 1;
    public static final Duration DEFAULT_DOCUMENT_TIMEOUT = Duration.ofSeconds(120);

    private final int maxKeywords;
    private final int minArticleLength;
    private final int descriptionWindow;
    private final int batchWorkers;
    private final Duration documentTimeout;

    public ProcessorConfig(int maxKeywords, int minArticleLength, int descriptionWindow,
            int batchWorkers, Duration documentTimeout) {
        this.maxKeywords = requirePositive(maxKeywords, "maxKeywords");
        this.minArticleLength = requirePositive(minArticleLength, "minArticleLength");
        this.descriptionWindow = requirePositive(descriptionWindow, "descriptionWindow");
        this.batchWorkers = requirePositive(batchWorkers, "batchWorkers");
        this.documentTimeout = Objects.requireNonNull(documentTimeout, "documentTimeout");
        if (documentTimeout.isNegative() || documentTimeout.isZero()) {
            throw new IllegalArgumentException("documentTimeout must be positive");
        }
    }

    public static ProcessorConfig defaults() {
        return new ProcessorConfig(DEFAULT_MAX_KEYWORDS, DEFAULT_MIN_ARTICLE_LENGTH, DEFAULT_DESCRIPTION_WINDOW,
                DEFAULT_BATCH_WORKERS, DEFAULT_DOCUMENT_TIMEOUT);
    }

    public int getMaxKeywords() {
        return maxKeywords;
    }

    public int getMinArticleLength() {
        return minArticleLength;
    }

    public int getDescriptionWindow() {
        return descriptionWindow;
    }

    public int getBatchWorkers() {
        return batchWorkers;
    }

    public Duration getDocumentTimeout() {
        return documentTimeout;
    }

    public boolean isParallelBatch() {
        return batchWorkers > 1;
    }

    public ProcessorConfig withBatchWorkers(int workers) {
        return new ProcessorConfig(maxKeywords, minArticleLength, descriptionWindow, workers, documentTimeout);
    }

    public ProcessorConfig withDocumentTimeout(Duration timeout) {
        return new ProcessorConfig(maxKeywords, minArticleLength, descriptionWindow, batchWorkers, timeout);
    }

    private static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1 but was " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return String.format(
                "ProcessorConfig{maxKeywords=%d, minArticleLength=%d, descriptionWindow=%d, batchWorkers=%d, timeout=%s}",
                maxKeywords, minArticleLength, descriptionWindow, batchWorkers, documentTimeout);
    }
}
