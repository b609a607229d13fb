package com.qanun.document.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of processing a single legal document
 */
public class ProcessingResult {
    private final LawSourceMetadata lawSource;
    private final List<Article> articles;
    private final ProcessingStatistics statistics;

    public ProcessingResult(LawSourceMetadata lawSource, List<Article> articles, ProcessingStatistics statistics) {
        this.lawSource = lawSource != null ? lawSource : new LawSourceMetadata();
        this.articles = articles != null ? List.copyOf(articles) : List.of();
        this.statistics = Objects.requireNonNull(statistics, "statistics");
    }

    public LawSourceMetadata getLawSource() {
        return lawSource;
    }

    public List<Article> getArticles() {
        return articles;
    }

    public ProcessingStatistics getStatistics() {
        return statistics;
    }

    public boolean hasArticles() {
        return !articles.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("ProcessingResult{lawSource='%s', articles=%d}",
                lawSource.getName(), articles.size());
    }
}
