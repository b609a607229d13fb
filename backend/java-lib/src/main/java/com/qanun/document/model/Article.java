package com.qanun.document.model;

import java.util.List;
import java.util.Objects;

/**
 * A numbered article segmented out of a legal text
 */
public class Article {
    private final String articleNumber;
    private final String title;
    private final String content;
    private final List<String> keywords;
    private final List<String> relatedReferences;

    public Article(String articleNumber, String title, String content,
            List<String> keywords, List<String> relatedReferences) {
        this.articleNumber = Objects.requireNonNull(articleNumber, "articleNumber");
        this.title = title;
        this.content = Objects.requireNonNull(content, "content");
        this.keywords = keywords != null ? List.copyOf(keywords) : List.of();
        this.relatedReferences = relatedReferences != null ? List.copyOf(relatedReferences) : List.of();
    }

    public String getArticleNumber() {
        return articleNumber;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public List<String> getRelatedReferences() {
        return relatedReferences;
    }

    public int getContentLength() {
        return content.length();
    }

    @Override
    public String toString() {
        return String.format("Article{number='%s', contentLength=%d, keywords=%d, references=%d}",
                articleNumber, content.length(), keywords.size(), relatedReferences.size());
    }
}
