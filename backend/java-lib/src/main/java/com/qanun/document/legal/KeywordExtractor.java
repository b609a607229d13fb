package com.qanun.document.legal;

import com.qanun.document.config.ProcessorConfig;
import com.qanun.document.text.ArabicTextUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Picks keywords for an article: legal dictionary terms first, then generic
 * keywords mined by the text utility.
 */
public class KeywordExtractor {
    private static final Logger logger = LoggerFactory.getLogger(KeywordExtractor.class);

    private final ArabicTextUtility textUtility;
    private final int defaultMaxKeywords;

    public KeywordExtractor(ArabicTextUtility textUtility) {
        this(textUtility, ProcessorConfig.DEFAULT_MAX_KEYWORDS);
    }

    public KeywordExtractor(ArabicTextUtility textUtility, int defaultMaxKeywords) {
        this.textUtility = Objects.requireNonNull(textUtility, "textUtility");
        this.defaultMaxKeywords = defaultMaxKeywords;
    }

    public List<String> extract(String content) {
        return extract(content, defaultMaxKeywords);
    }

    /**
     * @return unique keywords in insertion order, at most {@code maxKeywords}; empty on any failure
     */
    public List<String> extract(String content, int maxKeywords) {
        if (content == null || content.isEmpty() || maxKeywords <= 0) {
            return List.of();
        }

        try {
            Set<String> keywords = new LinkedHashSet<>();
            String contentLower = content.toLowerCase(Locale.ROOT);

            for (String keyword : ArabicLegalPatterns.LEGAL_KEYWORDS) {
                if (contentLower.contains(keyword)) {
                    keywords.add(keyword);
                }
            }

            List<String> generic = textUtility.extractGenericKeywords(content, maxKeywords);
            if (generic != null) {
                for (String keyword : generic) {
                    if (keyword != null && !keyword.isBlank()) {
                        keywords.add(keyword);
                    }
                }
            }

            List<String> ordered = new ArrayList<>(keywords);
            return ordered.size() > maxKeywords ? List.copyOf(ordered.subList(0, maxKeywords)) : ordered;
        } catch (RuntimeException e) {
            logger.error("Failed to extract keywords: {}", e.getMessage(), e);
            return List.of();
        }
    }
}
