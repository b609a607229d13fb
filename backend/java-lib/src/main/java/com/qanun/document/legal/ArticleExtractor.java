package com.qanun.document.legal;

import com.qanun.document.config.ProcessorConfig;
import com.qanun.document.model.Article;
import com.qanun.document.text.ArabicTextUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Segments Arabic legal text into numbered articles.
 *
 * Articles numbered with spelled-out ordinals ("المادة الأولى") are looked for
 * first; only if none is found are the numeric markers ("المادة 1", "مادة 1",
 * "الفقرة 1", "البند 1") tried. Every article is renumbered as "المادة N" and
 * the result is sorted by N.
 */
public class ArticleExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ArticleExtractor.class);

    public static final String ARTICLE_PREFIX = "المادة ";

    private final ArabicTextUtility textUtility;
    private final KeywordExtractor keywordExtractor;
    private final ReferenceExtractor referenceExtractor;
    private final int minArticleLength;

    public ArticleExtractor(ArabicTextUtility textUtility, KeywordExtractor keywordExtractor,
            ReferenceExtractor referenceExtractor) {
        this(textUtility, keywordExtractor, referenceExtractor, ProcessorConfig.DEFAULT_MIN_ARTICLE_LENGTH);
    }

    public ArticleExtractor(ArabicTextUtility textUtility, KeywordExtractor keywordExtractor,
            ReferenceExtractor referenceExtractor, int minArticleLength) {
        this.textUtility = Objects.requireNonNull(textUtility, "textUtility");
        this.keywordExtractor = Objects.requireNonNull(keywordExtractor, "keywordExtractor");
        this.referenceExtractor = Objects.requireNonNull(referenceExtractor, "referenceExtractor");
        this.minArticleLength = minArticleLength;
    }

    /**
     * @return articles sorted by number; empty when nothing is found or segmentation fails
     */
    public List<Article> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        try {
            List<Article> articles = extractOrdinalArticles(text);
            logger.debug("Ordinal pass found {} articles", articles.size());

            if (articles.isEmpty()) {
                for (Pattern pattern : ArabicLegalPatterns.NUMERIC_ARTICLE_PATTERNS) {
                    articles.addAll(extractNumericArticles(text, pattern));
                }
                logger.debug("Numeric pass found {} articles", articles.size());
            }

            articles.sort(Comparator.comparingInt(article -> sortKey(article.getArticleNumber())));
            return articles;
        } catch (RuntimeException | StackOverflowError e) {
            logger.error("Failed to extract articles from text: {}", e.toString(), e);
            return List.of();
        }
    }

    private List<Article> extractOrdinalArticles(String text) {
        List<Article> articles = new ArrayList<>();
        Matcher matcher = ArabicLegalPatterns.ORDINAL_ARTICLE_PATTERN.matcher(text);

        while (matcher.find()) {
            String ordinal = matcher.group(1).trim();
            String content = matcher.group(2).trim();
            if (content.length() < minArticleLength) {
                continue;
            }

            Optional<Integer> number = ArabicOrdinals.toNumber(ordinal);
            String numeral;
            if (number.isPresent()) {
                numeral = String.valueOf(number.get());
            } else {
                // Kept as written; the article then sorts first
                numeral = textUtility.normalize(ordinal);
                logger.warn("Unknown article ordinal '{}', keeping it unconverted", numeral);
            }
            articles.add(buildArticle(numeral, content));
        }
        return articles;
    }

    private List<Article> extractNumericArticles(String text, Pattern pattern) {
        List<Article> articles = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);

        while (matcher.find()) {
            String content = matcher.group(2).trim();
            if (content.length() < minArticleLength) {
                continue;
            }
            articles.add(buildArticle(ArabicLegalPatterns.toAsciiNumeral(matcher.group(1)), content));
        }
        return articles;
    }

    private Article buildArticle(String numeral, String rawContent) {
        String content = textUtility.normalize(rawContent);
        return new Article(
                ARTICLE_PREFIX + numeral,
                null,
                content,
                keywordExtractor.extract(content),
                referenceExtractor.extract(content));
    }

    /**
     * Number embedded in a canonical article number, 0 when it has none.
     */
    static int sortKey(String articleNumber) {
        Matcher matcher = ArabicLegalPatterns.ARTICLE_NUMBER_PATTERN.matcher(articleNumber);
        if (!matcher.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(ArabicLegalPatterns.toAsciiNumeral(matcher.group(1)));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
