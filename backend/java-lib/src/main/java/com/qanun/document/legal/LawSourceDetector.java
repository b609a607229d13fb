package com.qanun.document.legal;

import com.qanun.document.config.ProcessorConfig;
import com.qanun.document.model.LawSourceMetadata;
import com.qanun.document.model.LawSourceOverrides;
import com.qanun.document.model.LawType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers law-source metadata from document text using ordered pattern tables.
 * For every field the first pattern in the table that matches anywhere in the
 * text decides the value.
 */
public class LawSourceDetector {
    private static final Logger logger = LoggerFactory.getLogger(LawSourceDetector.class);

    private final int descriptionWindow;

    public LawSourceDetector() {
        this(ProcessorConfig.DEFAULT_DESCRIPTION_WINDOW);
    }

    public LawSourceDetector(int descriptionWindow) {
        if (descriptionWindow < 1) {
            throw new IllegalArgumentException("descriptionWindow must be at least 1");
        }
        this.descriptionWindow = descriptionWindow;
    }

    /**
     * Detect law metadata. Never fails: fields without a match keep their defaults.
     */
    public LawSourceMetadata detect(String text) {
        if (text == null || text.isEmpty()) {
            return new LawSourceMetadata();
        }

        try {
            String name = firstGroup(ArabicLegalPatterns.LAW_NAME_PATTERNS, text);
            LawType type = detectType(text);
            String issuingAuthority = firstGroup(ArabicLegalPatterns.ISSUING_AUTHORITY_PATTERNS, text);
            LocalDate issueDate = detectIssueDate(text);
            String description = detectDescription(text);

            LawSourceMetadata detected = new LawSourceMetadata(name, type, null, issuingAuthority,
                    issueDate, null, description, null);
            logger.debug("Detected law source: {}", detected);
            return detected;
        } catch (RuntimeException e) {
            logger.error("Failed to detect law source from text: {}", e.getMessage(), e);
            return new LawSourceMetadata();
        }
    }

    /**
     * Overlay caller-supplied values on detected ones. Any non-null provided field wins.
     */
    public LawSourceMetadata merge(LawSourceMetadata detected, LawSourceOverrides provided) {
        LawSourceMetadata base = detected != null ? detected : new LawSourceMetadata();
        if (provided == null) {
            return base;
        }

        return new LawSourceMetadata(
                pick(provided.getName(), base.getName()),
                pick(provided.getType(), base.getType()),
                pick(provided.getJurisdiction(), base.getJurisdiction()),
                pick(provided.getIssuingAuthority(), base.getIssuingAuthority()),
                pick(provided.getIssueDate(), base.getIssueDate()),
                pick(provided.getLastUpdate(), base.getLastUpdate()),
                pick(provided.getDescription(), base.getDescription()),
                pick(provided.getSourceUrl(), base.getSourceUrl()));
    }

    private static <T> T pick(T provided, T detected) {
        return provided != null ? provided : detected;
    }

    private static String firstGroup(Iterable<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.group(1).trim();
            }
        }
        return null;
    }

    private static LawType detectType(String text) {
        for (Map.Entry<Pattern, LawType> indicator : ArabicLegalPatterns.LAW_TYPE_PATTERNS) {
            if (indicator.getKey().matcher(text).find()) {
                return indicator.getValue();
            }
        }
        return null;
    }

    private static LocalDate detectIssueDate(String text) {
        String year = firstGroup(ArabicLegalPatterns.YEAR_PATTERNS, text);
        if (year == null) {
            return null;
        }
        return LocalDate.of(Integer.parseInt(ArabicLegalPatterns.toAsciiNumeral(year)), 1, 1);
    }

    private String detectDescription(String text) {
        String window = text.length() > descriptionWindow ? text.substring(0, descriptionWindow) : text;
        Matcher delimiter = ArabicLegalPatterns.SENTENCE_DELIMITER.matcher(window);
        String firstSentence = delimiter.find() ? window.substring(0, delimiter.start()) : window;
        firstSentence = firstSentence.trim();
        return firstSentence.isEmpty() ? null : firstSentence;
    }
}
