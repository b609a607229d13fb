package com.qanun.document.legal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds mentions of other legal instruments ("نظام العمل رقم ...",
 * "المادة 5 من نظام ... لعام ...") in article content.
 */
public class ReferenceExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceExtractor.class);

    /**
     * @return full matched reference strings, unique, in pattern then position order; empty on failure
     */
    public List<String> extract(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }

        try {
            Set<String> references = new LinkedHashSet<>();
            for (Pattern pattern : ArabicLegalPatterns.REFERENCE_PATTERNS) {
                Matcher matcher = pattern.matcher(content);
                while (matcher.find()) {
                    references.add(matcher.group().trim());
                }
            }
            return new ArrayList<>(references);
        } catch (RuntimeException e) {
            logger.error("Failed to extract references: {}", e.getMessage(), e);
            return List.of();
        }
    }
}
