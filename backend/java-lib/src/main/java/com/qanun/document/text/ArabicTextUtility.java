package com.qanun.document.text;

import java.util.List;

/**
 * Generic Arabic text helpers the legal pipeline relies on. Implementations
 * must accept {@code null} input and must not throw.
 */
public interface ArabicTextUtility {

    /**
     * Normalize Unicode composition, whitespace and punctuation.
     */
    String normalize(String text);

    /**
     * Frequency-agnostic keyword mining: unique content words in order of first appearance.
     */
    List<String> extractGenericKeywords(String text, int maxKeywords);

    /**
     * Two-letter language code for the dominant script of the text.
     */
    String detectLanguage(String text);
}
