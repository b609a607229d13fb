package com.qanun.document.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link ArabicTextUtility} used when the caller does not plug its own
 */
public class DefaultArabicTextUtility implements ArabicTextUtility {

    public static final String ARABIC = "ar";
    public static final String ENGLISH = "en";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern REPEATED_DOTS = Pattern.compile("\\.{2,}");
    private static final Pattern ARABIC_WORD = Pattern.compile("[\\u0600-\\u06FF]+");
    private static final Pattern ARABIC_CHARACTER = Pattern.compile(
            "[\\u0600-\\u06FF\\u0660-\\u0669\\u060C\\u061B\\u061F\\u0640\\u066A-\\u066D]");

    private static final int MIN_KEYWORD_LENGTH = 3;
    private static final double ARABIC_RATIO_THRESHOLD = 0.3;

    private static final Set<String> STOP_WORDS = Set.of(
            "في", "من", "إلى", "على", "هذا", "هذه", "ذلك", "تلك", "التي", "الذي",
            "الذين", "اللاتي", "اللائي", "اللذان", "اللتان", "اللذين", "اللتين",
            "هو", "هي", "هم", "هن", "أنت", "أنتم", "أنتن", "أنا", "نحن",
            "كان", "كانت", "كانوا", "كن", "يكون", "تكون", "يكونون", "تكونون",
            "له", "لها", "لهم", "لهن");

    @Override
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFC);
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        normalized = normalized.replace('،', ',')
                .replace('“', '"')
                .replace('”', '"')
                .replace('‘', '\'')
                .replace('’', '\'');
        normalized = REPEATED_DOTS.matcher(normalized).replaceAll("...");
        return normalized.trim();
    }

    @Override
    public List<String> extractGenericKeywords(String text, int maxKeywords) {
        if (text == null || maxKeywords <= 0 || !isArabicText(text)) {
            return List.of();
        }

        Set<String> keywords = new LinkedHashSet<>();
        Matcher matcher = ARABIC_WORD.matcher(normalize(text));
        while (matcher.find() && keywords.size() < maxKeywords) {
            String word = matcher.group();
            if (word.length() >= MIN_KEYWORD_LENGTH && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return new ArrayList<>(keywords);
    }

    @Override
    public String detectLanguage(String text) {
        if (text == null || text.isEmpty()) {
            return ENGLISH;
        }

        int arabicChars = 0;
        int wordChars = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_') {
                wordChars++;
                if (c >= '\u0600' && c <= '\u06FF') {
                    arabicChars++;
                }
            }
        }

        if (wordChars == 0) {
            return ENGLISH;
        }
        return (double) arabicChars / wordChars > ARABIC_RATIO_THRESHOLD ? ARABIC : ENGLISH;
    }

    public boolean isArabicText(String text) {
        return text != null && ARABIC_CHARACTER.matcher(text).find();
    }
}
