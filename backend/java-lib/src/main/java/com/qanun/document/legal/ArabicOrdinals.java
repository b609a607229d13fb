package com.qanun.document.legal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Spelled-out feminine ordinals used to number articles in Arabic legal prose
 * ("المادة الثالثة والعشرون"), mapped to their numeric value.
 *
 * Covers 1 to 109 and 200 to 209. Built once, read-only afterwards.
 */
public final class ArabicOrdinals {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    // Index n holds the ordinal of n; index 0 unused
    private static final String[] UNITS = {
            null, "الأولى", "الثانية", "الثالثة", "الرابعة", "الخامسة",
            "السادسة", "السابعة", "الثامنة", "التاسعة", "العاشرة"
    };

    // Index n holds the word for n * 10, from twenty on
    private static final String[] TENS = {
            null, null, "العشرون", "الثلاثون", "الأربعون", "الخمسون",
            "الستون", "السبعون", "الثمانون", "التسعون"
    };

    private static final String COMPOUND_ONE = "الحادية";
    private static final String HUNDRED = "المائة";
    private static final String TWO_HUNDRED = "المائتان";
    private static final String AFTER_HUNDRED = "بعد المائة";
    private static final String AFTER_TWO_HUNDRED = "بعد المائتين";

    private static final Map<String, Integer> PHRASE_TO_NUMBER;
    private static final List<String> PHRASES_LONGEST_FIRST;

    static {
        Map<String, Integer> table = new LinkedHashMap<>();

        for (int n = 1; n <= 10; n++) {
            table.put(UNITS[n], n);
        }
        for (int n = 11; n <= 19; n++) {
            table.put(compoundUnit(n - 10) + " عشرة", n);
        }
        for (int tens = 2; tens <= 9; tens++) {
            table.put(TENS[tens], tens * 10);
            for (int unit = 1; unit <= 9; unit++) {
                table.put(compoundUnit(unit) + " و" + TENS[tens], tens * 10 + unit);
            }
        }
        table.put(HUNDRED, 100);
        for (int unit = 1; unit <= 9; unit++) {
            table.put(compoundUnit(unit) + " " + AFTER_HUNDRED, 100 + unit);
        }
        table.put(TWO_HUNDRED, 200);
        for (int unit = 1; unit <= 9; unit++) {
            table.put(compoundUnit(unit) + " " + AFTER_TWO_HUNDRED, 200 + unit);
        }

        PHRASE_TO_NUMBER = Collections.unmodifiableMap(table);

        // Regex alternation tries alternatives in order, so "الثانية عشرة" must precede "الثانية"
        List<String> phrases = new ArrayList<>(table.keySet());
        phrases.sort(Comparator.comparingInt(String::length).reversed());
        PHRASES_LONGEST_FIRST = Collections.unmodifiableList(phrases);
    }

    private ArabicOrdinals() {
    }

    private static String compoundUnit(int unit) {
        return unit == 1 ? COMPOUND_ONE : UNITS[unit];
    }

    /**
     * Numeric value of an ordinal phrase. Runs of whitespace inside the phrase
     * are treated as a single space.
     */
    public static Optional<Integer> toNumber(String phrase) {
        if (phrase == null) {
            return Optional.empty();
        }
        String key = WHITESPACE.matcher(phrase).replaceAll(" ").trim();
        return Optional.ofNullable(PHRASE_TO_NUMBER.get(key));
    }

    public static Map<String, Integer> table() {
        return PHRASE_TO_NUMBER;
    }

    public static int size() {
        return PHRASE_TO_NUMBER.size();
    }

    /**
     * Regex alternation matching any known phrase, tolerant of extra whitespace between words.
     */
    static String alternationPattern() {
        StringBuilder alternation = new StringBuilder();
        for (String phrase : PHRASES_LONGEST_FIRST) {
            if (alternation.length() > 0) {
                alternation.append('|');
            }
            alternation.append(phrase.replace(" ", "\\s+"));
        }
        return alternation.toString();
    }
}
