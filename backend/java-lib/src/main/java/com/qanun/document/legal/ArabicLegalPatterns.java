package com.qanun.document.legal;

import com.qanun.document.model.LawType;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pattern tables for Arabic legal documents. Lists are scanned in order and
 * the first match wins, so the order here is part of the detected output.
 */
public final class ArabicLegalPatterns {

    // Unicode whitespace for \s (no-break spaces survive PDF extraction), '\n' as the only line terminator
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
            | Pattern.UNICODE_CHARACTER_CLASS | Pattern.UNIX_LINES;

    /** ASCII, Arabic-Indic and Extended Arabic-Indic digits */
    static final String DIGIT = "[0-9\\u0660-\\u0669\\u06F0-\\u06F9]";

    private static final String NAME_TERMINATOR = "(?:\\s+رقم|\\s+لعام|\\s+لسنة)";
    private static final String AUTHORITY_TERMINATOR = "(?:\\s+و|\\s+،|\\s+\\.|\\s+\\n)";
    private static final String REFERENCE_TERMINATOR = "(?:\\s+رقم|\\s+لعام)";

    public static final List<Pattern> LAW_NAME_PATTERNS = List.of(
            Pattern.compile("نظام\\s+(.+?)" + NAME_TERMINATOR, FLAGS),
            Pattern.compile("مرسوم\\s+(.+?)" + NAME_TERMINATOR, FLAGS),
            Pattern.compile("قانون\\s+(.+?)" + NAME_TERMINATOR, FLAGS),
            Pattern.compile("لائحة\\s+(.+?)" + NAME_TERMINATOR, FLAGS),
            Pattern.compile("قرار\\s+(.+?)" + NAME_TERMINATOR, FLAGS));

    public static final List<Map.Entry<Pattern, LawType>> LAW_TYPE_PATTERNS = List.of(
            Map.entry(Pattern.compile("نظام", FLAGS), LawType.LAW),
            Map.entry(Pattern.compile("مرسوم", FLAGS), LawType.DECREE),
            Map.entry(Pattern.compile("قانون", FLAGS), LawType.LAW),
            Map.entry(Pattern.compile("لائحة", FLAGS), LawType.REGULATION),
            Map.entry(Pattern.compile("قرار", FLAGS), LawType.DIRECTIVE));

    public static final List<Pattern> ISSUING_AUTHORITY_PATTERNS = List.of(
            Pattern.compile("وزارة\\s+(.+?)" + AUTHORITY_TERMINATOR, FLAGS),
            Pattern.compile("هيئة\\s+(.+?)" + AUTHORITY_TERMINATOR, FLAGS),
            Pattern.compile("مجلس\\s+(.+?)" + AUTHORITY_TERMINATOR, FLAGS));

    public static final List<Pattern> YEAR_PATTERNS = List.of(
            Pattern.compile("لعام\\s+(" + DIGIT + "{4})", FLAGS),
            Pattern.compile("لسنة\\s+(" + DIGIT + "{4})", FLAGS),
            Pattern.compile("عام\\s+(" + DIGIT + "{4})", FLAGS),
            Pattern.compile("سنة\\s+(" + DIGIT + "{4})", FLAGS));

    public static final Pattern SENTENCE_DELIMITER = Pattern.compile("[.!?]");

    /** Articles numbered with a spelled-out ordinal, body running to the next such marker */
    public static final Pattern ORDINAL_ARTICLE_PATTERN;

    /**
     * Numeric markers tried when no ordinal article is found. A bare "مادة" must
     * stand as its own word so it does not match again inside "المادة".
     */
    public static final List<Pattern> NUMERIC_ARTICLE_PATTERNS = List.of(
            numericMarker("المادة"),
            numericMarker("(?<![\\u0621-\\u064A])مادة"),
            numericMarker("الفقرة"),
            numericMarker("البند"));

    public static final Pattern ARTICLE_NUMBER_PATTERN = Pattern.compile("المادة\\s+(" + DIGIT + "+)", FLAGS);

    public static final List<Pattern> REFERENCE_PATTERNS = List.of(
            Pattern.compile("نظام\\s+(.+?)" + REFERENCE_TERMINATOR, FLAGS),
            Pattern.compile("قانون\\s+(.+?)" + REFERENCE_TERMINATOR, FLAGS),
            Pattern.compile("مرسوم\\s+(.+?)" + REFERENCE_TERMINATOR, FLAGS),
            Pattern.compile("المادة\\s+(" + DIGIT + "+)\\s+من\\s+(.+?)" + REFERENCE_TERMINATOR, FLAGS),
            Pattern.compile("الفقرة\\s+(" + DIGIT + "+)\\s+من\\s+(.+?)" + REFERENCE_TERMINATOR, FLAGS));

    public static final List<String> LEGAL_KEYWORDS = List.of(
            "حق", "واجب", "مسؤولية", "عقوبة", "غرامة", "سجن", "حظر", "منع",
            "إجازة", "ترخيص", "تصريح", "شهادة", "وثيقة", "عقد", "اتفاقية",
            "نظام", "قانون", "مرسوم", "قرار", "لائحة", "تعليمات", "إجراءات",
            "محكمة", "قاضي", "محامي", "شاهد", "دليل", "إثبات", "براءة",
            "ذنب", "جريمة", "جنحة", "مخالفة", "عقاب", "تعزير", "حد",
            "تعويض", "ضرر", "خسارة", "فائدة", "ربح", "مصلحة", "منفعة");

    /**
     * Hundreds tail of ordinals the table does not hold ("الحادية عشرة بعد المائة" is 111).
     * Captured with the phrase so the article is not mistaken for the shorter one.
     */
    private static final String HUNDREDS_TAIL = "(?:\\s+بعد\\s+المائ(?:ة|تين))?";

    /** The ordinal must end the word */
    private static final String WORD_END = "(?![\\u0621-\\u064A])";

    static {
        String ordinal = "(?:" + ArabicOrdinals.alternationPattern() + ")" + HUNDREDS_TAIL + WORD_END;
        ORDINAL_ARTICLE_PATTERN = Pattern.compile(
                "المادة\\s+(" + ordinal + ")[:.]?\\s*(.*?)(?=المادة\\s+" + ordinal + "|$)",
                Pattern.DOTALL | FLAGS);
    }

    private ArabicLegalPatterns() {
    }

    private static Pattern numericMarker(String marker) {
        return Pattern.compile(
                marker + "\\s+(" + DIGIT + "+)[:.]?\\s*(.*?)(?=" + marker + "\\s+" + DIGIT + "+|$)",
                Pattern.DOTALL | FLAGS);
    }

    /**
     * Replace Arabic-Indic digits with ASCII ones and drop leading zeros.
     */
    static String toAsciiNumeral(String digits) {
        StringBuilder ascii = new StringBuilder(digits.length());
        for (int i = 0; i < digits.length(); i++) {
            int value = Character.digit(digits.charAt(i), 10);
            if (value >= 0) {
                ascii.append((char) ('0' + value));
            }
        }
        int firstNonZero = 0;
        while (firstNonZero < ascii.length() - 1 && ascii.charAt(firstNonZero) == '0') {
            firstNonZero++;
        }
        return ascii.substring(firstNonZero);
    }
}
