package com.qanun.document.legal;

import static org.assertj.core.api.Assertions.assertThat;

import com.qanun.document.model.LawSourceMetadata;
import com.qanun.document.model.LawSourceOverrides;
import com.qanun.document.model.LawType;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class LawSourceDetectorTest {

    private static final String LABOR_LAW_HEADER =
            "نظام العمل الصادر بالمرسوم الملكي رقم م/51 لعام 1426. وزارة الموارد البشرية والتنمية الاجتماعية";

    private final LawSourceDetector detector = new LawSourceDetector();

    @Test
    void detectsNameTypeAuthorityAndYear() {
        LawSourceMetadata metadata = detector.detect(LABOR_LAW_HEADER);

        assertThat(metadata.getName()).isEqualTo("العمل الصادر بالمرسوم الملكي");
        assertThat(metadata.getType()).isEqualTo(LawType.LAW);
        assertThat(metadata.getJurisdiction()).isEqualTo(LawSourceMetadata.DEFAULT_JURISDICTION);
        assertThat(metadata.getIssuingAuthority()).isEqualTo("الموارد البشرية");
        assertThat(metadata.getIssueDate()).isEqualTo(LocalDate.of(1426, 1, 1));
        assertThat(metadata.getDescription()).isEqualTo("نظام العمل الصادر بالمرسوم الملكي رقم م/51 لعام 1426");
        assertThat(metadata.getLastUpdate()).isNull();
        assertThat(metadata.getSourceUrl()).isNull();
    }

    @Test
    void typeFollowsIndicatorPriorityNotPositionInText() {
        LawSourceMetadata metadata = detector.detect("لائحة تنظيم العمل الصادرة بمرسوم");

        assertThat(metadata.getType()).isEqualTo(LawType.DECREE);
        assertThat(metadata.getName()).isEqualTo(LawSourceMetadata.DEFAULT_NAME);
    }

    @Test
    void readsYearWrittenInArabicIndicDigits() {
        LawSourceMetadata metadata = detector.detect("قانون الشركات لسنة ٢٠١٥");

        assertThat(metadata.getName()).isEqualTo("الشركات");
        assertThat(metadata.getIssueDate()).isEqualTo(LocalDate.of(2015, 1, 1));
    }

    @Test
    void toleratesNoBreakSpacesBetweenWords() {
        LawSourceMetadata metadata = detector.detect("نظام\u00A0العمل\u00A0رقم 51 لعام\u00A01426");

        assertThat(metadata.getName()).isEqualTo("العمل");
        assertThat(metadata.getIssueDate()).isEqualTo(LocalDate.of(1426, 1, 1));
    }

    @Test
    void emptyTextYieldsDefaults() {
        LawSourceMetadata metadata = detector.detect("");

        assertThat(metadata.getName()).isEqualTo("وثيقة قانونية");
        assertThat(metadata.getType()).isEqualTo(LawType.LAW);
        assertThat(metadata.getJurisdiction()).isEqualTo("المملكة العربية السعودية");
        assertThat(metadata.hasIssuingAuthority()).isFalse();
        assertThat(metadata.hasIssueDate()).isFalse();
        assertThat(metadata.getDescription()).isNull();
        assertThat(detector.detect(null).getName()).isEqualTo(LawSourceMetadata.DEFAULT_NAME);
    }

    @Test
    void descriptionIsAbsentWhenFirstSentenceIsEmpty() {
        assertThat(detector.detect(". نظام العمل").getDescription()).isNull();
    }

    @Test
    void descriptionLooksOnlyAtConfiguredWindow() {
        LawSourceDetector narrow = new LawSourceDetector(10);

        assertThat(narrow.detect("أحكام عامة تسري على الجميع. ثم نص آخر").getDescription()).isEqualTo("أحكام عامة");
    }

    @Test
    void providedFieldsWinOverDetectedOnes() {
        LawSourceMetadata detected = detector.detect(LABOR_LAW_HEADER);

        LawSourceMetadata merged = detector.merge(detected, LawSourceOverrides.builder()
                .name("نظام العمل المعدل")
                .type(LawType.REGULATION)
                .sourceUrl("https://laws.example/labor")
                .build());

        assertThat(merged.getName()).isEqualTo("نظام العمل المعدل");
        assertThat(merged.getType()).isEqualTo(LawType.REGULATION);
        assertThat(merged.getSourceUrl()).isEqualTo("https://laws.example/labor");
        assertThat(merged.getIssuingAuthority()).isEqualTo("الموارد البشرية");
        assertThat(merged.getIssueDate()).isEqualTo(LocalDate.of(1426, 1, 1));
    }

    @Test
    void nullProvidedFieldsKeepDetectedValues() {
        LawSourceMetadata detected = detector.detect(LABOR_LAW_HEADER);

        LawSourceMetadata merged = detector.merge(detected, LawSourceOverrides.none());

        assertThat(merged.getName()).isEqualTo(detected.getName());
        assertThat(merged.getIssuingAuthority()).isEqualTo(detected.getIssuingAuthority());
        assertThat(detector.merge(detected, null)).isSameAs(detected);
    }
}
