package com.qanun.document.extractor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.qanun.document.TestDocuments;
import com.qanun.document.model.FailureKind;
import com.qanun.document.model.LegalDocumentException;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TextExtractorTest {

    @TempDir
    Path tempDir;

    private static TextExtractionBackend backend(String name, boolean available) {
        TextExtractionBackend backend = mock(TextExtractionBackend.class);
        when(backend.getName()).thenReturn(name);
        when(backend.isAvailableFor(any())).thenReturn(available);
        return backend;
    }

    @Test
    void rejectsUnsupportedExtensionWithoutCallingAnyBackend() throws IOException {
        TextExtractionBackend primary = backend("primary", true);
        TextExtractor extractor = new TextExtractor(List.of(primary));

        LegalDocumentException failure = catchThrowableOfType(
                () -> extractor.extractText(Paths.get("tariffs.xlsx")), LegalDocumentException.class);

        assertThat(failure.getKind()).isEqualTo(FailureKind.EXTRACTION);
        assertThat(failure.getMessage()).isEqualTo("Unsupported file format: .xlsx");
        assertThat(failure.getField()).isEqualTo("file_path");
        assertThat(failure.getDetails()).containsEntry("document_path", "tariffs.xlsx").containsEntry("extension", ".xlsx");
        verify(primary, never()).extract(any(), any());
    }

    @Test
    void usesFirstAvailableBackendOnly() throws IOException {
        TextExtractionBackend primary = backend("primary", true);
        TextExtractionBackend secondary = backend("secondary", true);
        when(primary.extract(any(), any())).thenReturn("  نص المستند  ");
        TextExtractor extractor = new TextExtractor(List.of(primary, secondary));

        ExtractedText extracted = extractor.extract(Paths.get("law.PDF"));

        assertThat(extracted.getText()).isEqualTo("نص المستند");
        assertThat(extracted.getFormat()).isEqualTo(DocumentFormat.PDF);
        assertThat(extracted.getBackendName()).isEqualTo("primary");
        assertThat(extractor.availableBackends(DocumentFormat.PDF)).containsExactly("primary", "secondary");
        verify(secondary, never()).extract(any(), any());
    }

    @Test
    void skipsBackendThatIsNotInstalled() throws IOException {
        TextExtractionBackend primary = backend("primary", false);
        TextExtractionBackend secondary = backend("secondary", true);
        when(secondary.extract(any(), any())).thenReturn("نص");
        TextExtractor extractor = new TextExtractor(List.of(primary, secondary));

        assertThat(extractor.extractText(Paths.get("law.docx"))).isEqualTo("نص");
        verify(primary, never()).extract(any(), any());
    }

    @Test
    void reportsMissingLibrariesForFormat() {
        TextExtractor extractor = new TextExtractor(List.of(backend("primary", false)));

        LegalDocumentException failure = catchThrowableOfType(
                () -> extractor.extractText(Paths.get("law.pdf")), LegalDocumentException.class);

        assertThat(failure.getKind()).isEqualTo(FailureKind.EXTRACTION);
        assertThat(failure.getMessage()).isEqualTo("Required PDF processing libraries not installed");
    }

    @Test
    void wrapsBackendFailureWithoutFallingBack() throws IOException {
        TextExtractionBackend primary = backend("primary", true);
        TextExtractionBackend secondary = backend("secondary", true);
        IOException broken = new IOException("broken xref table");
        when(primary.extract(any(), any())).thenThrow(broken);
        TextExtractor extractor = new TextExtractor(List.of(primary, secondary));

        LegalDocumentException failure = catchThrowableOfType(
                () -> extractor.extractText(Paths.get("law.pdf")), LegalDocumentException.class);

        assertThat(failure.getKind()).isEqualTo(FailureKind.EXTRACTION);
        assertThat(failure.getMessage()).isEqualTo("Failed to extract text from PDF: broken xref table");
        assertThat(failure).hasCause(broken);
        assertThat(failure.getDetails()).containsEntry("backend", "primary");
        verify(secondary, never()).extract(any(), any());
    }

    @Test
    void extractsParagraphsFromDocxWithPoi() throws IOException {
        Path docx = TestDocuments.writeDocx(tempDir, "labor.docx",
                "نظام العمل", "المادة الأولى: يحق للعامل الحصول على إجازة سنوية.");

        ExtractedText extracted = TextExtractor.withDefaultBackends().extract(docx);

        assertThat(extracted.getBackendName()).isEqualTo(PoiWordTextBackend.NAME);
        assertThat(extracted.getText()).isEqualTo("نظام العمل\nالمادة الأولى: يحق للعامل الحصول على إجازة سنوية.");
    }

    @Test
    void extractsEveryPageFromPdfWithPdfBox() throws IOException {
        Path pdf = TestDocuments.writePdf(tempDir, "two-pages.pdf", "Article one applies", "Article two follows");

        ExtractedText extracted = TextExtractor.withDefaultBackends().extract(pdf);

        assertThat(extracted.getBackendName()).isEqualTo(PdfBoxTextBackend.NAME);
        assertThat(extracted.getText()).contains("Article one applies").contains("Article two follows");
        assertThat(extracted.getText().indexOf("one")).isLessThan(extracted.getText().indexOf("two"));
    }

    @Test
    void tikaBackendReadsDocx() throws IOException {
        Path docx = TestDocuments.writeDocx(tempDir, "tika.docx", "المادة الأولى: يحق للعامل الاستقالة.");

        String text = new TikaTextBackend().extract(docx, DocumentFormat.DOCX);

        assertThat(text).contains("المادة الأولى: يحق للعامل الاستقالة.");
    }

    @Test
    void routesBinaryWordDocumentToBackendServingDoc() throws IOException {
        TextExtractionBackend pdfOnly = mock(TextExtractionBackend.class);
        when(pdfOnly.getName()).thenReturn("pdf-only");
        when(pdfOnly.isAvailableFor(DocumentFormat.PDF)).thenReturn(true);
        TextExtractionBackend word = mock(TextExtractionBackend.class);
        when(word.getName()).thenReturn("word");
        when(word.isAvailableFor(DocumentFormat.DOC)).thenReturn(true);
        Path doc = Paths.get("archive", "Old-Law.DOC");
        when(word.extract(doc, DocumentFormat.DOC)).thenReturn("المادة الأولى: نص قديم\n");
        TextExtractor extractor = new TextExtractor(List.of(pdfOnly, word));

        ExtractedText extracted = extractor.extract(doc);

        assertThat(extracted.getFormat()).isEqualTo(DocumentFormat.DOC);
        assertThat(extracted.getBackendName()).isEqualTo("word");
        assertThat(extracted.getText()).isEqualTo("المادة الأولى: نص قديم");
        verify(word).extract(doc, DocumentFormat.DOC);
        verify(pdfOnly, never()).extract(any(), any());
    }

    @Test
    void defaultBackendsServeDocWithPoiFirst() {
        TextExtractor extractor = TextExtractor.withDefaultBackends();

        assertThat(extractor.availableBackends(DocumentFormat.DOC))
                .containsExactly(PoiWordTextBackend.NAME, TikaTextBackend.NAME);
        assertThat(extractor.availableBackends(DocumentFormat.PDF))
                .containsExactly(PdfBoxTextBackend.NAME, TikaTextBackend.NAME);
    }

    @Test
    void unreadableDocFailsInPoiBinaryReader() throws IOException {
        Path garbage = TestDocuments.writeGarbage(tempDir, "corrupt.doc");

        LegalDocumentException failure = catchThrowableOfType(
                () -> TextExtractor.withDefaultBackends().extractText(garbage), LegalDocumentException.class);

        assertThat(failure.getKind()).isEqualTo(FailureKind.EXTRACTION);
        assertThat(failure.getMessage()).startsWith("Failed to extract text from DOC");
        assertThat(failure.getDetails()).containsEntry("backend", PoiWordTextBackend.NAME);
    }

    @Test
    void corruptPdfIsAnExtractionFailure() throws IOException {
        Path garbage = TestDocuments.writeGarbage(tempDir, "corrupt.pdf");

        LegalDocumentException failure = catchThrowableOfType(
                () -> TextExtractor.withDefaultBackends().extractText(garbage), LegalDocumentException.class);

        assertThat(failure.getKind()).isEqualTo(FailureKind.EXTRACTION);
        assertThat(failure.getMessage()).startsWith("Failed to extract text from PDF");
        assertThat(failure.getDocumentPath()).isEqualTo(garbage.toString());
    }

    @Test
    void reportsSupportedFormats() {
        assertThat(TextExtractor.supportedExtensions()).containsExactly("pdf", "docx", "doc");
        assertThat(TextExtractor.isSupportedFormat("law.PDF")).isTrue();
        assertThat(TextExtractor.isSupportedFormat("archive/law.doc")).isTrue();
        assertThat(TextExtractor.isSupportedFormat("law.xlsx")).isFalse();
        assertThat(TextExtractor.isSupportedFormat("law.txt")).isFalse();
        assertThat(TextExtractor.isSupportedFormat("README")).isFalse();
        assertThat(TextExtractor.isSupportedFormat(null)).isFalse();
        assertThat(TextExtractor.getFileExtension(Paths.get("dir", "Law.DocX"))).isEqualTo(".docx");
        assertThat(DocumentFormat.fromExtension(".DOC")).contains(DocumentFormat.DOC);
    }
}
