package com.qanun.document;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes small PDF and Word fixtures for tests
 */
public final class TestDocuments {

    public static final String TWO_ARTICLE_TEXT =
            "المادة الأولى: يحق للعامل الحصول على إجازة سنوية مدتها ثلاثون يوماً. "
                    + "المادة الثانية: يجب على صاحب العمل دفع الأجر في الموعد المحدد.";

    private TestDocuments() {
    }

    public static Path writeDocx(Path directory, String fileName, String... paragraphs) throws IOException {
        Path file = directory.resolve(fileName);
        try (XWPFDocument document = new XWPFDocument(); OutputStream out = Files.newOutputStream(file)) {
            for (String paragraph : paragraphs) {
                document.createParagraph().createRun().setText(paragraph);
            }
            document.write(out);
        }
        return file;
    }

    /**
     * One page per line of text. The standard Helvetica font has no Arabic glyphs,
     * so PDF fixtures carry Latin text only.
     */
    public static Path writePdf(Path directory, String fileName, String... pages) throws IOException {
        Path file = directory.resolve(fileName);
        try (PDDocument document = new PDDocument()) {
            for (String pageText : pages) {
                PDPage page = new PDPage();
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(pageText);
                    content.endText();
                }
            }
            document.save(file.toFile());
        }
        return file;
    }

    public static Path writeGarbage(Path directory, String fileName) throws IOException {
        Path file = directory.resolve(fileName);
        Files.write(file, "this is not a real document".getBytes(StandardCharsets.UTF_8));
        return file;
    }
}
