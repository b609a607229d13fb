package com.qanun.document.extractor;

import org.apache.poi.hwpf.HWPFDocument;
import org.apache.poi.hwpf.usermodel.Range;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Word text extraction with Apache POI. Paragraphs are emitted in document
 * order, one per line.
 */
public class PoiWordTextBackend implements TextExtractionBackend {
    private static final Logger logger = LoggerFactory.getLogger(PoiWordTextBackend.class);

    public static final String NAME = "poi";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailableFor(DocumentFormat format) {
        if (format == DocumentFormat.DOCX) {
            return TextExtractionBackend.isClassPresent("org.apache.poi.xwpf.usermodel.XWPFDocument");
        }
        if (format == DocumentFormat.DOC) {
            return TextExtractionBackend.isClassPresent("org.apache.poi.hwpf.HWPFDocument");
        }
        return false;
    }

    @Override
    public String extract(Path file, DocumentFormat format) throws IOException {
        StringBuilder text = new StringBuilder();
        int paragraphCount;

        try (InputStream inputStream = Files.newInputStream(file)) {
            if (format == DocumentFormat.DOC) {
                paragraphCount = appendBinaryParagraphs(inputStream, text);
            } else {
                paragraphCount = appendXmlParagraphs(inputStream, text);
            }
        }

        logger.debug("Extracted {} paragraphs ({} characters) from {}", paragraphCount, text.length(), file);
        return text.toString().trim();
    }

    private int appendXmlParagraphs(InputStream inputStream, StringBuilder text) throws IOException {
        try (XWPFDocument document = new XWPFDocument(inputStream)) {
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                text.append(paragraph.getText()).append('\n');
            }
            return document.getParagraphs().size();
        }
    }

    private int appendBinaryParagraphs(InputStream inputStream, StringBuilder text) throws IOException {
        try (HWPFDocument document = new HWPFDocument(inputStream)) {
            Range range = document.getRange();
            int count = range.numParagraphs();
            for (int i = 0; i < count; i++) {
                // HWPF keeps the paragraph mark and cell markers at the end
                text.append(range.getParagraph(i).text().trim()).append('\n');
            }
            return count;
        }
    }
}
