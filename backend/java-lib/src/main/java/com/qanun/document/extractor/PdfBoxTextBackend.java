package com.qanun.document.extractor;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * PDF text extraction with Apache PDFBox, one page at a time
 */
public class PdfBoxTextBackend implements TextExtractionBackend {
    private static final Logger logger = LoggerFactory.getLogger(PdfBoxTextBackend.class);

    public static final String NAME = "pdfbox";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailableFor(DocumentFormat format) {
        return format == DocumentFormat.PDF
                && TextExtractionBackend.isClassPresent("org.apache.pdfbox.Loader");
    }

    @Override
    public String extract(Path file, DocumentFormat format) throws IOException {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            int pageCount = document.getNumberOfPages();
            StringBuilder text = new StringBuilder();

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                text.append(stripper.getText(document));
            }

            logger.debug("Extracted {} characters from {} pages of {}", text.length(), pageCount, file);
            return text.toString().trim();
        }
    }
}
