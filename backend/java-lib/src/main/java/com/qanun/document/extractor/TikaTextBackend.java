package com.qanun.document.extractor;

import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Secondary backend for every format, using Apache Tika auto-detection.
 * When the body handler yields nothing, {@link Tika#parseToString} is tried once more.
 */
public class TikaTextBackend implements TextExtractionBackend {
    private static final Logger logger = LoggerFactory.getLogger(TikaTextBackend.class);

    public static final String NAME = "tika";

    private final Parser parser;
    private final Tika tika;

    public TikaTextBackend() {
        this.parser = new AutoDetectParser();
        this.tika = new Tika();
        this.tika.setMaxStringLength(-1);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailableFor(DocumentFormat format) {
        switch (format) {
            case PDF:
                return TextExtractionBackend.isClassPresent("org.apache.tika.parser.pdf.PDFParser");
            case DOCX:
                return TextExtractionBackend.isClassPresent("org.apache.tika.parser.microsoft.ooxml.OOXMLParser");
            case DOC:
                return TextExtractionBackend.isClassPresent("org.apache.tika.parser.microsoft.OfficeParser");
            default:
                return false;
        }
    }

    @Override
    public String extract(Path file, DocumentFormat format) throws IOException {
        String fileName = file.getFileName() != null ? file.getFileName().toString() : file.toString();

        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
        ParseContext parseContext = new ParseContext();
        parseContext.set(Parser.class, parser);
        BodyContentHandler textHandler = new BodyContentHandler(-1); // No limit

        try (InputStream inputStream = Files.newInputStream(file)) {
            parser.parse(inputStream, textHandler, metadata, parseContext);
        } catch (SAXException | TikaException e) {
            throw new IOException("Tika could not parse " + fileName + ": " + e.getMessage(), e);
        }

        String extractedText = textHandler.toString();
        logger.debug("Tika parsed {} as {} ({} characters)",
                fileName, metadata.get(Metadata.CONTENT_TYPE), extractedText.length());

        if (extractedText.trim().isEmpty()) {
            logger.debug("Empty body text for {}, retrying with Tika.parseToString", fileName);
            try (InputStream retryStream = Files.newInputStream(file)) {
                extractedText = tika.parseToString(retryStream);
            } catch (TikaException e) {
                throw new IOException("Tika could not parse " + fileName + ": " + e.getMessage(), e);
            }
        }

        return extractedText.trim();
    }
}
