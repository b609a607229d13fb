package com.qanun.document.extractor;

import com.qanun.document.model.FailureKind;
import com.qanun.document.model.LegalDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts raw text from PDF and Word documents, dispatching on the file extension.
 *
 * Backends are probed once at construction; for each format the first available
 * backend in the given order is the one used. A failure of that backend is reported
 * as is, without trying the next one.
 */
public class TextExtractor {
    private static final Logger logger = LoggerFactory.getLogger(TextExtractor.class);

    private final Map<DocumentFormat, List<TextExtractionBackend>> backendsByFormat;

    public TextExtractor(List<? extends TextExtractionBackend> candidates) {
        Objects.requireNonNull(candidates, "candidates");
        Map<DocumentFormat, List<TextExtractionBackend>> resolved = new EnumMap<>(DocumentFormat.class);

        for (DocumentFormat format : DocumentFormat.values()) {
            List<TextExtractionBackend> available = new ArrayList<>();
            for (TextExtractionBackend backend : candidates) {
                if (backend.isAvailableFor(format)) {
                    available.add(backend);
                }
            }
            if (available.isEmpty()) {
                logger.warn("No text extraction backend available for {} documents", format.getDisplayName());
            } else {
                logger.debug("{} backends in priority order: {}", format.getDisplayName(),
                        available.stream().map(TextExtractionBackend::getName).collect(Collectors.toList()));
            }
            resolved.put(format, Collections.unmodifiableList(available));
        }

        this.backendsByFormat = Collections.unmodifiableMap(resolved);
    }

    /**
     * PDFBox then Tika for PDF; POI then Tika for Word documents.
     */
    public static TextExtractor withDefaultBackends() {
        return new TextExtractor(List.of(new PdfBoxTextBackend(), new PoiWordTextBackend(), new TikaTextBackend()));
    }

    /**
     * Extract the text of a document.
     *
     * @param filePath path to a .pdf, .docx or .doc file
     * @return trimmed document text
     * @throws LegalDocumentException of kind {@link FailureKind#EXTRACTION} if the extension is
     *         unsupported, no backend is installed, or the file cannot be read
     */
    public String extractText(Path filePath) throws LegalDocumentException {
        return extract(filePath).getText();
    }

    public ExtractedText extract(Path filePath) throws LegalDocumentException {
        Objects.requireNonNull(filePath, "filePath");
        String documentPath = filePath.toString();
        String extension = getFileExtension(filePath);

        DocumentFormat format = DocumentFormat.fromExtension(extension)
                .orElseThrow(() -> new LegalDocumentException(FailureKind.EXTRACTION,
                        "Unsupported file format: " + (extension.isEmpty() ? "(none)" : extension),
                        "file_path", documentPath, Map.of("extension", extension), null));

        List<TextExtractionBackend> backends = backendsByFormat.get(format);
        if (backends.isEmpty()) {
            throw new LegalDocumentException(FailureKind.EXTRACTION,
                    String.format("Required %s processing libraries not installed", format.getDisplayName()),
                    documentPath);
        }

        TextExtractionBackend backend = backends.get(0);
        logger.info("Starting {} text extraction for: {} (backend: {})",
                format.getDisplayName(), documentPath, backend.getName());

        try {
            String text = backend.extract(filePath, format);
            ExtractedText extracted = new ExtractedText(text != null ? text.trim() : "", format, backend.getName());
            logger.info("Extraction completed - Text length: {}, backend: {}",
                    extracted.getText().length(), backend.getName());
            return extracted;
        } catch (Exception e) {
            throw new LegalDocumentException(FailureKind.EXTRACTION,
                    String.format("Failed to extract text from %s: %s", format.getDisplayName(), e.getMessage()),
                    null, documentPath, Map.of("backend", String.valueOf(backend.getName())), e);
        }
    }

    /**
     * Names of the backends that will serve a format, first one being used.
     */
    public List<String> availableBackends(DocumentFormat format) {
        return backendsByFormat.get(format).stream()
                .map(TextExtractionBackend::getName)
                .collect(Collectors.toList());
    }

    public static boolean isSupportedFormat(String fileName) {
        if (fileName == null) {
            return false;
        }
        return DocumentFormat.fromExtension(getFileExtension(fileName)).isPresent();
    }

    public static Set<String> supportedExtensions() {
        Set<String> extensions = new LinkedHashSet<>();
        for (DocumentFormat format : DocumentFormat.values()) {
            extensions.add(format.getExtension());
        }
        return Collections.unmodifiableSet(extensions);
    }

    /**
     * Lower-cased extension including the dot, or empty when the name has none.
     */
    static String getFileExtension(Path filePath) {
        Path name = filePath.getFileName();
        return name == null ? "" : getFileExtension(name.toString());
    }

    private static String getFileExtension(String fileName) {
        int lastDotIndex = fileName.lastIndexOf('.');
        if (lastDotIndex <= 0 || lastDotIndex == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(lastDotIndex).toLowerCase(Locale.ROOT);
    }
}
