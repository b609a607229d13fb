package com.qanun.document.extractor;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A library able to pull plain text out of a document file
 */
public interface TextExtractionBackend {

    String getName();

    /**
     * Whether this backend handles the format and its libraries are on the classpath.
     * Probed once when a {@link TextExtractor} is built.
     */
    boolean isAvailableFor(DocumentFormat format);

    /**
     * @return extracted text, never {@code null}
     * @throws IOException if the file cannot be read or parsed
     */
    String extract(Path file, DocumentFormat format) throws IOException;

    static boolean isClassPresent(String className) {
        try {
            Class.forName(className, false, TextExtractionBackend.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }
}
