package com.qanun.document.extractor;

import java.util.Locale;
import java.util.Optional;

/**
 * Document formats the text extractor accepts, keyed by file extension
 */
public enum DocumentFormat {
    PDF("pdf", "PDF"),
    DOCX("docx", "DOCX"),
    DOC("doc", "DOC");

    private final String extension;
    private final String displayName;

    DocumentFormat(String extension, String displayName) {
        this.extension = extension;
        this.displayName = displayName;
    }

    public String getExtension() {
        return extension;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a format from an extension with or without the leading dot.
     */
    public static Optional<DocumentFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (DocumentFormat format : values()) {
            if (format.extension.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
