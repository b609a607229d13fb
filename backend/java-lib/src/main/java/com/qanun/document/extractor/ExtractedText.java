package com.qanun.document.extractor;

import java.util.Objects;

/**
 * Raw text pulled out of a document together with where it came from
 */
public class ExtractedText {
    private final String text;
    private final DocumentFormat format;
    private final String backendName;

    public ExtractedText(String text, DocumentFormat format, String backendName) {
        this.text = text != null ? text : "";
        this.format = Objects.requireNonNull(format, "format");
        this.backendName = backendName != null ? backendName : "unknown";
    }

    public String getText() {
        return text;
    }

    public DocumentFormat getFormat() {
        return format;
    }

    public String getBackendName() {
        return backendName;
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    @Override
    public String toString() {
        return String.format("ExtractedText{format=%s, backend='%s', textLength=%d}",
                format, backendName, text.length());
    }
}
