package com.qanun.document.model;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single failure type raised by the processing pipeline. The {@link FailureKind}
 * tells callers what went wrong; {@code documentPath} is always present.
 */
public class LegalDocumentException extends IOException {
    private final FailureKind kind;
    private final String field;
    private final String documentPath;
    private final Map<String, Object> details;

    public LegalDocumentException(FailureKind kind, String message, String documentPath) {
        this(kind, message, null, documentPath, null, null);
    }

    public LegalDocumentException(FailureKind kind, String message, String documentPath, Throwable cause) {
        this(kind, message, null, documentPath, null, cause);
    }

    public LegalDocumentException(FailureKind kind, String message, String field, String documentPath,
            Map<String, ?> details, Throwable cause) {
        super(message != null ? message : "Arabic legal document processing failed", cause);
        this.kind = kind != null ? kind : FailureKind.UNEXPECTED;
        this.field = field;
        this.documentPath = documentPath != null ? documentPath : "";

        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("document_path", this.documentPath);
        if (details != null) {
            merged.putAll(details);
        }
        this.details = Collections.unmodifiableMap(merged);
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getField() {
        return field;
    }

    public String getDocumentPath() {
        return documentPath;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return String.format("LegalDocumentException{kind=%s, documentPath='%s', message='%s'}",
                kind, documentPath, getMessage());
    }
}
