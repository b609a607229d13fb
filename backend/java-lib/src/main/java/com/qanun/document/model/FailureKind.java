package com.qanun.document.model;

/**
 * What went wrong while processing a document
 */
public enum FailureKind {
    /** Unsupported extension, missing backend, or an unreadable file */
    EXTRACTION,
    /** Extraction ran but produced no usable text */
    EMPTY_TEXT,
    /** Any other internal fault */
    UNEXPECTED
}
