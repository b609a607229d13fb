package com.qanun.document.model;

import java.util.Objects;

/**
 * Per-file slot of a batch run. Exactly one of {@code data} and {@code error}
 * is set, depending on {@code success}.
 */
public class BatchEntry {
    private final String filePath;
    private final boolean success;
    private final ProcessingResult data;
    private final String error;
    private final FailureKind failureKind;

    private BatchEntry(String filePath, boolean success, ProcessingResult data, String error,
            FailureKind failureKind) {
        this.filePath = Objects.requireNonNull(filePath, "filePath");
        this.success = success;
        this.data = data;
        this.error = error;
        this.failureKind = failureKind;
    }

    public static BatchEntry success(String filePath, ProcessingResult data) {
        return new BatchEntry(filePath, true, Objects.requireNonNull(data, "data"), null, null);
    }

    public static BatchEntry failure(String filePath, String error, FailureKind failureKind) {
        return new BatchEntry(filePath, false, null,
                error != null ? error : "Unknown error",
                failureKind != null ? failureKind : FailureKind.UNEXPECTED);
    }

    public String getFilePath() {
        return filePath;
    }

    public boolean isSuccess() {
        return success;
    }

    public ProcessingResult getData() {
        return data;
    }

    public String getError() {
        return error;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    @Override
    public String toString() {
        return success
                ? String.format("BatchEntry{file='%s', success=true, articles=%d}", filePath, data.getArticles().size())
                : String.format("BatchEntry{file='%s', success=false, kind=%s, error='%s'}", filePath, failureKind, error);
    }
}
