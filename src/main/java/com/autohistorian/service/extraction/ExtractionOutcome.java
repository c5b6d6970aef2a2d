package com.autohistorian.service.extraction;

import com.autohistorian.model.ExtractionResult;

/**
 * Result-or-error for one document of a settled batch. Exactly one of {@link #getResult()} and
 * {@link #getError()} is non-null.
 */
public final class ExtractionOutcome {
    private final String documentId;
    private final ExtractionResult result;
    private final Throwable error;

    private ExtractionOutcome(String documentId, ExtractionResult result, Throwable error) {
        this.documentId = documentId;
        this.result = result;
        this.error = error;
    }

    public static ExtractionOutcome success(String documentId, ExtractionResult result) {
        return new ExtractionOutcome(documentId, result, null);
    }

    public static ExtractionOutcome failure(String documentId, Throwable error) {
        return new ExtractionOutcome(documentId, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String getDocumentId() { return documentId; }
    public ExtractionResult getResult() { return result; }
    public Throwable getError() { return error; }
}
