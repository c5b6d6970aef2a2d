package com.autohistorian.service.extraction;

/** Extraction of one document failed; carries that document's id. */
public class DocumentExtractionException extends RuntimeException {
    private final String documentId;

    public DocumentExtractionException(String documentId, Throwable cause) {
        super("Extraction failed for document " + documentId + ": " + cause.getMessage(), cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
