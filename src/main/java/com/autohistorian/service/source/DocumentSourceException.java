package com.autohistorian.service.source;

public class DocumentSourceException extends RuntimeException {
    public DocumentSourceException(String message) {
        super(message);
    }

    public DocumentSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
