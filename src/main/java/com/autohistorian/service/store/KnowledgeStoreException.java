package com.autohistorian.service.store;

/** Persistence failure or a result the store refuses to hold; nothing of the failed write is committed. */
public class KnowledgeStoreException extends RuntimeException {
    public KnowledgeStoreException(String message) {
        super(message);
    }

    public KnowledgeStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
