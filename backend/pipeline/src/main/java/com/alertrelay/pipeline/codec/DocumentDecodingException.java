package com.alertrelay.pipeline.codec;

import com.alertrelay.pipeline.store.PersistenceException;

public class DocumentDecodingException extends PersistenceException {
    public DocumentDecodingException(String message) {
        super(message);
    }

    public DocumentDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
