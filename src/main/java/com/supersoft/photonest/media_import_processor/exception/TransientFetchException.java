package com.supersoft.photonest.media_import_processor.exception;

public class TransientFetchException extends MediaFetchException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
