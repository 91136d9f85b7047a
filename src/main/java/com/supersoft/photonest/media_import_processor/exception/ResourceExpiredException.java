package com.supersoft.photonest.media_import_processor.exception;

public class ResourceExpiredException extends MediaFetchException {

    public ResourceExpiredException(String message) {
        super(message);
    }

    public ResourceExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
