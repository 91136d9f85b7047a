package com.supersoft.photonest.media_import_processor.exception;

public class AuthorizationFailureException extends MediaFetchException {

    public AuthorizationFailureException(String message) {
        super(message);
    }

    public AuthorizationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
