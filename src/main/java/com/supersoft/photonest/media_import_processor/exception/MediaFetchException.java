package com.supersoft.photonest.media_import_processor.exception;

/**
 * Base type for failures while pulling media bytes from a picker or local source.
 */
public class MediaFetchException extends Exception {

    public MediaFetchException(String message) {
        super(message);
    }

    public MediaFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
