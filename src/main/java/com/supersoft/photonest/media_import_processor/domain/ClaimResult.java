package com.supersoft.photonest.media_import_processor.domain;

public enum ClaimResult {
    CLAIMED,
    ALREADY_TAKEN,
    NOT_FOUND
}
