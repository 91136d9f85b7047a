package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ImportJob;
import com.supersoft.photonest.media_import_processor.domain.ImportSessionStats;

/**
 * Optional job-tracking record linked to a session.
 */
public interface ImportJobTracker {

    ImportJob open(Long sessionId, String targetType);

    /**
     * Closes every open job of the session. Returns how many were closed.
     */
    int finalizeForSession(Long sessionId, boolean success, ImportSessionStats stats);
}
