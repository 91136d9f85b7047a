package com.supersoft.photonest.media_import_processor.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Arranges for thumbnail generation to run again after a delay.
 */
public interface ThumbnailRetryScheduler {

    /**
     * @return the id of the scheduled job, or empty when nothing was scheduled
     */
    Optional<String> schedule(Long mediaId, boolean force, Duration countdown);
}
