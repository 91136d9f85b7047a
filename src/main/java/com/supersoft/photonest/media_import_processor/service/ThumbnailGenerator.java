package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ThumbnailResult;

/**
 * Thumbnail engine. Implementations live outside this service.
 */
public interface ThumbnailGenerator {
    ThumbnailResult generate(Long mediaId, boolean force);
}
