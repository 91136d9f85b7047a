package com.supersoft.photonest.media_import_processor.service;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hands imported media to the thumbnail and playback pipelines.
 */
public interface AssetGenerationPublisher {

    void requestThumbnails(Long mediaId, boolean force);

    void requestPlayback(Long mediaId);

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    class ThumbnailJobMessage {
        private Long mediaId;
        private boolean force;
        // set only on retries; deliveries whose job id no longer matches the retry record are stale
        private String jobId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    class PlaybackJobMessage {
        private Long mediaId;
    }
}
