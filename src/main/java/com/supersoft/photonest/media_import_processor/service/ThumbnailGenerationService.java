package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.RetryScheduleResult;
import com.supersoft.photonest.media_import_processor.domain.ThumbnailResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

@Slf4j
@Service
public class ThumbnailGenerationService {

    @Autowired
    private ObjectProvider<ThumbnailGenerator> thumbnailGenerator;

    @Autowired
    private ThumbnailRetryService retryService;

    public GenerationOutcome generate(Long mediaId, boolean force) {
        ThumbnailResult result;
        ThumbnailGenerator generator = thumbnailGenerator.getIfAvailable();
        if (generator == null) {
            log.warn("No thumbnail generator available, media {} left without thumbnails", mediaId);
            result = ThumbnailResult.builder().ok(false).notes(ThumbnailResult.GENERATOR_UNAVAILABLE).build();
        } else {
            try {
                result = generator.generate(mediaId, force);
            } catch (Exception e) {
                log.error("Thumbnail generation failed for media {}: {}", mediaId, e.getMessage(), e);
                result = ThumbnailResult.builder().ok(false).notes(e.getMessage()).build();
            }
        }

        if (result == null) {
            retryService.cancelPending(mediaId);
            return GenerationOutcome.FAILED;
        }

        if (result.isPlaybackNotReady()) {
            List<String> blockers = result.getBlockers() != null ? result.getBlockers() : Collections.singletonList(ThumbnailResult.PLAYBACK_NOT_READY);
            RetryScheduleResult retry = retryService.scheduleIfAllowed(mediaId, force, blockers);
            switch (retry.getOutcome()) {
                case SCHEDULED:
                    return GenerationOutcome.RETRY_SCHEDULED;
                case EXHAUSTED:
                    return GenerationOutcome.RETRY_EXHAUSTED;
                default:
                    return GenerationOutcome.FAILED;
            }
        }

        if (result.isOk()) {
            retryService.clearSuccess(mediaId);
            log.info("Thumbnails ready for media {} (generated={})", mediaId, result.isGenerated());
            return GenerationOutcome.COMPLETED;
        }

        log.warn("Thumbnail generation for media {} did not succeed: {}", mediaId, result.getNotes());
        retryService.cancelPending(mediaId);
        return GenerationOutcome.FAILED;
    }

    public enum GenerationOutcome {
        COMPLETED, RETRY_SCHEDULED, RETRY_EXHAUSTED, FAILED
    }
}
