package com.supersoft.photonest.media_import_processor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supersoft.photonest.media_import_processor.domain.RetryScheduleResult;
import com.supersoft.photonest.media_import_processor.domain.ThumbnailRetryRecord;
import com.supersoft.photonest.media_import_processor.repository.ThumbnailRetryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Schedules delayed thumbnail retries for media whose playback asset is not ready yet, and
 * disables retries for a media once the attempt budget is used up.
 */
@Slf4j
@Service
public class ThumbnailRetryService {

    @Autowired
    private ThumbnailRetryRepository retryRepository;

    @Autowired
    private ThumbnailRetryPolicy retryPolicy;

    @Autowired
    private ThumbnailRetryScheduler retryScheduler;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private Clock clock;

    public RetryScheduleResult scheduleIfAllowed(Long mediaId, boolean force, List<String> blockers) {
        LocalDateTime now = LocalDateTime.now(clock);
        ThumbnailRetryRecord record = retryRepository.getOrCreate(mediaId, force, now);
        String blockersJson = toJson(blockers);

        ThumbnailRetryPolicy.Decision decision = retryPolicy.decide(record.getAttempts());
        if (record.isDisabled() || !decision.isAllowed()) {
            if (retryRepository.markExhausted(mediaId, blockersJson, now)) {
                log.warn("Thumbnail retry exhausted for media {} after {} attempts, retries disabled (blockers {})",
                        mediaId, record.getAttempts(), blockers);
            }
            return RetryScheduleResult.exhausted(record.getAttempts());
        }

        Optional<String> jobId;
        try {
            jobId = retryScheduler.schedule(mediaId, force, decision.getCountdown());
        } catch (Exception e) {
            log.error("Failed to schedule thumbnail retry for media {}: {}", mediaId, e.getMessage(), e);
            return RetryScheduleResult.error("scheduler_failed: " + e.getMessage());
        }
        if (jobId.isEmpty()) {
            log.error("Scheduler returned no job id for thumbnail retry of media {}", mediaId);
            return RetryScheduleResult.error("scheduler_returned_nothing");
        }

        LocalDateTime scheduledFor = now.plus(decision.getCountdown());
        boolean persisted = retryRepository.persistScheduled(mediaId, record.getAttempts(), jobId.get(), scheduledFor,
                force, blockersJson, now);
        if (!persisted) {
            // the delivery we just scheduled carries a job id the record will never hold, so it is dropped on arrival
            log.warn("Thumbnail retry record for media {} changed concurrently; job {} will be ignored", mediaId, jobId.get());
            return RetryScheduleResult.error("concurrent_update");
        }

        int attempts = record.getAttempts() + 1;
        log.info("Thumbnail retry {} for media {} scheduled at {} (attempt {}/{})",
                jobId.get(), mediaId, scheduledFor, attempts, retryPolicy.getMaxAttempts());
        return RetryScheduleResult.scheduled(jobId.get(), scheduledFor, attempts);
    }

    public void clearSuccess(Long mediaId) {
        if (retryRepository.clearSuccess(mediaId, LocalDateTime.now(clock))) {
            log.debug("Cleared thumbnail retry record for media {}", mediaId);
        }
    }

    public void cancelPending(Long mediaId) {
        if (retryRepository.cancel(mediaId, LocalDateTime.now(clock))) {
            log.info("Canceled pending thumbnail retry for media {}", mediaId);
        }
    }

    /**
     * Claims a scheduled retry for execution. False means the delivery is stale or already taken.
     */
    public boolean beginAttempt(Long mediaId, String jobId) {
        return retryRepository.markRunning(mediaId, jobId, LocalDateTime.now(clock));
    }

    public List<ThumbnailRetryRecord> findExhausted(int limit) {
        return retryRepository.findDisabled(limit);
    }

    private String toJson(List<String> blockers) {
        try {
            return objectMapper.writeValueAsString(blockers == null ? Collections.emptyList() : blockers);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize thumbnail blockers", e);
        }
    }
}
