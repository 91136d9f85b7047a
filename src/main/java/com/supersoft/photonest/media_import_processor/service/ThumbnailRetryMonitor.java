package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ThumbnailRetryRecord;
import com.supersoft.photonest.media_import_processor.repository.ThumbnailRetryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Safety net for delayed thumbnail retries whose delivery never arrived, plus reporting of media
 * whose retries were disabled. It never re-enables a disabled record.
 */
@Slf4j
@Service
public class ThumbnailRetryMonitor {

    @Autowired
    private ThumbnailRetryRepository retryRepository;

    @Autowired
    private ThumbnailRetryService retryService;

    @Autowired
    private ThumbnailGenerationService generationService;

    @Autowired
    private Clock clock;

    @Value("${thumbnail.retry.monitor.enabled:true}")
    private boolean enabled;

    @Value("${thumbnail.retry.monitor.batch-size:50}")
    private int batchSize;

    @Value("${thumbnail.retry.monitor.grace-seconds:120}")
    private long graceSeconds;

    @Scheduled(fixedDelayString = "${thumbnail.retry.monitor.interval-ms:60000}")
    public void scheduledRun() {
        if (!enabled) {
            log.debug("Thumbnail retry monitor is disabled");
            return;
        }
        try {
            MonitorResult result = processDue(batchSize);
            if (result.getProcessed() == 0) {
                reportDisabled(batchSize);
            }
        } catch (Exception e) {
            log.error("Error in thumbnail retry monitor", e);
        }
    }

    public MonitorResult processDue(int limit) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<ThumbnailRetryRecord> due = retryRepository.findDue(now.minusSeconds(graceSeconds), limit);

        MonitorResult result = new MonitorResult();
        for (ThumbnailRetryRecord record : due) {
            try {
                if (!retryService.beginAttempt(record.getMediaId(), record.getScheduledJobId())) {
                    log.debug("Thumbnail retry {} for media {} already taken", record.getScheduledJobId(), record.getMediaId());
                    continue;
                }
                result.processed++;
                ThumbnailGenerationService.GenerationOutcome outcome =
                        generationService.generate(record.getMediaId(), record.isForceRegenerate());
                if (outcome == ThumbnailGenerationService.GenerationOutcome.RETRY_SCHEDULED) {
                    result.rescheduled++;
                } else {
                    result.cleared++;
                }
            } catch (Exception e) {
                log.error("Error running overdue thumbnail retry for media {}", record.getMediaId(), e);
            }
        }

        if (result.processed > 0) {
            log.info("Thumbnail retry monitor processed {} overdue retries ({} rescheduled, {} cleared)",
                    result.processed, result.rescheduled, result.cleared);
        }
        return result;
    }

    public int reportDisabled(int limit) {
        LocalDateTime now = LocalDateTime.now(clock);
        int reported = 0;
        for (ThumbnailRetryRecord record : retryRepository.findDisabledUnreported(limit)) {
            log.warn("Thumbnail retries blocked for media {}: {} attempts used, blockers {}",
                    record.getMediaId(), record.getAttempts(), record.getBlockersJson());
            if (retryRepository.markMonitorReported(record.getMediaId(), now)) {
                reported++;
            }
        }
        return reported;
    }

    public static class MonitorResult {
        private int processed;
        private int rescheduled;
        private int cleared;

        public int getProcessed() { return processed; }
        public int getRescheduled() { return rescheduled; }
        public int getCleared() { return cleared; }
    }
}
