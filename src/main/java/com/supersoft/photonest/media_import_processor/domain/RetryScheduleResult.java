package com.supersoft.photonest.media_import_processor.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class RetryScheduleResult {
    Outcome outcome;
    String jobId;
    LocalDateTime scheduledFor;
    int attempts;
    String reason;

    public static RetryScheduleResult scheduled(String jobId, LocalDateTime scheduledFor, int attempts) {
        return RetryScheduleResult.builder()
                .outcome(Outcome.SCHEDULED)
                .jobId(jobId)
                .scheduledFor(scheduledFor)
                .attempts(attempts)
                .build();
    }

    public static RetryScheduleResult exhausted(int attempts) {
        return RetryScheduleResult.builder()
                .outcome(Outcome.EXHAUSTED)
                .attempts(attempts)
                .reason("max_attempts")
                .build();
    }

    public static RetryScheduleResult error(String reason) {
        return RetryScheduleResult.builder()
                .outcome(Outcome.ERROR)
                .reason(reason)
                .build();
    }

    public boolean isScheduled() {
        return outcome == Outcome.SCHEDULED;
    }

    public enum Outcome {
        SCHEDULED, EXHAUSTED, ERROR
    }
}
