package com.supersoft.photonest.media_import_processor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThumbnailRetryRecord {
    private Long id;
    private Long mediaId;
    private RetryStatus status;
    private int attempts;
    private boolean forceRegenerate;
    private String blockersJson;
    private String scheduledJobId;
    private LocalDateTime scheduledFor;
    private boolean disabled;
    private boolean monitorReported;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public enum RetryStatus {
        IDLE, SCHEDULED, RUNNING, SUCCEEDED, EXHAUSTED, CANCELED
    }
}
