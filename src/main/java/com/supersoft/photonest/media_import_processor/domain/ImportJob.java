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
public class ImportJob {
    private Long id;
    private Long sessionId;
    private String targetType;
    private JobStatus status;
    private String statsJson;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private LocalDateTime createdAt;

    public enum JobStatus {
        QUEUED, RUNNING, SUCCESS, PARTIAL, FAILED, CANCELED
    }
}
