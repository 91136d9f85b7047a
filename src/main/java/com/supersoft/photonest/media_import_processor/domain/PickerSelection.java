package com.supersoft.photonest.media_import_processor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * One importable unit of a session. Mutated only through guarded single-statement
 * updates in {@code PickerSelectionRepository}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PickerSelection {
    private Long id;
    private Long sessionId;
    private SourceType sourceType;
    private String sourceReference;
    private String baseUrl;
    private String filename;
    private String mimeType;
    private SelectionStatus status;
    private int attempts;
    private String lockedBy;
    private LocalDateTime lockHeartbeatAt;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private LocalDateTime enqueuedAt;
    private LocalDateTime lastTransitionAt;
    private String errorMsg;
    private FailureKind failureKind;
    private Long mediaId;
    private LocalDateTime createdAt;

    public boolean isVideo() {
        return mimeType != null && mimeType.startsWith("video/");
    }

    public enum SelectionStatus {
        ENQUEUED, RUNNING, IMPORTED, DUP, FAILED, EXPIRED, SKIPPED;

        private static final Set<SelectionStatus> TERMINAL = EnumSet.of(IMPORTED, DUP, FAILED, EXPIRED, SKIPPED);
        private static final Set<SelectionStatus> SUCCESS = EnumSet.of(IMPORTED, DUP);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }

        public boolean isSuccess() {
            return SUCCESS.contains(this);
        }
    }

    public enum FailureKind {
        AUTHORIZATION,      // credentials rejected, never retried
        RESOURCE_EXPIRED,   // source gone or link expired
        TRANSIENT,          // network or server trouble, retried with backoff
        LEASE_EXPIRED;      // worker stopped heartbeating too many times

        public boolean isRetryable() {
            return this == TRANSIENT || this == LEASE_EXPIRED;
        }
    }

    public enum SourceType {
        PICKER, LOCAL
    }
}
