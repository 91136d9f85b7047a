package com.supersoft.photonest.media_import_processor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportSession {
    private Long id;
    private Long accountId;
    private String sessionKey;
    private SessionStatus status;
    private int selectedCount;
    private String statsJson;
    private LocalDateTime lastProgressAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public enum SessionStatus {
        PENDING, READY, EXPANDING, PROCESSING, ENQUEUED, IMPORTING, IMPORTED, CANCELED, EXPIRED, ERROR, FAILED;

        private static final Set<SessionStatus> TERMINAL = EnumSet.of(IMPORTED, CANCELED, EXPIRED, ERROR, FAILED);
        private static final Set<SessionStatus> PROCESSING_STATES = EnumSet.of(EXPANDING, PROCESSING, ENQUEUED, IMPORTING);
        private static final Set<SessionStatus> IDLE = EnumSet.of(PENDING, READY);

        public boolean isTerminal() {
            return TERMINAL.contains(this);
        }

        public boolean isProcessing() {
            return PROCESSING_STATES.contains(this);
        }

        public boolean isIdle() {
            return IDLE.contains(this);
        }
    }
}
