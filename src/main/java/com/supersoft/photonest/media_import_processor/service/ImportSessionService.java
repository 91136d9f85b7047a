package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ConsistencyReport;
import com.supersoft.photonest.media_import_processor.domain.ImportSession;
import com.supersoft.photonest.media_import_processor.domain.ImportSessionStats;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

public interface ImportSessionService {

    /**
     * Creates a READY session with one ENQUEUED selection per entry. Nothing is published yet.
     */
    ImportSession createSession(Long accountId, String sessionKey, List<NewSelection> selections);

    /**
     * Moves the session to ENQUEUED and publishes every selection still waiting for a worker.
     *
     * @return number of selections published
     */
    int enqueueSession(Long sessionId);

    /**
     * Cancels the session and skips selections no worker has claimed. Running selections finish normally.
     *
     * @return number of selections skipped
     */
    int cancelSession(Long sessionId, String reason);

    /**
     * Operator recovery: moves the session to {@code target} without consulting the transition table.
     * Selections are not touched.
     *
     * @return false when the session changed status concurrently
     */
    boolean forceStatus(Long sessionId, ImportSession.SessionStatus target, String reason);

    ImportSessionStats refreshStats(Long sessionId);

    ConsistencyReport checkConsistency(Long sessionId);

    Optional<ImportSession> findSession(Long sessionId);

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class NewSelection {
        private PickerSelection.SourceType sourceType;
        private String sourceReference;
        private String baseUrl;
        private String filename;
        private String mimeType;
    }
}
