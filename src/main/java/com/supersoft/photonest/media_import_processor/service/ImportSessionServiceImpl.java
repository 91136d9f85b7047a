package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ConsistencyReport;
import com.supersoft.photonest.media_import_processor.domain.ImportSession;
import com.supersoft.photonest.media_import_processor.domain.ImportSession.SessionStatus;
import com.supersoft.photonest.media_import_processor.domain.ImportSessionStats;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import com.supersoft.photonest.media_import_processor.repository.ImportSessionRepository;
import com.supersoft.photonest.media_import_processor.repository.PickerSelectionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class ImportSessionServiceImpl implements ImportSessionService {

    static final String JOB_TARGET = "picker_import";

    @Autowired
    private ImportSessionRepository sessionRepository;

    @Autowired
    private PickerSelectionRepository selectionRepository;

    @Autowired
    private SessionStatusUpdater statusUpdater;

    @Autowired
    private SelectionQueuePublisher queuePublisher;

    @Autowired
    private StateConsistencyValidator consistencyValidator;

    @Autowired
    private SessionLockRegistry lockRegistry;

    @Autowired
    private ObjectProvider<ImportJobTracker> jobTracker;

    @Autowired
    private Clock clock;

    @Override
    @Transactional
    public ImportSession createSession(Long accountId, String sessionKey, List<NewSelection> selections) {
        LocalDateTime now = LocalDateTime.now(clock);
        ImportSession session = ImportSession.builder()
                .accountId(accountId)
                .sessionKey(sessionKey)
                .status(SessionStatus.READY)
                .selectedCount(selections.size())
                .createdAt(now)
                .updatedAt(now)
                .build();
        sessionRepository.insert(session);

        for (NewSelection request : selections) {
            selectionRepository.insert(PickerSelection.builder()
                    .sessionId(session.getId())
                    .sourceType(request.getSourceType())
                    .sourceReference(request.getSourceReference())
                    .baseUrl(request.getBaseUrl())
                    .filename(request.getFilename())
                    .mimeType(request.getMimeType())
                    .status(PickerSelection.SelectionStatus.ENQUEUED)
                    .lastTransitionAt(now)
                    .build());
        }

        log.info("Created session {} ({}) for account {} with {} selections", session.getId(), sessionKey, accountId, selections.size());
        return session;
    }

    @Override
    public int enqueueSession(Long sessionId) {
        return lockRegistry.withLock(sessionId, () -> {
            ImportSession session = requireSession(sessionId);

            if (session.getStatus() == SessionStatus.READY) {
                if (!statusUpdater.apply(session, SessionStatus.PROCESSING, "enqueue requested")) {
                    return 0;
                }
            }
            if (session.getStatus() != SessionStatus.ENQUEUED) {
                if (!statusUpdater.apply(session, SessionStatus.ENQUEUED, "selections handed to workers",
                        Map.of("selectedCount", session.getSelectedCount()))) {
                    return 0;
                }
                openJob(sessionId);
            }

            LocalDateTime now = LocalDateTime.now(clock);
            int published = 0;
            for (PickerSelection selection : selectionRepository.findBySessionIdAndStatus(sessionId, PickerSelection.SelectionStatus.ENQUEUED)) {
                if (!selectionRepository.markEnqueued(selection.getId(), now)) {
                    continue;
                }
                try {
                    queuePublisher.publish(selection.getId(), sessionId);
                    published++;
                } catch (Exception e) {
                    log.warn("Selection {} stays enqueued unpublished; watchdog will republish: {}", selection.getId(), e.getMessage());
                }
            }

            log.info("Session {} enqueued: {} selections published", sessionId, published);
            return published;
        });
    }

    @Override
    public int cancelSession(Long sessionId, String reason) {
        return lockRegistry.withLock(sessionId, () -> {
            ImportSession session = requireSession(sessionId);
            if (session.getStatus() == SessionStatus.CANCELED) {
                return 0;
            }
            if (!statusUpdater.apply(session, SessionStatus.CANCELED, reason)) {
                return 0;
            }

            LocalDateTime now = LocalDateTime.now(clock);
            int skipped = selectionRepository.skipEnqueued(sessionId, "session canceled: " + reason, now);
            ImportSessionStats stats = ImportSessionStats.fromCounts(selectionRepository.countByStatus(sessionId));
            sessionRepository.updateStats(sessionId, stats, now);

            ImportJobTracker tracker = jobTracker.getIfAvailable();
            if (tracker != null) {
                try {
                    tracker.finalizeForSession(sessionId, false, stats);
                } catch (Exception e) {
                    log.error("Error closing import job for canceled session {}: {}", sessionId, e.getMessage(), e);
                }
            }

            log.info("Session {} canceled ({}): {} selections skipped", sessionId, reason, skipped);
            return skipped;
        });
    }

    @Override
    public boolean forceStatus(Long sessionId, SessionStatus target, String reason) {
        return lockRegistry.withLock(sessionId, () -> {
            ImportSession session = requireSession(sessionId);
            if (session.getStatus() == target) {
                return true;
            }
            Map<String, Object> metadata = Map.of("source", "operator");
            return statusUpdater.force(session, target, reason, metadata);
        });
    }

    @Override
    public ImportSessionStats refreshStats(Long sessionId) {
        requireSession(sessionId);
        ImportSessionStats stats = ImportSessionStats.fromCounts(selectionRepository.countByStatus(sessionId));
        sessionRepository.updateStats(sessionId, stats, LocalDateTime.now(clock));
        return stats;
    }

    @Override
    public ConsistencyReport checkConsistency(Long sessionId) {
        ImportSession session = requireSession(sessionId);
        ConsistencyReport report = consistencyValidator.validate(session.getStatus(), selectionRepository.countByStatus(sessionId));
        if (!report.isConsistent()) {
            log.warn("Session {} is inconsistent: {}", sessionId, report.getIssues());
        }
        return report;
    }

    @Override
    public Optional<ImportSession> findSession(Long sessionId) {
        return sessionRepository.findById(sessionId);
    }

    private void openJob(Long sessionId) {
        ImportJobTracker tracker = jobTracker.getIfAvailable();
        if (tracker == null) {
            return;
        }
        try {
            tracker.open(sessionId, JOB_TARGET);
        } catch (Exception e) {
            log.error("Error opening import job for session {}: {}", sessionId, e.getMessage(), e);
        }
    }

    private ImportSession requireSession(Long sessionId) {
        return sessionRepository.findById(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Session not found: " + sessionId));
    }
}
