package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ImportSession;
import com.supersoft.photonest.media_import_processor.domain.ImportSession.SessionStatus;
import com.supersoft.photonest.media_import_processor.domain.StateTransition;
import com.supersoft.photonest.media_import_processor.repository.ImportSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;

/**
 * Applies a validated session transition to the store with a compare-and-set on the current
 * status and records it in the audit trail.
 */
@Slf4j
@Service
public class SessionStatusUpdater {

    @Autowired
    private ImportSessionRepository sessionRepository;

    @Autowired
    private StateTransitionRecorder transitionRecorder;

    @Autowired
    private Clock clock;

    /**
     * @return false when another actor moved the session first; the passed session is left untouched
     * @throws com.supersoft.photonest.media_import_processor.exception.IllegalStateTransitionException if the move is not allowed
     */
    public boolean apply(ImportSession session, SessionStatus target, String reason) {
        return apply(session, target, reason, Collections.emptyMap());
    }

    public boolean apply(ImportSession session, SessionStatus target, String reason, Map<String, Object> metadata) {
        SessionStateMachine machine = new SessionStateMachine(session.getStatus(), clock);
        StateTransition<SessionStatus> transition = machine.transition(target, reason, metadata);
        return persist(session, transition);
    }

    /**
     * Recovery-only path that skips the transition table.
     */
    public boolean force(ImportSession session, SessionStatus target, String reason, Map<String, Object> metadata) {
        SessionStateMachine machine = new SessionStateMachine(session.getStatus(), clock);
        StateTransition<SessionStatus> transition = machine.forceTransition(target, reason, metadata);
        return persist(session, transition);
    }

    private boolean persist(ImportSession session, StateTransition<SessionStatus> transition) {
        LocalDateTime now = LocalDateTime.now(clock);
        boolean updated = sessionRepository.updateStatus(session.getId(), transition.getFrom(), transition.getTo(), now);
        if (!updated) {
            log.warn("Session {} was not moved {} -> {}: status changed concurrently",
                    session.getId(), transition.getFrom(), transition.getTo());
            return false;
        }
        session.setStatus(transition.getTo());
        session.setLastProgressAt(now);
        session.setUpdatedAt(now);
        transitionRecorder.record(StateTransitionRecorder.ENTITY_SESSION, session.getId(), transition);
        log.info("Session {} moved {} -> {}: {}", session.getId(), transition.getFrom(), transition.getTo(), transition.getReason());
        return true;
    }
}
