package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ImportSession.SessionStatus;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.supersoft.photonest.media_import_processor.domain.ImportSession.SessionStatus.*;

public class SessionStateMachine extends StateMachine<SessionStatus> {

    private static final Map<SessionStatus, Set<SessionStatus>> TRANSITIONS = new EnumMap<>(SessionStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(READY, CANCELED, EXPIRED, ERROR));
        TRANSITIONS.put(READY, EnumSet.of(EXPANDING, PROCESSING, CANCELED, ERROR));
        TRANSITIONS.put(EXPANDING, EnumSet.of(PROCESSING, ENQUEUED, CANCELED, ERROR, FAILED));
        TRANSITIONS.put(PROCESSING, EnumSet.of(ENQUEUED, IMPORTING, IMPORTED, CANCELED, ERROR, FAILED));
        TRANSITIONS.put(ENQUEUED, EnumSet.of(IMPORTING, CANCELED, ERROR, FAILED));
        TRANSITIONS.put(IMPORTING, EnumSet.of(IMPORTED, CANCELED, ERROR, FAILED));
        TRANSITIONS.put(IMPORTED, EnumSet.noneOf(SessionStatus.class));
        TRANSITIONS.put(CANCELED, EnumSet.noneOf(SessionStatus.class));
        TRANSITIONS.put(EXPIRED, EnumSet.noneOf(SessionStatus.class));
        TRANSITIONS.put(ERROR, EnumSet.noneOf(SessionStatus.class));
        // the only way out of a terminal state
        TRANSITIONS.put(FAILED, EnumSet.of(PROCESSING));
    }

    public SessionStateMachine(SessionStatus initial) {
        this(initial, Clock.systemUTC());
    }

    public SessionStateMachine(SessionStatus initial, Clock clock) {
        super(initial, clock);
    }

    @Override
    protected Set<SessionStatus> allowedFrom(SessionStatus state) {
        return Collections.unmodifiableSet(TRANSITIONS.get(state));
    }

    public static boolean isAllowed(SessionStatus from, SessionStatus to) {
        return TRANSITIONS.get(from).contains(to);
    }
}
