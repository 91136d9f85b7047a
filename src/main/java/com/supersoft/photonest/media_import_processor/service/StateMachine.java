package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.StateTransition;
import com.supersoft.photonest.media_import_processor.exception.IllegalStateTransitionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates moves between states of one entity against a fixed transition table and keeps the
 * history of transitions applied through it. Not thread safe; one instance per entity and operation.
 */
@Slf4j
public abstract class StateMachine<S extends Enum<S>> {

    private final Clock clock;
    private final List<StateTransition<S>> history = new ArrayList<>();
    private S current;

    protected StateMachine(S initial, Clock clock) {
        this.current = initial;
        this.clock = clock;
    }

    protected abstract Set<S> allowedFrom(S state);

    public S getCurrent() {
        return current;
    }

    public boolean canTransition(S target) {
        return allowedFrom(current).contains(target);
    }

    public Set<S> getAllowedTransitions() {
        return allowedFrom(current);
    }

    public StateTransition<S> transition(S target, String reason) {
        return transition(target, reason, Collections.emptyMap());
    }

    public StateTransition<S> transition(S target, String reason, Map<String, Object> metadata) {
        if (!canTransition(target)) {
            log.error("Rejected {} transition {} -> {} (reason: {})", getClass().getSimpleName(), current, target, reason);
            throw new IllegalStateTransitionException(current, target);
        }
        return apply(target, reason, metadata, false);
    }

    /**
     * Applies the move without consulting the table. Reserved for recovery paths.
     */
    public StateTransition<S> forceTransition(S target, String reason, Map<String, Object> metadata) {
        String forcedReason = "[FORCED] " + reason;
        log.warn("Forced {} transition {} -> {}: {}", getClass().getSimpleName(), current, target, reason);
        return apply(target, forcedReason, metadata, true);
    }

    public List<StateTransition<S>> getHistory() {
        return Collections.unmodifiableList(history);
    }

    private StateTransition<S> apply(S target, String reason, Map<String, Object> metadata, boolean forced) {
        StateTransition<S> transition = StateTransition.<S>builder()
                .from(current)
                .to(target)
                .reason(reason)
                .timestamp(LocalDateTime.now(clock))
                .forced(forced)
                .metadata(metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                .build();
        history.add(transition);
        log.debug("{} transition {} -> {}: {}", getClass().getSimpleName(), current, target, reason);
        current = target;
        return transition;
    }
}
