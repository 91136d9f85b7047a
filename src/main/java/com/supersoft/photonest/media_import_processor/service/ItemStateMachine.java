package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ItemState;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.supersoft.photonest.media_import_processor.domain.ItemState.*;

public class ItemStateMachine extends StateMachine<ItemState> {

    private static final Map<ItemState, Set<ItemState>> TRANSITIONS = new EnumMap<>(ItemState.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(ANALYZING, MISSING, FAILED));
        TRANSITIONS.put(ANALYZING, EnumSet.of(CHECKING, MISSING, FAILED));
        TRANSITIONS.put(CHECKING, EnumSet.of(MOVING, SKIPPED, FAILED));
        TRANSITIONS.put(MOVING, EnumSet.of(UPDATING, SOURCE_RESTORED, FAILED));
        TRANSITIONS.put(UPDATING, EnumSet.of(IMPORTED, PATH_UPDATED, WARNING, FAILED));
        TRANSITIONS.put(WARNING, EnumSet.of(IMPORTED));
        TRANSITIONS.put(FAILED, EnumSet.of(ANALYZING));
        TRANSITIONS.put(IMPORTED, EnumSet.noneOf(ItemState.class));
        TRANSITIONS.put(SKIPPED, EnumSet.noneOf(ItemState.class));
        TRANSITIONS.put(MISSING, EnumSet.noneOf(ItemState.class));
        TRANSITIONS.put(SOURCE_RESTORED, EnumSet.noneOf(ItemState.class));
        TRANSITIONS.put(PATH_UPDATED, EnumSet.noneOf(ItemState.class));
    }

    public ItemStateMachine(ItemState initial) {
        this(initial, Clock.systemUTC());
    }

    public ItemStateMachine(ItemState initial, Clock clock) {
        super(initial, clock);
    }

    @Override
    protected Set<ItemState> allowedFrom(ItemState state) {
        return Collections.unmodifiableSet(TRANSITIONS.get(state));
    }
}
