package com.supersoft.photonest.media_import_processor.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Processing phases of a single item while a worker holds its claim.
 */
public enum ItemState {
    PENDING,
    ANALYZING,
    CHECKING,
    MOVING,
    UPDATING,
    IMPORTED,
    SKIPPED,
    FAILED,
    MISSING,
    SOURCE_RESTORED,
    PATH_UPDATED,
    WARNING;

    private static final Set<ItemState> TERMINAL = EnumSet.of(IMPORTED, SKIPPED, FAILED, MISSING, SOURCE_RESTORED, PATH_UPDATED);
    private static final Set<ItemState> PROCESSING = EnumSet.of(ANALYZING, CHECKING, MOVING, UPDATING);
    private static final Set<ItemState> SUCCESS = EnumSet.of(IMPORTED, SOURCE_RESTORED, PATH_UPDATED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isProcessing() {
        return PROCESSING.contains(this);
    }

    public boolean isSuccess() {
        return SUCCESS.contains(this);
    }
}
