package com.supersoft.photonest.media_import_processor.domain;

import lombok.Data;

/**
 * Counters for a single watchdog sweep.
 */
@Data
public class WatchdogMetrics {
    private int requeued;
    private int failed;
    private int recovered;
    private int republished;
    private int completedSessions;
    private int inconsistentSessions;
    private int stepErrors;

    public boolean hasActivity() {
        return requeued + failed + recovered + republished + completedSessions > 0;
    }
}
