package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ConsistencyReport;
import com.supersoft.photonest.media_import_processor.domain.ImportSession;
import com.supersoft.photonest.media_import_processor.domain.ImportSession.SessionStatus;
import com.supersoft.photonest.media_import_processor.domain.ImportSessionStats;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection.SelectionStatus;
import com.supersoft.photonest.media_import_processor.domain.WatchdogMetrics;
import com.supersoft.photonest.media_import_processor.repository.ImportSessionRepository;
import com.supersoft.photonest.media_import_processor.repository.PickerSelectionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic recovery sweep for picker imports. It is the only component that moves work out of a
 * stuck state:
 * <ol>
 *     <li>reclaims RUNNING selections whose lease went stale,</li>
 *     <li>re-enqueues retryable FAILED selections once their backoff has elapsed,</li>
 *     <li>republishes ENQUEUED selections nobody picked up,</li>
 *     <li>rolls sessions whose selections are all terminal up to a final status.</li>
 * </ol>
 * Each step commits on its own and every write is guarded by the values the sweep observed, so
 * overlapping sweeps on several instances only ever apply a change once.
 */
@Slf4j
@Service
public class PickerImportWatchdog {

    private static final EnumSet<SessionStatus> ROLLUP_CANDIDATES = EnumSet.of(SessionStatus.ENQUEUED, SessionStatus.IMPORTING);

    @Autowired
    private PickerSelectionRepository selectionRepository;

    @Autowired
    private ImportSessionRepository sessionRepository;

    @Autowired
    private SelectionQueuePublisher queuePublisher;

    @Autowired
    private SessionStatusUpdater statusUpdater;

    @Autowired
    private StateConsistencyValidator consistencyValidator;

    @Autowired
    private ObjectProvider<ImportJobTracker> jobTracker;

    @Autowired
    private Clock clock;

    @Value("${picker.import.watchdog.enabled:true}")
    private boolean enabled;

    @Value("${picker.import.watchdog.lease-window-seconds:120}")
    private long leaseWindowSeconds;

    @Value("${picker.import.watchdog.max-processing-seconds:600}")
    private long maxProcessingSeconds;

    @Value("${picker.import.watchdog.max-attempts:3}")
    private int maxAttempts;

    @Value("${picker.import.watchdog.backoff-base-seconds:60}")
    private long backoffBaseSeconds;

    @Value("${picker.import.watchdog.backoff-max-attempts:5}")
    private int backoffMaxAttempts;

    @Value("${picker.import.watchdog.enqueued-stale-seconds:300}")
    private long enqueuedStaleSeconds;

    @Value("${picker.import.watchdog.batch-size:200}")
    private int batchSize;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${picker.import.watchdog.interval-ms:60000}")
    public void scheduledSweep() {
        if (!enabled) {
            log.debug("Picker import watchdog is disabled");
            return;
        }
        runOnce();
    }

    /**
     * Runs all steps once. A sweep already in progress in this process makes the call a no-op.
     */
    public WatchdogMetrics runOnce() {
        WatchdogMetrics metrics = new WatchdogMetrics();
        if (!running.compareAndSet(false, true)) {
            log.debug("Watchdog sweep already running, skipping");
            return metrics;
        }
        try {
            LocalDateTime now = LocalDateTime.now(clock);

            try {
                reclaimStaleRunning(now, metrics);
            } catch (Exception e) {
                metrics.setStepErrors(metrics.getStepErrors() + 1);
                log.error("Watchdog stale reclaim step failed", e);
            }

            try {
                retryFailedWithBackoff(now, metrics);
            } catch (Exception e) {
                metrics.setStepErrors(metrics.getStepErrors() + 1);
                log.error("Watchdog backoff retry step failed", e);
            }

            try {
                republishStuckEnqueued(now, metrics);
            } catch (Exception e) {
                metrics.setStepErrors(metrics.getStepErrors() + 1);
                log.error("Watchdog republish step failed", e);
            }

            try {
                rollUpSessions(now, metrics);
            } catch (Exception e) {
                metrics.setStepErrors(metrics.getStepErrors() + 1);
                log.error("Watchdog session roll-up step failed", e);
            }

            if (metrics.hasActivity() || metrics.getStepErrors() > 0) {
                log.info("Watchdog sweep: {}", metrics);
            } else {
                log.debug("Watchdog sweep found nothing to do");
            }
            return metrics;
        } finally {
            running.set(false);
        }
    }

    void reclaimStaleRunning(LocalDateTime now, WatchdogMetrics metrics) {
        LocalDateTime heartbeatCutoff = now.minusSeconds(leaseWindowSeconds);
        LocalDateTime startedCutoff = now.minusSeconds(maxProcessingSeconds);

        List<PickerSelection> stale = selectionRepository.findStaleRunning(heartbeatCutoff, startedCutoff, batchSize);
        for (PickerSelection selection : stale) {
            try {
                if (selection.getAttempts() < maxAttempts) {
                    if (selectionRepository.requeueStale(selection.getId(), selection.getAttempts(), heartbeatCutoff, startedCutoff, now)) {
                        metrics.setRequeued(metrics.getRequeued() + 1);
                        log.warn("Reclaimed stale selection {} from {} (attempt {}/{}, heartbeat {})",
                                selection.getId(), selection.getLockedBy(), selection.getAttempts(), maxAttempts,
                                selection.getLockHeartbeatAt());
                        republish(selection);
                    }
                } else {
                    String reason = String.format("Lease expired after %d attempts (last owner %s)",
                            selection.getAttempts(), selection.getLockedBy());
                    if (selectionRepository.failStale(selection.getId(), selection.getAttempts(), heartbeatCutoff, startedCutoff, reason, now)) {
                        metrics.setFailed(metrics.getFailed() + 1);
                        log.warn("Selection {} failed: {}", selection.getId(), reason);
                    }
                }
            } catch (Exception e) {
                log.error("Error reclaiming stale selection {}", selection.getId(), e);
            }
        }
    }

    void retryFailedWithBackoff(LocalDateTime now, WatchdogMetrics metrics) {
        for (PickerSelection selection : selectionRepository.findRetryableFailed(backoffMaxAttempts, batchSize)) {
            try {
                if (selection.getLastTransitionAt() == null) {
                    continue;
                }
                long delaySeconds = backoffDelaySeconds(selection.getAttempts());
                LocalDateTime eligibleAt = selection.getLastTransitionAt().plusSeconds(delaySeconds);
                if (eligibleAt.isAfter(now)) {
                    continue;
                }
                if (selectionRepository.requeueFailed(selection.getId(), selection.getAttempts(), now.minusSeconds(delaySeconds), now)) {
                    metrics.setRecovered(metrics.getRecovered() + 1);
                    log.info("Re-enqueued failed selection {} after {}s backoff (attempts {}, kind {})",
                            selection.getId(), delaySeconds, selection.getAttempts(), selection.getFailureKind());
                    republish(selection);
                }
            } catch (Exception e) {
                log.error("Error retrying failed selection {}", selection.getId(), e);
            }
        }
    }

    void republishStuckEnqueued(LocalDateTime now, WatchdogMetrics metrics) {
        LocalDateTime cutoff = now.minusSeconds(enqueuedStaleSeconds);
        for (PickerSelection selection : selectionRepository.findStuckEnqueued(cutoff, batchSize)) {
            try {
                if (selectionRepository.touchEnqueued(selection.getId(), cutoff, now)) {
                    queuePublisher.publish(selection.getId(), selection.getSessionId());
                    metrics.setRepublished(metrics.getRepublished() + 1);
                    log.info("Republished selection {} enqueued since {}", selection.getId(),
                            selection.getEnqueuedAt() != null ? selection.getEnqueuedAt() : selection.getLastTransitionAt());
                }
            } catch (Exception e) {
                log.error("Error republishing selection {}", selection.getId(), e);
            }
        }
    }

    void rollUpSessions(LocalDateTime now, WatchdogMetrics metrics) {
        for (ImportSession session : sessionRepository.findByStatuses(ROLLUP_CANDIDATES)) {
            try {
                Map<SelectionStatus, Integer> counts = selectionRepository.countByStatus(session.getId());
                ImportSessionStats stats = ImportSessionStats.fromCounts(counts);

                if (!stats.isAllTerminal()) {
                    ConsistencyReport report = consistencyValidator.validate(session.getStatus(), counts);
                    if (!report.isConsistent()) {
                        metrics.setInconsistentSessions(metrics.getInconsistentSessions() + 1);
                        log.warn("Session {} inconsistent: {}", session.getId(), report.getIssues());
                    }
                    continue;
                }

                if (completeSession(session, stats, now)) {
                    metrics.setCompletedSessions(metrics.getCompletedSessions() + 1);
                }
            } catch (Exception e) {
                log.error("Error rolling up session {}", session.getId(), e);
            }
        }
    }

    private boolean completeSession(ImportSession session, ImportSessionStats stats, LocalDateTime now) {
        SessionStatus target = rollUpStatus(stats);
        Map<String, Object> metadata = Map.of("countsByStatus", stats.getCountsByStatus());

        if (session.getStatus() == SessionStatus.ENQUEUED
                && !statusUpdater.apply(session, SessionStatus.IMPORTING, "all selections terminal", metadata)) {
            return false;
        }
        if (!statusUpdater.apply(session, target, "roll-up of " + stats.getTotal() + " selections", metadata)) {
            return false;
        }

        sessionRepository.updateStats(session.getId(), stats, now);
        log.info("Session {} completed as {}: {}", session.getId(), target, stats.getCountsByStatus());

        ImportJobTracker tracker = jobTracker.getIfAvailable();
        if (tracker != null) {
            try {
                tracker.finalizeForSession(session.getId(), target == SessionStatus.IMPORTED, stats);
            } catch (Exception e) {
                log.error("Error finalizing import job for session {}: {}", session.getId(), e.getMessage(), e);
            }
        }
        return true;
    }

    /**
     * Any imported or duplicate selection makes the session IMPORTED; otherwise failures make it
     * ERROR and a session where everything was skipped is CANCELED.
     */
    static SessionStatus rollUpStatus(ImportSessionStats stats) {
        if (stats.getTotal() == 0 || stats.getSuccess() > 0) {
            return SessionStatus.IMPORTED;
        }
        if (stats.getFailed() > 0) {
            return SessionStatus.ERROR;
        }
        return SessionStatus.CANCELED;
    }

    long backoffDelaySeconds(int attempts) {
        int exponent = Math.max(0, Math.min(attempts, 20));
        return backoffBaseSeconds * (1L << exponent);
    }

    private void republish(PickerSelection selection) {
        try {
            queuePublisher.publish(selection.getId(), selection.getSessionId());
        } catch (Exception e) {
            // the row is ENQUEUED already; step 3 picks it up once it is old enough
            log.warn("Immediate republish of selection {} failed: {}", selection.getId(), e.getMessage());
        }
    }
}
