package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.repository.PickerSelectionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the heartbeat of claimed selections fresh while a worker is processing them.
 */
@Slf4j
@Service
public class HeartbeatLeaseManager {

    @Autowired
    private PickerSelectionRepository selectionRepository;

    @Autowired
    @Qualifier("leaseScheduler")
    private ScheduledExecutorService leaseScheduler;

    @Autowired
    private Clock clock;

    @Value("${picker.import.heartbeat-interval-ms:30000}")
    private long heartbeatIntervalMs;

    public Lease start(Long selectionId, String workerId) {
        Lease lease = new Lease(selectionId, workerId);
        lease.future = leaseScheduler.scheduleWithFixedDelay(
                lease::tick, heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
        log.debug("Started heartbeat lease for selection {} (worker {}, every {}ms)", selectionId, workerId, heartbeatIntervalMs);
        return lease;
    }

    /**
     * Handle for one running lease. {@link #close()} stops the ticker and waits for an in-flight
     * renewal, so no heartbeat is written after it returns.
     */
    public class Lease implements AutoCloseable {

        private final Long selectionId;
        private final String workerId;
        private final ReentrantLock tickLock = new ReentrantLock();
        private volatile ScheduledFuture<?> future;
        private volatile boolean stopped;
        private volatile boolean lost;

        private Lease(Long selectionId, String workerId) {
            this.selectionId = selectionId;
            this.workerId = workerId;
        }

        void tick() {
            tickLock.lock();
            try {
                if (stopped || lost) {
                    return;
                }
                boolean renewed = selectionRepository.renewHeartbeat(selectionId, workerId, LocalDateTime.now(clock));
                if (!renewed) {
                    lost = true;
                    log.warn("Lease lost for selection {}: worker {} no longer owns the claim", selectionId, workerId);
                    cancelTicker();
                } else {
                    log.debug("Heartbeat renewed for selection {} by {}", selectionId, workerId);
                }
            } catch (Exception e) {
                // the next tick retries; the watchdog only reclaims after the whole lease window
                log.warn("Heartbeat renewal failed for selection {}: {}", selectionId, e.getMessage());
            } finally {
                tickLock.unlock();
            }
        }

        public boolean isLost() {
            return lost;
        }

        public boolean isStopped() {
            return stopped;
        }

        @Override
        public void close() {
            stopped = true;
            cancelTicker();
            tickLock.lock();
            tickLock.unlock();
            log.debug("Stopped heartbeat lease for selection {} (lost={})", selectionId, lost);
        }

        private void cancelTicker() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
