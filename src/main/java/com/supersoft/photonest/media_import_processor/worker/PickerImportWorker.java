package com.supersoft.photonest.media_import_processor.worker;

import com.supersoft.photonest.media_import_processor.config.RabbitMQConfig;
import com.supersoft.photonest.media_import_processor.domain.ClaimResult;
import com.supersoft.photonest.media_import_processor.domain.ItemOutcome;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import com.supersoft.photonest.media_import_processor.repository.PickerSelectionRepository;
import com.supersoft.photonest.media_import_processor.service.HeartbeatLeaseManager;
import com.supersoft.photonest.media_import_processor.service.PickerImportItemProcessor;
import com.supersoft.photonest.media_import_processor.service.SelectionClaimService;
import com.supersoft.photonest.media_import_processor.service.SelectionQueuePublisher;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Consumes selection messages: claim, process under a heartbeat lease, then write the outcome
 * back with a statement guarded by the lock owner. Messages are never rethrown; the store is the
 * source of truth and the watchdog recovers anything left behind.
 */
@Slf4j
@Component
public class PickerImportWorker {

    @Autowired
    private SelectionClaimService claimService;

    @Autowired
    private HeartbeatLeaseManager leaseManager;

    @Autowired
    private PickerImportItemProcessor itemProcessor;

    @Autowired
    private PickerSelectionRepository selectionRepository;

    @Autowired
    private SelectionQueuePublisher queuePublisher;

    @Autowired
    private Clock clock;

    @Value("${picker.import.worker-id:}")
    private String workerId;

    @Value("${picker.import.fast-retry-attempts:2}")
    private int fastRetryAttempts;

    @PostConstruct
    void initWorkerId() {
        if (workerId == null || workerId.isBlank()) {
            workerId = ManagementFactory.getRuntimeMXBean().getName() + ":" + UUID.randomUUID().toString().substring(0, 8);
        }
        log.info("Picker import worker id: {}", workerId);
    }

    @RabbitListener(queues = RabbitMQConfig.IMPORT_ITEMS_QUEUE)
    public void onSelection(SelectionQueuePublisher.SelectionMessage message) {
        try {
            handle(message.getSelectionId(), message.getSessionId());
        } catch (Exception e) {
            log.error("Unexpected failure handling selection {} of session {}",
                    message.getSelectionId(), message.getSessionId(), e);
        }
    }

    /**
     * Runs one selection end to end. Returns the outcome, or empty when the claim was not won.
     */
    public Optional<ItemOutcome> handle(Long selectionId, Long sessionId) {
        ClaimResult claim = claimService.claim(selectionId, sessionId, workerId);
        if (claim != ClaimResult.CLAIMED) {
            log.info("Skipping selection {}: {}", selectionId, claim);
            return Optional.empty();
        }

        Optional<PickerSelection> claimed = selectionRepository.findById(selectionId);
        if (claimed.isEmpty()) {
            log.error("Selection {} disappeared right after being claimed by {}", selectionId, workerId);
            return Optional.empty();
        }
        PickerSelection selection = claimed.get();

        ItemOutcome outcome;
        HeartbeatLeaseManager.Lease lease = leaseManager.start(selectionId, workerId);
        try {
            outcome = itemProcessor.process(selection);
        } catch (Exception e) {
            // fetch errors are classified inside the processor; anything escaping it is transient
            log.error("Processing selection {} failed unexpectedly", selectionId, e);
            outcome = ItemOutcome.failed(PickerSelection.FailureKind.TRANSIENT, e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            lease.close();
        }

        if (lease.isLost()) {
            log.warn("Selection {} lost its lease during processing; outcome {} will only stick if the claim is still ours",
                    selectionId, outcome.getStatus());
        }

        finalizeOutcome(selection, outcome);
        return Optional.of(outcome);
    }

    private void finalizeOutcome(PickerSelection selection, ItemOutcome outcome) {
        LocalDateTime now = LocalDateTime.now(clock);

        if (outcome.isTransientFailure() && selection.getAttempts() < fastRetryAttempts) {
            boolean released = selectionRepository.releaseForRetry(selection.getId(), workerId, outcome.getErrorMessage(), now);
            if (!released) {
                log.warn("Claim lost for selection {} before release; leaving it to its current owner", selection.getId());
                return;
            }
            log.info("Selection {} re-enqueued after transient failure (attempt {}/{})",
                    selection.getId(), selection.getAttempts(), fastRetryAttempts);
            try {
                queuePublisher.publish(selection.getId(), selection.getSessionId());
            } catch (Exception e) {
                log.warn("Re-publish of selection {} failed, watchdog will pick it up: {}", selection.getId(), e.getMessage());
            }
            return;
        }

        boolean finalized = selectionRepository.finalizeClaimed(
                selection.getId(),
                workerId,
                outcome.getStatus(),
                outcome.getFailureKind(),
                outcome.getErrorMessage(),
                outcome.getMediaId(),
                now);

        if (finalized) {
            log.info("Selection {} finished as {} after {} attempt(s)", selection.getId(), outcome.getStatus(), selection.getAttempts());
        } else {
            log.warn("Claim lost for selection {}: {} not written (worker {})", selection.getId(), outcome.getStatus(), workerId);
        }
    }

    String getWorkerId() {
        return workerId;
    }
}
