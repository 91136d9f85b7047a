package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ClaimResult;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import com.supersoft.photonest.media_import_processor.repository.PickerSelectionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Slf4j
@Service
public class SelectionClaimService {

    @Autowired
    private PickerSelectionRepository selectionRepository;

    @Autowired
    private Clock clock;

    /**
     * Atomically moves an enqueued selection to RUNNING for {@code workerId}. The affected-row count
     * of the conditional update decides the outcome; the follow-up read only explains a miss.
     */
    public ClaimResult claim(Long selectionId, Long sessionId, String workerId) {
        int updated = selectionRepository.claim(selectionId, sessionId, workerId, LocalDateTime.now(clock));

        if (updated > 0) {
            log.info("Claimed selection {} of session {} for worker {}", selectionId, sessionId, workerId);
            return ClaimResult.CLAIMED;
        }

        Optional<PickerSelection> current = selectionRepository.findById(selectionId);
        if (current.isEmpty() || !current.get().getSessionId().equals(sessionId)) {
            log.warn("Selection {} of session {} not found, nothing to claim", selectionId, sessionId);
            return ClaimResult.NOT_FOUND;
        }

        log.debug("Selection {} not claimable by {}: status={}, lockedBy={}",
                selectionId, workerId, current.get().getStatus(), current.get().getLockedBy());
        return ClaimResult.ALREADY_TAKEN;
    }
}
