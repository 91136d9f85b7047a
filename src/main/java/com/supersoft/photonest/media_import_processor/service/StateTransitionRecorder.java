package com.supersoft.photonest.media_import_processor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supersoft.photonest.media_import_processor.domain.ImportStateAudit;
import com.supersoft.photonest.media_import_processor.domain.StateTransition;
import com.supersoft.photonest.media_import_processor.repository.ImportStateAuditRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Writes applied transitions to the audit trail. Audit failures are logged and never undo the
 * transition itself.
 */
@Slf4j
@Service
public class StateTransitionRecorder {

    public static final String ENTITY_SESSION = "SESSION";
    public static final String ENTITY_SELECTION = "SELECTION";

    @Autowired
    private ImportStateAuditRepository auditRepository;

    @Autowired
    private ObjectMapper objectMapper;

    public void record(String entityType, Long entityId, StateTransition<?> transition) {
        try {
            String metadataJson = transition.getMetadata() == null || transition.getMetadata().isEmpty()
                    ? null
                    : objectMapper.writeValueAsString(transition.getMetadata());
            ImportStateAudit audit = ImportStateAudit.builder()
                    .entityType(entityType)
                    .entityId(entityId)
                    .fromState(transition.getFrom().name())
                    .toState(transition.getTo().name())
                    .reason(transition.getReason())
                    .forced(transition.isForced())
                    .metadataJson(metadataJson)
                    .createdAt(transition.getTimestamp())
                    .build();
            auditRepository.save(audit);
        } catch (Exception e) {
            log.error("Error recording {} transition for {} {}: {}", transition.getTo(), entityType, entityId, e.getMessage(), e);
        }
    }

    public void recordAll(String entityType, Long entityId, List<? extends StateTransition<?>> transitions) {
        for (StateTransition<?> transition : transitions) {
            record(entityType, entityId, transition);
        }
    }

    public List<ImportStateAudit> history(String entityType, Long entityId) {
        return auditRepository.findByEntity(entityType, entityId);
    }
}
