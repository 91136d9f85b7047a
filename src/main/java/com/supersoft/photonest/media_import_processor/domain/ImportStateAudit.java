package com.supersoft.photonest.media_import_processor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportStateAudit {
    private Long id;
    private String entityType;
    private Long entityId;
    private String fromState;
    private String toState;
    private String reason;
    private boolean forced;
    private String metadataJson;
    private LocalDateTime createdAt;
}
