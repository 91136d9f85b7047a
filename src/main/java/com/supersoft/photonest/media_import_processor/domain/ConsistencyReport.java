package com.supersoft.photonest.media_import_processor.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ConsistencyReport {
    ImportSession.SessionStatus sessionStatus;
    boolean consistent;
    List<String> issues;
    List<String> recommendations;
    ImportSessionStats stats;
}
