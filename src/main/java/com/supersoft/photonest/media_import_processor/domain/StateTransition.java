package com.supersoft.photonest.media_import_processor.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

@Value
@Builder
public class StateTransition<S extends Enum<S>> {
    S from;
    S to;
    String reason;
    LocalDateTime timestamp;
    boolean forced;
    Map<String, Object> metadata;
}
