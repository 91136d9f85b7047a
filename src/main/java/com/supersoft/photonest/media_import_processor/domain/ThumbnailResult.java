package com.supersoft.photonest.media_import_processor.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ThumbnailResult {

    public static final String PLAYBACK_NOT_READY = "playback_not_ready";
    public static final String GENERATOR_UNAVAILABLE = "generator_unavailable";

    boolean ok;
    boolean generated;
    String notes;
    List<String> blockers;

    public boolean isPlaybackNotReady() {
        return ok && PLAYBACK_NOT_READY.equals(notes);
    }
}
