package com.supersoft.photonest.media_import_processor.service;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Bytes pulled from a source, staged in a temp file owned by {@link OriginalsStorage}.
 */
@Value
@Builder
public class FetchedMedia {
    Path tempFile;
    String filename;
    String mimeType;
    long sizeBytes;
    LocalDateTime shotAt;
    boolean video;
}
