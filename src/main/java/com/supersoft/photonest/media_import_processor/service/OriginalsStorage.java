package com.supersoft.photonest.media_import_processor.service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;

public interface OriginalsStorage {
    Path createTempFile(String suffix) throws IOException;

    /**
     * Moves a staged temp file into the originals tree and returns its path relative to the root.
     * An existing original is never replaced; a colliding name gets a numeric suffix.
     */
    String storeOriginal(Path tempFile, String sha256, LocalDateTime shotAt, String sourceTag, String extension) throws IOException;

    void discard(Path tempFile);

    Path resolve(String relativePath);
}
