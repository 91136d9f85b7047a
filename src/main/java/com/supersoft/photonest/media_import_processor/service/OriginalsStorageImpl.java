package com.supersoft.photonest.media_import_processor.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.*;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Slf4j
@Service
public class OriginalsStorageImpl implements OriginalsStorage {

    private static final DateTimeFormatter DAY_DIR = DateTimeFormatter.ofPattern("yyyy/MM/dd");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_NAME_COLLISIONS = 100;

    @Value("${picker.import.storage.originals-path:/data/photonest/originals}")
    private String originalsPath;

    @Value("${picker.import.storage.tmp-path:/data/photonest/tmp}")
    private String tmpPath;

    @Autowired
    private Clock clock;

    @Override
    public Path createTempFile(String suffix) throws IOException {
        Path tmpDir = Paths.get(tmpPath);
        Files.createDirectories(tmpDir);
        return Files.createTempFile(tmpDir, "import_", suffix);
    }

    @Override
    public String storeOriginal(Path tempFile, String sha256, LocalDateTime shotAt, String sourceTag, String extension) throws IOException {
        LocalDateTime stamp = shotAt != null ? shotAt : LocalDateTime.now(clock);
        String ext = extension == null || extension.isEmpty() ? "" : (extension.startsWith(".") ? extension : "." + extension);
        String baseName = stamp.format(STAMP) + "_" + sourceTag + "_" + sha256.substring(0, 8);
        Path dayDir = Paths.get(originalsPath).resolve(stamp.format(DAY_DIR));
        Files.createDirectories(dayDir);

        // reserve a name nobody else holds, then move the bytes onto the reservation
        Path target = reserve(dayDir, baseName, ext.toLowerCase());
        Path staging = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.move(tempFile, staging, StandardCopyOption.REPLACE_EXISTING);
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(staging);
                Files.deleteIfExists(target);
            } catch (IOException cleanupException) {
                log.warn("Failed to clean up staging file: {}", staging, cleanupException);
            }
            throw e;
        }

        String relative = stamp.format(DAY_DIR) + "/" + target.getFileName();
        log.info("Stored original: {}", target);
        return relative;
    }

    private static Path reserve(Path dir, String baseName, String ext) throws IOException {
        for (int suffix = 0; suffix < MAX_NAME_COLLISIONS; suffix++) {
            Path candidate = dir.resolve(suffix == 0 ? baseName + ext : baseName + "_" + suffix + ext);
            try {
                return Files.createFile(candidate);
            } catch (FileAlreadyExistsException e) {
                log.debug("Original {} already exists, trying next name", candidate);
            }
        }
        throw new FileAlreadyExistsException(dir.resolve(baseName + ext).toString(), null,
                "no free name after " + MAX_NAME_COLLISIONS + " attempts");
    }

    @Override
    public void discard(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Failed to delete temp file: {}", tempFile, e);
        }
    }

    @Override
    public Path resolve(String relativePath) {
        return Paths.get(originalsPath).resolve(relativePath);
    }
}
