package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import com.supersoft.photonest.media_import_processor.exception.AuthorizationFailureException;
import com.supersoft.photonest.media_import_processor.exception.MediaFetchException;
import com.supersoft.photonest.media_import_processor.exception.ResourceExpiredException;
import com.supersoft.photonest.media_import_processor.exception.TransientFetchException;
import com.supersoft.photonest.media_import_processor.util.MediaFileNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Reads selections that point at files in the local drop folder. The source file is copied,
 * never moved, so a failed import leaves it in place.
 */
@Slf4j
@Component
public class LocalDropFolderFetcher implements MediaFetcher {

    @Value("${picker.import.local.drop-folder:/data/photonest/import}")
    private String dropFolder;

    @Autowired
    private OriginalsStorage originalsStorage;

    @Override
    public boolean supports(PickerSelection.SourceType sourceType) {
        return sourceType == PickerSelection.SourceType.LOCAL;
    }

    @Override
    public FetchedMedia fetch(PickerSelection selection) throws MediaFetchException {
        Path root = Paths.get(dropFolder).toAbsolutePath().normalize();
        Path source = root.resolve(selection.getSourceReference()).normalize();

        if (!source.startsWith(root)) {
            throw new AuthorizationFailureException("Path escapes drop folder: " + selection.getSourceReference());
        }
        if (!Files.isRegularFile(source)) {
            throw new ResourceExpiredException("Local file no longer available: " + selection.getSourceReference());
        }

        String filename = selection.getFilename() != null ? selection.getFilename() : source.getFileName().toString();
        Path temp = null;
        try {
            String mimeType = selection.getMimeType() != null ? selection.getMimeType() : Files.probeContentType(source);
            temp = originalsStorage.createTempFile(MediaFileNames.extensionFor(filename, mimeType));
            Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);

            LocalDateTime modified = LocalDateTime.ofInstant(Files.getLastModifiedTime(source).toInstant(), ZoneOffset.UTC);
            log.debug("Copied local file {} to {}", source, temp);
            return FetchedMedia.builder()
                    .tempFile(temp)
                    .filename(filename)
                    .mimeType(mimeType)
                    .sizeBytes(Files.size(temp))
                    .shotAt(modified)
                    .video(mimeType != null && mimeType.startsWith("video/"))
                    .build();
        } catch (IOException e) {
            originalsStorage.discard(temp);
            throw new TransientFetchException("Failed to read local file " + selection.getSourceReference() + ": " + e.getMessage(), e);
        }
    }
}
