package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import com.supersoft.photonest.media_import_processor.exception.AuthorizationFailureException;
import com.supersoft.photonest.media_import_processor.exception.ResourceExpiredException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class LocalDropFolderFetcherTest {

    private LocalDropFolderFetcher fetcher;
    private Path dropFolder;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        dropFolder = Files.createDirectories(tempDir.resolve("drop"));

        OriginalsStorageImpl storage = new OriginalsStorageImpl();
        ReflectionTestUtils.setField(storage, "originalsPath", tempDir.resolve("originals").toString());
        ReflectionTestUtils.setField(storage, "tmpPath", tempDir.resolve("tmp").toString());
        ReflectionTestUtils.setField(storage, "clock", Clock.systemUTC());

        fetcher = new LocalDropFolderFetcher();
        ReflectionTestUtils.setField(fetcher, "dropFolder", dropFolder.toString());
        ReflectionTestUtils.setField(fetcher, "originalsStorage", storage);
    }

    @Test
    void testCopiesFileAndKeepsSource() throws Exception {
        Path source = Files.createDirectories(dropFolder.resolve("holiday")).resolve("beach.jpg");
        Files.writeString(source, "sand");

        FetchedMedia media = fetcher.fetch(selection("holiday/beach.jpg", "image/jpeg"));

        assertTrue(Files.exists(source));
        assertEquals("sand", Files.readString(media.getTempFile()));
        assertEquals("beach.jpg", media.getFilename());
        assertEquals(4, media.getSizeBytes());
        assertNotNull(media.getShotAt());
        assertFalse(media.isVideo());
    }

    @Test
    void testVideoFlagFollowsMimeType() throws Exception {
        Files.writeString(dropFolder.resolve("clip.mp4"), "frames");

        FetchedMedia media = fetcher.fetch(selection("clip.mp4", "video/mp4"));

        assertTrue(media.isVideo());
        assertTrue(media.getTempFile().toString().endsWith(".mp4"));
    }

    @Test
    void testPathOutsideDropFolderIsRejected() throws Exception {
        Files.writeString(tempDir.resolve("secret.jpg"), "nope");

        assertThrows(AuthorizationFailureException.class, () -> fetcher.fetch(selection("../secret.jpg", "image/jpeg")));
    }

    @Test
    void testMissingFileIsExpired() {
        assertThrows(ResourceExpiredException.class, () -> fetcher.fetch(selection("missing.jpg", "image/jpeg")));
    }

    @Test
    void testDirectoryIsExpired() throws Exception {
        Files.createDirectories(dropFolder.resolve("album"));

        assertThrows(ResourceExpiredException.class, () -> fetcher.fetch(selection("album", null)));
    }

    @Test
    void testSupportsOnlyLocalSources() {
        assertTrue(fetcher.supports(PickerSelection.SourceType.LOCAL));
        assertFalse(fetcher.supports(PickerSelection.SourceType.PICKER));
    }

    private static PickerSelection selection(String reference, String mimeType) {
        return PickerSelection.builder()
                .id(3L)
                .sessionId(1L)
                .sourceType(PickerSelection.SourceType.LOCAL)
                .sourceReference(reference)
                .mimeType(mimeType)
                .build();
    }
}
