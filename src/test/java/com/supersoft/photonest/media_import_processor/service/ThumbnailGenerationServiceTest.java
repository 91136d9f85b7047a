package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.RetryScheduleResult;
import com.supersoft.photonest.media_import_processor.domain.ThumbnailResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ThumbnailGenerationServiceTest {

    @Mock
    private ObjectProvider<ThumbnailGenerator> thumbnailGenerator;

    @Mock
    private ThumbnailGenerator generator;

    @Mock
    private ThumbnailRetryService retryService;

    @InjectMocks
    private ThumbnailGenerationService generationService;

    @Test
    void testGeneratedThumbnailsClearRetryRecord() {
        when(thumbnailGenerator.getIfAvailable()).thenReturn(generator);
        when(generator.generate(42L, false)).thenReturn(ThumbnailResult.builder().ok(true).generated(true).build());

        assertEquals(ThumbnailGenerationService.GenerationOutcome.COMPLETED, generationService.generate(42L, false));
        verify(retryService).clearSuccess(42L);
        verify(retryService, never()).scheduleIfAllowed(anyLong(), anyBoolean(), any());
    }

    @Test
    void testPlaybackNotReadySchedulesRetry() {
        when(thumbnailGenerator.getIfAvailable()).thenReturn(generator);
        when(generator.generate(42L, false)).thenReturn(ThumbnailResult.builder()
                .ok(true)
                .notes(ThumbnailResult.PLAYBACK_NOT_READY)
                .blockers(List.of("playback_not_ready", "transcode_queued"))
                .build());
        when(retryService.scheduleIfAllowed(42L, false, List.of("playback_not_ready", "transcode_queued")))
                .thenReturn(RetryScheduleResult.scheduled("job-1", LocalDateTime.of(2024, 3, 1, 12, 5), 1));

        assertEquals(ThumbnailGenerationService.GenerationOutcome.RETRY_SCHEDULED, generationService.generate(42L, false));
        verify(retryService, never()).clearSuccess(anyLong());
    }

    @Test
    void testPlaybackNotReadyWithoutBlockersUsesDefault() {
        when(thumbnailGenerator.getIfAvailable()).thenReturn(generator);
        when(generator.generate(42L, true)).thenReturn(ThumbnailResult.builder()
                .ok(true)
                .notes(ThumbnailResult.PLAYBACK_NOT_READY)
                .build());
        when(retryService.scheduleIfAllowed(42L, true, List.of(ThumbnailResult.PLAYBACK_NOT_READY)))
                .thenReturn(RetryScheduleResult.exhausted(5));

        assertEquals(ThumbnailGenerationService.GenerationOutcome.RETRY_EXHAUSTED, generationService.generate(42L, true));
    }

    @Test
    void testMissingGeneratorFailsWithoutRetry() {
        when(thumbnailGenerator.getIfAvailable()).thenReturn(null);

        assertEquals(ThumbnailGenerationService.GenerationOutcome.FAILED, generationService.generate(42L, false));
        verify(retryService).cancelPending(42L);
        verify(retryService, never()).scheduleIfAllowed(anyLong(), anyBoolean(), any());
    }

    @Test
    void testGeneratorExceptionFailsWithoutRetry() {
        when(thumbnailGenerator.getIfAvailable()).thenReturn(generator);
        when(generator.generate(42L, false)).thenThrow(new RuntimeException("ffmpeg crashed"));

        assertEquals(ThumbnailGenerationService.GenerationOutcome.FAILED, generationService.generate(42L, false));
        verify(retryService).cancelPending(42L);
    }
}
