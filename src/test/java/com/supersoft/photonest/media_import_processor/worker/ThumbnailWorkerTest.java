package com.supersoft.photonest.media_import_processor.worker;

import com.supersoft.photonest.media_import_processor.service.AssetGenerationPublisher;
import com.supersoft.photonest.media_import_processor.service.ThumbnailGenerationService;
import com.supersoft.photonest.media_import_processor.service.ThumbnailRetryService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ThumbnailWorkerTest {

    @Mock
    private ThumbnailGenerationService generationService;

    @Mock
    private ThumbnailRetryService retryService;

    @InjectMocks
    private ThumbnailWorker worker;

    @Test
    void testFirstRequestGeneratesDirectly() {
        when(generationService.generate(42L, false)).thenReturn(ThumbnailGenerationService.GenerationOutcome.COMPLETED);

        worker.onThumbnailJob(new AssetGenerationPublisher.ThumbnailJobMessage(42L, false, null));

        verify(generationService).generate(42L, false);
        verifyNoInteractions(retryService);
    }

    @Test
    void testStaleRetryDeliveryIsDropped() {
        when(retryService.beginAttempt(42L, "job-old")).thenReturn(false);

        worker.onThumbnailJob(new AssetGenerationPublisher.ThumbnailJobMessage(42L, false, "job-old"));

        verifyNoInteractions(generationService);
    }

    @Test
    void testCurrentRetryDeliveryRuns() {
        when(retryService.beginAttempt(42L, "job-1")).thenReturn(true);
        when(generationService.generate(42L, true)).thenReturn(ThumbnailGenerationService.GenerationOutcome.RETRY_SCHEDULED);

        worker.onThumbnailJob(new AssetGenerationPublisher.ThumbnailJobMessage(42L, true, "job-1"));

        verify(generationService).generate(42L, true);
    }

    @Test
    void testGenerationErrorIsNotRethrown() {
        when(generationService.generate(anyLong(), anyBoolean())).thenThrow(new RuntimeException("disk full"));

        assertDoesNotThrow(() -> worker.onThumbnailJob(new AssetGenerationPublisher.ThumbnailJobMessage(42L, false, null)));
    }
}
