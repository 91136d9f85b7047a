package com.supersoft.photonest.media_import_processor.controller;

import com.supersoft.photonest.media_import_processor.domain.ConsistencyReport;
import com.supersoft.photonest.media_import_processor.domain.ImportSession;
import com.supersoft.photonest.media_import_processor.domain.WatchdogMetrics;
import com.supersoft.photonest.media_import_processor.exception.IllegalStateTransitionException;
import com.supersoft.photonest.media_import_processor.service.ImportSessionService;
import com.supersoft.photonest.media_import_processor.service.PickerImportWatchdog;
import com.supersoft.photonest.media_import_processor.service.StateTransitionRecorder;
import com.supersoft.photonest.media_import_processor.service.ThumbnailRetryService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImportDiagnosticsControllerTest {

    @Mock
    private ImportSessionService sessionService;

    @Mock
    private PickerImportWatchdog watchdog;

    @Mock
    private ThumbnailRetryService thumbnailRetryService;

    @Mock
    private StateTransitionRecorder transitionRecorder;

    @InjectMocks
    private ImportDiagnosticsController controller;

    @Test
    void testUnknownSessionIsNotFound() {
        when(sessionService.findSession(99L)).thenReturn(Optional.empty());

        assertEquals(HttpStatus.NOT_FOUND, controller.getSession(99L).getStatusCode());
    }

    @Test
    void testConsistencyReportReturned() {
        ConsistencyReport report = ConsistencyReport.builder()
                .sessionStatus(ImportSession.SessionStatus.IMPORTING)
                .consistent(false)
                .issues(List.of("Session is IMPORTING but all 5 selections are terminal"))
                .recommendations(List.of())
                .build();
        when(sessionService.checkConsistency(7L)).thenReturn(report);

        ResponseEntity<?> response = controller.checkConsistency(7L);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(report, response.getBody());
    }

    @Test
    void testIllegalCancelIsConflict() {
        when(sessionService.cancelSession(7L, "operator"))
                .thenThrow(new IllegalStateTransitionException(ImportSession.SessionStatus.IMPORTED, ImportSession.SessionStatus.CANCELED));

        ResponseEntity<?> response = controller.cancelSession(7L, "operator");

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("Invalid transition from IMPORTED to CANCELED", ((Map<?, ?>) response.getBody()).get("error"));
    }

    @Test
    void testForcedStatusLostToConcurrentChangeIsConflict() {
        when(sessionService.forceStatus(7L, ImportSession.SessionStatus.ERROR, "stuck")).thenReturn(false);

        assertEquals(HttpStatus.CONFLICT, controller.forceSessionStatus(7L, ImportSession.SessionStatus.ERROR, "stuck").getStatusCode());
    }

    @Test
    void testEnqueueReportsPublishedCount() {
        when(sessionService.enqueueSession(7L)).thenReturn(5);

        ResponseEntity<?> response = controller.enqueueSession(7L);

        assertEquals(5, ((Map<?, ?>) response.getBody()).get("publishedSelections"));
    }

    @Test
    void testManualWatchdogRun() {
        WatchdogMetrics metrics = new WatchdogMetrics();
        metrics.setRequeued(2);
        when(watchdog.runOnce()).thenReturn(metrics);

        assertEquals(2, controller.runWatchdog().getBody().getRequeued());
    }

    @Test
    void testExhaustedRetriesLimitIsClamped() {
        when(thumbnailRetryService.findExhausted(500)).thenReturn(List.of());

        controller.getExhaustedRetries(10_000);

        verify(thumbnailRetryService).findExhausted(500);
    }
}
