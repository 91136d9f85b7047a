package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ImportSession;
import com.supersoft.photonest.media_import_processor.domain.ImportSession.SessionStatus;
import com.supersoft.photonest.media_import_processor.domain.ImportSessionStats;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection.FailureKind;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection.SelectionStatus;
import com.supersoft.photonest.media_import_processor.domain.WatchdogMetrics;
import com.supersoft.photonest.media_import_processor.repository.ImportSessionRepository;
import com.supersoft.photonest.media_import_processor.repository.PickerSelectionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PickerImportWatchdogTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0, 0);

    @Mock
    private PickerSelectionRepository selectionRepository;

    @Mock
    private ImportSessionRepository sessionRepository;

    @Mock
    private SelectionQueuePublisher queuePublisher;

    @Mock
    private SessionStatusUpdater statusUpdater;

    @Spy
    private StateConsistencyValidator consistencyValidator = new StateConsistencyValidator();

    @Mock
    private ObjectProvider<ImportJobTracker> jobTracker;

    @Mock
    private ImportJobTracker tracker;

    @InjectMocks
    private PickerImportWatchdog watchdog;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(watchdog, "clock", Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
        ReflectionTestUtils.setField(watchdog, "enabled", true);
        ReflectionTestUtils.setField(watchdog, "leaseWindowSeconds", 120L);
        ReflectionTestUtils.setField(watchdog, "maxProcessingSeconds", 600L);
        ReflectionTestUtils.setField(watchdog, "maxAttempts", 3);
        ReflectionTestUtils.setField(watchdog, "backoffBaseSeconds", 60L);
        ReflectionTestUtils.setField(watchdog, "backoffMaxAttempts", 5);
        ReflectionTestUtils.setField(watchdog, "enqueuedStaleSeconds", 300L);
        ReflectionTestUtils.setField(watchdog, "batchSize", 200);
    }

    @Test
    void testStaleSelectionIsRequeuedAndRepublished() {
        PickerSelection stale = running(11L, 1, NOW.minusSeconds(130));
        when(selectionRepository.findStaleRunning(NOW.minusSeconds(120), NOW.minusSeconds(600), 200)).thenReturn(List.of(stale));
        when(selectionRepository.requeueStale(11L, 1, NOW.minusSeconds(120), NOW.minusSeconds(600), NOW)).thenReturn(true);

        WatchdogMetrics metrics = watchdog.runOnce();

        assertEquals(1, metrics.getRequeued());
        assertEquals(0, metrics.getFailed());
        verify(queuePublisher).publish(11L, 5L);
        verify(selectionRepository, never()).failStale(anyLong(), anyInt(), any(), any(), anyString(), any());
    }

    @Test
    void testStaleSelectionOutOfAttemptsIsFailed() {
        PickerSelection stale = running(11L, 3, NOW.minusSeconds(130));
        when(selectionRepository.findStaleRunning(any(), any(), anyInt())).thenReturn(List.of(stale));
        when(selectionRepository.failStale(eq(11L), eq(3), any(), any(), anyString(), eq(NOW))).thenReturn(true);

        WatchdogMetrics metrics = watchdog.runOnce();

        assertEquals(0, metrics.getRequeued());
        assertEquals(1, metrics.getFailed());
        verify(selectionRepository, never()).requeueStale(anyLong(), anyInt(), any(), any(), any());
        verify(queuePublisher, never()).publish(anyLong(), anyLong());
    }

    @Test
    void testStaleRequeueLosingRaceDoesNothing() {
        PickerSelection stale = running(11L, 1, NOW.minusSeconds(130));
        when(selectionRepository.findStaleRunning(any(), any(), anyInt())).thenReturn(List.of(stale));
        when(selectionRepository.requeueStale(anyLong(), anyInt(), any(), any(), any())).thenReturn(false);

        WatchdogMetrics metrics = watchdog.runOnce();

        assertEquals(0, metrics.getRequeued());
        verify(queuePublisher, never()).publish(anyLong(), anyLong());
    }

    @Test
    void testRepublishFailureAfterRequeueIsTolerated() {
        PickerSelection stale = running(11L, 1, NOW.minusSeconds(130));
        when(selectionRepository.findStaleRunning(any(), any(), anyInt())).thenReturn(List.of(stale));
        when(selectionRepository.requeueStale(anyLong(), anyInt(), any(), any(), any())).thenReturn(true);
        doThrow(new RuntimeException("broker down")).when(queuePublisher).publish(11L, 5L);

        WatchdogMetrics metrics = watchdog.runOnce();

        assertEquals(1, metrics.getRequeued());
        assertEquals(0, metrics.getStepErrors());
    }

    @Test
    void testBackoffNotElapsedLeavesSelectionFailed() {
        // attempts=3, base 60s: delay is 480s
        PickerSelection failed = failed(21L, 3, NOW.minusSeconds(479));
        when(selectionRepository.findRetryableFailed(5, 200)).thenReturn(List.of(failed));

        WatchdogMetrics metrics = watchdog.runOnce();

        assertEquals(0, metrics.getRecovered());
        verify(selectionRepository, never()).requeueFailed(anyLong(), anyInt(), any(), any());
        verify(queuePublisher, never()).publish(anyLong(), anyLong());
    }

    @Test
    void testBackoffElapsedRequeuesSelection() {
        PickerSelection failed = failed(21L, 3, NOW.minusSeconds(481));
        when(selectionRepository.findRetryableFailed(5, 200)).thenReturn(List.of(failed));
        when(selectionRepository.requeueFailed(21L, 3, NOW.minusSeconds(480), NOW)).thenReturn(true);

        WatchdogMetrics metrics = watchdog.runOnce();

        assertEquals(1, metrics.getRecovered());
        verify(queuePublisher).publish(21L, 5L);
    }

    @Test
    void testBackoffDelayDoublesPerAttempt() {
        assertEquals(60L, watchdog.backoffDelaySeconds(0));
        assertEquals(120L, watchdog.backoffDelaySeconds(1));
        assertEquals(480L, watchdog.backoffDelaySeconds(3));
    }

    @Test
    void testStuckEnqueuedIsRepublished() {
        PickerSelection stuck = PickerSelection.builder()
                .id(31L)
                .sessionId(5L)
                .status(SelectionStatus.ENQUEUED)
                .enqueuedAt(NOW.minusSeconds(400))
                .build();
        when(selectionRepository.findStuckEnqueued(NOW.minusSeconds(300), 200)).thenReturn(List.of(stuck));
        when(selectionRepository.touchEnqueued(31L, NOW.minusSeconds(300), NOW)).thenReturn(true);

        WatchdogMetrics metrics = watchdog.runOnce();

        assertEquals(1, metrics.getRepublished());
        verify(queuePublisher).publish(31L, 5L);
    }

    @Test
    void testRollUpCompletesSessionAsImported() {
        ImportSession session = session(7L, SessionStatus.IMPORTING);
        when(sessionRepository.findByStatuses(any())).thenReturn(List.of(session));
        when(selectionRepository.countByStatus(7L)).thenReturn(counts(SelectionStatus.IMPORTED, 3, SelectionStatus.FAILED, 2));
        when(statusUpdater.apply(eq(session), eq(SessionStatus.IMPORTED), anyString(), anyMap())).thenReturn(true);
        when(jobTracker.getIfAvailable()).thenReturn(tracker);

        WatchdogMetrics metrics = watchdog.runOnce();

        assertEquals(1, metrics.getCompletedSessions());

        ArgumentCaptor<ImportSessionStats> stats = ArgumentCaptor.forClass(ImportSessionStats.class);
        verify(sessionRepository).updateStats(eq(7L), stats.capture(), eq(NOW));
        assertEquals(Map.of("imported", 3, "failed", 2), stats.getValue().getCountsByStatus());
        assertEquals(5, stats.getValue().getTotal());
        assertEquals(0.6, stats.getValue().getSuccessRate(), 0.0001);

        verify(tracker).finalizeForSession(eq(7L), eq(true), any(ImportSessionStats.class));
    }

    @Test
    void testEnqueuedSessionPassesThroughImporting() {
        ImportSession session = session(7L, SessionStatus.ENQUEUED);
        when(sessionRepository.findByStatuses(any())).thenReturn(List.of(session));
        when(selectionRepository.countByStatus(7L)).thenReturn(counts(SelectionStatus.DUP, 2, SelectionStatus.SKIPPED, 1));
        when(statusUpdater.apply(eq(session), any(SessionStatus.class), anyString(), anyMap())).thenReturn(true);

        watchdog.runOnce();

        InOrder order = inOrder(statusUpdater);
        order.verify(statusUpdater).apply(eq(session), eq(SessionStatus.IMPORTING), anyString(), anyMap());
        order.verify(statusUpdater).apply(eq(session), eq(SessionStatus.IMPORTED), anyString(), anyMap());
    }

    @Test
    void testRollUpLosingRaceWritesNothing() {
        ImportSession session = session(7L, SessionStatus.IMPORTING);
        when(sessionRepository.findByStatuses(any())).thenReturn(List.of(session));
        when(selectionRepository.countByStatus(7L)).thenReturn(counts(SelectionStatus.IMPORTED, 3, SelectionStatus.FAILED, 2));
        when(statusUpdater.apply(eq(session), eq(SessionStatus.IMPORTED), anyString(), anyMap())).thenReturn(false);

        WatchdogMetrics metrics = watchdog.runOnce();

        assertEquals(0, metrics.getCompletedSessions());
        verify(sessionRepository, never()).updateStats(anyLong(), any(), any());
        verify(jobTracker, never()).getIfAvailable();
    }

    @Test
    void testOpenSelectionsKeepSessionRunning() {
        ImportSession session = session(7L, SessionStatus.IMPORTING);
        when(sessionRepository.findByStatuses(any())).thenReturn(List.of(session));
        when(selectionRepository.countByStatus(7L)).thenReturn(counts(SelectionStatus.IMPORTED, 3, SelectionStatus.RUNNING, 1));

        WatchdogMetrics metrics = watchdog.runOnce();

        assertEquals(0, metrics.getCompletedSessions());
        assertEquals(0, metrics.getInconsistentSessions());
        verifyNoInteractions(statusUpdater);
    }

    @Test
    void testFailingStepDoesNotStopSweep() {
        when(selectionRepository.findStaleRunning(any(), any(), anyInt())).thenThrow(new RuntimeException("connection reset"));

        WatchdogMetrics metrics = watchdog.runOnce();

        assertEquals(1, metrics.getStepErrors());
        verify(selectionRepository).findRetryableFailed(anyInt(), anyInt());
        verify(selectionRepository).findStuckEnqueued(any(), anyInt());
        verify(sessionRepository).findByStatuses(any());
    }

    @Test
    void testDisabledWatchdogSkipsScheduledSweep() {
        ReflectionTestUtils.setField(watchdog, "enabled", false);

        watchdog.scheduledSweep();

        verifyNoInteractions(selectionRepository, sessionRepository);
    }

    @Test
    void testRollUpStatusPolicy() {
        assertEquals(SessionStatus.IMPORTED, PickerImportWatchdog.rollUpStatus(
                ImportSessionStats.fromCounts(counts(SelectionStatus.IMPORTED, 1, SelectionStatus.FAILED, 9))));
        assertEquals(SessionStatus.IMPORTED, PickerImportWatchdog.rollUpStatus(
                ImportSessionStats.fromCounts(counts(SelectionStatus.DUP, 2, SelectionStatus.EXPIRED, 1))));
        assertEquals(SessionStatus.ERROR, PickerImportWatchdog.rollUpStatus(
                ImportSessionStats.fromCounts(counts(SelectionStatus.FAILED, 2, SelectionStatus.SKIPPED, 1))));
        assertEquals(SessionStatus.CANCELED, PickerImportWatchdog.rollUpStatus(
                ImportSessionStats.fromCounts(new EnumMap<>(Map.of(SelectionStatus.SKIPPED, 4)))));
        assertEquals(SessionStatus.IMPORTED, PickerImportWatchdog.rollUpStatus(
                ImportSessionStats.fromCounts(new EnumMap<>(SelectionStatus.class))));
    }

    private static PickerSelection running(Long id, int attempts, LocalDateTime heartbeat) {
        return PickerSelection.builder()
                .id(id)
                .sessionId(5L)
                .status(SelectionStatus.RUNNING)
                .attempts(attempts)
                .lockedBy("worker-a")
                .lockHeartbeatAt(heartbeat)
                .startedAt(heartbeat)
                .build();
    }

    private static PickerSelection failed(Long id, int attempts, LocalDateTime lastTransitionAt) {
        return PickerSelection.builder()
                .id(id)
                .sessionId(5L)
                .status(SelectionStatus.FAILED)
                .failureKind(FailureKind.TRANSIENT)
                .attempts(attempts)
                .lastTransitionAt(lastTransitionAt)
                .build();
    }

    private static ImportSession session(Long id, SessionStatus status) {
        return ImportSession.builder()
                .id(id)
                .accountId(1L)
                .sessionKey("session-" + id)
                .status(status)
                .selectedCount(5)
                .build();
    }

    private static Map<SelectionStatus, Integer> counts(SelectionStatus first, int firstCount, SelectionStatus second, int secondCount) {
        Map<SelectionStatus, Integer> counts = new EnumMap<>(SelectionStatus.class);
        counts.put(first, firstCount);
        counts.put(second, secondCount);
        return counts;
    }
}
