package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ClaimResult;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection;
import com.supersoft.photonest.media_import_processor.repository.PickerSelectionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SelectionClaimServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0, 0);

    @Mock
    private PickerSelectionRepository selectionRepository;

    @InjectMocks
    private SelectionClaimService claimService;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(claimService, "clock", Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @Test
    void testClaimWon() {
        when(selectionRepository.claim(1L, 5L, "worker-a", NOW)).thenReturn(1);

        assertEquals(ClaimResult.CLAIMED, claimService.claim(1L, 5L, "worker-a"));
        verify(selectionRepository, never()).findById(1L);
    }

    @Test
    void testClaimAlreadyTaken() {
        when(selectionRepository.claim(1L, 5L, "worker-a", NOW)).thenReturn(0);
        when(selectionRepository.findById(1L)).thenReturn(Optional.of(PickerSelection.builder()
                .id(1L)
                .sessionId(5L)
                .status(PickerSelection.SelectionStatus.RUNNING)
                .lockedBy("worker-b")
                .build()));

        assertEquals(ClaimResult.ALREADY_TAKEN, claimService.claim(1L, 5L, "worker-a"));
    }

    @Test
    void testClaimUnknownSelection() {
        when(selectionRepository.claim(1L, 5L, "worker-a", NOW)).thenReturn(0);
        when(selectionRepository.findById(1L)).thenReturn(Optional.empty());

        assertEquals(ClaimResult.NOT_FOUND, claimService.claim(1L, 5L, "worker-a"));
    }

    @Test
    void testClaimSelectionOfAnotherSession() {
        when(selectionRepository.claim(1L, 5L, "worker-a", NOW)).thenReturn(0);
        when(selectionRepository.findById(1L)).thenReturn(Optional.of(PickerSelection.builder()
                .id(1L)
                .sessionId(6L)
                .status(PickerSelection.SelectionStatus.ENQUEUED)
                .build()));

        assertEquals(ClaimResult.NOT_FOUND, claimService.claim(1L, 5L, "worker-a"));
    }
}
