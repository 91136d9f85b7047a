package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ConsistencyReport;
import com.supersoft.photonest.media_import_processor.domain.ImportSession.SessionStatus;
import com.supersoft.photonest.media_import_processor.domain.PickerSelection.SelectionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateConsistencyValidatorTest {

    private StateConsistencyValidator validator;

    @BeforeEach
    void setUp() {
        validator = new StateConsistencyValidator();
    }

    @Test
    void testRunningSessionWithOpenItemsIsConsistent() {
        ConsistencyReport report = validator.validate(SessionStatus.IMPORTING,
                List.of(SelectionStatus.IMPORTED, SelectionStatus.RUNNING, SelectionStatus.ENQUEUED));

        assertTrue(report.isConsistent());
        assertTrue(report.getIssues().isEmpty());
        assertEquals(3, report.getStats().getTotal());
    }

    @Test
    void testProcessingSessionWithAllItemsTerminal() {
        ConsistencyReport report = validator.validate(SessionStatus.IMPORTING,
                List.of(SelectionStatus.IMPORTED, SelectionStatus.FAILED));

        assertFalse(report.isConsistent());
        assertEquals(1, report.getIssues().size());
        assertTrue(report.getIssues().get(0).contains("all 2 selections are terminal"));
        assertFalse(report.getRecommendations().isEmpty());
    }

    @Test
    void testTerminalSessionWithOpenItems() {
        ConsistencyReport report = validator.validate(SessionStatus.IMPORTED,
                List.of(SelectionStatus.IMPORTED, SelectionStatus.RUNNING));

        assertFalse(report.isConsistent());
        assertTrue(report.getIssues().get(0).contains("1 selections are not terminal"));
    }

    @Test
    void testIdleSessionWithRunningItems() {
        ConsistencyReport report = validator.validate(SessionStatus.READY, List.of(SelectionStatus.RUNNING));

        assertFalse(report.isConsistent());
        assertTrue(report.getIssues().get(0).contains("are running"));
    }

    @Test
    void testErrorSessionWithImportedItems() {
        ConsistencyReport report = validator.validate(SessionStatus.ERROR,
                List.of(SelectionStatus.DUP, SelectionStatus.FAILED));

        assertFalse(report.isConsistent());
        assertTrue(report.getIssues().get(0).contains("1 selections imported"));
    }

    @Test
    void testImportedSessionWithoutSuccess() {
        ConsistencyReport report = validator.validate(SessionStatus.IMPORTED,
                List.of(SelectionStatus.FAILED, SelectionStatus.EXPIRED));

        assertFalse(report.isConsistent());
        assertEquals("Session is IMPORTED but no selection imported successfully", report.getIssues().get(0));
    }

    @Test
    void testEmptySession() {
        assertTrue(validator.validate(SessionStatus.READY, Collections.<SelectionStatus>emptyList()).isConsistent());
        assertTrue(validator.validate(SessionStatus.IMPORTED, Collections.<SelectionStatus>emptyList()).isConsistent());
        assertFalse(validator.validate(SessionStatus.ENQUEUED, Collections.<SelectionStatus>emptyList()).isConsistent());
    }
}
