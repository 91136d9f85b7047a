package com.supersoft.photonest.media_import_processor.service;

import com.supersoft.photonest.media_import_processor.domain.ItemState;
import com.supersoft.photonest.media_import_processor.exception.IllegalStateTransitionException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ItemStateMachineTest {

    @Test
    void testImportPhases() {
        ItemStateMachine machine = new ItemStateMachine(ItemState.PENDING);

        machine.transition(ItemState.ANALYZING, "fetching");
        machine.transition(ItemState.CHECKING, "hashing");
        machine.transition(ItemState.MOVING, "storing");
        machine.transition(ItemState.UPDATING, "catalog", Map.of("path", "2024/03/01/x.jpg"));
        machine.transition(ItemState.IMPORTED, "done");

        assertEquals(ItemState.IMPORTED, machine.getCurrent());
        assertTrue(machine.getCurrent().isTerminal());
        assertTrue(machine.getCurrent().isSuccess());
        assertEquals(5, machine.getHistory().size());
    }

    @Test
    void testDuplicateIsSkippedAfterChecking() {
        ItemStateMachine machine = new ItemStateMachine(ItemState.PENDING);
        machine.transition(ItemState.ANALYZING, "fetching");
        machine.transition(ItemState.CHECKING, "hashing");

        assertTrue(machine.canTransition(ItemState.SKIPPED));
        assertFalse(machine.canTransition(ItemState.IMPORTED));
    }

    @Test
    void testWarningCanOnlyFinishImported() {
        ItemStateMachine machine = new ItemStateMachine(ItemState.WARNING);

        assertEquals(1, machine.getAllowedTransitions().size());
        assertTrue(machine.canTransition(ItemState.IMPORTED));
    }

    @Test
    void testFailedItemCanBeRetried() {
        ItemStateMachine machine = new ItemStateMachine(ItemState.FAILED);

        machine.transition(ItemState.ANALYZING, "retry");

        assertEquals(ItemState.ANALYZING, machine.getCurrent());
        assertTrue(machine.getCurrent().isProcessing());
    }

    @Test
    void testSkippingPhasesIsRejected() {
        ItemStateMachine machine = new ItemStateMachine(ItemState.PENDING);

        assertThrows(IllegalStateTransitionException.class, () -> machine.transition(ItemState.IMPORTED, "shortcut"));
        assertEquals(ItemState.PENDING, machine.getCurrent());
    }
}
