package com.aquiferai.pipeline.service;

import com.aquiferai.pipeline.model.ValidationStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HealingStateTest {

    private static final int MAX_RETRIES = 3;

    @Test
    void testPendingQueryThatRunsBecomesValid() {
        HealingState state = HealingState.pending("MATCH (a:Aquifer) RETURN a").executed(12);
        assertEquals(HealingState.Phase.VALID, state.phase());
        assertEquals(0, state.attempt());
        assertEquals(12L, state.executionTimeMs());
        assertTrue(state.isTerminal());
    }

    @Test
    void testFailureMovesToHealingWhileRetriesRemain() {
        HealingState state = HealingState.pending("q0")
                .failed(ValidationStatus.SCHEMA_ERROR, "unknown label", null, MAX_RETRIES);
        assertEquals(HealingState.Phase.HEALING, state.phase());
        assertEquals(ValidationStatus.SCHEMA_ERROR, state.failureStatus());

        HealingState repaired = state.repaired("q1");
        assertEquals(HealingState.Phase.PENDING, repaired.phase());
        assertEquals(1, repaired.attempt());
        assertEquals("q1", repaired.query());
        assertNull(repaired.failureStatus());
    }

    @Test
    void testRetryCeilingEndsInFailed() {
        HealingState state = HealingState.pending("q0");
        for (int i = 1; i <= MAX_RETRIES; i++) {
            state = state.failed(ValidationStatus.EXECUTION_ERROR, "boom", 5L, MAX_RETRIES).repaired("q" + i);
        }
        state = state.failed(ValidationStatus.EXECUTION_ERROR, "boom", 5L, MAX_RETRIES);
        assertEquals(HealingState.Phase.FAILED, state.phase());
        assertEquals(MAX_RETRIES, state.attempt());
        assertEquals("q3", state.query());
    }

    @Test
    void testZeroRetriesFailsImmediately() {
        HealingState state = HealingState.pending("q0").failed(ValidationStatus.SYNTAX_ERROR, "bad", null, 0);
        assertEquals(HealingState.Phase.FAILED, state.phase());
    }

    @Test
    void testTerminalStatesAreAbsorbing() {
        HealingState valid = HealingState.pending("q0").executed(3);
        assertSame(valid, valid.failed(ValidationStatus.SYNTAX_ERROR, "x", null, MAX_RETRIES));
        assertSame(valid, valid.repaired("other"));
        assertSame(valid, valid.abandon("cancelled"));

        HealingState failed = HealingState.pending("q0").failed(ValidationStatus.SYNTAX_ERROR, "x", null, 0);
        assertSame(failed, failed.executed(1));
        assertSame(failed, failed.repaired("other"));
    }

    @Test
    void testTransitionsOutOfPhaseAreIgnored() {
        HealingState pending = HealingState.pending("q0");
        assertSame(pending, pending.repaired("q1"));
        HealingState healing = pending.failed(ValidationStatus.SYNTAX_ERROR, "x", null, MAX_RETRIES);
        assertSame(healing, healing.executed(1));
    }

    @Test
    void testAbandonKeepsLastFailure() {
        HealingState abandoned = HealingState.pending("q0")
                .failed(ValidationStatus.SCHEMA_ERROR, "unknown label", null, MAX_RETRIES)
                .abandon("run cancelled");
        assertEquals(HealingState.Phase.FAILED, abandoned.phase());
        assertEquals(ValidationStatus.SCHEMA_ERROR, abandoned.failureStatus());
        assertEquals("unknown label (run cancelled)", abandoned.errorMessage());

        HealingState untouched = HealingState.pending("q0").abandon("run cancelled");
        assertEquals(ValidationStatus.EXECUTION_ERROR, untouched.failureStatus());
        assertEquals("run cancelled", untouched.errorMessage());
    }
}
