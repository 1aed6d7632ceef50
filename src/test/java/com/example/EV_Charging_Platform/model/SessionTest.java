package com.example.EV_Charging_Platform.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the session state graph
 *
 * Tests cover:
 * - The linear happy path
 * - Rejected shortcuts and moves out of terminal states
 * - FAILED reachable from every non-terminal state
 * - Energy never decreasing
 */
class SessionTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private Session session;

    @BeforeEach
    void setUp() {
        session = new Session("sess_1", "user_1", "stn_1", "chargepoint:cp_001_1", "chargepoint", "cp_001_1",
                0.35, T0);
    }

    @Test
    void testTransition_HappyPath() {
        // When
        session.transitionTo(Session.State.STARTING, T0);
        session.markActive("native_1", T0, T0);
        session.transitionTo(Session.State.STOPPING, T0.plusSeconds(60));
        session.complete(12.3, null, T0.plus(Duration.ofMinutes(30)), T0.plus(Duration.ofMinutes(30)));

        // Then
        assertEquals(Session.State.COMPLETED, session.getState());
        assertEquals("native_1", session.getProviderSessionId());
        assertEquals(12.3, session.getEnergyDeliveredKwh(), 1e-9);
        assertEquals(30L, session.getDurationMinutes());
        assertTrue(session.isTerminal());
    }

    @Test
    void testTransition_RequestedToCompletedRejected() {
        // When & Then
        IllegalStateTransitionException e = assertThrows(IllegalStateTransitionException.class,
                () -> session.complete(5.0, 10L, T0, T0));
        assertEquals(Session.State.REQUESTED, e.getFrom());
        assertEquals(Session.State.COMPLETED, e.getTo());
        assertEquals(Session.State.REQUESTED, session.getState());
    }

    @Test
    void testTransition_SkippingStatesRejected() {
        assertThrows(IllegalStateTransitionException.class, () -> session.transitionTo(Session.State.ACTIVE, T0));
        session.transitionTo(Session.State.STARTING, T0);
        assertThrows(IllegalStateTransitionException.class, () -> session.transitionTo(Session.State.STOPPING, T0));
        assertThrows(IllegalStateTransitionException.class, () -> session.transitionTo(Session.State.REQUESTED, T0));
    }

    @Test
    void testTransition_FailedFromEveryNonTerminalState() {
        for (Session.State state : Session.State.values()) {
            if (state.isTerminal()) {
                assertFalse(state.canTransitionTo(Session.State.FAILED), state + " is terminal");
            } else {
                assertTrue(state.canTransitionTo(Session.State.FAILED), state + " should reach FAILED");
            }
        }
    }

    @Test
    void testTransition_TerminalStatesAreFinal() {
        // Given
        session.fail(ErrorKind.SESSION_CONFLICT, "duplicate", T0);

        // Then
        for (Session.State next : Session.State.values()) {
            assertThrows(IllegalStateTransitionException.class, () -> session.transitionTo(next, T0));
        }
        assertEquals(ErrorKind.SESSION_CONFLICT, session.getFailureKind());
    }

    @Test
    void testRecordProgress_EnergyIsMonotonic() {
        // Given
        session.transitionTo(Session.State.STARTING, T0);
        session.markActive("native_1", T0, T0);

        // When
        session.recordProgress(4.0, 50.0, T0.plusSeconds(300));
        session.recordProgress(3.5, 45.0, T0.plusSeconds(360));

        // Then
        assertEquals(4.0, session.getEnergyDeliveredKwh(), 1e-9);
        assertEquals(45.0, session.getCurrentPowerKw(), 1e-9);
    }

    @Test
    void testFail_KeepsDeliveredEnergy() {
        // Given
        session.transitionTo(Session.State.STARTING, T0);
        session.markActive("native_1", T0, T0);
        session.recordProgress(7.5, 50.0, T0.plusSeconds(600));
        session.transitionTo(Session.State.STOPPING, T0.plusSeconds(700));

        // When
        session.fail(ErrorKind.PROVIDER_TIMEOUT, "stop not confirmed", T0.plusSeconds(720));

        // Then
        assertEquals(Session.State.FAILED, session.getState());
        assertEquals(7.5, session.getEnergyDeliveredKwh(), 1e-9);
        assertEquals(0.0, session.getCurrentPowerKw(), 1e-9);
        assertEquals(12L, session.getDurationMinutes());
    }

    @Test
    void testClaimKey_UserAndCharger() {
        assertEquals("user_1|chargepoint:cp_001_1", session.getClaimKey());
        assertEquals(session.getClaimKey(), Session.claimKey("user_1", "chargepoint:cp_001_1"));
    }
}
