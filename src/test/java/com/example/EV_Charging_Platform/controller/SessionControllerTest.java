package com.example.EV_Charging_Platform.controller;

import com.example.EV_Charging_Platform.dto.ErrorResponse;
import com.example.EV_Charging_Platform.dto.SessionResponse;
import com.example.EV_Charging_Platform.dto.StartSessionRequest;
import com.example.EV_Charging_Platform.model.ConnectorType;
import com.example.EV_Charging_Platform.model.ErrorKind;
import com.example.EV_Charging_Platform.model.Session;
import com.example.EV_Charging_Platform.service.SessionCoordinator;
import com.example.EV_Charging_Platform.service.SessionNotFoundException;
import com.example.EV_Charging_Platform.service.SessionStats;
import com.example.EV_Charging_Platform.support.MutableClock;
import com.example.EV_Charging_Platform.support.TestSessions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for SessionController
 *
 * Tests cover:
 * - Start answers 201 for started and for provider-refused sessions
 * - Unknown chargers and unknown sessions
 * - Elapsed time of running sessions
 * - Active and history listings, invalid paging
 * - Unexpected service errors
 * - Per-user stats summary
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SessionControllerTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private SessionCoordinator sessionCoordinator;

    private MutableClock clock;
    private SessionController sessionController;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(CREATED);
        sessionController = new SessionController(sessionCoordinator, clock);
    }

    @Test
    void testStartSession_Created() {
        // Given
        Session session = TestSessions.requested("s1", "user_1", CREATED);
        session.transitionTo(Session.State.STARTING, CREATED);
        session.markActive("cp_session_s1", CREATED, CREATED);
        when(sessionCoordinator.start("user_1", "stn_a", "chargepoint:cp_001_1")).thenReturn(session);
        clock.advance(Duration.ofMinutes(12));

        // When
        ResponseEntity<?> response = sessionController.startSession(
                new StartSessionRequest("user_1", "stn_a", "chargepoint:cp_001_1"));

        // Then
        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        SessionResponse body = (SessionResponse) response.getBody();
        assertNotNull(body);
        assertEquals("s1", body.sessionId);
        assertEquals("ACTIVE", body.state);
        assertEquals("chargepoint", body.provider);
        assertEquals(12L, body.elapsedMinutes);
    }

    @Test
    void testStartSession_ProviderRefusalStillCreated() {
        // Given
        Session session = TestSessions.requested("s2", "user_1", CREATED);
        session.fail(ErrorKind.SESSION_CONFLICT, "Charger busy", CREATED);
        when(sessionCoordinator.start(anyString(), anyString(), anyString())).thenReturn(session);

        // When
        ResponseEntity<?> response = sessionController.startSession(
                new StartSessionRequest("user_1", "stn_a", "chargepoint:cp_001_1"));

        // Then
        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        SessionResponse body = (SessionResponse) response.getBody();
        assertEquals("FAILED", body.state);
        assertEquals(ErrorKind.SESSION_CONFLICT, body.failureKind);
        assertNull(body.elapsedMinutes);
    }

    @Test
    void testStartSession_UnknownCharger() {
        // Given
        when(sessionCoordinator.start(anyString(), anyString(), anyString()))
                .thenThrow(new IllegalArgumentException("Unknown charger chargepoint:nope"));

        // When
        ResponseEntity<?> response = sessionController.startSession(
                new StartSessionRequest("user_1", "stn_a", "chargepoint:nope"));

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("INVALID_CHARGER", ((ErrorResponse) response.getBody()).error);
    }

    @Test
    void testStartSession_ServiceException() {
        // Given
        when(sessionCoordinator.start(anyString(), anyString(), anyString()))
                .thenThrow(new RuntimeException("Repository down"));

        // When
        ResponseEntity<?> response = sessionController.startSession(
                new StartSessionRequest("user_1", "stn_a", "chargepoint:cp_001_1"));

        // Then
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_ERROR", ((ErrorResponse) response.getBody()).error);
    }

    @Test
    void testStopSession_ReturnsSummary() {
        // Given
        Session session = TestSessions.completed("s3", 25.0, 0.35, CREATED);
        when(sessionCoordinator.stop("s3")).thenReturn(session);

        // When
        ResponseEntity<?> response = sessionController.stopSession("s3");

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        SessionResponse body = (SessionResponse) response.getBody();
        assertEquals("COMPLETED", body.state);
        assertEquals(25.0, body.energyDeliveredKwh, 0.0001);
        assertEquals(30L, body.durationMinutes);
        assertNull(body.elapsedMinutes);
    }

    @Test
    void testStopSession_NotFound() {
        // Given
        when(sessionCoordinator.stop("missing")).thenThrow(new SessionNotFoundException("missing"));

        // When
        ResponseEntity<?> response = sessionController.stopSession("missing");

        // Then
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("SESSION_NOT_FOUND", ((ErrorResponse) response.getBody()).error);
    }

    @Test
    void testGetSession_NotFound() {
        // Given
        when(sessionCoordinator.status("missing")).thenThrow(new SessionNotFoundException("missing"));

        // When
        ResponseEntity<?> response = sessionController.getSession("missing");

        // Then
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    void testGetSession_Success() {
        // Given
        when(sessionCoordinator.status("s1")).thenReturn(TestSessions.requested("s1", "user_1", CREATED));

        // When
        ResponseEntity<?> response = sessionController.getSession("s1");

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        SessionResponse body = (SessionResponse) response.getBody();
        assertEquals("REQUESTED", body.state);
        assertNull(body.startedAt);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testActiveSessions_MapsEverySession() {
        // Given
        when(sessionCoordinator.activeSessions("user_1")).thenReturn(List.of(
                TestSessions.requested("s1", "user_1", CREATED),
                TestSessions.requested("s2", "user_1", CREATED)));

        // When
        ResponseEntity<?> response = sessionController.activeSessions("user_1");

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        List<SessionResponse> body = (List<SessionResponse>) response.getBody();
        assertEquals(2, body.size());
        assertEquals("s1", body.get(0).sessionId);
    }

    @Test
    void testHistory_InvalidPage() {
        // Given
        when(sessionCoordinator.history("user_1", -1, null))
                .thenThrow(new IllegalArgumentException("Limit must be positive"));

        // When
        ResponseEntity<?> response = sessionController.history("user_1", -1, null);

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("INVALID_PAGE", ((ErrorResponse) response.getBody()).error);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testHistory_Success() {
        // Given
        when(sessionCoordinator.history("user_1", 10, 0))
                .thenReturn(List.of(TestSessions.completed("s9", 4.0, 0.40, CREATED)));

        // When
        ResponseEntity<?> response = sessionController.history("user_1", 10, 0);

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        List<SessionResponse> body = (List<SessionResponse>) response.getBody();
        assertEquals(1, body.size());
        assertEquals(0.40, body.get(0).pricePerKwh, 0.0001);
        verify(sessionCoordinator, never()).activeSessions(any());
    }

    @Test
    void testStatsSummary_Success() {
        // Given
        SessionStats stats = new SessionStats("user_1", 2, 0, 30.5, new BigDecimal("11.20"), 75, 15.25,
                "stn_a", ConnectorType.CCS);
        when(sessionCoordinator.stats("user_1")).thenReturn(stats);

        // When
        ResponseEntity<?> response = sessionController.statsSummary("user_1");

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(stats, response.getBody());
    }

    @Test
    void testStatsSummary_ServiceException() {
        // Given
        when(sessionCoordinator.stats("user_1")).thenThrow(new RuntimeException("disk gone"));

        // When
        ResponseEntity<?> response = sessionController.statsSummary("user_1");

        // Then
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_ERROR", ((ErrorResponse) response.getBody()).error);
    }
}
