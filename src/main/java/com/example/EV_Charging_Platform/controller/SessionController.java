package com.example.EV_Charging_Platform.controller;

import com.example.EV_Charging_Platform.dto.*;
import com.example.EV_Charging_Platform.model.Session;
import com.example.EV_Charging_Platform.service.SessionCoordinator;
import com.example.EV_Charging_Platform.service.SessionNotFoundException;
import com.example.EV_Charging_Platform.service.SessionStats;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API Controller for Charging Session Management
 *
 * A start that the provider refuses is still a created session: it is returned with 201 in
 * state FAILED and the failure kind, so clients always get a session id to refer to.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@CrossOrigin(origins = "*")
public class SessionController {

    private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

    private final SessionCoordinator sessionCoordinator;
    private final Clock clock;

    public SessionController(SessionCoordinator sessionCoordinator, Clock clock) {
        this.sessionCoordinator = sessionCoordinator;
        this.clock = clock;
    }

    /**
     * Start a new charging session
     *
     * POST /api/v1/sessions
     * Body: {"userId": "user_1", "stationId": "stn_...", "chargerId": "chargepoint:cp_001_1"}
     */
    @PostMapping
    public ResponseEntity<?> startSession(@Valid @RequestBody StartSessionRequest request) {
        logger.info("Starting session request: user={}, station={}, charger={}",
                request.userId, request.stationId, request.chargerId);
        try {
            Session session = sessionCoordinator.start(request.userId, request.stationId, request.chargerId);
            return ResponseEntity.status(HttpStatus.CREATED).body(new SessionResponse(session, clock.instant()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_CHARGER", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error starting session", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Session start failed"));
        }
    }

    /**
     * Stop a charging session; stopping a finished session returns its stored summary
     *
     * POST /api/v1/sessions/{sessionId}/stop
     */
    @PostMapping("/{sessionId}/stop")
    public ResponseEntity<?> stopSession(@PathVariable String sessionId) {
        logger.info("Stopping session request: {}", sessionId);
        try {
            Session session = sessionCoordinator.stop(sessionId);
            return ResponseEntity.ok(new SessionResponse(session, clock.instant()));
        } catch (SessionNotFoundException e) {
            return notFound(e);
        } catch (Exception e) {
            logger.error("Error stopping session {}", sessionId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Session stop failed"));
        }
    }

    /**
     * GET /api/v1/sessions/{sessionId}
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<?> getSession(@PathVariable String sessionId) {
        try {
            return ResponseEntity.ok(new SessionResponse(sessionCoordinator.status(sessionId), clock.instant()));
        } catch (SessionNotFoundException e) {
            return notFound(e);
        } catch (Exception e) {
            logger.error("Error loading session {}", sessionId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Session lookup failed"));
        }
    }

    /**
     * GET /api/v1/sessions/active?userId=...
     */
    @GetMapping("/active")
    public ResponseEntity<?> activeSessions(@RequestParam String userId) {
        try {
            return ResponseEntity.ok(toResponses(sessionCoordinator.activeSessions(userId)));
        } catch (Exception e) {
            logger.error("Error listing active sessions of {}", userId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Session listing failed"));
        }
    }

    /**
     * GET /api/v1/sessions/history?userId=...&limit=20&offset=0
     */
    @GetMapping("/history")
    public ResponseEntity<?> history(@RequestParam String userId,
                                     @RequestParam(required = false) Integer limit,
                                     @RequestParam(required = false) Integer offset) {
        try {
            return ResponseEntity.ok(toResponses(sessionCoordinator.history(userId, limit, offset)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_PAGE", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error loading session history of {}", userId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Session history failed"));
        }
    }

    /**
     * Totals over the user's completed sessions
     *
     * GET /api/v1/sessions/stats/summary?userId=...
     */
    @GetMapping("/stats/summary")
    public ResponseEntity<?> statsSummary(@RequestParam String userId) {
        try {
            SessionStats stats = sessionCoordinator.stats(userId);
            logger.debug("Stats for {}: {}", userId, stats);
            return ResponseEntity.ok(stats);
        } catch (Exception e) {
            logger.error("Error computing session stats of {}", userId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Session stats failed"));
        }
    }

    private List<SessionResponse> toResponses(List<Session> sessions) {
        Instant now = clock.instant();
        return sessions.stream().map(session -> new SessionResponse(session, now)).collect(Collectors.toList());
    }

    private static ResponseEntity<ErrorResponse> notFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("SESSION_NOT_FOUND", e.getMessage()));
    }
}
