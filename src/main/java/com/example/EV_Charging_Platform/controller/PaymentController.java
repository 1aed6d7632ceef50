package com.example.EV_Charging_Platform.controller;

import com.example.EV_Charging_Platform.dto.*;
import com.example.EV_Charging_Platform.model.PaymentIntent;
import com.example.EV_Charging_Platform.model.ReconciliationRecord;
import com.example.EV_Charging_Platform.payment.PaymentCoordinator;
import com.example.EV_Charging_Platform.payment.PaymentIntentNotFoundException;
import com.example.EV_Charging_Platform.payment.PaymentProcessorException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * REST API Controller for payments of finished sessions
 */
@RestController
@RequestMapping("/api/v1/payments")
@CrossOrigin(origins = "*")
public class PaymentController {

    private static final Logger logger = LoggerFactory.getLogger(PaymentController.class);

    private final PaymentCoordinator paymentCoordinator;

    public PaymentController(PaymentCoordinator paymentCoordinator) {
        this.paymentCoordinator = paymentCoordinator;
    }

    /**
     * GET /api/v1/payments/sessions/{sessionId}
     */
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<?> intentForSession(@PathVariable String sessionId) {
        try {
            Optional<PaymentIntent> intent = paymentCoordinator.intentForSession(sessionId);
            if (intent.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponse("PAYMENT_NOT_FOUND", "No payment for session " + sessionId));
            }
            return ResponseEntity.ok(intent.get());
        } catch (Exception e) {
            logger.error("Error loading payment of session {}", sessionId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Payment lookup failed"));
        }
    }

    /**
     * Payments of a user's sessions, newest first
     *
     * GET /api/v1/payments/history?userId=...&limit=10
     */
    @GetMapping("/history")
    public ResponseEntity<?> history(@RequestParam String userId, @RequestParam(required = false) Integer limit) {
        try {
            return ResponseEntity.ok(paymentCoordinator.history(userId, limit));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_PAGE", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error loading payment history of {}", userId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Payment history failed"));
        }
    }

    /**
     * Full or partial refund of a captured payment
     *
     * POST /api/v1/payments/{paymentIntentId}/refund
     * Body: {"amount": 2.50, "reason": "requested_by_customer"} (both optional)
     */
    @PostMapping("/{paymentIntentId}/refund")
    public ResponseEntity<?> refund(@PathVariable String paymentIntentId,
                                    @Valid @RequestBody(required = false) RefundRequest request) {
        RefundRequest body = request != null ? request : new RefundRequest();
        logger.info("Refund request for {}: amount={}, reason={}", paymentIntentId, body.amount, body.reason);
        try {
            return ResponseEntity.ok(paymentCoordinator.refund(paymentIntentId, body.amount, body.reason));
        } catch (PaymentIntentNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("PAYMENT_NOT_FOUND", e.getMessage()));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse("NOT_REFUNDABLE", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_AMOUNT", e.getMessage()));
        } catch (PaymentProcessorException e) {
            logger.warn("Processor rejected refund of {}: {}", paymentIntentId, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse("REFUND_FAILED", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error refunding {}", paymentIntentId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new ErrorResponse("INTERNAL_ERROR", "Refund failed"));
        }
    }

    /**
     * Open reconciliation records, oldest first
     *
     * GET /api/v1/payments/reconciliation
     */
    @GetMapping("/reconciliation")
    public ResponseEntity<List<ReconciliationRecord>> reconciliation() {
        return ResponseEntity.ok(paymentCoordinator.pendingReconciliation());
    }
}
