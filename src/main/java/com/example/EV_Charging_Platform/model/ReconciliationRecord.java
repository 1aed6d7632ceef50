package com.example.EV_Charging_Platform.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Durable marker for a session/payment pair that needs manual or scheduled follow-up
 */
public class ReconciliationRecord {

    public enum Reason {
        CAPTURE_FAILED,
        STOP_UNCONFIRMED
    }

    @JsonProperty("id")
    private String id;
    @JsonProperty("sessionId")
    private String sessionId;
    @JsonProperty("paymentIntentId")
    private String paymentIntentId;
    @JsonProperty("amount")
    private BigDecimal amount;
    @JsonProperty("reason")
    private Reason reason;
    @JsonProperty("detail")
    private volatile String detail;
    @JsonProperty("attempts")
    private volatile int attempts;
    @JsonProperty("resolved")
    private volatile boolean resolved;
    @JsonProperty("createdAt")
    private Instant createdAt;
    @JsonProperty("updatedAt")
    private volatile Instant updatedAt;

    protected ReconciliationRecord() {
        // Jackson
    }

    public ReconciliationRecord(String id, String sessionId, String paymentIntentId, BigDecimal amount,
                                Reason reason, String detail, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "Record ID cannot be null");
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.paymentIntentId = paymentIntentId;
        this.amount = amount;
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
        this.detail = detail;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getId() { return id; }
    public String getSessionId() { return sessionId; }
    public String getPaymentIntentId() { return paymentIntentId; }
    public BigDecimal getAmount() { return amount; }
    public Reason getReason() { return reason; }
    public String getDetail() { return detail; }
    public int getAttempts() { return attempts; }
    public boolean isResolved() { return resolved; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void recordAttempt(String detail, Instant now) {
        this.attempts++;
        this.detail = detail;
        this.updatedAt = now;
    }

    public void resolve(Instant now) {
        this.resolved = true;
        this.updatedAt = now;
    }

    @Override
    public String toString() {
        return String.format("ReconciliationRecord{id='%s', session='%s', reason=%s, amount=%s, resolved=%s}",
                id, sessionId, reason, amount, resolved);
    }
}
