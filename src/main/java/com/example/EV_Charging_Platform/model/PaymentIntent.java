package com.example.EV_Charging_Platform.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Local record of one capture attempt series for a session. Mutated only by the
 * payment coordinator, always while holding the lock of its idempotency key.
 */
public class PaymentIntent {

    public enum State {
        PENDING,
        CAPTURED,
        FAILED,
        REFUNDED
    }

    @JsonProperty("id")
    private String id;
    @JsonProperty("sessionId")
    private String sessionId;
    @JsonProperty("amount")
    private BigDecimal amount;
    @JsonProperty("currency")
    private String currency;
    @JsonProperty("idempotencyKey")
    private String idempotencyKey;
    @JsonProperty("state")
    private volatile State state = State.PENDING;
    @JsonProperty("processorReference")
    private volatile String processorReference;
    @JsonProperty("refundedAmount")
    private volatile BigDecimal refundedAmount = BigDecimal.ZERO;
    @JsonProperty("failureReason")
    private volatile String failureReason;
    @JsonProperty("attempts")
    private volatile int attempts;
    @JsonProperty("createdAt")
    private Instant createdAt;
    @JsonProperty("updatedAt")
    private volatile Instant updatedAt;

    protected PaymentIntent() {
        // Jackson
    }

    public PaymentIntent(String id, String sessionId, BigDecimal amount, String currency,
                         String idempotencyKey, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "Payment intent ID cannot be null");
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.amount = Objects.requireNonNull(amount, "Amount cannot be null");
        this.currency = Objects.requireNonNull(currency, "Currency cannot be null");
        this.idempotencyKey = Objects.requireNonNull(idempotencyKey, "Idempotency key cannot be null");
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getId() { return id; }
    public String getSessionId() { return sessionId; }
    public BigDecimal getAmount() { return amount; }
    public String getCurrency() { return currency; }
    public String getIdempotencyKey() { return idempotencyKey; }
    public State getState() { return state; }
    public String getProcessorReference() { return processorReference; }
    public BigDecimal getRefundedAmount() { return refundedAmount; }
    public String getFailureReason() { return failureReason; }
    public int getAttempts() { return attempts; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public void recordAttempt(Instant now) {
        this.attempts++;
        this.updatedAt = now;
    }

    public void markCaptured(String processorReference, Instant now) {
        requireState(State.PENDING, State.CAPTURED);
        this.processorReference = processorReference;
        this.failureReason = null;
        this.state = State.CAPTURED;
        this.updatedAt = now;
    }

    public void markFailed(String reason, Instant now) {
        requireState(State.PENDING, State.FAILED);
        this.failureReason = reason;
        this.state = State.FAILED;
        this.updatedAt = now;
    }

    /**
     * Failed intents go back to pending when the scheduled reconciliation retries them
     * under the same idempotency key.
     */
    public void reopen(Instant now) {
        requireState(State.FAILED, State.PENDING);
        this.state = State.PENDING;
        this.updatedAt = now;
    }

    public void markRefunded(BigDecimal refunded, Instant now) {
        requireState(State.CAPTURED, State.REFUNDED);
        this.refundedAmount = refunded;
        this.state = State.REFUNDED;
        this.updatedAt = now;
    }

    private void requireState(State expected, State target) {
        if (state != expected) {
            throw new IllegalStateException(String.format(
                    "Payment intent %s cannot move from %s to %s", id, state, target));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((PaymentIntent) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("PaymentIntent{id='%s', session='%s', amount=%s %s, state=%s, key='%s'}",
                id, sessionId, amount, currency, state, idempotencyKey);
    }
}
