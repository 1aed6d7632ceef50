package com.example.EV_Charging_Platform.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Charging session as tracked locally. Mutated only by the session coordinator,
 * which serializes every operation on one session id.
 */
public class Session {

    public enum State {
        REQUESTED,
        STARTING,
        ACTIVE,
        STOPPING,
        COMPLETED,
        FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }

        public boolean canTransitionTo(State next) {
            if (next == FAILED) {
                return !isTerminal();
            }
            switch (this) {
                case REQUESTED: return next == STARTING;
                case STARTING: return next == ACTIVE;
                case ACTIVE: return next == STOPPING;
                case STOPPING: return next == COMPLETED;
                default: return false;
            }
        }
    }

    @JsonProperty("sessionId")
    private String sessionId;
    @JsonProperty("userId")
    private String userId;
    @JsonProperty("stationId")
    private String stationId;
    @JsonProperty("chargerId")
    private String chargerId;
    @JsonProperty("provider")
    private String provider;
    @JsonProperty("nativeChargerId")
    private String nativeChargerId;
    @JsonProperty("connectorType")
    private ConnectorType connectorType;
    @JsonProperty("providerSessionId")
    private volatile String providerSessionId;
    @JsonProperty("state")
    private volatile State state = State.REQUESTED;
    @JsonProperty("createdAt")
    private Instant createdAt;
    @JsonProperty("startedAt")
    private volatile Instant startedAt;
    @JsonProperty("endedAt")
    private volatile Instant endedAt;
    @JsonProperty("energyDeliveredKwh")
    private volatile double energyDeliveredKwh;
    @JsonProperty("currentPowerKw")
    private volatile double currentPowerKw;
    @JsonProperty("durationMinutes")
    private volatile Long durationMinutes;
    @JsonProperty("pricePerKwh")
    private double pricePerKwh;
    @JsonProperty("failureKind")
    private volatile ErrorKind failureKind;
    @JsonProperty("failureMessage")
    private volatile String failureMessage;
    @JsonProperty("lastUpdateTime")
    private volatile Instant lastUpdateTime;

    protected Session() {
        // Jackson
    }

    public Session(String sessionId, String userId, String stationId, String chargerId, String provider,
                   String nativeChargerId, double pricePerKwh, Instant createdAt) {
        this(sessionId, userId, stationId, chargerId, provider, nativeChargerId, null, pricePerKwh, createdAt);
    }

    public Session(String sessionId, String userId, String stationId, String chargerId, String provider,
                   String nativeChargerId, ConnectorType connectorType, double pricePerKwh, Instant createdAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.userId = Objects.requireNonNull(userId, "User ID cannot be null");
        this.stationId = Objects.requireNonNull(stationId, "Station ID cannot be null");
        this.chargerId = Objects.requireNonNull(chargerId, "Charger ID cannot be null");
        this.provider = Objects.requireNonNull(provider, "Provider cannot be null");
        this.nativeChargerId = Objects.requireNonNull(nativeChargerId, "Native charger ID cannot be null");
        this.connectorType = connectorType;
        this.pricePerKwh = Math.max(0, pricePerKwh);
        this.createdAt = Objects.requireNonNull(createdAt, "Creation time cannot be null");
        this.lastUpdateTime = createdAt;
    }

    public String getSessionId() { return sessionId; }
    public String getUserId() { return userId; }
    public String getStationId() { return stationId; }
    public String getChargerId() { return chargerId; }
    public String getProvider() { return provider; }
    public String getNativeChargerId() { return nativeChargerId; }
    public ConnectorType getConnectorType() { return connectorType; }
    public String getProviderSessionId() { return providerSessionId; }
    public State getState() { return state; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getEndedAt() { return endedAt; }
    public double getEnergyDeliveredKwh() { return energyDeliveredKwh; }
    public double getCurrentPowerKw() { return currentPowerKw; }
    public Long getDurationMinutes() { return durationMinutes; }
    public double getPricePerKwh() { return pricePerKwh; }
    public ErrorKind getFailureKind() { return failureKind; }
    public String getFailureMessage() { return failureMessage; }
    public Instant getLastUpdateTime() { return lastUpdateTime; }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    @JsonIgnore
    public String getClaimKey() {
        return claimKey(userId, chargerId);
    }

    public static String claimKey(String userId, String chargerId) {
        return userId + "|" + chargerId;
    }

    /**
     * Move along the session graph, rejecting anything the graph does not allow
     */
    public void transitionTo(State next, Instant now) {
        State current = this.state;
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateTransitionException(sessionId, current, next);
        }
        this.state = next;
        this.lastUpdateTime = now;
    }

    public void markActive(String providerSessionId, Instant startedAt, Instant now) {
        transitionTo(State.ACTIVE, now);
        this.providerSessionId = Objects.requireNonNull(providerSessionId, "Provider session ID cannot be null");
        this.startedAt = startedAt != null ? startedAt : now;
    }

    /**
     * Energy reported by providers only grows; a lower reading never erases delivered energy.
     */
    public void recordProgress(double energyKwh, double powerKw, Instant now) {
        this.energyDeliveredKwh = Math.max(this.energyDeliveredKwh, Math.max(0, energyKwh));
        this.currentPowerKw = Math.max(0, powerKw);
        this.lastUpdateTime = now;
    }

    public void complete(double energyKwh, Long durationMinutes, Instant endedAt, Instant now) {
        transitionTo(State.COMPLETED, now);
        this.energyDeliveredKwh = Math.max(this.energyDeliveredKwh, Math.max(0, energyKwh));
        this.currentPowerKw = 0;
        this.endedAt = endedAt != null ? endedAt : now;
        this.durationMinutes = durationMinutes != null ? durationMinutes : computeDurationMinutes(this.endedAt);
    }

    public void fail(ErrorKind kind, String message, Instant now) {
        transitionTo(State.FAILED, now);
        this.failureKind = kind;
        this.failureMessage = message;
        this.currentPowerKw = 0;
        this.endedAt = now;
        if (startedAt != null) {
            this.durationMinutes = computeDurationMinutes(now);
        }
    }

    private Long computeDurationMinutes(Instant end) {
        if (startedAt == null || end == null) {
            return 0L;
        }
        return Math.max(0, Duration.between(startedAt, end).toMinutes());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Session session = (Session) o;
        return sessionId.equals(session.sessionId);
    }

    @Override
    public int hashCode() {
        return sessionId.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Session{id='%s', user='%s', charger='%s', providerSession='%s', state=%s, energy=%.2fkWh}",
                sessionId, userId, chargerId, providerSessionId, state, energyDeliveredKwh);
    }
}
