package com.example.EV_Charging_Platform.dto;

import com.example.EV_Charging_Platform.model.ConnectorType;
import com.example.EV_Charging_Platform.model.ErrorKind;
import com.example.EV_Charging_Platform.model.Session;

import java.time.Duration;
import java.time.Instant;

/**
 * Data Transfer Object for a charging session as clients see it
 */
public class SessionResponse {

    public String sessionId;
    public String userId;
    public String stationId;
    public String chargerId;
    public String provider;
    public ConnectorType connectorType;
    public String state;
    public Instant createdAt;
    public Instant startedAt;
    public Instant endedAt;
    public double energyDeliveredKwh;
    public double currentPowerKw;
    public Long durationMinutes;
    public Long elapsedMinutes; // running sessions only
    public double pricePerKwh;
    public ErrorKind failureKind;
    public String failureMessage;

    public SessionResponse() {}

    public SessionResponse(Session session, Instant now) {
        this.sessionId = session.getSessionId();
        this.userId = session.getUserId();
        this.stationId = session.getStationId();
        this.chargerId = session.getChargerId();
        this.provider = session.getProvider();
        this.connectorType = session.getConnectorType();
        this.state = session.getState().toString();
        this.createdAt = session.getCreatedAt();
        this.startedAt = session.getStartedAt();
        this.endedAt = session.getEndedAt();
        this.energyDeliveredKwh = session.getEnergyDeliveredKwh();
        this.currentPowerKw = session.getCurrentPowerKw();
        this.durationMinutes = session.getDurationMinutes();
        this.pricePerKwh = session.getPricePerKwh();
        this.failureKind = session.getFailureKind();
        this.failureMessage = session.getFailureMessage();
        if (!session.isTerminal() && session.getStartedAt() != null) {
            this.elapsedMinutes = Math.max(0, Duration.between(session.getStartedAt(), now).toMinutes());
        }
    }
}
