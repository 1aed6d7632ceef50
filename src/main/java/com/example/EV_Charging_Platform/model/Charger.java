package com.example.EV_Charging_Platform.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Canonical, bookable charger. Identity is always provider-scoped:
 * two providers reporting the same physical plug yield two chargers.
 */
public class Charger {

    @JsonProperty("id")
    public final String id;

    @JsonProperty("stationId")
    public final String stationId;

    @JsonProperty("provider")
    public final String provider;

    @JsonProperty("nativeId")
    public final String nativeId;

    @JsonProperty("connectorType")
    public final ConnectorType connectorType;

    @JsonProperty("powerKw")
    public final double powerKw;

    @JsonProperty("available")
    public final boolean available; // provider-asserted, may be stale

    @JsonProperty("pricePerKwh")
    public final Double pricePerKwh;

    @JsonProperty("lastRefreshed")
    public final Instant lastRefreshed;

    public Charger(String stationId, String provider, String nativeId, ConnectorType connectorType,
                   double powerKw, boolean available, Double pricePerKwh, Instant lastRefreshed) {
        this.provider = Objects.requireNonNull(provider, "Provider cannot be null");
        this.nativeId = Objects.requireNonNull(nativeId, "Native charger ID cannot be null");
        this.id = canonicalId(provider, nativeId);
        this.stationId = Objects.requireNonNull(stationId, "Station ID cannot be null");
        this.connectorType = Objects.requireNonNull(connectorType, "Connector type cannot be null");
        this.powerKw = Math.max(0, powerKw);
        this.available = available;
        this.pricePerKwh = pricePerKwh;
        this.lastRefreshed = lastRefreshed;
    }

    public static String canonicalId(String provider, String nativeChargerId) {
        return provider + ":" + nativeChargerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Charger) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Charger{id='%s', type=%s, power=%.1fkW, available=%s}",
                id, connectorType, powerKw, available);
    }
}
