package com.example.EV_Charging_Platform.service;

import com.example.EV_Charging_Platform.model.Charger;
import com.example.EV_Charging_Platform.model.ConnectorType;
import com.example.EV_Charging_Platform.model.GeoPoint;
import com.example.EV_Charging_Platform.model.Station;

import java.time.Duration;
import java.util.Objects;

/**
 * Discovery request: where to look and which chargers qualify a station.
 * Charger-level filters must all hold for one and the same charger.
 */
public class NearbyQuery {

    private final GeoPoint center;
    private final double radiusMeters;
    private ConnectorType connectorType;
    private boolean availableOnly;
    private Double minPowerKw;
    private Double maxPricePerKwh;
    private Duration deadline;

    public NearbyQuery(GeoPoint center, double radiusMeters) {
        if (radiusMeters <= 0) {
            throw new IllegalArgumentException("Radius must be positive: " + radiusMeters);
        }
        this.center = Objects.requireNonNull(center, "Center cannot be null");
        this.radiusMeters = radiusMeters;
    }

    public NearbyQuery connectorType(ConnectorType connectorType) {
        this.connectorType = connectorType;
        return this;
    }

    public NearbyQuery availableOnly(boolean availableOnly) {
        this.availableOnly = availableOnly;
        return this;
    }

    public NearbyQuery minPowerKw(Double minPowerKw) {
        this.minPowerKw = minPowerKw;
        return this;
    }

    public NearbyQuery maxPricePerKwh(Double maxPricePerKwh) {
        this.maxPricePerKwh = maxPricePerKwh;
        return this;
    }

    /**
     * Overall caller deadline; null means the aggregator default
     */
    public NearbyQuery deadline(Duration deadline) {
        this.deadline = deadline;
        return this;
    }

    public GeoPoint getCenter() { return center; }
    public double getRadiusMeters() { return radiusMeters; }
    public ConnectorType getConnectorType() { return connectorType; }
    public boolean isAvailableOnly() { return availableOnly; }
    public Double getMinPowerKw() { return minPowerKw; }
    public Double getMaxPricePerKwh() { return maxPricePerKwh; }
    public Duration getDeadline() { return deadline; }

    public boolean matches(Station station) {
        if (center.distanceMeters(station.location) > radiusMeters) {
            return false;
        }
        if (!hasChargerFilter()) {
            return true;
        }
        return station.chargers.stream().anyMatch(this::matches);
    }

    boolean matches(Charger charger) {
        if (connectorType != null && charger.connectorType != connectorType) return false;
        if (availableOnly && !charger.available) return false;
        if (minPowerKw != null && charger.powerKw < minPowerKw) return false;
        // an unpriced charger cannot prove it is under the limit
        if (maxPricePerKwh != null && (charger.pricePerKwh == null || charger.pricePerKwh > maxPricePerKwh)) return false;
        return true;
    }

    private boolean hasChargerFilter() {
        return connectorType != null || availableOnly || minPowerKw != null || maxPricePerKwh != null;
    }

    @Override
    public String toString() {
        return String.format("NearbyQuery{center=(%.5f,%.5f), radius=%.0fm, connector=%s, availableOnly=%s}",
                center.latitude, center.longitude, radiusMeters, connectorType, availableOnly);
    }
}
