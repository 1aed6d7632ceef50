package com.example.EV_Charging_Platform.service;

import com.example.EV_Charging_Platform.model.ConnectorType;

/**
 * A bookable charger reduced to what a session start needs
 */
public class ResolvedCharger {

    public final String stationId;
    public final String chargerId;
    public final String provider;
    public final String nativeChargerId;
    public final Double pricePerKwh; // null when the provider published no price
    public final ConnectorType connectorType; // null when the station is not in the directory

    public ResolvedCharger(String stationId, String chargerId, String provider, String nativeChargerId, Double pricePerKwh) {
        this(stationId, chargerId, provider, nativeChargerId, pricePerKwh, null);
    }

    public ResolvedCharger(String stationId, String chargerId, String provider, String nativeChargerId,
                           Double pricePerKwh, ConnectorType connectorType) {
        this.stationId = stationId;
        this.chargerId = chargerId;
        this.provider = provider;
        this.nativeChargerId = nativeChargerId;
        this.pricePerKwh = pricePerKwh;
        this.connectorType = connectorType;
    }

    @Override
    public String toString() {
        return String.format("ResolvedCharger{station='%s', charger='%s'}", stationId, chargerId);
    }
}
