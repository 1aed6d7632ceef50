package com.example.EV_Charging_Platform.dto;

import com.example.EV_Charging_Platform.model.Station;

import java.time.Instant;

/**
 * Data Transfer Object for the availability summary of one station
 */
public class StationAvailabilityResponse {

    public String stationId;
    public int availableChargers;
    public int totalChargers;
    public Instant lastUpdated; // oldest charger refresh, i.e. how stale the summary can be

    public StationAvailabilityResponse() {}

    public StationAvailabilityResponse(Station station) {
        this.stationId = station.id;
        this.totalChargers = station.chargers.size();
        this.availableChargers = (int) station.chargers.stream().filter(charger -> charger.available).count();
        this.lastUpdated = station.chargers.stream()
                .map(charger -> charger.lastRefreshed)
                .filter(refreshed -> refreshed != null)
                .min(Instant::compareTo)
                .orElse(null);
    }
}
