package com.example.EV_Charging_Platform.dto;

import com.example.EV_Charging_Platform.model.GeoPoint;
import com.example.EV_Charging_Platform.model.ProviderError;
import com.example.EV_Charging_Platform.model.Station;
import com.example.EV_Charging_Platform.service.NearbyResult;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Data Transfer Object for a discovery answer
 */
public class NearbyStationsResponse {

    public List<NearbyStation> stations;
    public List<ProviderError> providerErrors;
    public boolean partial;
    public long timestamp;

    public NearbyStationsResponse() {}

    public NearbyStationsResponse(NearbyResult result, GeoPoint center, long timestamp) {
        this.stations = result.getStations().stream()
                .map(station -> new NearbyStation(station, center.distanceMeters(station.location) / 1000.0))
                .collect(Collectors.toList());
        this.providerErrors = result.getProviderErrors();
        this.partial = result.isPartial();
        this.timestamp = timestamp;
    }

    public static class NearbyStation {
        @JsonUnwrapped
        public Station station;
        public double distanceKm;

        public NearbyStation(Station station, double distanceKm) {
            this.station = station;
            this.distanceKm = Math.round(distanceKm * 100.0) / 100.0;
        }
    }
}
