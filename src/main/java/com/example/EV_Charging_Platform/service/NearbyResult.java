package com.example.EV_Charging_Platform.service;

import com.example.EV_Charging_Platform.model.ProviderError;
import com.example.EV_Charging_Platform.model.Station;

import java.util.List;

/**
 * Merged stations plus every per-provider problem met while building them
 */
public class NearbyResult {

    private final List<Station> stations;
    private final List<ProviderError> providerErrors;

    public NearbyResult(List<Station> stations, List<ProviderError> providerErrors) {
        this.stations = List.copyOf(stations);
        this.providerErrors = List.copyOf(providerErrors);
    }

    public List<Station> getStations() { return stations; }
    public List<ProviderError> getProviderErrors() { return providerErrors; }

    public boolean isPartial() {
        return !providerErrors.isEmpty();
    }
}
