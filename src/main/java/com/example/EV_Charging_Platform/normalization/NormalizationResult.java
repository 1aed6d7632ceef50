package com.example.EV_Charging_Platform.normalization;

import com.example.EV_Charging_Platform.model.ProviderError;
import com.example.EV_Charging_Platform.model.Station;

import java.util.List;

public class NormalizationResult {

    public final List<Station> stations;
    public final List<ProviderError> schemaMismatches;

    public NormalizationResult(List<Station> stations, List<ProviderError> schemaMismatches) {
        this.stations = List.copyOf(stations);
        this.schemaMismatches = List.copyOf(schemaMismatches);
    }
}
