package com.example.EV_Charging_Platform.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider-native station payload as an adapter decoded it from the wire.
 * Loosely typed on purpose: nothing of this shape may travel past the normalizer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderStation {

    @JsonProperty("provider")
    public String provider;

    @JsonProperty("station_id")
    public String stationId;

    @JsonProperty("name")
    public String name;

    @JsonProperty("latitude")
    public Double latitude;

    @JsonProperty("longitude")
    public Double longitude;

    @JsonProperty("address")
    public String address;

    @JsonProperty("chargers")
    public List<ProviderCharger> chargers;

    @JsonProperty("amenities")
    public List<String> amenities;

    @JsonProperty("rating")
    public Double rating;

    @JsonProperty("operating_hours")
    public String operatingHours;

    public ProviderStation() {}

    public ProviderStation(String provider, String stationId, String name, Double latitude, Double longitude,
                           String address, List<ProviderCharger> chargers) {
        this.provider = provider;
        this.stationId = stationId;
        this.name = name;
        this.latitude = latitude;
        this.longitude = longitude;
        this.address = address;
        this.chargers = chargers;
    }

    public ProviderStation copy() {
        ProviderStation copy = new ProviderStation(provider, stationId, name, latitude, longitude, address, null);
        if (chargers != null) {
            copy.chargers = new ArrayList<>();
            for (ProviderCharger charger : chargers) {
                copy.chargers.add(charger != null ? charger.copy() : null);
            }
        }
        copy.amenities = amenities != null ? new ArrayList<>(amenities) : null;
        copy.rating = rating;
        copy.operatingHours = operatingHours;
        return copy;
    }

    @Override
    public String toString() {
        return String.format("ProviderStation{provider='%s', id='%s', name='%s', chargers=%d}",
                provider, stationId, name, chargers != null ? chargers.size() : 0);
    }
}
