package com.example.EV_Charging_Platform.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical station, the merge of one or more provider records that
 * describe the same physical site.
 */
public class Station {

    @JsonProperty("id")
    public final String id;

    @JsonProperty("sources")
    public final List<SourceRef> sources;

    @JsonProperty("location")
    public final GeoPoint location;

    @JsonProperty("name")
    public final String name;

    @JsonProperty("address")
    public final String address;

    @JsonProperty("chargers")
    public final List<Charger> chargers;

    @JsonProperty("amenities")
    public final List<String> amenities;

    @JsonProperty("rating")
    public final Double rating;

    @JsonProperty("operatingHours")
    public final String operatingHours;

    public Station(String id, List<SourceRef> sources, GeoPoint location, String name, String address,
                   List<Charger> chargers, List<String> amenities, Double rating, String operatingHours) {
        this.id = Objects.requireNonNull(id, "Station ID cannot be null");
        this.sources = List.copyOf(sources);
        this.location = Objects.requireNonNull(location, "Location cannot be null");
        this.name = name;
        this.address = address;
        this.chargers = List.copyOf(chargers);
        this.amenities = amenities != null ? List.copyOf(amenities) : List.of();
        this.rating = rating;
        this.operatingHours = operatingHours;
    }

    @JsonIgnore
    public boolean hasAvailableCharger() {
        return chargers.stream().anyMatch(charger -> charger.available);
    }

    @JsonIgnore
    public boolean hasConnector(ConnectorType type) {
        return chargers.stream().anyMatch(charger -> charger.connectorType == type);
    }

    public Optional<Charger> findCharger(String chargerId) {
        return chargers.stream().filter(charger -> charger.id.equals(chargerId)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Station) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Station{id='%s', name='%s', sources=%s, chargers=%d}",
                id, name, sources, chargers.size());
    }
}
