package com.example.EV_Charging_Platform.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * (provider, provider-native id) pair a canonical station was built from
 */
public class SourceRef {

    @JsonProperty("provider")
    public final String provider;

    @JsonProperty("nativeId")
    public final String nativeId;

    @JsonCreator
    public SourceRef(@JsonProperty("provider") String provider, @JsonProperty("nativeId") String nativeId) {
        this.provider = Objects.requireNonNull(provider, "Provider cannot be null");
        this.nativeId = Objects.requireNonNull(nativeId, "Native ID cannot be null");
    }

    public String key() {
        return provider + ":" + nativeId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceRef sourceRef = (SourceRef) o;
        return provider.equals(sourceRef.provider) && nativeId.equals(sourceRef.nativeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, nativeId);
    }

    @Override
    public String toString() {
        return key();
    }
}
