package com.example.EV_Charging_Platform.provider;

import java.time.Instant;
import java.util.Objects;

/**
 * A provider station payload together with the moment it was read from the provider
 */
public class ProviderSnapshot {

    public final ProviderStation payload;
    public final Instant observedAt;

    public ProviderSnapshot(ProviderStation payload, Instant observedAt) {
        this.payload = Objects.requireNonNull(payload, "Payload cannot be null");
        this.observedAt = Objects.requireNonNull(observedAt, "Observation time cannot be null");
    }

    @Override
    public String toString() {
        return String.format("ProviderSnapshot{%s, observedAt=%s}", payload, observedAt);
    }
}
