package com.example.EV_Charging_Platform.provider;

import java.time.Instant;

/**
 * Provider answer to a start request
 */
public class ProviderSessionRef {

    public enum Outcome {
        STARTED,
        CHARGER_BUSY
    }

    public final Outcome outcome;
    public final String nativeSessionId;
    public final Instant startedAt;

    private ProviderSessionRef(Outcome outcome, String nativeSessionId, Instant startedAt) {
        this.outcome = outcome;
        this.nativeSessionId = nativeSessionId;
        this.startedAt = startedAt;
    }

    public static ProviderSessionRef started(String nativeSessionId, Instant startedAt) {
        return new ProviderSessionRef(Outcome.STARTED, nativeSessionId, startedAt);
    }

    public static ProviderSessionRef chargerBusy() {
        return new ProviderSessionRef(Outcome.CHARGER_BUSY, null, null);
    }

    @Override
    public String toString() {
        return String.format("ProviderSessionRef{outcome=%s, nativeSessionId='%s'}", outcome, nativeSessionId);
    }
}
