package com.example.EV_Charging_Platform.provider;

import java.time.Instant;

/**
 * Provider view of a session: live progress while active, final figures once ended
 */
public class ProviderSessionSummary {

    public enum Status {
        ACTIVE,
        COMPLETED,
        FAULTED // ended remotely by hardware fault or provider-side timeout
    }

    public final String nativeSessionId;
    public final Status status;
    public final double energyDeliveredKwh;
    public final double currentPowerKw;
    public final Long durationMinutes;
    public final Instant endedAt;

    public ProviderSessionSummary(String nativeSessionId, Status status, double energyDeliveredKwh,
                                  double currentPowerKw, Long durationMinutes, Instant endedAt) {
        this.nativeSessionId = nativeSessionId;
        this.status = status;
        this.energyDeliveredKwh = energyDeliveredKwh;
        this.currentPowerKw = currentPowerKw;
        this.durationMinutes = durationMinutes;
        this.endedAt = endedAt;
    }

    public boolean isEnded() {
        return status != Status.ACTIVE;
    }

    @Override
    public String toString() {
        return String.format("ProviderSessionSummary{id='%s', status=%s, energy=%.2fkWh, power=%.1fkW}",
                nativeSessionId, status, energyDeliveredKwh, currentPowerKw);
    }
}
