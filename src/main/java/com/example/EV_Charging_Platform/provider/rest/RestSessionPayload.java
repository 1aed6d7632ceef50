package com.example.EV_Charging_Platform.provider.rest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Session body exchanged with JSON-over-HTTP providers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RestSessionPayload {

    @JsonProperty("session_id")
    public String sessionId;

    @JsonProperty("status")
    public String status;

    @JsonProperty("started_at")
    public String startedAt;

    @JsonProperty("ended_at")
    public String endedAt;

    @JsonProperty("energy_delivered_kwh")
    public Double energyDeliveredKwh;

    @JsonProperty("current_power_kw")
    public Double currentPowerKw;

    @JsonProperty("duration_minutes")
    public Long durationMinutes;

    @JsonProperty("elapsed_minutes")
    public Long elapsedMinutes;

    public RestSessionPayload() {}
}
