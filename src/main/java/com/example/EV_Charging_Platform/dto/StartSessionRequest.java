package com.example.EV_Charging_Platform.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Data Transfer Object for starting a charging session
 */
public class StartSessionRequest {

    @NotBlank
    public String userId;

    @NotBlank
    public String stationId;

    @NotBlank
    public String chargerId; // canonical id, provider:nativeChargerId

    public StartSessionRequest() {}

    public StartSessionRequest(String userId, String stationId, String chargerId) {
        this.userId = userId;
        this.stationId = stationId;
        this.chargerId = chargerId;
    }
}
