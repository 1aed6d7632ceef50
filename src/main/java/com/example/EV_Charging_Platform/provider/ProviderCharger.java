package com.example.EV_Charging_Platform.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provider-native charger payload. Every field may be missing; validation happens during normalization.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProviderCharger {

    @JsonProperty("charger_id")
    public String chargerId;

    @JsonProperty("connector_type")
    public String connectorType;

    @JsonProperty("power_kw")
    public Double powerKw;

    @JsonProperty("available")
    public Boolean available;

    @JsonProperty("price_per_kwh")
    public Double pricePerKwh;

    public ProviderCharger() {}

    public ProviderCharger(String chargerId, String connectorType, Double powerKw, Boolean available, Double pricePerKwh) {
        this.chargerId = chargerId;
        this.connectorType = connectorType;
        this.powerKw = powerKw;
        this.available = available;
        this.pricePerKwh = pricePerKwh;
    }

    public ProviderCharger copy() {
        return new ProviderCharger(chargerId, connectorType, powerKw, available, pricePerKwh);
    }

    @Override
    public String toString() {
        return String.format("ProviderCharger{id='%s', type='%s', available=%s}", chargerId, connectorType, available);
    }
}
