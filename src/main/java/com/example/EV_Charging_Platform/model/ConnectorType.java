package com.example.EV_Charging_Platform.model;

import java.util.Locale;

public enum ConnectorType {
    CCS,
    CHADEMO,
    TYPE2,
    TESLA;

    /**
     * Parse the loosely spelled connector names providers report ("CHAdeMO", "Type 2", "NACS", ...)
     *
     * @return matching connector type or null when the value is not recognised
     */
    public static ConnectorType fromProviderValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace(" ", "").replace("_", "").replace("-", "");
        switch (normalized) {
            case "CCS":
            case "CCS1":
            case "CCS2":
            case "COMBO":
                return CCS;
            case "CHADEMO":
                return CHADEMO;
            case "TYPE2":
            case "MENNEKES":
            case "J1772":
                return TYPE2;
            case "TESLA":
            case "NACS":
                return TESLA;
            default:
                return null;
        }
    }
}
