package com.example.EV_Charging_Platform.model;

/**
 * Error taxonomy shared by discovery, session and payment handling.
 * STALE_CACHE_SERVED is informational only, the read itself succeeded.
 */
public enum ErrorKind {
    PROVIDER_TIMEOUT,
    PROVIDER_UNAVAILABLE,
    PROVIDER_NOT_FOUND,
    PROVIDER_UNAUTHORIZED,
    SCHEMA_MISMATCH,
    SESSION_CONFLICT,
    PAYMENT_CAPTURE_FAILED,
    STALE_CACHE_SERVED;

    public boolean isSoft() {
        return this == STALE_CACHE_SERVED;
    }
}
