package com.example.EV_Charging_Platform.provider;

import com.example.EV_Charging_Platform.model.GeoPoint;

import java.time.Duration;
import java.util.List;

/**
 * Capability every charging network integration implements.
 *
 * Implementations translate provider error codes into {@link ProviderException.Kind}
 * and report expected business states (a busy charger) as result values.
 */
public interface ProviderAdapter {

    /**
     * Stable provider name, also the prefix of canonical charger ids
     */
    String name();

    /**
     * Upper bound for a single call to this provider
     */
    Duration timeout();

    List<ProviderStation> listNearby(GeoPoint center, double radiusMeters) throws ProviderException;

    ProviderStation getStation(String nativeId) throws ProviderException;

    ProviderSessionRef startSession(String nativeChargerId) throws ProviderException;

    ProviderSessionSummary stopSession(String nativeSessionId) throws ProviderException;

    ProviderSessionSummary getSessionStatus(String nativeSessionId) throws ProviderException;

    /**
     * Re-acquire credentials after an UNAUTHORIZED answer. Callers retry at most once afterwards.
     */
    default void refreshCredentials() throws ProviderException {
        throw new ProviderException(name(), ProviderException.Kind.UNAUTHORIZED,
                "Provider " + name() + " has no refreshable credentials");
    }

    default boolean supportsPush() {
        return false;
    }

    default void subscribe(StationUpdateListener listener) {
        // poll-only providers have nothing to stream
    }
}
