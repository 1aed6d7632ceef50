package com.example.EV_Charging_Platform.cache;

import com.example.EV_Charging_Platform.model.ProviderError;

import java.util.Optional;

/**
 * Result of a cache read together with where the value came from.
 * A STALE read carries the STALE_CACHE_SERVED annotation and the failure that forced it.
 */
public class CacheRead<T> {

    public enum Origin {
        FRESH,
        REFRESHED,
        DISCOVERED,
        STALE
    }

    private final T value;
    private final Origin origin;
    private final ProviderError annotation;
    private final ProviderError refreshFailure;

    private CacheRead(T value, Origin origin, ProviderError annotation, ProviderError refreshFailure) {
        this.value = value;
        this.origin = origin;
        this.annotation = annotation;
        this.refreshFailure = refreshFailure;
    }

    static <T> CacheRead<T> of(T value, Origin origin) {
        return new CacheRead<>(value, origin, null, null);
    }

    static <T> CacheRead<T> stale(T value, ProviderError annotation, ProviderError refreshFailure) {
        return new CacheRead<>(value, Origin.STALE, annotation, refreshFailure);
    }

    public T getValue() { return value; }
    public Origin getOrigin() { return origin; }

    public boolean isStale() {
        return origin == Origin.STALE;
    }

    /**
     * Whether serving this read cost a provider call
     */
    public boolean calledProvider() {
        return origin != Origin.FRESH;
    }

    public Optional<ProviderError> getAnnotation() {
        return Optional.ofNullable(annotation);
    }

    public Optional<ProviderError> getRefreshFailure() {
        return Optional.ofNullable(refreshFailure);
    }
}
