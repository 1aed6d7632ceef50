package com.example.EV_Charging_Platform.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Per-provider error annotation returned next to discovery results
 */
public class ProviderError {

    @JsonProperty("provider")
    public final String provider;

    @JsonProperty("kind")
    public final ErrorKind kind;

    @JsonProperty("message")
    public final String message;

    public ProviderError(String provider, ErrorKind kind, String message) {
        this.provider = Objects.requireNonNull(provider, "Provider cannot be null");
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.message = message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderError that = (ProviderError) o;
        return provider.equals(that.provider) && kind == that.kind && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, kind, message);
    }

    @Override
    public String toString() {
        return String.format("ProviderError{provider='%s', kind=%s, message='%s'}", provider, kind, message);
    }
}
