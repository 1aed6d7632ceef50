package com.example.EV_Charging_Platform.provider;

import com.example.EV_Charging_Platform.model.ErrorKind;

/**
 * Provider-specific failure translated into the adapter error vocabulary.
 * Expected business states such as a busy charger are result values, not exceptions.
 */
public class ProviderException extends Exception {

    public enum Kind {
        TIMEOUT,
        UNAVAILABLE,
        NOT_FOUND,
        CONFLICT,
        UNAUTHORIZED
    }

    private final String provider;
    private final Kind kind;

    public ProviderException(String provider, Kind kind, String message) {
        super(message);
        this.provider = provider;
        this.kind = kind;
    }

    public ProviderException(String provider, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public String getProvider() { return provider; }
    public Kind getKind() { return kind; }

    /**
     * Only timeouts and outages are worth another attempt
     */
    public boolean isTransient() {
        return kind == Kind.TIMEOUT || kind == Kind.UNAVAILABLE;
    }

    public ErrorKind toErrorKind() {
        switch (kind) {
            case TIMEOUT: return ErrorKind.PROVIDER_TIMEOUT;
            case NOT_FOUND: return ErrorKind.PROVIDER_NOT_FOUND;
            case CONFLICT: return ErrorKind.SESSION_CONFLICT;
            case UNAUTHORIZED: return ErrorKind.PROVIDER_UNAUTHORIZED;
            case UNAVAILABLE:
            default:
                return ErrorKind.PROVIDER_UNAVAILABLE;
        }
    }
}
