package com.example.EV_Charging_Platform.provider.rest;

import com.example.EV_Charging_Platform.model.GeoPoint;
import com.example.EV_Charging_Platform.provider.ProviderAdapter;
import com.example.EV_Charging_Platform.provider.ProviderException;
import com.example.EV_Charging_Platform.provider.ProviderSessionRef;
import com.example.EV_Charging_Platform.provider.ProviderSessionSummary;
import com.example.EV_Charging_Platform.provider.ProviderStation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Adapter for providers exposing a JSON-over-HTTP station and session API.
 *
 * Endpoints (relative to the configured base URL):
 * - GET  /stations/nearby?latitude=..&longitude=..&radius=..
 * - GET  /stations/{id}
 * - POST /sessions                 {"charger_id": ..}
 * - POST /sessions/{id}/stop
 * - GET  /sessions/{id}
 *
 * HTTP statuses are mapped onto {@link ProviderException.Kind}; a 409 on start is a busy
 * charger and therefore a result value, not an error.
 */
public class RestProviderAdapter implements ProviderAdapter {

    private static final Logger logger = LoggerFactory.getLogger(RestProviderAdapter.class);

    private static final ParameterizedTypeReference<List<ProviderStation>> STATION_LIST =
            new ParameterizedTypeReference<List<ProviderStation>>() {};

    private final String name;
    private final WebClient webClient;
    private final Duration timeout;
    private final CredentialSource credentials;

    public RestProviderAdapter(String name, WebClient webClient, Duration timeout, CredentialSource credentials) {
        this.name = name;
        this.webClient = webClient;
        this.timeout = timeout;
        this.credentials = credentials;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public List<ProviderStation> listNearby(GeoPoint center, double radiusMeters) throws ProviderException {
        List<ProviderStation> stations = exchange("listNearby", webClient.get()
                .uri(uri -> uri.path("/stations/nearby")
                        .queryParam("latitude", center.latitude)
                        .queryParam("longitude", center.longitude)
                        .queryParam("radius", (long) radiusMeters)
                        .build())
                .headers(headers -> headers.setBearerAuth(credentials.currentToken()))
                .retrieve()
                .bodyToMono(STATION_LIST));
        if (stations == null) {
            return List.of();
        }
        stations.forEach(station -> station.provider = name);
        return stations;
    }

    @Override
    public ProviderStation getStation(String nativeId) throws ProviderException {
        ProviderStation station = exchange("getStation", webClient.get()
                .uri("/stations/{id}", nativeId)
                .headers(headers -> headers.setBearerAuth(credentials.currentToken()))
                .retrieve()
                .bodyToMono(ProviderStation.class));
        if (station == null) {
            throw new ProviderException(name, ProviderException.Kind.NOT_FOUND, "Empty body for station " + nativeId);
        }
        station.provider = name;
        return station;
    }

    @Override
    public ProviderSessionRef startSession(String nativeChargerId) throws ProviderException {
        RestSessionPayload payload;
        try {
            payload = exchange("startSession", webClient.post()
                    .uri("/sessions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(credentials.currentToken()))
                    .bodyValue(Map.of("charger_id", nativeChargerId))
                    .retrieve()
                    .bodyToMono(RestSessionPayload.class));
        } catch (ProviderException e) {
            if (e.getKind() == ProviderException.Kind.CONFLICT) {
                return ProviderSessionRef.chargerBusy();
            }
            throw e;
        }

        if (payload == null || payload.sessionId == null) {
            if (payload != null && "busy".equalsIgnoreCase(payload.status)) {
                return ProviderSessionRef.chargerBusy();
            }
            throw new ProviderException(name, ProviderException.Kind.UNAVAILABLE, "Start answer carried no session id");
        }
        return ProviderSessionRef.started(payload.sessionId, parseTimestamp(payload.startedAt));
    }

    @Override
    public ProviderSessionSummary stopSession(String nativeSessionId) throws ProviderException {
        RestSessionPayload payload = exchange("stopSession", webClient.post()
                .uri("/sessions/{id}/stop", nativeSessionId)
                .headers(headers -> headers.setBearerAuth(credentials.currentToken()))
                .retrieve()
                .bodyToMono(RestSessionPayload.class));
        return toSummary(nativeSessionId, payload, ProviderSessionSummary.Status.COMPLETED);
    }

    @Override
    public ProviderSessionSummary getSessionStatus(String nativeSessionId) throws ProviderException {
        RestSessionPayload payload = exchange("getSessionStatus", webClient.get()
                .uri("/sessions/{id}", nativeSessionId)
                .headers(headers -> headers.setBearerAuth(credentials.currentToken()))
                .retrieve()
                .bodyToMono(RestSessionPayload.class));
        return toSummary(nativeSessionId, payload, ProviderSessionSummary.Status.ACTIVE);
    }

    @Override
    public void refreshCredentials() throws ProviderException {
        credentials.refresh();
        logger.info("Refreshed credentials for provider {}", name);
    }

    private <T> T exchange(String operation, Mono<T> call) throws ProviderException {
        try {
            return call.timeout(timeout).block();
        } catch (WebClientResponseException e) {
            throw new ProviderException(name, kindFor(e.getStatusCode().value()),
                    operation + " answered HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw new ProviderException(name, ProviderException.Kind.UNAVAILABLE,
                    operation + " could not reach provider: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new ProviderException(name, ProviderException.Kind.TIMEOUT,
                        operation + " exceeded " + timeout.toMillis() + "ms", cause);
            }
            throw new ProviderException(name, ProviderException.Kind.UNAVAILABLE,
                    operation + " failed: " + e.getMessage(), e);
        }
    }

    static ProviderException.Kind kindFor(int status) {
        if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
            return ProviderException.Kind.UNAUTHORIZED;
        }
        if (status == HttpStatus.NOT_FOUND.value()) {
            return ProviderException.Kind.NOT_FOUND;
        }
        if (status == HttpStatus.CONFLICT.value()) {
            return ProviderException.Kind.CONFLICT;
        }
        if (status == HttpStatus.REQUEST_TIMEOUT.value() || status == HttpStatus.GATEWAY_TIMEOUT.value()) {
            return ProviderException.Kind.TIMEOUT;
        }
        return ProviderException.Kind.UNAVAILABLE;
    }

    private ProviderSessionSummary toSummary(String nativeSessionId, RestSessionPayload payload,
                                             ProviderSessionSummary.Status fallback) throws ProviderException {
        if (payload == null) {
            throw new ProviderException(name, ProviderException.Kind.UNAVAILABLE,
                    "Empty session body for " + nativeSessionId);
        }
        ProviderSessionSummary.Status status = parseStatus(payload.status, fallback);
        Long minutes = payload.durationMinutes != null ? payload.durationMinutes : payload.elapsedMinutes;
        return new ProviderSessionSummary(
                payload.sessionId != null ? payload.sessionId : nativeSessionId,
                status,
                payload.energyDeliveredKwh != null ? payload.energyDeliveredKwh : 0.0,
                payload.currentPowerKw != null ? payload.currentPowerKw : 0.0,
                minutes,
                parseTimestamp(payload.endedAt));
    }

    static ProviderSessionSummary.Status parseStatus(String raw, ProviderSessionSummary.Status fallback) {
        if (raw == null) {
            return fallback;
        }
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "active":
            case "charging":
                return ProviderSessionSummary.Status.ACTIVE;
            case "completed":
            case "stopped":
                return ProviderSessionSummary.Status.COMPLETED;
            case "faulted":
            case "error":
            case "terminated":
                return ProviderSessionSummary.Status.FAULTED;
            default:
                return fallback;
        }
    }

    /**
     * Providers send either ISO instants or zone-less local timestamps (taken as UTC)
     */
    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                logger.debug("Unparseable provider timestamp '{}'", raw);
                return null;
            }
        }
    }
}
