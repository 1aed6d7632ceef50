package com.example.EV_Charging_Platform.provider.simulated;

import com.example.EV_Charging_Platform.model.GeoPoint;
import com.example.EV_Charging_Platform.provider.ProviderAdapter;
import com.example.EV_Charging_Platform.provider.ProviderCharger;
import com.example.EV_Charging_Platform.provider.ProviderException;
import com.example.EV_Charging_Platform.provider.ProviderSessionRef;
import com.example.EV_Charging_Platform.provider.ProviderSessionSummary;
import com.example.EV_Charging_Platform.provider.ProviderStation;
import com.example.EV_Charging_Platform.provider.StationUpdateListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory charging network.
 *
 * Stands in for a real provider backend in local runs and tests: stations come from a
 * fixture, sessions accrue energy from the charger's rated power, and latency and
 * failures can be injected per operation.
 */
public class SimulatedProviderAdapter implements ProviderAdapter {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedProviderAdapter.class);

    public static final String LIST_NEARBY = "listNearby";
    public static final String GET_STATION = "getStation";
    public static final String START_SESSION = "startSession";
    public static final String STOP_SESSION = "stopSession";
    public static final String SESSION_STATUS = "getSessionStatus";

    private final String name;
    private final Duration timeout;
    private final boolean pushCapable;
    private final Clock clock;

    private final Map<String, ProviderStation> stations = new ConcurrentHashMap<>();
    private final Map<String, String> chargerToStation = new ConcurrentHashMap<>();
    private final Map<String, SimulatedSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> occupiedChargers = new ConcurrentHashMap<>();
    private final List<StationUpdateListener> listeners = new CopyOnWriteArrayList<>();

    private final Map<String, AtomicInteger> callCounts = new ConcurrentHashMap<>();
    private final Map<String, Queue<ProviderException.Kind>> scriptedFailures = new ConcurrentHashMap<>();
    private final AtomicInteger credentialRefreshes = new AtomicInteger();
    private final AtomicInteger unkeyed = new AtomicInteger();

    private volatile Duration latency = Duration.ZERO;
    private volatile ProviderException.Kind outage;
    private volatile boolean credentialsExpired;

    public SimulatedProviderAdapter(String name, Duration timeout, boolean pushCapable, Clock clock,
                                    Collection<ProviderStation> seed) {
        this.name = name;
        this.timeout = timeout;
        this.pushCapable = pushCapable;
        this.clock = clock;
        seed.forEach(this::putStation);
        logger.info("Simulated provider {} initialized with {} stations (push={})", name, stations.size(), pushCapable);
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
    public boolean supportsPush() {
        return pushCapable;
    }

    @Override
    public void subscribe(StationUpdateListener listener) {
        if (pushCapable) {
            listeners.add(listener);
        }
    }

    @Override
    public List<ProviderStation> listNearby(GeoPoint center, double radiusMeters) throws ProviderException {
        enter(LIST_NEARBY);
        return stations.values().stream()
                .filter(station -> withinRadius(station, center, radiusMeters))
                .map(ProviderStation::copy)
                .collect(Collectors.toList());
    }

    @Override
    public ProviderStation getStation(String nativeId) throws ProviderException {
        enter(GET_STATION);
        ProviderStation station = stations.get(nativeId);
        if (station == null) {
            throw new ProviderException(name, ProviderException.Kind.NOT_FOUND, "Unknown station " + nativeId);
        }
        return station.copy();
    }

    @Override
    public ProviderSessionRef startSession(String nativeChargerId) throws ProviderException {
        enter(START_SESSION);
        ProviderCharger charger = findCharger(nativeChargerId);
        if (charger == null) {
            throw new ProviderException(name, ProviderException.Kind.NOT_FOUND, "Unknown charger " + nativeChargerId);
        }

        String nativeSessionId = name + "_session_" + UUID.randomUUID();
        if (occupiedChargers.putIfAbsent(nativeChargerId, nativeSessionId) != null) {
            logger.debug("Charger {} on {} is busy", nativeChargerId, name);
            return ProviderSessionRef.chargerBusy();
        }

        Instant now = clock.instant();
        double powerKw = charger.powerKw != null ? charger.powerKw : 0.0;
        sessions.put(nativeSessionId, new SimulatedSession(nativeSessionId, nativeChargerId, powerKw, now));
        setAvailability(nativeChargerId, false);
        logger.debug("Provider {} started session {} on charger {}", name, nativeSessionId, nativeChargerId);
        return ProviderSessionRef.started(nativeSessionId, now);
    }

    @Override
    public ProviderSessionSummary stopSession(String nativeSessionId) throws ProviderException {
        enter(STOP_SESSION);
        SimulatedSession session = requireSession(nativeSessionId);
        synchronized (session) {
            if (session.status == ProviderSessionSummary.Status.ACTIVE) {
                session.end(ProviderSessionSummary.Status.COMPLETED, session.energyAt(clock.instant()), clock.instant());
                release(session);
            }
            return session.summary(clock.instant());
        }
    }

    @Override
    public ProviderSessionSummary getSessionStatus(String nativeSessionId) throws ProviderException {
        enter(SESSION_STATUS);
        SimulatedSession session = requireSession(nativeSessionId);
        synchronized (session) {
            return session.summary(clock.instant());
        }
    }

    @Override
    public void refreshCredentials() {
        credentialRefreshes.incrementAndGet();
        credentialsExpired = false;
    }

    // Simulation controls

    public void setLatency(Duration latency) {
        this.latency = latency != null ? latency : Duration.ZERO;
    }

    /**
     * Every call fails with the given kind until cleared with null
     */
    public void setOutage(ProviderException.Kind kind) {
        this.outage = kind;
    }

    /**
     * The next {@code times} calls of {@code operation} fail with {@code kind}
     */
    public void failNext(String operation, ProviderException.Kind kind, int times) {
        Queue<ProviderException.Kind> queue = scriptedFailures.computeIfAbsent(operation, k -> new ConcurrentLinkedQueue<>());
        for (int i = 0; i < times; i++) {
            queue.add(kind);
        }
    }

    public void expireCredentials() {
        this.credentialsExpired = true;
    }

    public int getCredentialRefreshes() {
        return credentialRefreshes.get();
    }

    public int callCount(String operation) {
        AtomicInteger count = callCounts.get(operation);
        return count != null ? count.get() : 0;
    }

    public void putStation(ProviderStation station) {
        ProviderStation stored = station.copy();
        stored.provider = name;
        // records without an id are still served so discovery sees the malformed payload
        String key = stored.stationId != null ? stored.stationId : "#unkeyed-" + unkeyed.incrementAndGet();
        stations.put(key, stored);
        if (stored.chargers != null) {
            for (ProviderCharger charger : stored.chargers) {
                if (charger != null && charger.chargerId != null) {
                    chargerToStation.put(charger.chargerId, key);
                }
            }
        }
    }

    /**
     * Flip a charger's availability and stream the change to push subscribers
     */
    public void setAvailability(String nativeChargerId, boolean available) {
        String stationId = chargerToStation.get(nativeChargerId);
        if (stationId == null) {
            return;
        }
        ProviderStation updated = stations.computeIfPresent(stationId, (id, station) -> {
            ProviderStation copy = station.copy();
            if (copy.chargers != null) {
                for (ProviderCharger charger : copy.chargers) {
                    if (charger != null && nativeChargerId.equals(charger.chargerId)) {
                        charger.available = available;
                    }
                }
            }
            return copy;
        });
        if (updated != null && pushCapable) {
            for (StationUpdateListener listener : listeners) {
                listener.onStationUpdate(updated.copy());
            }
        }
    }

    /**
     * The provider ends a session on its own (hardware fault, idle timeout, ...)
     */
    public void terminateRemotely(String nativeSessionId, double energyDeliveredKwh) {
        SimulatedSession session = sessions.get(nativeSessionId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            if (session.status == ProviderSessionSummary.Status.ACTIVE) {
                session.end(ProviderSessionSummary.Status.FAULTED, energyDeliveredKwh, clock.instant());
                release(session);
                logger.info("Provider {} terminated session {} remotely at {}kWh", name, nativeSessionId, energyDeliveredKwh);
            }
        }
    }

    public List<String> activeSessionIds() {
        return new ArrayList<>(occupiedChargers.values());
    }

    private void enter(String operation) throws ProviderException {
        callCounts.computeIfAbsent(operation, k -> new AtomicInteger()).incrementAndGet();

        Duration delay = latency;
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderException(name, ProviderException.Kind.TIMEOUT, operation + " interrupted", e);
            }
        }

        Queue<ProviderException.Kind> scripted = scriptedFailures.get(operation);
        ProviderException.Kind failure = scripted != null ? scripted.poll() : null;
        if (failure == null) {
            failure = outage;
        }
        if (failure == null && credentialsExpired) {
            failure = ProviderException.Kind.UNAUTHORIZED;
        }
        if (failure != null) {
            throw new ProviderException(name, failure, "Simulated " + failure + " on " + operation);
        }
    }

    private boolean withinRadius(ProviderStation station, GeoPoint center, double radiusMeters) {
        if (station.latitude == null || station.longitude == null
                || !GeoPoint.isValid(station.latitude, station.longitude)) {
            return true; // malformed records are still returned, the normalizer reports them
        }
        return center.distanceMeters(new GeoPoint(station.latitude, station.longitude)) <= radiusMeters;
    }

    private ProviderCharger findCharger(String nativeChargerId) {
        String stationId = chargerToStation.get(nativeChargerId);
        ProviderStation station = stationId != null ? stations.get(stationId) : null;
        if (station == null || station.chargers == null) {
            return null;
        }
        return station.chargers.stream()
                .filter(charger -> charger != null && nativeChargerId.equals(charger.chargerId))
                .findFirst()
                .orElse(null);
    }

    private SimulatedSession requireSession(String nativeSessionId) throws ProviderException {
        SimulatedSession session = sessions.get(nativeSessionId);
        if (session == null) {
            throw new ProviderException(name, ProviderException.Kind.NOT_FOUND, "Unknown session " + nativeSessionId);
        }
        return session;
    }

    private void release(SimulatedSession session) {
        occupiedChargers.remove(session.nativeChargerId, session.nativeSessionId);
        setAvailability(session.nativeChargerId, true);
    }

    private static final class SimulatedSession {
        final String nativeSessionId;
        final String nativeChargerId;
        final double powerKw;
        final Instant startedAt;
        ProviderSessionSummary.Status status = ProviderSessionSummary.Status.ACTIVE;
        double finalEnergyKwh;
        Instant endedAt;

        SimulatedSession(String nativeSessionId, String nativeChargerId, double powerKw, Instant startedAt) {
            this.nativeSessionId = nativeSessionId;
            this.nativeChargerId = nativeChargerId;
            this.powerKw = powerKw;
            this.startedAt = startedAt;
        }

        double energyAt(Instant now) {
            double hours = Math.max(0, Duration.between(startedAt, now).toMillis()) / 3_600_000.0;
            return powerKw * hours;
        }

        void end(ProviderSessionSummary.Status endStatus, double energyKwh, Instant now) {
            this.status = endStatus;
            this.finalEnergyKwh = energyKwh;
            this.endedAt = now;
        }

        ProviderSessionSummary summary(Instant now) {
            if (status == ProviderSessionSummary.Status.ACTIVE) {
                long minutes = Duration.between(startedAt, now).toMinutes();
                return new ProviderSessionSummary(nativeSessionId, status, energyAt(now), powerKw, minutes, null);
            }
            long minutes = Duration.between(startedAt, endedAt).toMinutes();
            return new ProviderSessionSummary(nativeSessionId, status, finalEnergyKwh, 0.0, minutes, endedAt);
        }
    }
}
