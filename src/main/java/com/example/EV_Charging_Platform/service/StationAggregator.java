package com.example.EV_Charging_Platform.service;

import com.example.EV_Charging_Platform.cache.AvailabilityCache;
import com.example.EV_Charging_Platform.cache.CacheRead;
import com.example.EV_Charging_Platform.config.PlatformProperties;
import com.example.EV_Charging_Platform.model.Charger;
import com.example.EV_Charging_Platform.model.ErrorKind;
import com.example.EV_Charging_Platform.model.ProviderError;
import com.example.EV_Charging_Platform.model.SourceRef;
import com.example.EV_Charging_Platform.model.Station;
import com.example.EV_Charging_Platform.normalization.NormalizationResult;
import com.example.EV_Charging_Platform.normalization.StationNormalizer;
import com.example.EV_Charging_Platform.provider.ProviderAdapter;
import com.example.EV_Charging_Platform.provider.ProviderException;
import com.example.EV_Charging_Platform.provider.ProviderRegistry;
import com.example.EV_Charging_Platform.provider.ProviderSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Discovery front door
 *
 * Fans a query out to every provider in parallel (through the availability cache), waits at most
 * for the caller deadline, normalizes whatever came back and filters/sorts the merged stations.
 * Provider problems never fail the call; they come back as per-provider errors.
 *
 * Also keeps a directory of the stations it has merged so far, used for station detail
 * lookups and to resolve chargers when a session starts.
 */
@Service
public class StationAggregator {

    private static final Logger logger = LoggerFactory.getLogger(StationAggregator.class);

    private static final Comparator<ProviderError> ERROR_ORDER =
            Comparator.comparing((ProviderError e) -> e.provider).thenComparing(e -> e.kind);

    private final ProviderRegistry registry;
    private final AvailabilityCache cache;
    private final StationNormalizer normalizer;
    private final ProviderHealthTracker healthTracker;
    private final ExecutorService providerCallExecutor;
    private final Duration defaultDeadline;

    // canonical station id -> last merged view
    private final Map<String, Station> directory = new ConcurrentHashMap<>();

    // provider record -> canonical id it was first published under
    private final Map<SourceRef, String> assignedIds = new ConcurrentHashMap<>();

    public StationAggregator(ProviderRegistry registry, AvailabilityCache cache, StationNormalizer normalizer,
                             ProviderHealthTracker healthTracker,
                             @Qualifier("providerCallExecutor") ExecutorService providerCallExecutor,
                             PlatformProperties properties) {
        this.registry = registry;
        this.cache = cache;
        this.normalizer = normalizer;
        this.healthTracker = healthTracker;
        this.providerCallExecutor = providerCallExecutor;
        this.defaultDeadline = properties.getDiscovery().getDeadline();
    }

    /**
     * Merged stations around the query center, sorted by distance then canonical id
     */
    public NearbyResult nearby(NearbyQuery query) {
        Duration deadline = query.getDeadline() != null ? query.getDeadline() : defaultDeadline;
        long deadlineNanos = System.nanoTime() + deadline.toNanos();
        List<ProviderError> errors = new ArrayList<>();

        Map<ProviderAdapter, Future<CacheRead<List<ProviderSnapshot>>>> pending = new LinkedHashMap<>();
        for (ProviderAdapter adapter : registry.all()) {
            if (!healthTracker.isAvailable(adapter.name())) {
                errors.add(new ProviderError(adapter.name(), ErrorKind.PROVIDER_UNAVAILABLE,
                        "Skipped: provider is marked down"));
                continue;
            }
            try {
                pending.put(adapter, providerCallExecutor.submit(
                        () -> cache.readArea(adapter, query.getCenter(), query.getRadiusMeters())));
            } catch (RejectedExecutionException e) {
                errors.add(new ProviderError(adapter.name(), ErrorKind.PROVIDER_UNAVAILABLE,
                        "Provider call rejected: executor saturated"));
            }
        }

        List<ProviderSnapshot> snapshots = new ArrayList<>();
        boolean interrupted = false;
        for (Map.Entry<ProviderAdapter, Future<CacheRead<List<ProviderSnapshot>>>> entry : pending.entrySet()) {
            String provider = entry.getKey().name();
            Future<CacheRead<List<ProviderSnapshot>>> future = entry.getValue();
            long remaining = deadlineNanos - System.nanoTime();
            try {
                if (interrupted) {
                    throw new TimeoutException("interrupted");
                }
                CacheRead<List<ProviderSnapshot>> read = future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
                snapshots.addAll(read.getValue());
                read.getAnnotation().ifPresent(errors::add);
            } catch (TimeoutException e) {
                future.cancel(true);
                healthTracker.recordFailure(provider, ErrorKind.PROVIDER_TIMEOUT);
                errors.add(new ProviderError(provider, ErrorKind.PROVIDER_TIMEOUT,
                        "No answer within " + deadline.toMillis() + "ms"));
            } catch (InterruptedException e) {
                interrupted = true;
                future.cancel(true);
                errors.add(new ProviderError(provider, ErrorKind.PROVIDER_TIMEOUT, "Discovery interrupted"));
            } catch (ExecutionException e) {
                errors.add(toProviderError(provider, e.getCause()));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        NormalizationResult normalized = normalizer.normalize(snapshots);
        errors.addAll(normalized.schemaMismatches);
        List<Station> published = publish(normalized.stations);

        List<Station> stations = new ArrayList<>();
        for (Station station : published) {
            if (query.matches(station)) {
                stations.add(station);
            }
        }
        stations.sort(Comparator.comparingDouble((Station s) -> query.getCenter().distanceMeters(s.location))
                .thenComparing(s -> s.id));
        errors.sort(ERROR_ORDER);

        logger.info("Nearby {} -> {} stations from {} providers, {} provider errors",
                query, stations.size(), pending.size(), errors.size());
        return new NearbyResult(stations, errors);
    }

    /**
     * Current view of a station discovery has seen before, refreshed through the cache.
     * Sources that cannot be refreshed keep their previous contribution.
     */
    public Optional<Station> station(String stationId) {
        Station known = directory.get(stationId);
        if (known == null) {
            return Optional.empty();
        }

        List<ProviderSnapshot> snapshots = new ArrayList<>();
        int gone = 0;
        for (SourceRef source : known.sources) {
            Optional<ProviderAdapter> adapter = registry.find(source.provider);
            if (adapter.isEmpty()) {
                continue;
            }
            try {
                snapshots.add(cache.readStation(adapter.get(), source.nativeId).getValue());
            } catch (ProviderException e) {
                if (e.getKind() == ProviderException.Kind.NOT_FOUND) {
                    gone++;
                    continue;
                }
                logger.warn("Could not refresh {} for station {}: {}", source, stationId, e.getMessage());
                cache.peek(source.provider, source.nativeId).ifPresent(snapshots::add);
            }
        }

        if (gone == known.sources.size()) {
            directory.remove(stationId);
            logger.info("Station {} removed: no provider knows it anymore", stationId);
            return Optional.empty();
        }
        if (snapshots.isEmpty()) {
            return Optional.of(known);
        }

        Station refreshed = pickSameStation(normalizer.normalize(snapshots).stations, known);
        synchronized (this) {
            directory.put(stationId, refreshed);
            refreshed.sources.forEach(source -> assignedIds.putIfAbsent(source, stationId));
        }
        return Optional.of(refreshed);
    }

    /**
     * Resolve a canonical charger id for a session start. The provider prefix decides routing;
     * the station directory, when it knows the station, supplies price and connector and validates membership.
     *
     * @throws IllegalArgumentException for malformed ids, unknown providers or a charger outside the station
     */
    public ResolvedCharger resolveCharger(String stationId, String chargerId) {
        int separator = chargerId.indexOf(':');
        if (separator <= 0 || separator == chargerId.length() - 1) {
            throw new IllegalArgumentException("Charger id must look like provider:nativeId, got " + chargerId);
        }
        String provider = chargerId.substring(0, separator);
        String nativeChargerId = chargerId.substring(separator + 1);
        if (registry.find(provider).isEmpty()) {
            throw new IllegalArgumentException("Unknown provider in charger id: " + provider);
        }

        Station station = directory.get(stationId);
        if (station == null) {
            return new ResolvedCharger(stationId, chargerId, provider, nativeChargerId, null);
        }
        Charger charger = station.findCharger(chargerId).orElseThrow(() ->
                new IllegalArgumentException("Charger " + chargerId + " does not belong to station " + stationId));
        return new ResolvedCharger(stationId, chargerId, provider, nativeChargerId, charger.pricePerKwh,
                charger.connectorType);
    }

    public int directorySize() {
        return directory.size();
    }

    /**
     * Give each merged station the id its sources were already published under, so an id survives
     * a provider dropping out of the cluster. When a cluster split leaves two stations claiming the
     * same id, the one holding more of that id's sources keeps it and the other takes its own.
     */
    private synchronized List<Station> publish(List<Station> merged) {
        Map<String, Station> claims = new LinkedHashMap<>();
        for (Station station : merged) {
            String id = assignedId(station).orElse(station.id);
            Station rival = claims.get(id);
            if (rival == null) {
                claims.put(id, station);
            } else if (sourcesUnder(station, id) > sourcesUnder(rival, id)) {
                claims.put(id, station);
                claims.put(rival.id, rival);
            } else {
                claims.put(station.id, station);
            }
        }

        List<Station> published = new ArrayList<>();
        for (Map.Entry<String, Station> claim : claims.entrySet()) {
            Station station = rekey(claim.getValue(), claim.getKey());
            for (SourceRef source : station.sources) {
                String previous = assignedIds.putIfAbsent(source, station.id);
                if (previous != null && !previous.equals(station.id)) {
                    logger.info("Source {} moved from station {} to {}", source, previous, station.id);
                    assignedIds.put(source, station.id);
                }
            }
            directory.put(station.id, station);
            published.add(station);
        }
        return published;
    }

    private Optional<String> assignedId(Station station) {
        for (SourceRef source : station.sources) {
            String id = assignedIds.get(source);
            if (id != null) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    private long sourcesUnder(Station station, String id) {
        return station.sources.stream().filter(source -> id.equals(assignedIds.get(source))).count();
    }

    private Station pickSameStation(List<Station> candidates, Station known) {
        for (Station candidate : candidates) {
            if (candidate.id.equals(known.id)) {
                return rekey(candidate, known.id);
            }
        }
        // the cluster split or its primary source changed: keep the part sharing most sources
        Station best = candidates.get(0);
        long bestOverlap = -1;
        for (Station candidate : candidates) {
            long overlap = candidate.sources.stream().filter(known.sources::contains).count();
            if (overlap > bestOverlap) {
                best = candidate;
                bestOverlap = overlap;
            }
        }
        return rekey(best, known.id);
    }

    private static Station rekey(Station station, String stationId) {
        if (station.id.equals(stationId)) {
            return station;
        }
        List<Charger> chargers = new ArrayList<>();
        for (Charger charger : station.chargers) {
            chargers.add(new Charger(stationId, charger.provider, charger.nativeId, charger.connectorType,
                    charger.powerKw, charger.available, charger.pricePerKwh, charger.lastRefreshed));
        }
        return new Station(stationId, station.sources, station.location, station.name, station.address,
                chargers, station.amenities, station.rating, station.operatingHours);
    }

    private static ProviderError toProviderError(String provider, Throwable cause) {
        if (cause instanceof ProviderException) {
            ProviderException e = (ProviderException) cause;
            logger.warn("Provider {} failed during discovery: {} {}", provider, e.getKind(), e.getMessage());
            return new ProviderError(provider, e.toErrorKind(), e.getMessage());
        }
        logger.error("Unexpected failure reading provider {}", provider, cause);
        return new ProviderError(provider, ErrorKind.PROVIDER_UNAVAILABLE, String.valueOf(cause));
    }
}
