package com.example.EV_Charging_Platform.cache;

import com.example.EV_Charging_Platform.model.ErrorKind;
import com.example.EV_Charging_Platform.model.GeoPoint;
import com.example.EV_Charging_Platform.model.ProviderError;
import com.example.EV_Charging_Platform.model.SourceRef;
import com.example.EV_Charging_Platform.provider.ProviderAdapter;
import com.example.EV_Charging_Platform.provider.ProviderCalls;
import com.example.EV_Charging_Platform.provider.ProviderException;
import com.example.EV_Charging_Platform.provider.ProviderSnapshot;
import com.example.EV_Charging_Platform.provider.ProviderStation;
import com.example.EV_Charging_Platform.service.ProviderHealthTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Near-real-time store of provider station payloads
 *
 * Two kinds of entries:
 * - station entries, one per (provider, native station id), refreshed by discovery, push and polling;
 * - area entries, one per (provider, rounded center, radius), remembering which stations a
 *   discovery returned so repeated queries for the same area need no provider call. Discovery
 *   for an area covers the rounded center widened by the rounding error, so every query that maps
 *   to the area gets a superset of its own circle and filters it down.
 *
 * Reads serve fresh entries as-is, refresh stale ones synchronously within {@code refreshTimeout}
 * and fall back to the stale value (tagged STALE_CACHE_SERVED) when that refresh fails.
 * Entry replacement goes through ConcurrentHashMap compute/merge so each entry changes atomically.
 */
public class AvailabilityCache {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityCache.class);

    private final Map<SourceRef, StationEntry> stations = new ConcurrentHashMap<>();
    private final Map<AreaKey, AreaEntry> areas = new ConcurrentHashMap<>();

    private final Clock clock;
    private final ExecutorService providerCallExecutor;
    private final ProviderHealthTracker healthTracker;
    private final Duration defaultStaleness;
    private final Map<String, Duration> stalenessByProvider;
    private final Duration refreshTimeout;
    private final Duration longStaleWindow;

    public AvailabilityCache(Clock clock, ExecutorService providerCallExecutor, ProviderHealthTracker healthTracker,
                             Duration defaultStaleness, Map<String, Duration> stalenessByProvider,
                             Duration refreshTimeout, Duration longStaleWindow) {
        this.clock = clock;
        this.providerCallExecutor = providerCallExecutor;
        this.healthTracker = healthTracker;
        this.defaultStaleness = defaultStaleness;
        this.stalenessByProvider = stalenessByProvider != null ? Map.copyOf(stalenessByProvider) : Map.of();
        this.refreshTimeout = refreshTimeout;
        this.longStaleWindow = longStaleWindow;
    }

    public Duration stalenessFor(String provider) {
        return stalenessByProvider.getOrDefault(provider, defaultStaleness);
    }

    // Reads

    /**
     * Stations one provider reports around {@code center}, served from cache when possible.
     * The list may include stations slightly outside {@code radiusMeters}; callers filter.
     *
     * @throws ProviderException only when nothing is cached and discovery fails
     */
    public CacheRead<List<ProviderSnapshot>> readArea(ProviderAdapter adapter, GeoPoint center, double radiusMeters)
            throws ProviderException {
        AreaKey key = AreaKey.of(adapter.name(), center, radiusMeters);
        Instant now = clock.instant();
        AreaEntry entry = areas.computeIfPresent(key, (k, existing) -> existing.touched(now));

        if (entry == null) {
            return CacheRead.of(discover(adapter, key, adapter.timeout()), CacheRead.Origin.DISCOVERED);
        }
        if (isFresh(adapter.name(), entry.refreshedAt, now)) {
            return CacheRead.of(currentMembers(entry), CacheRead.Origin.FRESH);
        }

        try {
            return CacheRead.of(discover(adapter, key, refreshTimeout), CacheRead.Origin.REFRESHED);
        } catch (ProviderException e) {
            logger.warn("Refresh of area {} failed ({}), serving entry from {}", key, e.getKind(), entry.refreshedAt);
            return CacheRead.stale(currentMembers(entry), staleAnnotation(adapter.name(), entry.refreshedAt),
                    new ProviderError(adapter.name(), e.toErrorKind(), e.getMessage()));
        }
    }

    /**
     * One provider station, served from cache when possible.
     * A NOT_FOUND answer evicts the entry and is passed on.
     */
    public CacheRead<ProviderSnapshot> readStation(ProviderAdapter adapter, String nativeId) throws ProviderException {
        SourceRef ref = new SourceRef(adapter.name(), nativeId);
        Instant now = clock.instant();
        StationEntry entry = stations.computeIfPresent(ref, (k, existing) -> existing.touched(now));

        if (entry == null) {
            return CacheRead.of(fetch(adapter, ref, adapter.timeout()), CacheRead.Origin.DISCOVERED);
        }
        if (isFresh(adapter.name(), entry.snapshot.observedAt, now)) {
            return CacheRead.of(entry.snapshot, CacheRead.Origin.FRESH);
        }

        try {
            return CacheRead.of(fetch(adapter, ref, refreshTimeout), CacheRead.Origin.REFRESHED);
        } catch (ProviderException e) {
            if (e.getKind() == ProviderException.Kind.NOT_FOUND) {
                throw e;
            }
            logger.warn("Refresh of station {} failed ({}), serving entry from {}", ref, e.getKind(),
                    entry.snapshot.observedAt);
            return CacheRead.stale(entry.snapshot, staleAnnotation(adapter.name(), entry.snapshot.observedAt),
                    new ProviderError(adapter.name(), e.toErrorKind(), e.getMessage()));
        }
    }

    /**
     * Cached snapshot without any provider call, fresh or not
     */
    public Optional<ProviderSnapshot> peek(String provider, String nativeId) {
        StationEntry entry = stations.get(new SourceRef(provider, nativeId));
        return entry != null ? Optional.of(entry.snapshot) : Optional.empty();
    }

    // Writes

    /**
     * Apply a pushed station update. It replaces the entry and restarts its staleness window.
     *
     * @return false when the update cannot be keyed and was ignored
     */
    public boolean applyPush(ProviderStation update) {
        if (update == null || update.provider == null || update.stationId == null) {
            logger.warn("Ignoring push update without provider or station id: {}", update);
            return false;
        }
        store(new ProviderSnapshot(update.copy(), clock.instant()));
        logger.debug("Applied push update for {}:{}", update.provider, update.stationId);
        return true;
    }

    /**
     * One polling pass for a provider: re-discover every area read recently, then refresh the
     * recently read stations no area covered. Stops at the first failure so an outage costs one call.
     *
     * @return number of successful provider calls
     */
    public int refreshProvider(ProviderAdapter adapter) {
        String provider = adapter.name();
        Instant passStart = clock.instant();
        Instant activeSince = passStart.minus(longStaleWindow);
        int refreshed = 0;

        try {
            for (Map.Entry<AreaKey, AreaEntry> area : new ArrayList<>(areas.entrySet())) {
                AreaKey key = area.getKey();
                if (!key.provider.equals(provider) || area.getValue().lastRead.isBefore(activeSince)) {
                    continue;
                }
                discover(adapter, key, adapter.timeout());
                refreshed++;
            }

            for (Map.Entry<SourceRef, StationEntry> station : new ArrayList<>(stations.entrySet())) {
                SourceRef ref = station.getKey();
                StationEntry entry = station.getValue();
                if (!ref.provider.equals(provider)
                        || !entry.snapshot.observedAt.isBefore(passStart)
                        || entry.lastRead.isBefore(activeSince)) {
                    continue;
                }
                try {
                    fetch(adapter, ref, adapter.timeout());
                    refreshed++;
                } catch (ProviderException e) {
                    if (e.getKind() != ProviderException.Kind.NOT_FOUND) {
                        throw e;
                    }
                }
            }
        } catch (ProviderException e) {
            logger.warn("Polling pass for {} stopped after {} refreshes: {} {}", provider, refreshed, e.getKind(),
                    e.getMessage());
        }
        return refreshed;
    }

    /**
     * Drop entries neither read nor refreshed within the long-stale window
     *
     * @return number of entries removed
     */
    public int evictLongStale() {
        Instant cutoff = clock.instant().minus(longStaleWindow);
        int before = stations.size() + areas.size();
        stations.entrySet().removeIf(e -> e.getValue().lastTouched().isBefore(cutoff));
        areas.entrySet().removeIf(e -> e.getValue().lastTouched().isBefore(cutoff));
        int evicted = before - (stations.size() + areas.size());
        if (evicted > 0) {
            logger.info("Evicted {} long-stale cache entries", evicted);
        }
        return evicted;
    }

    public int stationCount() {
        return stations.size();
    }

    public int areaCount() {
        return areas.size();
    }

    // Provider calls

    private List<ProviderSnapshot> discover(ProviderAdapter adapter, AreaKey key, Duration timeout)
            throws ProviderException {
        GeoPoint center = key.center();
        double radiusMeters = key.discoveryRadiusMeters();
        List<ProviderStation> payloads = call(adapter, timeout,
                () -> ProviderCalls.withCredentialRefresh(adapter, () -> adapter.listNearby(center, radiusMeters)));
        Instant observedAt = clock.instant();

        List<ProviderSnapshot> members = new ArrayList<>();
        for (ProviderStation payload : payloads) {
            if (payload == null) {
                continue;
            }
            if (payload.provider == null) {
                payload.provider = adapter.name();
            }
            ProviderSnapshot snapshot = new ProviderSnapshot(payload, observedAt);
            members.add(snapshot);
            if (payload.stationId != null) {
                store(snapshot);
            }
        }
        areas.compute(key, (k, existing) -> new AreaEntry(members, observedAt,
                existing != null ? existing.lastRead : observedAt));
        logger.debug("Discovered {} stations for area {}", members.size(), key);
        return members;
    }

    private ProviderSnapshot fetch(ProviderAdapter adapter, SourceRef ref, Duration timeout) throws ProviderException {
        ProviderStation payload;
        try {
            payload = call(adapter, timeout,
                    () -> ProviderCalls.withCredentialRefresh(adapter, () -> adapter.getStation(ref.nativeId)));
        } catch (ProviderException e) {
            if (e.getKind() == ProviderException.Kind.NOT_FOUND && stations.remove(ref) != null) {
                logger.info("Station {} no longer known to its provider, entry evicted", ref);
            }
            throw e;
        }
        if (payload.provider == null) {
            payload.provider = adapter.name();
        }
        if (payload.stationId == null) {
            payload.stationId = ref.nativeId;
        }
        ProviderSnapshot snapshot = new ProviderSnapshot(payload, clock.instant());
        store(snapshot);
        return snapshot;
    }

    private <T> T call(ProviderAdapter adapter, Duration timeout, ProviderCalls.Call<T> call) throws ProviderException {
        try {
            T result = ProviderCalls.withTimeout(providerCallExecutor, adapter, timeout, call);
            healthTracker.recordSuccess(adapter.name());
            return result;
        } catch (ProviderException e) {
            // a caller that gave up on us (deadline cancellation) accounts for that timeout itself
            if (!Thread.currentThread().isInterrupted() && e.getKind() != ProviderException.Kind.NOT_FOUND) {
                healthTracker.recordFailure(adapter.name(), e.toErrorKind());
            }
            throw e;
        }
    }

    private void store(ProviderSnapshot snapshot) {
        SourceRef ref = new SourceRef(snapshot.payload.provider, snapshot.payload.stationId);
        stations.merge(ref, new StationEntry(snapshot, snapshot.observedAt),
                (existing, candidate) -> candidate.snapshot.observedAt.isBefore(existing.snapshot.observedAt)
                        ? existing
                        : new StationEntry(candidate.snapshot, existing.lastRead));
    }

    private List<ProviderSnapshot> currentMembers(AreaEntry entry) {
        List<ProviderSnapshot> members = new ArrayList<>(entry.members.size());
        Set<SourceRef> seen = new HashSet<>();
        for (ProviderSnapshot member : entry.members) {
            if (member.payload.stationId == null) {
                members.add(member);
                continue;
            }
            SourceRef ref = new SourceRef(member.payload.provider, member.payload.stationId);
            if (!seen.add(ref)) {
                continue;
            }
            StationEntry latest = stations.get(ref);
            members.add(latest != null && latest.snapshot.observedAt.isAfter(member.observedAt) ? latest.snapshot : member);
        }
        return members;
    }

    private boolean isFresh(String provider, Instant refreshedAt, Instant now) {
        return now.isBefore(refreshedAt.plus(stalenessFor(provider)));
    }

    private static ProviderError staleAnnotation(String provider, Instant refreshedAt) {
        return new ProviderError(provider, ErrorKind.STALE_CACHE_SERVED, "Served data last refreshed at " + refreshedAt);
    }

    // Entries

    private static final class StationEntry {
        final ProviderSnapshot snapshot;
        final Instant lastRead;

        StationEntry(ProviderSnapshot snapshot, Instant lastRead) {
            this.snapshot = snapshot;
            this.lastRead = lastRead;
        }

        StationEntry touched(Instant now) {
            return new StationEntry(snapshot, now);
        }

        Instant lastTouched() {
            return lastRead.isAfter(snapshot.observedAt) ? lastRead : snapshot.observedAt;
        }
    }

    private static final class AreaEntry {
        final List<ProviderSnapshot> members;
        final Instant refreshedAt;
        final Instant lastRead;

        AreaEntry(List<ProviderSnapshot> members, Instant refreshedAt, Instant lastRead) {
            this.members = List.copyOf(members);
            this.refreshedAt = refreshedAt;
            this.lastRead = lastRead;
        }

        AreaEntry touched(Instant now) {
            return new AreaEntry(members, refreshedAt, now);
        }

        Instant lastTouched() {
            return lastRead.isAfter(refreshedAt) ? lastRead : refreshedAt;
        }
    }

    /**
     * Area cache key: center rounded to 3 decimals (about 100 m), radius to whole meters
     */
    static final class AreaKey {

        // half a step in both axes plus half a meter of radius rounding, about 79 m at the equator
        static final double ROUNDING_SLACK_METERS = 80.0;

        final String provider;
        final long latitudeE3;
        final long longitudeE3;
        final long radiusMeters;

        private AreaKey(String provider, long latitudeE3, long longitudeE3, long radiusMeters) {
            this.provider = provider;
            this.latitudeE3 = latitudeE3;
            this.longitudeE3 = longitudeE3;
            this.radiusMeters = radiusMeters;
        }

        static AreaKey of(String provider, GeoPoint center, double radiusMeters) {
            return new AreaKey(provider, Math.round(center.latitude * 1000), Math.round(center.longitude * 1000),
                    Math.round(radiusMeters));
        }

        GeoPoint center() {
            return new GeoPoint(latitudeE3 / 1000.0, longitudeE3 / 1000.0);
        }

        /**
         * Radius around {@link #center()} that contains the circle of every query mapped to this key
         */
        double discoveryRadiusMeters() {
            return radiusMeters + ROUNDING_SLACK_METERS;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            AreaKey other = (AreaKey) o;
            return latitudeE3 == other.latitudeE3 && longitudeE3 == other.longitudeE3
                    && radiusMeters == other.radiusMeters && provider.equals(other.provider);
        }

        @Override
        public int hashCode() {
            return Objects.hash(provider, latitudeE3, longitudeE3, radiusMeters);
        }

        @Override
        public String toString() {
            return String.format("%s@(%.3f,%.3f)/%dm", provider, latitudeE3 / 1000.0, longitudeE3 / 1000.0, radiusMeters);
        }
    }
}
