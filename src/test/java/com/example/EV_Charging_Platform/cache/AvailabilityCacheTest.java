package com.example.EV_Charging_Platform.cache;

import com.example.EV_Charging_Platform.model.ErrorKind;
import com.example.EV_Charging_Platform.model.GeoPoint;
import com.example.EV_Charging_Platform.model.ProviderHealth;
import com.example.EV_Charging_Platform.provider.ProviderException;
import com.example.EV_Charging_Platform.provider.ProviderSnapshot;
import com.example.EV_Charging_Platform.provider.ProviderStation;
import com.example.EV_Charging_Platform.provider.simulated.SimulatedProviderAdapter;
import com.example.EV_Charging_Platform.service.ProviderHealthTracker;
import com.example.EV_Charging_Platform.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.example.EV_Charging_Platform.support.TestStations.CENTER_LAT;
import static com.example.EV_Charging_Platform.support.TestStations.CENTER_LON;
import static com.example.EV_Charging_Platform.support.TestStations.ccs;
import static com.example.EV_Charging_Platform.support.TestStations.station;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AvailabilityCache
 *
 * Tests cover:
 * - Fresh reads served without provider calls
 * - Stale reads refreshed synchronously
 * - Stale fallback tagged STALE_CACHE_SERVED when the refresh fails or is too slow
 * - Push updates restarting the staleness window
 * - Polling passes and long-stale eviction
 */
class AvailabilityCacheTest {

    private static final GeoPoint CENTER = new GeoPoint(CENTER_LAT, CENTER_LON);

    private MutableClock clock;
    private ExecutorService executor;
    private ProviderHealthTracker healthTracker;
    private SimulatedProviderAdapter evgo;
    private AvailabilityCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        executor = Executors.newCachedThreadPool();
        healthTracker = new ProviderHealthTracker(clock, 3, Duration.ofSeconds(30));
        evgo = new SimulatedProviderAdapter("evgo", Duration.ofSeconds(2), false, clock, List.of(
                station("evgo", "evgo_001", "Mall", 37.7649, -122.4294, ccs("evgo_001_1", 100, true, 0.42)),
                station("evgo", "evgo_002", "Downtown", 37.78492, -122.40945, ccs("evgo_002_1", 150, true, 0.45))));
        cache = new AvailabilityCache(clock, executor, healthTracker, Duration.ofSeconds(60),
                Map.of("electrify_america", Duration.ofSeconds(120)), Duration.ofMillis(200), Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testReadArea_FreshEntryMakesNoProviderCall() throws Exception {
        // Given
        CacheRead<List<ProviderSnapshot>> first = cache.readArea(evgo, CENTER, 5000);
        clock.advance(Duration.ofSeconds(30));

        // When
        CacheRead<List<ProviderSnapshot>> second = cache.readArea(evgo, CENTER, 5000);

        // Then
        assertEquals(CacheRead.Origin.DISCOVERED, first.getOrigin());
        assertEquals(CacheRead.Origin.FRESH, second.getOrigin());
        assertFalse(second.calledProvider());
        assertEquals(2, second.getValue().size());
        assertEquals(1, evgo.callCount(SimulatedProviderAdapter.LIST_NEARBY));
    }

    @Test
    void testReadArea_NearbyCenterSharesEntry() throws Exception {
        // Given - centers differ by less than the rounding step
        cache.readArea(evgo, CENTER, 5000);

        // When
        CacheRead<List<ProviderSnapshot>> read = cache.readArea(evgo, new GeoPoint(CENTER_LAT + 0.0001, CENTER_LON), 5000);

        // Then
        assertEquals(CacheRead.Origin.FRESH, read.getOrigin());
        assertEquals(1, cache.areaCount());
    }

    @Test
    void testReadArea_SharedAreaCoversEveryMappedCircle() throws Exception {
        // Given - 989 m from the second center, 1079 m from the first
        evgo.putStation(station("evgo", "evgo_010", "Polk Street", 37.7843, -122.4194,
                ccs("evgo_010_1", 50, true, 0.40)));
        cache.readArea(evgo, new GeoPoint(37.7746, -122.4194), 1000);

        // When
        CacheRead<List<ProviderSnapshot>> read = cache.readArea(evgo, new GeoPoint(37.7754, -122.4194), 1000);

        // Then
        assertEquals(CacheRead.Origin.FRESH, read.getOrigin());
        assertTrue(read.getValue().stream().anyMatch(s -> "evgo_010".equals(s.payload.stationId)));
        assertEquals(1, evgo.callCount(SimulatedProviderAdapter.LIST_NEARBY));
    }

    @Test
    void testReadArea_StaleEntryRefreshed() throws Exception {
        // Given
        cache.readArea(evgo, CENTER, 5000);
        clock.advance(Duration.ofSeconds(61));

        // When
        CacheRead<List<ProviderSnapshot>> read = cache.readArea(evgo, CENTER, 5000);

        // Then
        assertEquals(CacheRead.Origin.REFRESHED, read.getOrigin());
        assertFalse(read.isStale());
        assertEquals(2, evgo.callCount(SimulatedProviderAdapter.LIST_NEARBY));
        assertEquals(clock.instant(), read.getValue().get(0).observedAt);
    }

    @Test
    void testReadArea_FailedRefreshServesStaleWithAnnotation() throws Exception {
        // Given
        cache.readArea(evgo, CENTER, 5000);
        clock.advance(Duration.ofSeconds(61));
        evgo.setOutage(ProviderException.Kind.UNAVAILABLE);

        // When
        CacheRead<List<ProviderSnapshot>> read = cache.readArea(evgo, CENTER, 5000);

        // Then
        assertTrue(read.isStale());
        assertEquals(2, read.getValue().size());
        assertEquals(ErrorKind.STALE_CACHE_SERVED, read.getAnnotation().orElseThrow().kind);
        assertEquals(ErrorKind.PROVIDER_UNAVAILABLE, read.getRefreshFailure().orElseThrow().kind);
        assertEquals(1, healthTracker.health("evgo").getConsecutiveFailures());
    }

    @Test
    void testReadArea_SlowRefreshServesStale() throws Exception {
        // Given - refresh budget is 200ms
        cache.readArea(evgo, CENTER, 5000);
        clock.advance(Duration.ofSeconds(61));
        evgo.setLatency(Duration.ofMillis(1500));

        // When
        long started = System.nanoTime();
        CacheRead<List<ProviderSnapshot>> read = cache.readArea(evgo, CENTER, 5000);
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        // Then
        assertTrue(read.isStale());
        assertEquals(ErrorKind.PROVIDER_TIMEOUT, read.getRefreshFailure().orElseThrow().kind);
        assertTrue(elapsedMillis < 1000, "stale fallback should not wait for the slow provider");
    }

    @Test
    void testReadArea_NothingCachedAndProviderDown() {
        // Given
        evgo.setOutage(ProviderException.Kind.TIMEOUT);

        // When
        ProviderException error = assertThrows(ProviderException.class, () -> cache.readArea(evgo, CENTER, 5000));

        // Then
        assertEquals(ProviderException.Kind.TIMEOUT, error.getKind());
        assertEquals(0, cache.areaCount());
    }

    @Test
    void testStalenessFor_PerProviderOverride() {
        assertEquals(Duration.ofSeconds(120), cache.stalenessFor("electrify_america"));
        assertEquals(Duration.ofSeconds(60), cache.stalenessFor("evgo"));
    }

    @Test
    void testReadStation_DiscoveredThenFresh() throws Exception {
        // When
        CacheRead<ProviderSnapshot> first = cache.readStation(evgo, "evgo_001");
        CacheRead<ProviderSnapshot> second = cache.readStation(evgo, "evgo_001");

        // Then
        assertEquals(CacheRead.Origin.DISCOVERED, first.getOrigin());
        assertEquals(CacheRead.Origin.FRESH, second.getOrigin());
        assertEquals(1, evgo.callCount(SimulatedProviderAdapter.GET_STATION));
    }

    @Test
    void testReadStation_AreaDiscoveryFillsStationEntries() throws Exception {
        // Given
        cache.readArea(evgo, CENTER, 5000);

        // When
        CacheRead<ProviderSnapshot> read = cache.readStation(evgo, "evgo_002");

        // Then
        assertEquals(CacheRead.Origin.FRESH, read.getOrigin());
        assertEquals(0, evgo.callCount(SimulatedProviderAdapter.GET_STATION));
    }

    @Test
    void testReadStation_NotFoundEvictsEntry() throws Exception {
        // Given
        cache.readStation(evgo, "evgo_001");
        clock.advance(Duration.ofSeconds(61));
        evgo.failNext(SimulatedProviderAdapter.GET_STATION, ProviderException.Kind.NOT_FOUND, 1);

        // When
        ProviderException error = assertThrows(ProviderException.class, () -> cache.readStation(evgo, "evgo_001"));

        // Then
        assertEquals(ProviderException.Kind.NOT_FOUND, error.getKind());
        assertTrue(cache.peek("evgo", "evgo_001").isEmpty());
        assertEquals(ProviderHealth.Status.OK, healthTracker.health("evgo").getStatus());
    }

    @Test
    void testApplyPush_ReplacesEntryAndRestartsStaleness() throws Exception {
        // Given
        cache.readArea(evgo, CENTER, 5000);
        clock.advance(Duration.ofSeconds(50));
        ProviderStation update = evgo.getStation("evgo_001");
        update.chargers.get(0).available = false;

        // When
        assertTrue(cache.applyPush(update));
        clock.advance(Duration.ofSeconds(20));
        CacheRead<ProviderSnapshot> station = cache.readStation(evgo, "evgo_001");

        // Then
        assertEquals(CacheRead.Origin.FRESH, station.getOrigin());
        assertFalse(station.getValue().payload.chargers.get(0).available);
        assertEquals(1, evgo.callCount(SimulatedProviderAdapter.GET_STATION), "only the call building the update");
    }

    @Test
    void testApplyPush_VisibleThroughFreshAreaRead() throws Exception {
        // Given
        cache.readArea(evgo, CENTER, 5000);
        clock.advance(Duration.ofSeconds(10));
        ProviderStation update = evgo.getStation("evgo_002");
        update.chargers.get(0).available = false;
        cache.applyPush(update);

        // When
        CacheRead<List<ProviderSnapshot>> read = cache.readArea(evgo, CENTER, 5000);

        // Then
        ProviderSnapshot pushed = read.getValue().stream()
                .filter(snapshot -> "evgo_002".equals(snapshot.payload.stationId))
                .findFirst()
                .orElseThrow();
        assertFalse(pushed.payload.chargers.get(0).available);
        assertEquals(CacheRead.Origin.FRESH, read.getOrigin());
    }

    @Test
    void testApplyPush_UnkeyedUpdateIgnored() {
        ProviderStation update = new ProviderStation();
        update.provider = "evgo";

        assertFalse(cache.applyPush(update));
        assertEquals(0, cache.stationCount());
    }

    @Test
    void testRefreshProvider_RefreshesRecentlyReadAreas() throws Exception {
        // Given
        cache.readArea(evgo, CENTER, 5000);
        clock.advance(Duration.ofSeconds(30));

        // When
        int refreshed = cache.refreshProvider(evgo);

        // Then
        assertEquals(1, refreshed);
        assertEquals(2, evgo.callCount(SimulatedProviderAdapter.LIST_NEARBY));
        assertEquals(clock.instant(), cache.peek("evgo", "evgo_001").orElseThrow().observedAt);
    }

    @Test
    void testRefreshProvider_StopsOnOutage() throws Exception {
        // Given
        cache.readArea(evgo, CENTER, 5000);
        cache.readArea(evgo, new GeoPoint(37.7849, -122.4094), 2000);
        evgo.setOutage(ProviderException.Kind.UNAVAILABLE);

        // When
        int refreshed = cache.refreshProvider(evgo);

        // Then
        assertEquals(0, refreshed);
        assertEquals(3, evgo.callCount(SimulatedProviderAdapter.LIST_NEARBY), "one failed call, not one per area");
    }

    @Test
    void testEvictLongStale_DropsUnreadEntries() throws Exception {
        // Given
        cache.readArea(evgo, CENTER, 5000);
        clock.advance(Duration.ofMinutes(59));
        cache.readStation(evgo, "evgo_001");
        clock.advance(Duration.ofMinutes(2));

        // When
        int evicted = cache.evictLongStale();

        // Then - area and evgo_002 are gone, evgo_001 was read a minute ago
        assertEquals(2, evicted);
        assertEquals(0, cache.areaCount());
        assertEquals(1, cache.stationCount());
        assertTrue(cache.peek("evgo", "evgo_001").isPresent());
    }
}
