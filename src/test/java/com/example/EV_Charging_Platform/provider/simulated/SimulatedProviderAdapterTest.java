package com.example.EV_Charging_Platform.provider.simulated;

import com.example.EV_Charging_Platform.model.GeoPoint;
import com.example.EV_Charging_Platform.provider.ProviderException;
import com.example.EV_Charging_Platform.provider.ProviderSessionRef;
import com.example.EV_Charging_Platform.provider.ProviderSessionSummary;
import com.example.EV_Charging_Platform.provider.ProviderStation;
import com.example.EV_Charging_Platform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.example.EV_Charging_Platform.support.TestStations.CENTER_LAT;
import static com.example.EV_Charging_Platform.support.TestStations.CENTER_LON;
import static com.example.EV_Charging_Platform.support.TestStations.ccs;
import static com.example.EV_Charging_Platform.support.TestStations.station;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SimulatedProviderAdapter
 *
 * Tests cover:
 * - Radius queries and returned copies
 * - Session lifecycle, busy chargers and energy accrual
 * - Remote termination
 * - Injected failures, outages and expired credentials
 * - Push updates for push-capable providers
 */
class SimulatedProviderAdapterTest {

    private MutableClock clock;
    private SimulatedProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        adapter = new SimulatedProviderAdapter("chargepoint", Duration.ofSeconds(2), true, clock, List.of(
                station("chargepoint", "cp_001", "Downtown", 37.7849, -122.4094, ccs("cp_001_1", 50, true, 0.35)),
                station("chargepoint", "cp_far", "Oakland", 37.8044, -122.2712, ccs("cp_far_1", 50, true, 0.35))));
    }

    @Test
    void testListNearby_FiltersByRadius() throws Exception {
        // When
        List<ProviderStation> nearby = adapter.listNearby(new GeoPoint(CENTER_LAT, CENTER_LON), 5_000);

        // Then
        assertEquals(1, nearby.size());
        assertEquals("cp_001", nearby.get(0).stationId);
        assertEquals("chargepoint", nearby.get(0).provider);
        assertEquals(1, adapter.callCount(SimulatedProviderAdapter.LIST_NEARBY));
    }

    @Test
    void testGetStation_ReturnsCopy() throws Exception {
        // Given
        ProviderStation first = adapter.getStation("cp_001");
        first.chargers.get(0).available = false;

        // When
        ProviderStation second = adapter.getStation("cp_001");

        // Then
        assertTrue(second.chargers.get(0).available);
    }

    @Test
    void testGetStation_UnknownIsNotFound() {
        ProviderException error = assertThrows(ProviderException.class, () -> adapter.getStation("cp_404"));

        assertEquals(ProviderException.Kind.NOT_FOUND, error.getKind());
    }

    @Test
    void testStartSession_SecondStartOnSameChargerIsBusy() throws Exception {
        // When
        ProviderSessionRef first = adapter.startSession("cp_001_1");
        ProviderSessionRef second = adapter.startSession("cp_001_1");

        // Then
        assertEquals(ProviderSessionRef.Outcome.STARTED, first.outcome);
        assertNotNull(first.nativeSessionId);
        assertEquals(ProviderSessionRef.Outcome.CHARGER_BUSY, second.outcome);
        assertFalse(adapter.getStation("cp_001").chargers.get(0).available);
    }

    @Test
    void testStartSession_UnknownChargerIsNotFound() {
        ProviderException error = assertThrows(ProviderException.class, () -> adapter.startSession("nope"));

        assertEquals(ProviderException.Kind.NOT_FOUND, error.getKind());
    }

    @Test
    void testStopSession_EnergyFromRatedPower() throws Exception {
        // Given
        ProviderSessionRef ref = adapter.startSession("cp_001_1");
        clock.advance(Duration.ofMinutes(30));

        // When
        ProviderSessionSummary summary = adapter.stopSession(ref.nativeSessionId);

        // Then
        assertEquals(ProviderSessionSummary.Status.COMPLETED, summary.status);
        assertEquals(25.0, summary.energyDeliveredKwh, 1e-9);
        assertEquals(30L, summary.durationMinutes);
        assertTrue(adapter.getStation("cp_001").chargers.get(0).available);
        assertTrue(adapter.activeSessionIds().isEmpty());
    }

    @Test
    void testStopSession_RepeatedStopReturnsSameFigures() throws Exception {
        // Given
        ProviderSessionRef ref = adapter.startSession("cp_001_1");
        clock.advance(Duration.ofMinutes(12));
        ProviderSessionSummary first = adapter.stopSession(ref.nativeSessionId);
        clock.advance(Duration.ofMinutes(10));

        // When
        ProviderSessionSummary second = adapter.stopSession(ref.nativeSessionId);

        // Then
        assertEquals(first.energyDeliveredKwh, second.energyDeliveredKwh, 1e-9);
        assertEquals(first.endedAt, second.endedAt);
    }

    @Test
    void testGetSessionStatus_ReportsProgress() throws Exception {
        // Given
        ProviderSessionRef ref = adapter.startSession("cp_001_1");
        clock.advance(Duration.ofMinutes(6));

        // When
        ProviderSessionSummary summary = adapter.getSessionStatus(ref.nativeSessionId);

        // Then
        assertEquals(ProviderSessionSummary.Status.ACTIVE, summary.status);
        assertEquals(5.0, summary.energyDeliveredKwh, 1e-9);
        assertEquals(50.0, summary.currentPowerKw, 1e-9);
    }

    @Test
    void testTerminateRemotely_SessionFaultedWithGivenEnergy() throws Exception {
        // Given
        ProviderSessionRef ref = adapter.startSession("cp_001_1");

        // When
        adapter.terminateRemotely(ref.nativeSessionId, 12.3);
        ProviderSessionSummary summary = adapter.getSessionStatus(ref.nativeSessionId);

        // Then
        assertEquals(ProviderSessionSummary.Status.FAULTED, summary.status);
        assertTrue(summary.isEnded());
        assertEquals(12.3, summary.energyDeliveredKwh, 1e-9);
    }

    @Test
    void testFailNext_ScriptedFailuresThenSuccess() throws Exception {
        // Given
        adapter.failNext(SimulatedProviderAdapter.GET_STATION, ProviderException.Kind.TIMEOUT, 2);

        // When / Then
        assertThrows(ProviderException.class, () -> adapter.getStation("cp_001"));
        assertThrows(ProviderException.class, () -> adapter.getStation("cp_001"));
        assertNotNull(adapter.getStation("cp_001"));
        assertEquals(3, adapter.callCount(SimulatedProviderAdapter.GET_STATION));
    }

    @Test
    void testSetOutage_AffectsEveryOperationUntilCleared() throws Exception {
        // Given
        adapter.setOutage(ProviderException.Kind.UNAVAILABLE);

        // When
        ProviderException error = assertThrows(ProviderException.class,
                () -> adapter.listNearby(new GeoPoint(CENTER_LAT, CENTER_LON), 1_000));
        adapter.setOutage(null);

        // Then
        assertEquals(ProviderException.Kind.UNAVAILABLE, error.getKind());
        assertNotNull(adapter.getStation("cp_001"));
    }

    @Test
    void testExpiredCredentials_ClearedByRefresh() throws Exception {
        // Given
        adapter.expireCredentials();

        // When
        ProviderException error = assertThrows(ProviderException.class, () -> adapter.getStation("cp_001"));
        adapter.refreshCredentials();

        // Then
        assertEquals(ProviderException.Kind.UNAUTHORIZED, error.getKind());
        assertEquals(1, adapter.getCredentialRefreshes());
        assertNotNull(adapter.getStation("cp_001"));
    }

    @Test
    void testSetAvailability_PushedToSubscribers() {
        // Given
        List<ProviderStation> updates = new ArrayList<>();
        adapter.subscribe(updates::add);

        // When
        adapter.setAvailability("cp_001_1", false);

        // Then
        assertEquals(1, updates.size());
        assertEquals("cp_001", updates.get(0).stationId);
        assertFalse(updates.get(0).chargers.get(0).available);
    }

    @Test
    void testSetAvailability_PollOnlyProviderDoesNotPush() {
        // Given
        SimulatedProviderAdapter pollOnly = new SimulatedProviderAdapter("evgo", Duration.ofSeconds(2), false, clock,
                List.of(station("evgo", "evgo_001", "Mall", 37.7649, -122.4294, ccs("evgo_001_1", 100, true, 0.42))));
        List<ProviderStation> updates = new ArrayList<>();
        pollOnly.subscribe(updates::add);

        // When
        pollOnly.setAvailability("evgo_001_1", false);

        // Then
        assertFalse(pollOnly.supportsPush());
        assertTrue(updates.isEmpty());
    }
}
