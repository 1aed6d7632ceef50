package com.example.EV_Charging_Platform.normalization;

import com.example.EV_Charging_Platform.model.Charger;
import com.example.EV_Charging_Platform.model.ConnectorType;
import com.example.EV_Charging_Platform.model.ErrorKind;
import com.example.EV_Charging_Platform.model.ProviderError;
import com.example.EV_Charging_Platform.model.SourceRef;
import com.example.EV_Charging_Platform.model.Station;
import com.example.EV_Charging_Platform.provider.ProviderCharger;
import com.example.EV_Charging_Platform.provider.ProviderSnapshot;
import com.example.EV_Charging_Platform.provider.ProviderStation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.example.EV_Charging_Platform.support.TestStations.ccs;
import static com.example.EV_Charging_Platform.support.TestStations.charger;
import static com.example.EV_Charging_Platform.support.TestStations.station;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StationNormalizer
 *
 * Tests cover:
 * - Merging records within distance and name thresholds
 * - Records that must stay apart (distance, name, same provider)
 * - Explicit cross-provider id mappings
 * - Primary record selection and canonical ids
 * - Malformed stations and chargers reported as SCHEMA_MISMATCH
 */
class StationNormalizerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private StationNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new StationNormalizer(MergePolicy.defaults());
    }

    @Test
    void testNormalize_NearDuplicatesMergeWithUnionOfChargers() {
        // Given - same site reported by two providers about 5 m apart
        ProviderStation chargepoint = station("chargepoint", "cp_001", "ChargePoint Station - Downtown",
                37.7849, -122.4094, ccs("cp_001_1", 50, true, 0.35), charger("cp_001_2", "CHAdeMO", 50, false, 0.35));
        chargepoint.address = "123 Main St";
        chargepoint.amenities = List.of("wifi");
        ProviderStation evgo = station("evgo", "evgo_002", "Downtown EVgo", 37.78492, -122.40945,
                ccs("evgo_002_1", 150, true, 0.45));

        // When
        NormalizationResult result = normalizer.normalize(snapshots(chargepoint, evgo));

        // Then
        assertEquals(1, result.stations.size());
        Station merged = result.stations.get(0);
        assertEquals(3, merged.chargers.size(), "chargers are never deduplicated across providers");
        assertEquals(List.of("chargepoint:cp_001_1", "chargepoint:cp_001_2", "evgo:evgo_002_1"),
                merged.chargers.stream().map(c -> c.id).collect(Collectors.toList()));
        assertTrue(merged.sources.contains(new SourceRef("chargepoint", "cp_001")));
        assertTrue(merged.sources.contains(new SourceRef("evgo", "evgo_002")));
        assertEquals("ChargePoint Station - Downtown", merged.name);
        assertEquals("123 Main St", merged.address);
        assertTrue(result.schemaMismatches.isEmpty());
    }

    @Test
    void testNormalize_CanonicalIdDerivedFromHighestPrioritySource() {
        // Given
        ProviderStation evgo = station("evgo", "evgo_002", "Downtown EVgo", 37.78492, -122.40945,
                ccs("evgo_002_1", 150, true, 0.45));
        ProviderStation chargepoint = station("chargepoint", "cp_001", "Downtown ChargePoint", 37.7849, -122.4094,
                ccs("cp_001_1", 50, true, 0.35));
        String expected = "stn_" + UUID.nameUUIDFromBytes("chargepoint:cp_001".getBytes(StandardCharsets.UTF_8));

        // When - input order must not matter
        Station first = normalizer.normalize(snapshots(evgo, chargepoint)).stations.get(0);
        Station second = normalizer.normalize(snapshots(chargepoint, evgo)).stations.get(0);

        // Then
        assertEquals(expected, first.id);
        assertEquals(first.id, second.id);
        for (Charger charger : first.chargers) {
            assertEquals(expected, charger.stationId);
        }
    }

    @Test
    void testNormalize_SameNameBeyondDistanceStaysApart() {
        // Given - ~220 m apart
        ProviderStation a = station("chargepoint", "cp_001", "Downtown", 37.7849, -122.4094, ccs("a1", 50, true, 0.3));
        ProviderStation b = station("evgo", "evgo_009", "Downtown", 37.7869, -122.4094, ccs("b1", 50, true, 0.3));

        // When
        NormalizationResult result = normalizer.normalize(snapshots(a, b));

        // Then
        assertEquals(2, result.stations.size());
    }

    @Test
    void testNormalize_DifferentNamesWithinDistanceStayApart() {
        // Given
        ProviderStation a = station("chargepoint", "cp_002", "Union Square Garage", 37.7880, -122.4075,
                ccs("a1", 7, true, 0.3));
        ProviderStation b = station("evgo", "evgo_010", "Mission Bay Plaza", 37.78801, -122.40751,
                ccs("b1", 100, true, 0.4));

        // When
        NormalizationResult result = normalizer.normalize(snapshots(a, b));

        // Then
        assertEquals(2, result.stations.size());
    }

    @Test
    void testNormalize_SameProviderRecordsWithinThresholdMerge() {
        // Given - one provider lists the same garage twice, about a meter apart
        ProviderStation a = station("evgo", "evgo_001", "Downtown Garage", 37.7649, -122.4294,
                ccs("e1", 100, true, 0.42));
        ProviderStation b = station("evgo", "evgo_003", "Downtown Garage", 37.76491, -122.4294,
                ccs("e2", 100, true, 0.42));

        // When
        NormalizationResult result = normalizer.normalize(snapshots(a, b));

        // Then
        assertEquals(1, result.stations.size());
        Station merged = result.stations.get(0);
        assertEquals(2, merged.sources.size());
        assertEquals(List.of("evgo:e1", "evgo:e2"),
                merged.chargers.stream().map(c -> c.id).collect(Collectors.toList()));
    }

    @Test
    void testNormalize_SameProviderRecordsFarApartStaySeparate() {
        // Given
        ProviderStation a = station("evgo", "evgo_001", "Mall", 37.7649, -122.4294, ccs("e1", 100, true, 0.42));
        ProviderStation b = station("evgo", "evgo_003", "Mall", 37.7700, -122.4294, ccs("e2", 100, true, 0.42));

        // When
        NormalizationResult result = normalizer.normalize(snapshots(a, b));

        // Then
        assertEquals(2, result.stations.size());
    }

    @Test
    void testNormalize_ExplicitMappingMergesDistantRecords() {
        // Given - a mapping overrides geometry and names
        MergePolicy policy = new MergePolicy(50, 0.6, MergePolicy.DEFAULT_PROVIDER_PRIORITY,
                Map.of("sfo_terminal", List.of("evgo:evgo_777", "electrify_america:ea_555")));
        StationNormalizer mapped = new StationNormalizer(policy);
        ProviderStation evgo = station("evgo", "evgo_777", "Airport Lot A", 37.6213, -122.3790, ccs("e1", 100, true, 0.4));
        ProviderStation ea = station("electrify_america", "ea_555", "SFO Long Term Parking", 37.6240, -122.3810,
                ccs("x1", 350, true, 0.5));

        // When
        NormalizationResult result = mapped.normalize(snapshots(evgo, ea));

        // Then
        assertEquals(1, result.stations.size());
        assertEquals("stn_sfo_terminal", result.stations.get(0).id);
        assertEquals(2, result.stations.get(0).chargers.size());
    }

    @Test
    void testNormalize_PrimaryIsMostCompleteRecord() {
        // Given - the lower-priority provider has the richer record
        ProviderStation chargepoint = station("chargepoint", "cp_100", "Harbor Point", 37.80, -122.41,
                ccs("c1", 50, true, 0.3));
        ProviderStation ea = station("electrify_america", "ea_100", "Harbor Point Plaza", 37.80001, -122.41001,
                ccs("e1", 150, true, 0.5));
        ea.address = "1 Harbor Way";
        ea.rating = 4.8;
        ea.operatingHours = "24/7";

        // When
        Station merged = normalizer.normalize(snapshots(chargepoint, ea)).stations.get(0);

        // Then
        assertEquals("Harbor Point Plaza", merged.name);
        assertEquals("1 Harbor Way", merged.address);
        assertEquals(4.8, merged.rating);
    }

    @Test
    void testNormalize_MalformedStationsDroppedWithAnnotation() {
        // Given
        ProviderStation good = station("evgo", "evgo_001", "Mall", 37.7649, -122.4294, ccs("e1", 100, true, 0.42));
        ProviderStation noName = station("evgo", "evgo_002", null, 37.7650, -122.4290, ccs("e2", 100, true, 0.42));
        ProviderStation noCoordinates = new ProviderStation("chargepoint", "cp_9", "Somewhere", null, null, null, null);
        ProviderStation outOfRange = station("electrify_america", "ea_9", "Nowhere", 123.0, -122.4, ccs("x", 50, true, 0.4));
        ProviderStation noId = station("electrify_america", null, "Nameless", 37.7, -122.4, ccs("y", 50, true, 0.4));

        // When
        NormalizationResult result = normalizer.normalize(snapshots(good, noName, noCoordinates, outOfRange, noId));

        // Then
        assertEquals(1, result.stations.size());
        assertEquals(4, result.schemaMismatches.size());
        for (ProviderError error : result.schemaMismatches) {
            assertEquals(ErrorKind.SCHEMA_MISMATCH, error.kind);
        }
    }

    @Test
    void testNormalize_MalformedChargerDroppedStationKept() {
        // Given
        ProviderStation station = station("chargepoint", "cp_001", "Downtown", 37.7849, -122.4094,
                ccs("cp_001_1", 50, true, 0.35),
                charger("cp_001_2", "SCHUKO", 3.7, true, 0.30),
                new ProviderCharger(null, "CCS", 50.0, true, 0.35));

        // When
        NormalizationResult result = normalizer.normalize(snapshots(station));

        // Then
        assertEquals(1, result.stations.size());
        assertEquals(1, result.stations.get(0).chargers.size());
        assertEquals(2, result.schemaMismatches.size());
        assertEquals("chargepoint", result.schemaMismatches.get(0).provider);
    }

    @Test
    void testNormalize_ChargerFieldsMapped() {
        // Given
        ProviderCharger unknownAvailability = new ProviderCharger("n1", "NACS", 250.0, null, null);
        ProviderStation station = station("electrify_america", "ea_002", "Mission Bay", 37.7706, -122.3893,
                unknownAvailability);

        // When
        Charger charger = normalizer.normalize(snapshots(station)).stations.get(0).chargers.get(0);

        // Then
        assertEquals("electrify_america:n1", charger.id);
        assertEquals(ConnectorType.TESLA, charger.connectorType);
        assertFalse(charger.available, "unknown availability is reported as unavailable");
        assertNull(charger.pricePerKwh);
        assertEquals(T0, charger.lastRefreshed);
    }

    @Test
    void testNormalize_DuplicateSourceKeepsLatestObservation() {
        // Given
        ProviderStation older = station("evgo", "evgo_001", "Mall", 37.7649, -122.4294, ccs("e1", 100, true, 0.42));
        ProviderStation newer = older.copy();
        newer.chargers.get(0).available = false;
        List<ProviderSnapshot> input = List.of(
                new ProviderSnapshot(newer, T0.plusSeconds(30)),
                new ProviderSnapshot(older, T0));

        // When
        NormalizationResult result = normalizer.normalize(input);

        // Then
        assertEquals(1, result.stations.size());
        assertFalse(result.stations.get(0).chargers.get(0).available);
        assertEquals(T0.plusSeconds(30), result.stations.get(0).chargers.get(0).lastRefreshed);
    }

    @Test
    void testNormalize_ThreeProvidersSameSite() {
        // Given
        ProviderStation cp = station("chargepoint", "cp_1", "Civic Center Garage", 37.7790, -122.4170, ccs("c", 50, true, 0.3));
        ProviderStation evgo = station("evgo", "evgo_1", "Civic Center Garage EVgo", 37.77902, -122.41702, ccs("e", 100, true, 0.4));
        ProviderStation ea = station("electrify_america", "ea_1", "Civic Center Garage", 37.77898, -122.41698, ccs("x", 150, true, 0.5));
        List<ProviderSnapshot> input = new ArrayList<>(snapshots(ea, cp, evgo));
        Collections.shuffle(input);

        // When
        NormalizationResult result = normalizer.normalize(input);

        // Then
        assertEquals(1, result.stations.size());
        assertEquals(3, result.stations.get(0).sources.size());
    }

    private static List<ProviderSnapshot> snapshots(ProviderStation... stations) {
        List<ProviderSnapshot> snapshots = new ArrayList<>();
        for (ProviderStation station : stations) {
            snapshots.add(new ProviderSnapshot(station, T0));
        }
        return snapshots;
    }
}
