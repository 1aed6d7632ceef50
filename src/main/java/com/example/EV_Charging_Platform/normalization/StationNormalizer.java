package com.example.EV_Charging_Platform.normalization;

import com.example.EV_Charging_Platform.model.Charger;
import com.example.EV_Charging_Platform.model.ConnectorType;
import com.example.EV_Charging_Platform.model.ErrorKind;
import com.example.EV_Charging_Platform.model.GeoPoint;
import com.example.EV_Charging_Platform.model.ProviderError;
import com.example.EV_Charging_Platform.model.SourceRef;
import com.example.EV_Charging_Platform.model.Station;
import com.example.EV_Charging_Platform.provider.ProviderCharger;
import com.example.EV_Charging_Platform.provider.ProviderSnapshot;
import com.example.EV_Charging_Platform.provider.ProviderStation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Normalization layer: turns provider payloads into canonical stations.
 *
 * Merge rules:
 * - records sharing an explicit cross-provider mapping group always merge;
 * - otherwise a record joins a cluster when it lies within the merge distance of every
 *   member and its name is similar enough to the cluster's primary record, whichever
 *   provider reported it;
 * - chargers are never deduplicated, the merged station carries the union;
 * - station-level fields come from the most complete record, ties broken by provider priority.
 *
 * Malformed records are dropped and reported as SCHEMA_MISMATCH, never thrown.
 */
public class StationNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(StationNormalizer.class);

    private final MergePolicy policy;

    public StationNormalizer(MergePolicy policy) {
        this.policy = policy;
    }

    public MergePolicy getPolicy() {
        return policy;
    }

    public NormalizationResult normalize(Collection<ProviderSnapshot> snapshots) {
        List<ProviderError> mismatches = new ArrayList<>();
        Map<SourceRef, ValidRecord> records = new LinkedHashMap<>();

        for (ProviderSnapshot snapshot : snapshots) {
            ValidRecord record = validate(snapshot, mismatches);
            if (record == null) {
                continue;
            }
            // the same source seen twice (e.g. two cache paths): keep the freshest observation
            records.merge(record.source, record,
                    (existing, candidate) -> candidate.observedAt.isAfter(existing.observedAt) ? candidate : existing);
        }

        List<Station> stations = new ArrayList<>();
        for (List<ValidRecord> cluster : cluster(new ArrayList<>(records.values()))) {
            stations.add(merge(cluster));
        }

        if (!mismatches.isEmpty()) {
            logger.debug("Dropped {} malformed provider payloads during normalization", mismatches.size());
        }
        return new NormalizationResult(stations, mismatches);
    }

    // Validation

    private ValidRecord validate(ProviderSnapshot snapshot, List<ProviderError> mismatches) {
        ProviderStation payload = snapshot.payload;
        String provider = payload.provider != null ? payload.provider : "unknown";

        List<String> missing = new ArrayList<>();
        if (isBlank(payload.stationId)) missing.add("station_id");
        if (isBlank(payload.name)) missing.add("name");
        if (payload.latitude == null) missing.add("latitude");
        if (payload.longitude == null) missing.add("longitude");
        if (payload.provider == null) missing.add("provider");

        if (!missing.isEmpty()) {
            mismatches.add(new ProviderError(provider, ErrorKind.SCHEMA_MISMATCH,
                    "Station " + payload.stationId + " missing " + String.join(", ", missing)));
            return null;
        }
        if (!GeoPoint.isValid(payload.latitude, payload.longitude)) {
            mismatches.add(new ProviderError(provider, ErrorKind.SCHEMA_MISMATCH,
                    "Station " + payload.stationId + " has out-of-range coordinates"));
            return null;
        }

        List<ProviderCharger> chargers = new ArrayList<>();
        Set<String> seenChargerIds = new HashSet<>();
        if (payload.chargers != null) {
            for (ProviderCharger charger : payload.chargers) {
                String problem = chargerProblem(charger);
                if (problem == null && !seenChargerIds.add(charger.chargerId)) {
                    problem = "duplicate charger_id " + charger.chargerId;
                }
                if (problem != null) {
                    mismatches.add(new ProviderError(provider, ErrorKind.SCHEMA_MISMATCH,
                            "Station " + payload.stationId + ": " + problem));
                    continue;
                }
                chargers.add(charger);
            }
        }

        return new ValidRecord(new SourceRef(provider, payload.stationId), payload,
                new GeoPoint(payload.latitude, payload.longitude), chargers, snapshot.observedAt);
    }

    private static String chargerProblem(ProviderCharger charger) {
        if (charger == null) {
            return "null charger entry";
        }
        if (isBlank(charger.chargerId)) {
            return "charger without charger_id";
        }
        if (ConnectorType.fromProviderValue(charger.connectorType) == null) {
            return "charger " + charger.chargerId + " has unknown connector_type '" + charger.connectorType + "'";
        }
        return null;
    }

    // Clustering

    private List<List<ValidRecord>> cluster(List<ValidRecord> records) {
        // deterministic order: provider priority, then native id
        records.sort(Comparator.comparingInt((ValidRecord r) -> policy.priorityOf(r.source.provider))
                .thenComparing(r -> r.source.provider)
                .thenComparing(r -> r.source.nativeId));

        Map<String, List<ValidRecord>> explicitClusters = new LinkedHashMap<>();
        List<List<ValidRecord>> geoClusters = new ArrayList<>();

        for (ValidRecord record : records) {
            String group = policy.explicitGroup(record.source).orElse(null);
            if (group != null) {
                record.group = group;
                explicitClusters.computeIfAbsent(group, g -> new ArrayList<>()).add(record);
                continue;
            }
            List<ValidRecord> target = null;
            for (List<ValidRecord> cluster : geoClusters) {
                if (accepts(cluster, record)) {
                    target = cluster;
                    break;
                }
            }
            if (target == null) {
                target = new ArrayList<>();
                geoClusters.add(target);
            }
            target.add(record);
        }

        List<List<ValidRecord>> clusters = new ArrayList<>(explicitClusters.values());
        clusters.addAll(geoClusters);
        return clusters;
    }

    private boolean accepts(List<ValidRecord> cluster, ValidRecord candidate) {
        for (ValidRecord member : cluster) {
            if (member.location.distanceMeters(candidate.location) > policy.getDistanceMeters()) {
                return false;
            }
        }
        return NameSimilarity.score(cluster.get(0).payload.name, candidate.payload.name)
                >= policy.getNameSimilarityThreshold();
    }

    // Merge

    private Station merge(List<ValidRecord> cluster) {
        ValidRecord primary = cluster.stream()
                .min(Comparator.comparingInt((ValidRecord r) -> -completeness(r.payload))
                        .thenComparingInt(r -> policy.priorityOf(r.source.provider))
                        .thenComparing(r -> r.source.provider)
                        .thenComparing(r -> r.source.nativeId))
                .orElseThrow();

        String stationId = canonicalId(cluster);

        List<SourceRef> sources = new ArrayList<>();
        List<Charger> chargers = new ArrayList<>();
        for (ValidRecord record : cluster) {
            sources.add(record.source);
            for (ProviderCharger charger : record.chargers) {
                chargers.add(new Charger(
                        stationId,
                        record.source.provider,
                        charger.chargerId,
                        ConnectorType.fromProviderValue(charger.connectorType),
                        charger.powerKw != null ? charger.powerKw : 0.0,
                        Boolean.TRUE.equals(charger.available),
                        charger.pricePerKwh,
                        record.observedAt));
            }
        }
        chargers.sort(Comparator.comparing(charger -> charger.id));

        ProviderStation fields = primary.payload;
        return new Station(stationId, sources, primary.location, fields.name, fields.address,
                chargers, fields.amenities, fields.rating, fields.operatingHours);
    }

    /**
     * Id derived from the cluster alone. Callers that publish ids keep the first one a source
     * was seen under, so this only names clusters none of whose sources has been published.
     */
    private String canonicalId(List<ValidRecord> cluster) {
        ValidRecord first = cluster.get(0);
        if (first.group != null) {
            return "stn_" + first.group;
        }
        // clusters are built in priority order, so the first record is the highest-priority source
        return "stn_" + UUID.nameUUIDFromBytes(first.source.key().getBytes(StandardCharsets.UTF_8));
    }

    private static int completeness(ProviderStation payload) {
        int score = 0;
        if (!isBlank(payload.name)) score++;
        if (!isBlank(payload.address)) score++;
        if (payload.amenities != null && !payload.amenities.isEmpty()) score++;
        if (payload.rating != null) score++;
        if (!isBlank(payload.operatingHours)) score++;
        return score;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class ValidRecord {
        final SourceRef source;
        final ProviderStation payload;
        final GeoPoint location;
        final List<ProviderCharger> chargers;
        final Instant observedAt;
        String group;

        ValidRecord(SourceRef source, ProviderStation payload, GeoPoint location,
                    List<ProviderCharger> chargers, Instant observedAt) {
            this.source = source;
            this.payload = payload;
            this.location = location;
            this.chargers = chargers;
            this.observedAt = observedAt;
        }
    }
}
