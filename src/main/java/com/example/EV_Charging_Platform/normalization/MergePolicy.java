package com.example.EV_Charging_Platform.normalization;

import com.example.EV_Charging_Platform.model.SourceRef;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Policy constants for deciding when provider records describe the same physical station
 */
public class MergePolicy {

    public static final double DEFAULT_DISTANCE_METERS = 50.0;
    public static final double DEFAULT_NAME_SIMILARITY = 0.6;
    public static final List<String> DEFAULT_PROVIDER_PRIORITY = List.of("chargepoint", "evgo", "electrify_america");

    private final double distanceMeters;
    private final double nameSimilarityThreshold;
    private final List<String> providerPriority;
    private final Map<String, String> groupBySourceKey;

    /**
     * @param idMappings explicit cross-provider groups: group id -> "provider:nativeId" members
     */
    public MergePolicy(double distanceMeters, double nameSimilarityThreshold, List<String> providerPriority,
                       Map<String, List<String>> idMappings) {
        if (distanceMeters < 0 || nameSimilarityThreshold < 0 || nameSimilarityThreshold > 1) {
            throw new IllegalArgumentException("Invalid merge thresholds: distance=" + distanceMeters
                    + ", similarity=" + nameSimilarityThreshold);
        }
        this.distanceMeters = distanceMeters;
        this.nameSimilarityThreshold = nameSimilarityThreshold;
        this.providerPriority = List.copyOf(providerPriority);
        this.groupBySourceKey = new HashMap<>();
        if (idMappings != null) {
            idMappings.forEach((group, members) -> members.forEach(member -> {
                String previous = groupBySourceKey.putIfAbsent(member.trim(), group);
                if (previous != null && !previous.equals(group)) {
                    throw new IllegalArgumentException("Source " + member + " mapped to both " + previous + " and " + group);
                }
            }));
        }
    }

    public static MergePolicy defaults() {
        return new MergePolicy(DEFAULT_DISTANCE_METERS, DEFAULT_NAME_SIMILARITY, DEFAULT_PROVIDER_PRIORITY, Map.of());
    }

    public double getDistanceMeters() { return distanceMeters; }
    public double getNameSimilarityThreshold() { return nameSimilarityThreshold; }
    public List<String> getProviderPriority() { return providerPriority; }

    public Optional<String> explicitGroup(SourceRef source) {
        return Optional.ofNullable(groupBySourceKey.get(source.key()));
    }

    /**
     * Lower is preferred; providers missing from the list rank after all listed ones
     */
    public int priorityOf(String provider) {
        int index = providerPriority.indexOf(provider);
        return index >= 0 ? index : providerPriority.size();
    }
}
