package com.example.EV_Charging_Platform.service;

import com.example.EV_Charging_Platform.model.ErrorKind;
import com.example.EV_Charging_Platform.model.ProviderHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider health bookkeeping
 *
 * A provider goes DOWN after {@code downThreshold} consecutive failures and is skipped by
 * discovery until {@code probeInterval} has passed since its last failure; the next call then
 * acts as a probe and a single success restores it to OK.
 */
public class ProviderHealthTracker {

    private static final Logger logger = LoggerFactory.getLogger(ProviderHealthTracker.class);

    private final Map<String, ProviderHealth> healthByProvider = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int downThreshold;
    private final Duration probeInterval;

    public ProviderHealthTracker(Clock clock, int downThreshold, Duration probeInterval) {
        if (downThreshold < 1) {
            throw new IllegalArgumentException("downThreshold must be at least 1");
        }
        this.clock = clock;
        this.downThreshold = downThreshold;
        this.probeInterval = probeInterval;
    }

    public ProviderHealth health(String provider) {
        return healthByProvider.computeIfAbsent(provider, ProviderHealth::new);
    }

    public void recordSuccess(String provider) {
        ProviderHealth health = health(provider);
        ProviderHealth.Status before = health.getStatus();
        health.recordSuccess(clock.instant());
        if (before != ProviderHealth.Status.OK) {
            logger.info("Provider {} recovered ({} -> OK)", provider, before);
        }
    }

    /**
     * Soft kinds (stale cache served) say nothing about the provider and are ignored
     */
    public void recordFailure(String provider, ErrorKind kind) {
        if (kind.isSoft()) {
            return;
        }
        ProviderHealth health = health(provider);
        ProviderHealth.Status before = health.getStatus();
        ProviderHealth.Status after = health.recordFailure(kind, clock.instant(), downThreshold);
        if (after == ProviderHealth.Status.DOWN && before != ProviderHealth.Status.DOWN) {
            logger.warn("Provider {} marked DOWN after {} consecutive failures (last: {})",
                    provider, health.getConsecutiveFailures(), kind);
        } else {
            logger.debug("Provider {} failure recorded: {} ({} consecutive)",
                    provider, kind, health.getConsecutiveFailures());
        }
    }

    /**
     * Whether callers should attempt this provider right now
     */
    public boolean isAvailable(String provider) {
        ProviderHealth health = health(provider);
        if (health.getStatus() != ProviderHealth.Status.DOWN) {
            return true;
        }
        Instant lastFailure = health.getLastFailure();
        return lastFailure == null || !clock.instant().isBefore(lastFailure.plus(probeInterval));
    }

    public List<ProviderHealth> snapshot() {
        List<ProviderHealth> all = new ArrayList<>(healthByProvider.values());
        all.sort(Comparator.comparing(ProviderHealth::getProvider));
        return all;
    }

    public int getDownThreshold() {
        return downThreshold;
    }
}
