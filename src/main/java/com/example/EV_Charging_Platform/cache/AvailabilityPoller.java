package com.example.EV_Charging_Platform.cache;

import com.example.EV_Charging_Platform.provider.ProviderAdapter;
import com.example.EV_Charging_Platform.provider.ProviderRegistry;
import com.example.EV_Charging_Platform.service.ProviderHealthTracker;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the availability cache warm.
 *
 * Push-capable providers are subscribed once at startup. Every provider additionally gets its own
 * polling loop on the background scheduler with an independent, jittered cadence, plus one
 * shared sweep that evicts long-stale entries.
 */
public class AvailabilityPoller {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityPoller.class);

    private final AvailabilityCache cache;
    private final ProviderRegistry registry;
    private final ProviderHealthTracker healthTracker;
    private final ScheduledExecutorService scheduler;
    private final Duration defaultPollInterval;
    private final Map<String, Duration> pollIntervalByProvider;
    private final double jitter;
    private final Duration evictionInterval;

    private final List<ScheduledFuture<?>> scheduled = new ArrayList<>();
    private volatile boolean running;

    public AvailabilityPoller(AvailabilityCache cache, ProviderRegistry registry, ProviderHealthTracker healthTracker,
                              ScheduledExecutorService scheduler, Duration defaultPollInterval,
                              Map<String, Duration> pollIntervalByProvider, double jitter, Duration evictionInterval) {
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("Poll jitter must be in [0, 1): " + jitter);
        }
        this.cache = cache;
        this.registry = registry;
        this.healthTracker = healthTracker;
        this.scheduler = scheduler;
        this.defaultPollInterval = defaultPollInterval;
        this.pollIntervalByProvider = pollIntervalByProvider != null ? Map.copyOf(pollIntervalByProvider) : Map.of();
        this.jitter = jitter;
        this.evictionInterval = evictionInterval;
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        for (ProviderAdapter adapter : registry.all()) {
            if (adapter.supportsPush()) {
                adapter.subscribe(cache::applyPush);
                logger.info("Subscribed to push updates from {}", adapter.name());
            }
            scheduleNext(adapter);
        }
        long sweepMillis = evictionInterval.toMillis();
        scheduled.add(scheduler.scheduleWithFixedDelay(this::sweep, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS));
        logger.info("Availability polling started for {} providers", registry.size());
    }

    @PreDestroy
    public synchronized void stop() {
        running = false;
        scheduled.forEach(future -> future.cancel(false));
        scheduled.clear();
        logger.info("Availability polling stopped");
    }

    public Duration pollIntervalFor(String provider) {
        return pollIntervalByProvider.getOrDefault(provider, defaultPollInterval);
    }

    /**
     * Base interval scaled by a random factor in [1 - jitter, 1 + jitter]
     */
    long nextDelayMillis(String provider) {
        long base = pollIntervalFor(provider).toMillis();
        if (jitter == 0) {
            return base;
        }
        double factor = 1 + ThreadLocalRandom.current().nextDouble(-jitter, jitter);
        return Math.max(1, Math.round(base * factor));
    }

    /**
     * One polling pass for a provider; skipped while the provider is down and not yet due a probe
     */
    void pollOnce(ProviderAdapter adapter) {
        if (!healthTracker.isAvailable(adapter.name())) {
            logger.debug("Skipping poll of {}: provider is down", adapter.name());
            return;
        }
        try {
            int refreshed = cache.refreshProvider(adapter);
            logger.debug("Polled {}: {} entries refreshed", adapter.name(), refreshed);
        } catch (RuntimeException e) {
            logger.error("Unexpected error polling {}", adapter.name(), e);
        }
    }

    private void scheduleNext(ProviderAdapter adapter) {
        if (!running) {
            return;
        }
        synchronized (this) {
            scheduled.removeIf(ScheduledFuture::isDone);
            try {
                scheduled.add(scheduler.schedule(() -> {
                    pollOnce(adapter);
                    scheduleNext(adapter);
                }, nextDelayMillis(adapter.name()), TimeUnit.MILLISECONDS));
            } catch (RejectedExecutionException e) {
                logger.debug("Scheduler shut down, polling loop for {} ends", adapter.name());
            }
        }
    }

    private void sweep() {
        try {
            cache.evictLongStale();
        } catch (RuntimeException e) {
            logger.error("Cache eviction sweep failed", e);
        }
    }
}
