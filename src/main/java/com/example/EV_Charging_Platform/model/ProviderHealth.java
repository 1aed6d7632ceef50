package com.example.EV_Charging_Platform.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rolling health of one provider. Updated with plain atomics, no cross-provider coordination.
 */
public class ProviderHealth {

    public enum Status {
        OK,
        DEGRADED,
        DOWN
    }

    private final String provider;
    private final AtomicReference<Status> status = new AtomicReference<>(Status.OK);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong successCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicReference<Instant> lastSuccess = new AtomicReference<>();
    private final AtomicReference<Instant> lastFailure = new AtomicReference<>();
    private final AtomicReference<ErrorKind> lastErrorKind = new AtomicReference<>();

    public ProviderHealth(String provider) {
        this.provider = provider;
    }

    @JsonProperty("provider")
    public String getProvider() { return provider; }

    @JsonProperty("status")
    public Status getStatus() { return status.get(); }

    @JsonProperty("consecutiveFailures")
    public int getConsecutiveFailures() { return consecutiveFailures.get(); }

    @JsonProperty("successCount")
    public long getSuccessCount() { return successCount.get(); }

    @JsonProperty("failureCount")
    public long getFailureCount() { return failureCount.get(); }

    @JsonProperty("lastSuccess")
    public Instant getLastSuccess() { return lastSuccess.get(); }

    @JsonProperty("lastFailure")
    public Instant getLastFailure() { return lastFailure.get(); }

    @JsonProperty("lastErrorKind")
    public ErrorKind getLastErrorKind() { return lastErrorKind.get(); }

    public void recordSuccess(Instant now) {
        successCount.incrementAndGet();
        consecutiveFailures.set(0);
        lastSuccess.set(now);
        status.set(Status.OK);
    }

    /**
     * @return the status after this failure was counted
     */
    public Status recordFailure(ErrorKind kind, Instant now, int downThreshold) {
        failureCount.incrementAndGet();
        int failures = consecutiveFailures.incrementAndGet();
        lastFailure.set(now);
        lastErrorKind.set(kind);
        Status next = failures >= downThreshold ? Status.DOWN : Status.DEGRADED;
        status.set(next);
        return next;
    }

    @Override
    public String toString() {
        return String.format("ProviderHealth{provider='%s', status=%s, consecutiveFailures=%d}",
                provider, status.get(), consecutiveFailures.get());
    }
}
