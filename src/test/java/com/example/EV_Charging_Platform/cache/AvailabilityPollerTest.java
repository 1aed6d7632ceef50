package com.example.EV_Charging_Platform.cache;

import com.example.EV_Charging_Platform.model.ErrorKind;
import com.example.EV_Charging_Platform.provider.ProviderAdapter;
import com.example.EV_Charging_Platform.provider.ProviderRegistry;
import com.example.EV_Charging_Platform.provider.StationUpdateListener;
import com.example.EV_Charging_Platform.service.ProviderHealthTracker;
import com.example.EV_Charging_Platform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for AvailabilityPoller
 *
 * Tests cover:
 * - Push subscription for push-capable providers only
 * - One polling loop per provider plus the eviction sweep
 * - Jittered delays within bounds
 * - Polls skipped while a provider is down
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AvailabilityPollerTest {

    @Mock
    private AvailabilityCache cache;

    @Mock
    private ScheduledExecutorService scheduler;

    @Mock
    private ScheduledFuture<?> future;

    @Mock
    private ProviderAdapter chargepoint;

    @Mock
    private ProviderAdapter evgo;

    private MutableClock clock;
    private ProviderHealthTracker healthTracker;
    private AvailabilityPoller poller;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        healthTracker = new ProviderHealthTracker(clock, 2, Duration.ofSeconds(30));
        doReturn(future).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(),
                any(TimeUnit.class));
        when(chargepoint.name()).thenReturn("chargepoint");
        when(chargepoint.supportsPush()).thenReturn(true);
        when(evgo.name()).thenReturn("evgo");
        when(evgo.supportsPush()).thenReturn(false);
        ProviderRegistry registry = new ProviderRegistry(List.of(chargepoint, evgo));
        poller = new AvailabilityPoller(cache, registry, healthTracker, scheduler, Duration.ofSeconds(30),
                Map.of("evgo", Duration.ofSeconds(45)), 0.2, Duration.ofMinutes(5));
    }

    @Test
    void testStart_SubscribesPushProvidersAndSchedulesLoops() {
        // When
        poller.start();

        // Then
        verify(chargepoint).subscribe(any(StationUpdateListener.class));
        verify(evgo, never()).subscribe(any(StationUpdateListener.class));
        verify(scheduler, times(2)).schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS));
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(300_000L), eq(300_000L),
                eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void testStart_Idempotent() {
        // When
        poller.start();
        poller.start();

        // Then
        verify(chargepoint, times(1)).subscribe(any(StationUpdateListener.class));
    }

    @Test
    void testNextDelay_WithinJitterBounds() {
        for (int i = 0; i < 100; i++) {
            long delay = poller.nextDelayMillis("evgo");
            assertTrue(delay >= 36_000 && delay <= 54_000, "delay out of bounds: " + delay);
        }
        assertEquals(Duration.ofSeconds(30), poller.pollIntervalFor("chargepoint"));
    }

    @Test
    void testPollOnce_SkippedWhileProviderDown() {
        // Given
        healthTracker.recordFailure("evgo", ErrorKind.PROVIDER_UNAVAILABLE);
        healthTracker.recordFailure("evgo", ErrorKind.PROVIDER_UNAVAILABLE);

        // When
        poller.pollOnce(evgo);

        // Then
        verify(cache, never()).refreshProvider(any());
    }

    @Test
    void testPollOnce_ProbesAfterInterval() {
        // Given
        healthTracker.recordFailure("evgo", ErrorKind.PROVIDER_UNAVAILABLE);
        healthTracker.recordFailure("evgo", ErrorKind.PROVIDER_UNAVAILABLE);
        clock.advance(Duration.ofSeconds(31));

        // When
        poller.pollOnce(evgo);

        // Then
        verify(cache).refreshProvider(evgo);
    }

    @Test
    void testPollOnce_UnexpectedErrorContained() {
        // Given
        when(cache.refreshProvider(chargepoint)).thenThrow(new IllegalStateException("boom"));

        // When / Then
        assertDoesNotThrow(() -> poller.pollOnce(chargepoint));
    }

    @Test
    void testStop_CancelsScheduledWork() {
        // Given
        poller.start();

        // When
        poller.stop();

        // Then
        verify(future, times(3)).cancel(false);
    }

    @Test
    void testConstructor_RejectsInvalidJitter() {
        assertThrows(IllegalArgumentException.class, () -> new AvailabilityPoller(cache,
                new ProviderRegistry(List.of()), healthTracker, scheduler, Duration.ofSeconds(30), Map.of(), 1.0,
                Duration.ofMinutes(5)));
    }
}
