package com.example.EV_Charging_Platform.config;

import com.example.EV_Charging_Platform.cache.AvailabilityCache;
import com.example.EV_Charging_Platform.cache.AvailabilityPoller;
import com.example.EV_Charging_Platform.normalization.StationNormalizer;
import com.example.EV_Charging_Platform.payment.PaymentProcessor;
import com.example.EV_Charging_Platform.payment.SimulatedPaymentProcessor;
import com.example.EV_Charging_Platform.provider.ProviderAdapter;
import com.example.EV_Charging_Platform.provider.ProviderRegistry;
import com.example.EV_Charging_Platform.provider.ProviderStation;
import com.example.EV_Charging_Platform.provider.rest.CredentialSource;
import com.example.EV_Charging_Platform.provider.rest.RestProviderAdapter;
import com.example.EV_Charging_Platform.provider.simulated.SimulatedProviderAdapter;
import com.example.EV_Charging_Platform.service.ProviderHealthTracker;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Wires the provider layer, cache and executors from {@link PlatformProperties}.
 *
 * Providers are declared under {@code platform.providers.<name>}; {@code simulated} ones are
 * seeded from a JSON fixture on the classpath, {@code rest} ones talk to {@code base-url}.
 */
@Configuration
public class PlatformConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(PlatformConfiguration.class);

    private static final TypeReference<List<ProviderStation>> STATION_FIXTURE = new TypeReference<>() {};

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Provider calls. Unbounded queueing would hide a stuck provider, so a saturated pool rejects
     * and the caller reports PROVIDER_UNAVAILABLE.
     */
    @Bean(name = "providerCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor(PlatformProperties properties) {
        return new ThreadPoolExecutor(0, properties.getExecutor().getProviderCallThreads(),
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(),
                new CustomizableThreadFactory("provider-call-"));
    }

    @Bean(name = "backgroundScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService backgroundScheduler(PlatformProperties properties) {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(
                properties.getExecutor().getSchedulerThreads(), new CustomizableThreadFactory("background-"));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public StationNormalizer stationNormalizer(PlatformProperties properties) {
        return new StationNormalizer(properties.getMerge().toPolicy());
    }

    @Bean
    public ProviderHealthTracker providerHealthTracker(Clock clock, PlatformProperties properties) {
        return new ProviderHealthTracker(clock, properties.getHealth().getDownThreshold(),
                properties.getHealth().getProbeInterval());
    }

    @Bean
    public ProviderRegistry providerRegistry(PlatformProperties properties, ObjectMapper objectMapper, Clock clock) {
        List<ProviderAdapter> adapters = new ArrayList<>();
        for (Map.Entry<String, PlatformProperties.Provider> entry : properties.getProviders().entrySet()) {
            adapters.add(createAdapter(entry.getKey(), entry.getValue(), objectMapper, clock));
        }
        if (adapters.isEmpty()) {
            logger.warn("No providers configured under platform.providers, discovery will return nothing");
        }
        return new ProviderRegistry(adapters);
    }

    @Bean
    public AvailabilityCache availabilityCache(Clock clock,
                                               @Qualifier("providerCallExecutor") ExecutorService providerCallExecutor,
                                               ProviderHealthTracker healthTracker, PlatformProperties properties) {
        PlatformProperties.Cache cache = properties.getCache();
        return new AvailabilityCache(clock, providerCallExecutor, healthTracker, cache.getStaleness(),
                cache.getStalenessByProvider(), cache.getRefreshTimeout(), cache.getLongStaleWindow());
    }

    @Bean
    public AvailabilityPoller availabilityPoller(AvailabilityCache availabilityCache, ProviderRegistry registry,
                                                 ProviderHealthTracker healthTracker,
                                                 @Qualifier("backgroundScheduler") ScheduledExecutorService scheduler,
                                                 PlatformProperties properties) {
        PlatformProperties.Cache cache = properties.getCache();
        return new AvailabilityPoller(availabilityCache, registry, healthTracker, scheduler, cache.getPollInterval(),
                cache.getPollIntervalByProvider(), cache.getPollJitter(), cache.getEvictionInterval());
    }

    @Bean
    public PaymentProcessor paymentProcessor() {
        return new SimulatedPaymentProcessor();
    }

    private ProviderAdapter createAdapter(String name, PlatformProperties.Provider config, ObjectMapper objectMapper,
                                          Clock clock) {
        switch (config.getType()) {
            case "simulated": {
                List<ProviderStation> seed = config.getFixture() != null
                        ? loadFixture(config.getFixture(), objectMapper)
                        : List.of();
                SimulatedProviderAdapter adapter = new SimulatedProviderAdapter(name, config.getTimeout(),
                        config.isPush(), clock, seed);
                adapter.setLatency(config.getLatency());
                return adapter;
            }
            case "rest": {
                if (config.getBaseUrl() == null) {
                    throw new IllegalStateException("Provider " + name + " is of type rest but has no base-url");
                }
                WebClient webClient = WebClient.builder().baseUrl(config.getBaseUrl()).build();
                logger.info("REST provider {} at {}", name, config.getBaseUrl());
                return new RestProviderAdapter(name, webClient, config.getTimeout(),
                        CredentialSource.fixed(config.getApiKey()));
            }
            default:
                throw new IllegalStateException("Unknown provider type '" + config.getType() + "' for " + name);
        }
    }

    private static List<ProviderStation> loadFixture(String path, ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return objectMapper.readValue(in, STATION_FIXTURE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read provider fixture " + path, e);
        }
    }
}
