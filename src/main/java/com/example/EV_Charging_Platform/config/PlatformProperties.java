package com.example.EV_Charging_Platform.config;

import com.example.EV_Charging_Platform.normalization.MergePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All tunables of the platform, bound from {@code platform.*} in application.properties.
 * Defaults here are the values used when a property is absent.
 */
@ConfigurationProperties(prefix = "platform")
public class PlatformProperties {

    private final Discovery discovery = new Discovery();
    private final Cache cache = new Cache();
    private final Merge merge = new Merge();
    private final Health health = new Health();
    private final Sessions session = new Sessions();
    private final Payment payment = new Payment();
    private final Storage storage = new Storage();
    private final Executor executor = new Executor();
    private Map<String, Provider> providers = new LinkedHashMap<>();

    public Discovery getDiscovery() { return discovery; }
    public Cache getCache() { return cache; }
    public Merge getMerge() { return merge; }
    public Health getHealth() { return health; }
    public Sessions getSession() { return session; }
    public Payment getPayment() { return payment; }
    public Storage getStorage() { return storage; }
    public Executor getExecutor() { return executor; }
    public Map<String, Provider> getProviders() { return providers; }
    public void setProviders(Map<String, Provider> providers) { this.providers = providers; }

    public static class Discovery {
        private Duration deadline = Duration.ofSeconds(3);
        private double defaultRadiusMeters = 5000;

        public Duration getDeadline() { return deadline; }
        public void setDeadline(Duration deadline) { this.deadline = deadline; }
        public double getDefaultRadiusMeters() { return defaultRadiusMeters; }
        public void setDefaultRadiusMeters(double defaultRadiusMeters) { this.defaultRadiusMeters = defaultRadiusMeters; }
    }

    public static class Cache {
        private Duration staleness = Duration.ofSeconds(60);
        private Map<String, Duration> stalenessByProvider = new HashMap<>();
        private Duration refreshTimeout = Duration.ofSeconds(1);
        private Duration longStaleWindow = Duration.ofHours(1);
        private Duration pollInterval = Duration.ofSeconds(30);
        private Map<String, Duration> pollIntervalByProvider = new HashMap<>();
        private double pollJitter = 0.2;
        private Duration evictionInterval = Duration.ofMinutes(5);

        public Duration getStaleness() { return staleness; }
        public void setStaleness(Duration staleness) { this.staleness = staleness; }
        public Map<String, Duration> getStalenessByProvider() { return stalenessByProvider; }
        public void setStalenessByProvider(Map<String, Duration> stalenessByProvider) { this.stalenessByProvider = stalenessByProvider; }
        public Duration getRefreshTimeout() { return refreshTimeout; }
        public void setRefreshTimeout(Duration refreshTimeout) { this.refreshTimeout = refreshTimeout; }
        public Duration getLongStaleWindow() { return longStaleWindow; }
        public void setLongStaleWindow(Duration longStaleWindow) { this.longStaleWindow = longStaleWindow; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Map<String, Duration> getPollIntervalByProvider() { return pollIntervalByProvider; }
        public void setPollIntervalByProvider(Map<String, Duration> pollIntervalByProvider) { this.pollIntervalByProvider = pollIntervalByProvider; }
        public double getPollJitter() { return pollJitter; }
        public void setPollJitter(double pollJitter) { this.pollJitter = pollJitter; }
        public Duration getEvictionInterval() { return evictionInterval; }
        public void setEvictionInterval(Duration evictionInterval) { this.evictionInterval = evictionInterval; }
    }

    public static class Merge {
        private double distanceMeters = MergePolicy.DEFAULT_DISTANCE_METERS;
        private double nameSimilarity = MergePolicy.DEFAULT_NAME_SIMILARITY;
        private List<String> providerPriority = new ArrayList<>(MergePolicy.DEFAULT_PROVIDER_PRIORITY);
        // group id -> "provider:nativeStationId" members
        private Map<String, List<String>> idMappings = new HashMap<>();

        public double getDistanceMeters() { return distanceMeters; }
        public void setDistanceMeters(double distanceMeters) { this.distanceMeters = distanceMeters; }
        public double getNameSimilarity() { return nameSimilarity; }
        public void setNameSimilarity(double nameSimilarity) { this.nameSimilarity = nameSimilarity; }
        public List<String> getProviderPriority() { return providerPriority; }
        public void setProviderPriority(List<String> providerPriority) { this.providerPriority = providerPriority; }
        public Map<String, List<String>> getIdMappings() { return idMappings; }
        public void setIdMappings(Map<String, List<String>> idMappings) { this.idMappings = idMappings; }

        public MergePolicy toPolicy() {
            return new MergePolicy(distanceMeters, nameSimilarity, providerPriority, idMappings);
        }
    }

    public static class Health {
        private int downThreshold = 3;
        private Duration probeInterval = Duration.ofSeconds(30);

        public int getDownThreshold() { return downThreshold; }
        public void setDownThreshold(int downThreshold) { this.downThreshold = downThreshold; }
        public Duration getProbeInterval() { return probeInterval; }
        public void setProbeInterval(Duration probeInterval) { this.probeInterval = probeInterval; }
    }

    public static class Sessions {
        private int startMaxAttempts = 3;
        private int stopMaxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(200);
        private Duration reconcileInterval = Duration.ofSeconds(15);
        private BigDecimal defaultPricePerKwh = new BigDecimal("0.35");
        private int historyPageSize = 20;

        public int getStartMaxAttempts() { return startMaxAttempts; }
        public void setStartMaxAttempts(int startMaxAttempts) { this.startMaxAttempts = startMaxAttempts; }
        public int getStopMaxAttempts() { return stopMaxAttempts; }
        public void setStopMaxAttempts(int stopMaxAttempts) { this.stopMaxAttempts = stopMaxAttempts; }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
        public Duration getReconcileInterval() { return reconcileInterval; }
        public void setReconcileInterval(Duration reconcileInterval) { this.reconcileInterval = reconcileInterval; }
        public BigDecimal getDefaultPricePerKwh() { return defaultPricePerKwh; }
        public void setDefaultPricePerKwh(BigDecimal defaultPricePerKwh) { this.defaultPricePerKwh = defaultPricePerKwh; }
        public int getHistoryPageSize() { return historyPageSize; }
        public void setHistoryPageSize(int historyPageSize) { this.historyPageSize = historyPageSize; }
    }

    public static class Payment {
        private String currency = "usd";
        private int captureMaxAttempts = 3;
        private Duration retryBackoff = Duration.ofMillis(100);
        private Duration retryInterval = Duration.ofMinutes(5);

        public String getCurrency() { return currency; }
        public void setCurrency(String currency) { this.currency = currency; }
        public int getCaptureMaxAttempts() { return captureMaxAttempts; }
        public void setCaptureMaxAttempts(int captureMaxAttempts) { this.captureMaxAttempts = captureMaxAttempts; }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
        public Duration getRetryInterval() { return retryInterval; }
        public void setRetryInterval(Duration retryInterval) { this.retryInterval = retryInterval; }
    }

    public static class Storage {
        private String dataDir = "./data";

        public String getDataDir() { return dataDir; }
        public void setDataDir(String dataDir) { this.dataDir = dataDir; }
    }

    public static class Executor {
        private int providerCallThreads = 32;
        private int schedulerThreads = 4;

        public int getProviderCallThreads() { return providerCallThreads; }
        public void setProviderCallThreads(int providerCallThreads) { this.providerCallThreads = providerCallThreads; }
        public int getSchedulerThreads() { return schedulerThreads; }
        public void setSchedulerThreads(int schedulerThreads) { this.schedulerThreads = schedulerThreads; }
    }

    /**
     * One charging network. {@code type} is {@code simulated} (fixture-backed) or {@code rest}.
     */
    public static class Provider {
        private String type = "simulated";
        private Duration timeout = Duration.ofSeconds(2);
        private String fixture;
        private Duration latency = Duration.ZERO;
        private boolean push;
        private String baseUrl;
        private String apiKey;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public String getFixture() { return fixture; }
        public void setFixture(String fixture) { this.fixture = fixture; }
        public Duration getLatency() { return latency; }
        public void setLatency(Duration latency) { this.latency = latency; }
        public boolean isPush() { return push; }
        public void setPush(boolean push) { this.push = push; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    }
}
