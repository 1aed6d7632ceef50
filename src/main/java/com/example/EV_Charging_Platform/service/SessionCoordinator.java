package com.example.EV_Charging_Platform.service;

import com.example.EV_Charging_Platform.config.PlatformProperties;
import com.example.EV_Charging_Platform.model.ConnectorType;
import com.example.EV_Charging_Platform.model.ErrorKind;
import com.example.EV_Charging_Platform.model.Session;
import com.example.EV_Charging_Platform.payment.PaymentCoordinator;
import com.example.EV_Charging_Platform.provider.ProviderAdapter;
import com.example.EV_Charging_Platform.provider.ProviderCalls;
import com.example.EV_Charging_Platform.provider.ProviderException;
import com.example.EV_Charging_Platform.provider.ProviderRegistry;
import com.example.EV_Charging_Platform.provider.ProviderSessionRef;
import com.example.EV_Charging_Platform.provider.ProviderSessionSummary;
import com.example.EV_Charging_Platform.repository.JsonFileRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Charging session lifecycle and reconciliation with the providers
 *
 * Sessions move REQUESTED -> STARTING -> ACTIVE -> STOPPING -> COMPLETED, or to FAILED from any
 * non-terminal state. Local intent is reconciled with the provider's view of the session:
 * - at most one non-terminal session per (user, charger), enforced by an atomic claim;
 * - all work on one session is serialized by its own lock, provider calls included;
 * - transient provider failures are retried, everything else fails the session with its kind;
 * - a background loop polls active sessions and completes those the provider already ended;
 * - completion hands the session to the PaymentCoordinator.
 */
@Service
public class SessionCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(SessionCoordinator.class);

    private final ProviderRegistry registry;
    private final StationAggregator aggregator;
    private final PaymentCoordinator payments;
    private final JsonFileRepository repository;
    private final ProviderHealthTracker healthTracker;
    private final ExecutorService providerCallExecutor;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final int startMaxAttempts;
    private final int stopMaxAttempts;
    private final Duration retryBackoff;
    private final Duration reconcileInterval;
    private final BigDecimal defaultPricePerKwh;
    private final int historyPageSize;

    // claim key (user|charger) -> session id holding it
    private final Map<String, String> claims = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> sessionLocks = new ConcurrentHashMap<>();
    private ScheduledFuture<?> reconcileLoop;

    public SessionCoordinator(ProviderRegistry registry, StationAggregator aggregator, PaymentCoordinator payments,
                              JsonFileRepository repository, ProviderHealthTracker healthTracker,
                              @Qualifier("providerCallExecutor") ExecutorService providerCallExecutor,
                              @Qualifier("backgroundScheduler") ScheduledExecutorService scheduler,
                              Clock clock, PlatformProperties properties) {
        this.registry = registry;
        this.aggregator = aggregator;
        this.payments = payments;
        this.repository = repository;
        this.healthTracker = healthTracker;
        this.providerCallExecutor = providerCallExecutor;
        this.scheduler = scheduler;
        this.clock = clock;

        PlatformProperties.Sessions config = properties.getSession();
        this.startMaxAttempts = Math.max(1, config.getStartMaxAttempts());
        this.stopMaxAttempts = Math.max(1, config.getStopMaxAttempts());
        this.retryBackoff = config.getRetryBackoff();
        this.reconcileInterval = config.getReconcileInterval();
        this.defaultPricePerKwh = config.getDefaultPricePerKwh();
        this.historyPageSize = config.getHistoryPageSize();
    }

    @PostConstruct
    public void start() {
        recoverOnStartup();
        long intervalMillis = reconcileInterval.toMillis();
        reconcileLoop = scheduler.scheduleWithFixedDelay(this::runReconcilePass, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
        logger.info("Session reconciliation scheduled every {}s", reconcileInterval.toSeconds());
    }

    @PreDestroy
    public void stop() {
        if (reconcileLoop != null) {
            reconcileLoop.cancel(false);
        }
    }

    // Operations

    /**
     * Start charging. The returned session is ACTIVE on success; otherwise FAILED with the failure kind
     * (SESSION_CONFLICT for a duplicate (user, charger) request or a busy charger).
     *
     * @throws IllegalArgumentException when the charger cannot be resolved
     */
    public Session start(String userId, String stationId, String chargerId) {
        ResolvedCharger charger = aggregator.resolveCharger(stationId, chargerId);
        double price = charger.pricePerKwh != null ? charger.pricePerKwh : defaultPricePerKwh.doubleValue();

        Session session = new Session("sess_" + UUID.randomUUID(), userId, stationId, charger.chargerId,
                charger.provider, charger.nativeChargerId, charger.connectorType, price, clock.instant());
        ReentrantLock lock = lockFor(session.getSessionId());
        lock.lock();
        try {
            repository.saveSession(session);

            String holder = claims.putIfAbsent(session.getClaimKey(), session.getSessionId());
            if (holder != null) {
                logger.warn("User {} already has session {} on charger {}", userId, holder, chargerId);
                session.fail(ErrorKind.SESSION_CONFLICT, "Session " + holder + " is already open on this charger",
                        clock.instant());
                repository.saveSession(session);
                return session;
            }

            session.transitionTo(Session.State.STARTING, clock.instant());
            repository.saveSession(session);
            logger.info("Starting session {} for user {} on {}", session.getSessionId(), userId, chargerId);

            requestStart(session);
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stop charging. Terminal sessions are returned as stored without contacting the provider.
     */
    public Session stop(String sessionId) {
        Session session = require(sessionId);
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            switch (session.getState()) {
                case COMPLETED:
                case FAILED:
                    logger.debug("Session {} already {}, returning stored summary", sessionId, session.getState());
                    return session;
                case REQUESTED:
                case STARTING:
                    fail(session, ErrorKind.PROVIDER_UNAVAILABLE, "Stopped before the provider acknowledged the start");
                    return session;
                case ACTIVE:
                    session.transitionTo(Session.State.STOPPING, clock.instant());
                    repository.saveSession(session);
                    logger.info("Stopping session {}", sessionId);
                    finishStop(session);
                    return session;
                case STOPPING:
                default:
                    finishStop(session);
                    return session;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current session; an active one is first synchronized with the provider when nobody else holds it
     */
    public Session status(String sessionId) {
        Session session = require(sessionId);
        if (session.getState() == Session.State.ACTIVE) {
            reconcile(session);
        }
        return session;
    }

    public List<Session> activeSessions(String userId) {
        return repository.findSessionsByUser(userId).stream()
                .filter(session -> !session.isTerminal())
                .collect(Collectors.toList());
    }

    /**
     * All sessions of a user, newest first
     */
    public List<Session> history(String userId, Integer limit, Integer offset) {
        int pageSize = limit != null ? limit : historyPageSize;
        int skip = offset != null ? offset : 0;
        if (pageSize <= 0 || skip < 0) {
            throw new IllegalArgumentException("limit must be positive and offset non-negative");
        }
        return repository.findSessionsByUser(userId).stream()
                .skip(skip)
                .limit(pageSize)
                .collect(Collectors.toList());
    }

    /**
     * Totals over the user's completed sessions, computed from the stored sessions. Cost uses the
     * same rounding as payment capture; ties for favorite station and connector go to the smaller value.
     */
    public SessionStats stats(String userId) {
        List<Session> sessions = repository.findSessionsByUser(userId);
        List<Session> completed = sessions.stream()
                .filter(session -> session.getState() == Session.State.COMPLETED)
                .collect(Collectors.toList());
        int failed = (int) sessions.stream().filter(session -> session.getState() == Session.State.FAILED).count();

        BigDecimal energy = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO.setScale(2);
        long minutes = 0;
        Map<String, Long> stationUse = new TreeMap<>();
        Map<ConnectorType, Long> connectorUse = new EnumMap<>(ConnectorType.class);
        for (Session session : completed) {
            energy = energy.add(BigDecimal.valueOf(session.getEnergyDeliveredKwh()));
            cost = cost.add(PaymentCoordinator.amountFor(session.getEnergyDeliveredKwh(), session.getPricePerKwh()));
            if (session.getDurationMinutes() != null) {
                minutes += session.getDurationMinutes();
            }
            stationUse.merge(session.getStationId(), 1L, Long::sum);
            if (session.getConnectorType() != null) {
                connectorUse.merge(session.getConnectorType(), 1L, Long::sum);
            }
        }

        double average = completed.isEmpty() ? 0.0
                : energy.divide(BigDecimal.valueOf(completed.size()), 2, RoundingMode.HALF_UP).doubleValue();
        return new SessionStats(userId, completed.size(), failed, energy.setScale(3, RoundingMode.HALF_UP).doubleValue(),
                cost, minutes, average, mostUsed(stationUse), mostUsed(connectorUse));
    }

    /**
     * One reconciliation pass over every ACTIVE and STOPPING session
     *
     * @return number of sessions that reached a terminal state during the pass
     */
    public int reconcileActiveSessions() {
        int finished = 0;
        for (Session session : repository.findAllSessions()) {
            Session.State state = session.getState();
            if (state != Session.State.ACTIVE && state != Session.State.STOPPING) {
                continue;
            }
            if (reconcile(session)) {
                finished++;
            }
        }
        if (finished > 0) {
            logger.info("Reconciliation finished {} sessions", finished);
        }
        return finished;
    }

    /**
     * Rebuild claims from the durable store. Sessions stuck before the provider acknowledged them
     * have no native id to reconcile against and are failed.
     *
     * @return number of sessions failed by recovery
     */
    public int recoverOnStartup() {
        int failed = 0;
        int restored = 0;
        for (Session session : repository.findAllSessions()) {
            if (session.isTerminal()) {
                continue;
            }
            ReentrantLock lock = lockFor(session.getSessionId());
            lock.lock();
            try {
                if (session.getProviderSessionId() == null) {
                    session.fail(ErrorKind.PROVIDER_UNAVAILABLE,
                            "Interrupted before the provider acknowledged the start", clock.instant());
                    repository.saveSession(session);
                    failed++;
                } else {
                    claims.put(session.getClaimKey(), session.getSessionId());
                    restored++;
                }
            } finally {
                lock.unlock();
            }
        }
        if (failed + restored > 0) {
            logger.info("Session recovery: {} sessions resumed, {} failed", restored, failed);
        }
        return failed;
    }

    // State machine

    private void requestStart(Session session) {
        ProviderAdapter adapter = registry.getRequired(session.getProvider());
        for (int attempt = 1; ; attempt++) {
            try {
                ProviderSessionRef ref = call(adapter, () -> adapter.startSession(session.getNativeChargerId()));
                if (ref.outcome == ProviderSessionRef.Outcome.CHARGER_BUSY) {
                    fail(session, ErrorKind.SESSION_CONFLICT, "Charger is busy at " + adapter.name());
                    return;
                }
                session.markActive(ref.nativeSessionId, ref.startedAt, clock.instant());
                repository.saveSession(session);
                logger.info("Session {} active as {} on {}", session.getSessionId(), ref.nativeSessionId, adapter.name());
                return;
            } catch (ProviderException e) {
                if (e.isTransient() && attempt < startMaxAttempts && backoff(attempt)) {
                    logger.warn("Start of session {} attempt {}/{} failed: {} {}", session.getSessionId(), attempt,
                            startMaxAttempts, e.getKind(), e.getMessage());
                    continue;
                }
                fail(session, e.toErrorKind(), e.getMessage());
                return;
            }
        }
    }

    private void finishStop(Session session) {
        ProviderAdapter adapter = registry.getRequired(session.getProvider());
        ProviderException lastError = null;
        for (int attempt = 1; attempt <= stopMaxAttempts; attempt++) {
            try {
                ProviderSessionSummary summary = call(adapter, () -> adapter.stopSession(session.getProviderSessionId()));
                complete(session, summary);
                return;
            } catch (ProviderException e) {
                lastError = e;
                logger.warn("Stop of session {} attempt {}/{} failed: {} {}", session.getSessionId(), attempt,
                        stopMaxAttempts, e.getKind(), e.getMessage());
                if (!e.isTransient() || attempt == stopMaxAttempts || !backoff(attempt)) {
                    break;
                }
            }
        }

        String detail = "Stop not confirmed by " + adapter.name() + ": " + lastError.getMessage();
        fail(session, lastError.toErrorKind(), detail);
        if (session.getEnergyDeliveredKwh() > 0) {
            payments.recordUnconfirmedStop(session, detail);
        }
    }

    /**
     * Poll one session; returns true when it reached a terminal state
     */
    private boolean reconcile(Session session) {
        ReentrantLock lock = lockFor(session.getSessionId());
        if (!lock.tryLock()) {
            return false;
        }
        try {
            if (session.getState() == Session.State.STOPPING) {
                finishStop(session);
                return session.isTerminal();
            }
            if (session.getState() != Session.State.ACTIVE) {
                return false;
            }

            ProviderAdapter adapter = registry.getRequired(session.getProvider());
            ProviderSessionSummary summary;
            try {
                summary = call(adapter, () -> adapter.getSessionStatus(session.getProviderSessionId()));
            } catch (ProviderException e) {
                logger.debug("Status poll for session {} failed: {} {}", session.getSessionId(), e.getKind(),
                        e.getMessage());
                return false;
            }

            if (summary.isEnded()) {
                logger.info("Provider {} reports session {} ended ({}), completing", adapter.name(),
                        session.getSessionId(), summary.status);
                session.transitionTo(Session.State.STOPPING, clock.instant());
                repository.saveSession(session);
                complete(session, summary);
                return true;
            }
            session.recordProgress(summary.energyDeliveredKwh, summary.currentPowerKw, clock.instant());
            repository.saveSession(session);
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void complete(Session session, ProviderSessionSummary summary) {
        session.complete(summary.energyDeliveredKwh, summary.durationMinutes, summary.endedAt, clock.instant());
        repository.saveSession(session);
        releaseClaim(session);
        logger.info("Session {} completed: {} kWh in {} min", session.getSessionId(),
                session.getEnergyDeliveredKwh(), session.getDurationMinutes());
        try {
            payments.captureForSession(session);
        } catch (RuntimeException e) {
            // the retry pass picks up pending and failed intents
            logger.error("Payment handoff for session {} failed", session.getSessionId(), e);
        }
    }

    private void fail(Session session, ErrorKind kind, String message) {
        session.fail(kind, message, clock.instant());
        repository.saveSession(session);
        releaseClaim(session);
        logger.warn("Session {} failed: {} {}", session.getSessionId(), kind, message);
    }

    // Helpers

    private <T> T call(ProviderAdapter adapter, ProviderCalls.Call<T> call) throws ProviderException {
        try {
            T result = ProviderCalls.withTimeout(providerCallExecutor, adapter, adapter.timeout(),
                    () -> ProviderCalls.withCredentialRefresh(adapter, call));
            healthTracker.recordSuccess(adapter.name());
            return result;
        } catch (ProviderException e) {
            if (e.isTransient() || e.getKind() == ProviderException.Kind.UNAUTHORIZED) {
                healthTracker.recordFailure(adapter.name(), e.toErrorKind());
            }
            throw e;
        }
    }

    private boolean backoff(int attempt) {
        try {
            Thread.sleep(retryBackoff.toMillis() * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void releaseClaim(Session session) {
        claims.remove(session.getClaimKey(), session.getSessionId());
    }

    private Session require(String sessionId) {
        return repository.findSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    // sorted maps, so the first maximum is the smallest key
    private static <K> K mostUsed(Map<K, Long> counts) {
        K best = null;
        long bestCount = 0;
        for (Map.Entry<K, Long> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private ReentrantLock lockFor(String sessionId) {
        return sessionLocks.computeIfAbsent(sessionId, id -> new ReentrantLock());
    }

    private void runReconcilePass() {
        try {
            reconcileActiveSessions();
        } catch (RuntimeException e) {
            logger.error("Session reconciliation pass failed", e);
        }
    }
}
