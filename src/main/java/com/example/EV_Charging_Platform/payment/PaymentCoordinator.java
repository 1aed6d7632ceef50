package com.example.EV_Charging_Platform.payment;

import com.example.EV_Charging_Platform.config.PlatformProperties;
import com.example.EV_Charging_Platform.model.PaymentIntent;
import com.example.EV_Charging_Platform.model.ReconciliationRecord;
import com.example.EV_Charging_Platform.model.Session;
import com.example.EV_Charging_Platform.repository.JsonFileRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * At-most-once payment capture for completed sessions
 *
 * Guarantees:
 * - one PaymentIntent per session, keyed by an idempotency key derived from the session id;
 * - the intent is persisted as PENDING before the processor is called;
 * - concurrent capture requests for one session serialize on a per-key lock, and all but the
 *   first get the existing intent back;
 * - captures that still fail after the retry budget leave a FAILED intent plus an open
 *   reconciliation record, which the scheduled retry keeps working on with the same key.
 */
@Service
public class PaymentCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(PaymentCoordinator.class);

    static final int DEFAULT_HISTORY_LIMIT = 10;

    private final JsonFileRepository repository;
    private final PaymentProcessor processor;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final String currency;
    private final int captureMaxAttempts;
    private final Duration retryBackoff;
    private final Duration retryInterval;

    private final Map<String, ReentrantLock> keyLocks = new ConcurrentHashMap<>();
    private ScheduledFuture<?> retryLoop;

    public PaymentCoordinator(JsonFileRepository repository, PaymentProcessor processor, Clock clock,
                              @Qualifier("backgroundScheduler") ScheduledExecutorService scheduler,
                              PlatformProperties properties) {
        this.repository = repository;
        this.processor = processor;
        this.clock = clock;
        this.scheduler = scheduler;
        this.currency = properties.getPayment().getCurrency();
        this.captureMaxAttempts = Math.max(1, properties.getPayment().getCaptureMaxAttempts());
        this.retryBackoff = properties.getPayment().getRetryBackoff();
        this.retryInterval = properties.getPayment().getRetryInterval();
    }

    @PostConstruct
    public void start() {
        long intervalMillis = retryInterval.toMillis();
        retryLoop = scheduler.scheduleWithFixedDelay(this::runRetryPass, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
        logger.info("Payment reconciliation scheduled every {}s", retryInterval.toSeconds());
    }

    @PreDestroy
    public void stop() {
        if (retryLoop != null) {
            retryLoop.cancel(false);
        }
    }

    public static String idempotencyKey(String sessionId) {
        return UUID.nameUUIDFromBytes(("session-capture:" + sessionId).getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Energy times price, rounded half-up to cents
     */
    public static BigDecimal amountFor(double energyKwh, double pricePerKwh) {
        return BigDecimal.valueOf(energyKwh)
                .multiply(BigDecimal.valueOf(pricePerKwh))
                .setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Capture payment for a completed session.
     *
     * @return the session's intent, or empty when nothing is billable (no energy or zero amount)
     */
    public Optional<PaymentIntent> captureForSession(Session session) {
        if (session.getState() != Session.State.COMPLETED) {
            throw new IllegalStateException("Session " + session.getSessionId() + " is " + session.getState()
                    + ", only completed sessions are billed");
        }
        if (session.getEnergyDeliveredKwh() <= 0) {
            logger.info("Session {} delivered no energy, nothing to capture", session.getSessionId());
            return Optional.empty();
        }

        String key = idempotencyKey(session.getSessionId());
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            Optional<PaymentIntent> existing = repository.findIntentBySession(session.getSessionId());
            if (existing.isPresent()) {
                logger.debug("Session {} already has intent {} in state {}",
                        session.getSessionId(), existing.get().getId(), existing.get().getState());
                return existing;
            }

            BigDecimal amount = amountFor(session.getEnergyDeliveredKwh(), session.getPricePerKwh());
            if (amount.signum() <= 0) {
                logger.info("Session {} rounds to a zero amount, nothing to capture", session.getSessionId());
                return Optional.empty();
            }

            PaymentIntent intent = new PaymentIntent("pi_" + UUID.randomUUID(), session.getSessionId(), amount,
                    currency, key, clock.instant());
            repository.saveIntent(intent);
            logger.info("Created payment intent {} for session {}: {} {} ({} kWh at {})", intent.getId(),
                    session.getSessionId(), amount, currency, session.getEnergyDeliveredKwh(), session.getPricePerKwh());

            attemptCapture(intent);
            return Optional.of(intent);
        } finally {
            lock.unlock();
        }
    }

    public Optional<PaymentIntent> intentForSession(String sessionId) {
        return repository.findIntentBySession(sessionId);
    }

    /**
     * Payments of the user's sessions, newest first
     */
    public List<PaymentIntent> history(String userId, Integer limit) {
        int size = limit != null ? limit : DEFAULT_HISTORY_LIMIT;
        if (size <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return repository.findSessionsByUser(userId).stream()
                .map(session -> repository.findIntentBySession(session.getSessionId()))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(PaymentIntent::getCreatedAt).reversed()
                        .thenComparing(PaymentIntent::getId))
                .limit(size)
                .collect(Collectors.toList());
    }

    public PaymentIntent intent(String paymentIntentId) {
        return repository.findIntent(paymentIntentId)
                .orElseThrow(() -> new PaymentIntentNotFoundException(paymentIntentId));
    }

    /**
     * Refund a captured intent, fully when {@code amount} is null
     *
     * @throws IllegalStateException when the intent is not captured
     * @throws IllegalArgumentException when the amount is not positive or exceeds the captured amount
     */
    public PaymentIntent refund(String paymentIntentId, BigDecimal amount, String reason)
            throws PaymentProcessorException {
        PaymentIntent intent = intent(paymentIntentId);
        ReentrantLock lock = lockFor(intent.getIdempotencyKey());
        lock.lock();
        try {
            if (intent.getState() != PaymentIntent.State.CAPTURED) {
                throw new IllegalStateException("Payment intent " + paymentIntentId + " is " + intent.getState()
                        + ", only captured payments can be refunded");
            }
            BigDecimal refundAmount = amount != null ? amount.setScale(2, RoundingMode.HALF_UP) : intent.getAmount();
            if (refundAmount.signum() <= 0 || refundAmount.compareTo(intent.getAmount()) > 0) {
                throw new IllegalArgumentException("Refund amount must be in (0, " + intent.getAmount() + "]: "
                        + refundAmount);
            }

            String refundReference = processor.refund(intent.getProcessorReference(), refundAmount,
                    reason != null ? reason : "requested_by_customer");
            intent.markRefunded(refundAmount, clock.instant());
            repository.saveIntent(intent);
            logger.info("Refunded {} {} of intent {} ({})", refundAmount, intent.getCurrency(), paymentIntentId,
                    refundReference);
            return intent;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Open reconciliation records, oldest first
     */
    public List<ReconciliationRecord> pendingReconciliation() {
        return repository.findOpenRecords();
    }

    /**
     * Note a session whose stop was never confirmed although energy was delivered
     */
    public ReconciliationRecord recordUnconfirmedStop(Session session, String detail) {
        ReconciliationRecord record = new ReconciliationRecord("rec_" + UUID.randomUUID(), session.getSessionId(),
                null, amountFor(session.getEnergyDeliveredKwh(), session.getPricePerKwh()),
                ReconciliationRecord.Reason.STOP_UNCONFIRMED, detail, clock.instant());
        repository.saveRecord(record);
        logger.warn("Stop of session {} unconfirmed after {} kWh, reconciliation record {} opened",
                session.getSessionId(), session.getEnergyDeliveredKwh(), record.getId());
        return record;
    }

    /**
     * Re-attempt failed captures, and pending ones nobody is working on (left over from a crash),
     * under their original idempotency keys.
     *
     * @return number of intents captured by this pass
     */
    public int retryFailedCaptures() {
        int captured = 0;
        for (PaymentIntent intent : repository.findIntentsByState(PaymentIntent.State.FAILED)) {
            captured += retry(intent) ? 1 : 0;
        }
        for (PaymentIntent intent : repository.findIntentsByState(PaymentIntent.State.PENDING)) {
            captured += retry(intent) ? 1 : 0;
        }
        if (captured > 0) {
            logger.info("Reconciliation pass captured {} payments", captured);
        }
        return captured;
    }

    private boolean retry(PaymentIntent intent) {
        ReentrantLock lock = lockFor(intent.getIdempotencyKey());
        if (!lock.tryLock()) {
            return false; // a capture for this key is in flight
        }
        try {
            if (intent.getState() == PaymentIntent.State.FAILED) {
                intent.reopen(clock.instant());
                repository.saveIntent(intent);
            } else if (intent.getState() != PaymentIntent.State.PENDING) {
                return false;
            }
            logger.info("Retrying capture of intent {} for session {}", intent.getId(), intent.getSessionId());
            attemptCapture(intent);
            return intent.getState() == PaymentIntent.State.CAPTURED;
        } finally {
            lock.unlock();
        }
    }

    private void attemptCapture(PaymentIntent intent) {
        PaymentProcessorException lastError = null;
        for (int attempt = 1; attempt <= captureMaxAttempts; attempt++) {
            intent.recordAttempt(clock.instant());
            try {
                CaptureResult result = processor.capture(intent.getSessionId(), intent.getAmount(),
                        intent.getCurrency(), intent.getIdempotencyKey());
                intent.markCaptured(result.processorReference, clock.instant());
                repository.saveIntent(intent);
                resolveRecords(intent);
                logger.info("Captured intent {} ({}) on attempt {}", intent.getId(), result.processorReference, attempt);
                return;
            } catch (PaymentProcessorException e) {
                lastError = e;
                logger.warn("Capture attempt {}/{} for intent {} failed: {}", attempt, captureMaxAttempts,
                        intent.getId(), e.getMessage());
                if (!e.isRetryable() || attempt == captureMaxAttempts || !backoff()) {
                    break;
                }
            }
        }

        String reason = lastError != null ? lastError.getMessage() : "capture not attempted";
        intent.markFailed(reason, clock.instant());
        repository.saveIntent(intent);
        openCaptureRecord(intent, reason);
    }

    private void openCaptureRecord(PaymentIntent intent, String reason) {
        Optional<ReconciliationRecord> open = repository.findRecordsBySession(intent.getSessionId()).stream()
                .filter(record -> !record.isResolved()
                        && record.getReason() == ReconciliationRecord.Reason.CAPTURE_FAILED)
                .findFirst();
        ReconciliationRecord record;
        if (open.isPresent()) {
            record = open.get();
            record.recordAttempt(reason, clock.instant());
        } else {
            record = new ReconciliationRecord("rec_" + UUID.randomUUID(), intent.getSessionId(), intent.getId(),
                    intent.getAmount(), ReconciliationRecord.Reason.CAPTURE_FAILED, reason, clock.instant());
        }
        repository.saveRecord(record);
        logger.error("Capture of intent {} for session {} failed, reconciliation record {}: {}",
                intent.getId(), intent.getSessionId(), record.getId(), reason);
    }

    private void resolveRecords(PaymentIntent intent) {
        for (ReconciliationRecord record : repository.findRecordsBySession(intent.getSessionId())) {
            if (!record.isResolved() && record.getReason() == ReconciliationRecord.Reason.CAPTURE_FAILED) {
                record.resolve(clock.instant());
                repository.saveRecord(record);
                logger.info("Reconciliation record {} resolved by capture of {}", record.getId(), intent.getId());
            }
        }
    }

    private boolean backoff() {
        try {
            Thread.sleep(retryBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ReentrantLock lockFor(String key) {
        return keyLocks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    private void runRetryPass() {
        try {
            retryFailedCaptures();
        } catch (RuntimeException e) {
            logger.error("Payment reconciliation pass failed", e);
        }
    }
}
