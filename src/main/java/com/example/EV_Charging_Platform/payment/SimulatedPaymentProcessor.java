package com.example.EV_Charging_Platform.payment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory processor, idempotent per key, with scripted failures for exercising retry paths
 */
public class SimulatedPaymentProcessor implements PaymentProcessor {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedPaymentProcessor.class);

    private final Map<String, CaptureResult> capturesByKey = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> capturedByReference = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> refundedByReference = new ConcurrentHashMap<>();
    private final Queue<Boolean> scriptedFailures = new ConcurrentLinkedQueue<>();
    private final AtomicInteger captureCalls = new AtomicInteger();
    private final AtomicInteger chargesCreated = new AtomicInteger();

    @Override
    public CaptureResult capture(String sessionId, BigDecimal amount, String currency, String idempotencyKey)
            throws PaymentProcessorException {
        captureCalls.incrementAndGet();
        Boolean retryable = scriptedFailures.poll();
        if (retryable != null) {
            throw new PaymentProcessorException("Simulated capture failure for session " + sessionId, retryable);
        }
        if (amount.signum() <= 0) {
            throw new PaymentProcessorException("Capture amount must be positive: " + amount, false);
        }

        CaptureResult result = capturesByKey.computeIfAbsent(idempotencyKey, key -> {
            String reference = "ch_" + UUID.randomUUID().toString().replace("-", "");
            capturedByReference.put(reference, amount);
            chargesCreated.incrementAndGet();
            logger.info("Captured {} cents ({}) for session {} as {}",
                    PaymentProcessor.toMinorUnits(amount), currency, sessionId, reference);
            return new CaptureResult(reference, amount, currency);
        });
        if (result.amount.compareTo(amount) != 0) {
            throw new PaymentProcessorException("Idempotency key " + idempotencyKey
                    + " reused with a different amount", false);
        }
        return result;
    }

    @Override
    public String refund(String processorReference, BigDecimal amount, String reason) throws PaymentProcessorException {
        BigDecimal captured = capturedByReference.get(processorReference);
        if (captured == null) {
            throw new PaymentProcessorException("Unknown charge " + processorReference, false);
        }
        synchronized (refundedByReference) {
            BigDecimal alreadyRefunded = refundedByReference.getOrDefault(processorReference, BigDecimal.ZERO);
            if (alreadyRefunded.add(amount).compareTo(captured) > 0) {
                throw new PaymentProcessorException("Refund of " + amount + " exceeds captured amount "
                        + captured + " for " + processorReference, false);
            }
            refundedByReference.put(processorReference, alreadyRefunded.add(amount));
        }
        String refundReference = "re_" + UUID.randomUUID().toString().replace("-", "");
        logger.info("Refunded {} on {} ({})", amount, processorReference, reason);
        return refundReference;
    }

    /**
     * The next {@code times} capture calls fail before touching any state
     */
    public void failNextCaptures(int times, boolean retryable) {
        for (int i = 0; i < times; i++) {
            scriptedFailures.add(retryable);
        }
    }

    public int getCaptureCalls() {
        return captureCalls.get();
    }

    /**
     * Distinct charges actually created, i.e. money moved
     */
    public int getChargesCreated() {
        return chargesCreated.get();
    }
}
