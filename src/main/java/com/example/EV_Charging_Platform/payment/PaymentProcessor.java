package com.example.EV_Charging_Platform.payment;

import java.math.BigDecimal;

/**
 * Abstraction over the external payment processor.
 *
 * Implementations must treat {@code idempotencyKey} as the identity of a capture: repeating a
 * capture with a key already seen returns the original result and moves no money.
 */
public interface PaymentProcessor {

    CaptureResult capture(String sessionId, BigDecimal amount, String currency, String idempotencyKey)
            throws PaymentProcessorException;

    /**
     * @return processor reference of the refund
     */
    String refund(String processorReference, BigDecimal amount, String reason) throws PaymentProcessorException;

    /**
     * Amount in the smallest currency unit (cents), as processors expect it
     */
    static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).longValueExact();
    }
}
