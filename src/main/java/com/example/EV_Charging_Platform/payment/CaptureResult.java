package com.example.EV_Charging_Platform.payment;

import java.math.BigDecimal;

/**
 * Processor acknowledgement of a capture
 */
public class CaptureResult {

    public final String processorReference;
    public final BigDecimal amount;
    public final String currency;

    public CaptureResult(String processorReference, BigDecimal amount, String currency) {
        this.processorReference = processorReference;
        this.amount = amount;
        this.currency = currency;
    }

    @Override
    public String toString() {
        return String.format("CaptureResult{ref='%s', amount=%s %s}", processorReference, amount, currency);
    }
}
