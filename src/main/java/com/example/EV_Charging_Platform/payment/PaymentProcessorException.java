package com.example.EV_Charging_Platform.payment;

/**
 * Failure reported by the payment processor. Only retryable failures are attempted again.
 */
public class PaymentProcessorException extends Exception {

    private final boolean retryable;

    public PaymentProcessorException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public PaymentProcessorException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
