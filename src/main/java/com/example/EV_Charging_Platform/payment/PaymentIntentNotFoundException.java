package com.example.EV_Charging_Platform.payment;

public class PaymentIntentNotFoundException extends RuntimeException {

    public PaymentIntentNotFoundException(String paymentIntentId) {
        super("Payment intent not found: " + paymentIntentId);
    }
}
