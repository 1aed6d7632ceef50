package com.example.EV_Charging_Platform.dto;

import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Data Transfer Object for a refund; a missing amount refunds everything captured
 */
public class RefundRequest {

    @Positive
    public BigDecimal amount;

    public String reason;

    public RefundRequest() {}

    public RefundRequest(BigDecimal amount, String reason) {
        this.amount = amount;
        this.reason = reason;
    }
}
