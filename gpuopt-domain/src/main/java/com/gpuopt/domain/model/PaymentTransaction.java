package com.gpuopt.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Payment state as recorded locally. {@code (gateway, paymentId)} identifies a transaction.
 */
public record PaymentTransaction(
        String paymentId,
        String customerEmail,
        String gateway,
        SubscriptionTier plan,
        BigDecimal amount,
        String currency,
        PaymentStatus status,
        String metadataJson,
        Instant createdAt,
        Instant updatedAt
) {
    public PaymentTransaction withStatus(PaymentStatus next, Instant at) {
        return new PaymentTransaction(paymentId, customerEmail, gateway, plan, amount, currency,
                next, metadataJson, createdAt, at);
    }
}
