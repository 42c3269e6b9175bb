package com.gpuopt.application.payment;

import com.gpuopt.domain.model.SubscriptionTier;

import java.math.BigDecimal;

/**
 * What an adapter is asked to charge. Amount and currency are final (already converted if needed).
 */
public record ChargeRequest(
        String customerEmail,
        SubscriptionTier plan,
        BigDecimal amount,
        String currency,
        String countryCode
) {
}
