package com.gpuopt.application.payment;

import com.gpuopt.domain.model.SubscriptionTier;

import java.math.BigDecimal;

/**
 * Client request to buy a plan.
 *
 * @param amount  null means the plan's list price
 * @param gateway null means automatic selection by country
 */
public record PaymentRequest(
        String customerEmail,
        SubscriptionTier plan,
        BigDecimal amount,
        String currency,
        GatewayId gateway,
        String countryCode
) {
}
