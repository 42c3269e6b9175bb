package com.gpuopt.application.catalog;

import com.gpuopt.domain.model.SubscriptionTier;
import com.gpuopt.domain.model.TierLimits;

import java.math.BigDecimal;

/**
 * Tier -> price and limits.
 * Custom is priced per contract; the list price is the floor.
 */
public final class TierCatalog {

    private TierCatalog() {}

    public static TierLimits limits(SubscriptionTier tier) {
        return switch (tier) {
            case FREE -> new TierLimits(
                    BigDecimal.ZERO,
                    2,
                    100,
                    1000
            );
            case PROFESSIONAL -> new TierLimits(
                    new BigDecimal("49"),
                    TierLimits.UNBOUNDED,
                    1000,
                    10000
            );
            case ENTERPRISE -> new TierLimits(
                    new BigDecimal("199"),
                    TierLimits.UNBOUNDED,
                    TierLimits.UNBOUNDED,
                    TierLimits.UNBOUNDED
            );
            case CUSTOM -> new TierLimits(
                    new BigDecimal("499"),
                    TierLimits.UNBOUNDED,
                    TierLimits.UNBOUNDED,
                    TierLimits.UNBOUNDED
            );
        };
    }

    public static BigDecimal price(SubscriptionTier tier) {
        return limits(tier).monthlyPriceUsd();
    }
}
