package com.gpuopt.application.stats;

import com.gpuopt.application.catalog.TierCatalog;
import com.gpuopt.application.ports.CustomerRepository;
import com.gpuopt.domain.model.SubscriptionTier;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only revenue dashboard figures.
 */
public class RevenueStatsService {

    static final Duration SIGNUP_WINDOW = Duration.ofDays(30);

    private final CustomerRepository customers;
    private final Clock clock;

    public RevenueStatsService(CustomerRepository customers, Clock clock) {
        this.customers = Objects.requireNonNull(customers, "customers");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RevenueStats snapshot() {
        Map<SubscriptionTier, Long> byTier = customers.countByTier();

        Map<String, Long> rendered = new LinkedHashMap<>();
        BigDecimal mrr = BigDecimal.ZERO;
        long total = 0;
        long paying = 0;
        for (SubscriptionTier tier : SubscriptionTier.values()) {
            long n = byTier.getOrDefault(tier, 0L);
            rendered.put(tier.code(), n);
            total += n;
            if (tier != SubscriptionTier.FREE) {
                paying += n;
                mrr = mrr.add(TierCatalog.price(tier).multiply(BigDecimal.valueOf(n)));
            }
        }

        double conversion = paying * 100.0 / Math.max(total, 1);
        return new RevenueStats(
                rendered,
                mrr,
                customers.totalMonthlySavings(),
                customers.dailySignups(clock.instant().minus(SIGNUP_WINDOW)),
                conversion
        );
    }
}
