package com.gpuopt.application.stats;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

public record RevenueStats(
        Map<String, Long> customersByTier,
        BigDecimal monthlyRecurringRevenue,
        double totalCustomerSavings,
        Map<LocalDate, Long> dailySignups,
        double conversionRate
) {
}
