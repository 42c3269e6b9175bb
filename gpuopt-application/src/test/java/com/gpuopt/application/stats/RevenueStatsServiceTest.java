package com.gpuopt.application.stats;

import com.gpuopt.application.support.Fixtures;
import com.gpuopt.domain.model.SubscriptionTier;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class RevenueStatsServiceTest {

    private final Fixtures f = new Fixtures();
    private final RevenueStatsService stats = new RevenueStatsService(f.customers, f.clock);

    @Test
    void emptyBookHasZeroConversion() {
        RevenueStats s = stats.snapshot();
        assertThat(s.monthlyRecurringRevenue()).isEqualByComparingTo("0");
        assertThat(s.conversionRate()).isZero();
        assertThat(s.customersByTier()).containsEntry("free", 0L);
    }

    @Test
    void mrrAndConversionFromTierCounts() {
        f.identities.createCustomer("a@example.com");
        f.identities.createCustomer("b@example.com");
        f.identities.createCustomer("c@example.com");
        f.identities.createCustomer("d@example.com");
        f.upgrade("a@example.com", SubscriptionTier.PROFESSIONAL, "p1");
        f.upgrade("b@example.com", SubscriptionTier.ENTERPRISE, "p2");

        RevenueStats s = stats.snapshot();
        assertThat(s.monthlyRecurringRevenue()).isEqualByComparingTo("248");
        assertThat(s.conversionRate()).isEqualTo(50.0);
        assertThat(s.customersByTier()).containsEntry("free", 2L).containsEntry("professional", 1L);
        assertThat(s.dailySignups()).containsEntry(LocalDate.of(2024, 5, 1), 4L);
    }

    @Test
    void signupsOlderThanThirtyDaysAreExcluded() {
        f.identities.createCustomer("old@example.com");
        f.clock.advance(Duration.ofDays(31));
        f.identities.createCustomer("new@example.com");

        assertThat(stats.snapshot().dailySignups()).hasSize(1);
    }
}
