package com.gpuopt.api.maintenance;

import com.gpuopt.api.config.GpuOptProperties;
import com.gpuopt.application.cache.TtlCache;
import com.gpuopt.application.guard.AccessGuard;
import com.gpuopt.application.payment.PaymentOrchestrator;
import com.gpuopt.domain.model.Customer;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class MaintenanceJobsTest {

  private static GpuOptProperties withGuard(GpuOptProperties.Guard guard) {
    return new GpuOptProperties(null, null, null, null, guard, null, null);
  }

  @Test
  void defaultsKeepCountersForTheHourlyQuotas() {
    assertThat(MaintenanceJobs.evictionWindow(withGuard(null).guard())).isEqualTo(Duration.ofHours(1));
  }

  @Test
  void longestConfiguredWindowWins() {
    GpuOptProperties.Guard guard = new GpuOptProperties.Guard(
        50, Duration.ofHours(2), 5, Duration.ofMinutes(1), 5, Duration.ofHours(6));

    assertThat(MaintenanceJobs.evictionWindow(guard)).isEqualTo(Duration.ofHours(6));
  }

  @Test
  void evictionRunUsesTheConfiguredWindow() {
    AccessGuard accessGuard = mock(AccessGuard.class);
    MaintenanceJobs jobs = new MaintenanceJobs(
        new TtlCache<String, Customer>(Duration.ofMinutes(5), Clock.systemUTC()),
        accessGuard,
        mock(PaymentOrchestrator.class),
        withGuard(new GpuOptProperties.Guard(50, Duration.ofHours(2), 0, null, 0, null)));

    jobs.evictRateLimitWindows();

    verify(accessGuard).evictIdleWindows(Duration.ofHours(2));
  }
}
