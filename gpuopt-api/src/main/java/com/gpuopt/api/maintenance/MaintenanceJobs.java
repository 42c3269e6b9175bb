package com.gpuopt.api.maintenance;

import com.gpuopt.api.config.GpuOptProperties;
import com.gpuopt.application.cache.TtlCache;
import com.gpuopt.application.guard.AccessGuard;
import com.gpuopt.application.guard.GuardStages;
import com.gpuopt.application.payment.PaymentOrchestrator;
import com.gpuopt.domain.model.Customer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Periodic housekeeping: cache purge, idle rate-limit windows, pending payment reconciliation.
 */
@Component
@ConditionalOnProperty(prefix = "gpuopt.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MaintenanceJobs {

  private static final Logger log = LoggerFactory.getLogger(MaintenanceJobs.class);

  private final TtlCache<String, Customer> customerCache;
  private final AccessGuard accessGuard;
  private final PaymentOrchestrator payments;
  private final Duration reconcileAfter;
  private final Duration idleAfter;

  public MaintenanceJobs(TtlCache<String, Customer> customerCache,
                         AccessGuard accessGuard,
                         PaymentOrchestrator payments,
                         GpuOptProperties props) {
    this.customerCache = customerCache;
    this.accessGuard = accessGuard;
    this.payments = payments;
    this.reconcileAfter = props.payments().reconcileAfter();
    this.idleAfter = evictionWindow(props.guard());
  }

  @Scheduled(fixedDelayString = "${gpuopt.maintenance.cache-purge-ms:60000}")
  public void purgeCache() {
    int purged = customerCache.purgeExpired();
    if (purged > 0) log.debug("Purged {} expired cache entries", purged);
  }

  @Scheduled(fixedDelayString = "${gpuopt.maintenance.limiter-eviction-ms:300000}")
  public void evictRateLimitWindows() {
    accessGuard.evictIdleWindows(idleAfter);
  }

  /** A counter is only dropped once it has been idle longer than any window that might still count it. */
  static Duration evictionWindow(GpuOptProperties.Guard guard) {
    Duration longest = GuardStages.TIER_WINDOW;
    for (Duration w : List.of(guard.ipWindow(), guard.signupWindow(), guard.paymentWindow())) {
      if (w.compareTo(longest) > 0) longest = w;
    }
    return longest;
  }

  @Scheduled(fixedDelayString = "${gpuopt.maintenance.reconcile-ms:300000}",
      initialDelayString = "${gpuopt.maintenance.reconcile-initial-delay-ms:60000}")
  public void reconcilePayments() {
    try {
      payments.reconcilePending(reconcileAfter);
    } catch (RuntimeException e) {
      log.warn("Payment reconciliation run failed: {}", e.getMessage());
    }
  }
}
