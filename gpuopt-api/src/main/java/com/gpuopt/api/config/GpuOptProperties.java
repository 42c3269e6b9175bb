package com.gpuopt.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Typed binding of the {@code gpuopt.*} configuration tree.
 *
 * <pre>
 * gpuopt:
 *   db:
 *     path: data/gpuopt.db
 *     pool-size: 10
 *   cache:
 *     ttl: 5m
 *   payments:
 *     callback-base-url: https://gpuoptimizer.example
 *     gateways:
 *       nowpayments:
 *         api-key: ${NOWPAYMENTS_API_KEY:}
 * </pre>
 *
 * Missing sections fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "gpuopt")
public record GpuOptProperties(
    Db db,
    Cache cache,
    Usage usage,
    Payments payments,
    Guard guard,
    Admin admin,
    Notifications notifications
) {

  public GpuOptProperties {
    if (db == null) db = new Db(null, 0, null, null);
    if (cache == null) cache = new Cache(null);
    if (usage == null) usage = new Usage(0, 0);
    if (payments == null) payments = new Payments(null, null, null, null);
    if (guard == null) guard = new Guard(0, null, 0, null, 0, null);
    if (admin == null) admin = new Admin(null);
    if (notifications == null) notifications = new Notifications(null, null, 0);
  }

  /**
   * @param path           SQLite file
   * @param poolSize       pooled connections kept open
   * @param acquireTimeout wait before an ephemeral connection is opened
   * @param busyTimeout    SQLite busy handler timeout
   */
  public record Db(String path, int poolSize, Duration acquireTimeout, Duration busyTimeout) {
    public Db {
      if (path == null || path.isBlank()) path = "data/gpuopt.db";
      if (poolSize <= 0) poolSize = 10;
      if (acquireTimeout == null) acquireTimeout = Duration.ofSeconds(5);
      if (busyTimeout == null) busyTimeout = Duration.ofSeconds(30);
    }
  }

  public record Cache(Duration ttl) {
    public Cache {
      if (ttl == null || ttl.isZero() || ttl.isNegative()) ttl = Duration.ofMinutes(5);
    }
  }

  /**
   * @param maxBatchSize readings accepted per track-usage call
   * @param recentLimit  default page size of the recent-usage listing
   */
  public record Usage(int maxBatchSize, int recentLimit) {
    public Usage {
      if (maxBatchSize <= 0) maxBatchSize = 64;
      if (recentLimit <= 0) recentLimit = 50;
    }
  }

  /**
   * @param gateways credentials per gateway code ({@code nowpayments}, {@code paypal}, ...)
   */
  public record Payments(
      String callbackBaseUrl,
      Duration requestTimeout,
      Duration reconcileAfter,
      Map<String, Map<String, String>> gateways
  ) {
    public Payments {
      if (callbackBaseUrl == null || callbackBaseUrl.isBlank()) callbackBaseUrl = "http://localhost:8080";
      if (requestTimeout == null) requestTimeout = Duration.ofSeconds(15);
      if (reconcileAfter == null) reconcileAfter = Duration.ofMinutes(15);
      gateways = gateways == null ? Map.of() : Map.copyOf(gateways);
    }
  }

  /**
   * Per-IP limits. {@code ipLimit} applies to every guarded route; signup and payment
   * creation have their own tighter windows.
   */
  public record Guard(
      int ipLimit,
      Duration ipWindow,
      int signupLimit,
      Duration signupWindow,
      int paymentLimit,
      Duration paymentWindow
  ) {
    public Guard {
      if (ipLimit == 0) ipLimit = 50;
      if (ipWindow == null) ipWindow = Duration.ofHours(1);
      if (signupLimit == 0) signupLimit = 5;
      if (signupWindow == null) signupWindow = Duration.ofMinutes(1);
      if (paymentLimit == 0) paymentLimit = 5;
      if (paymentWindow == null) paymentWindow = Duration.ofMinutes(1);
    }
  }

  /** @param token shared secret for {@code /api/admin/**}; blank disables the admin API */
  public record Admin(String token) {
    public Admin {
      if (token == null) token = "";
    }
  }

  /**
   * @param mode {@code log} (default) or {@code smtp}
   */
  public record Notifications(String mode, String from, int workerThreads) {
    public Notifications {
      if (mode == null || mode.isBlank()) mode = "log";
      if (from == null || from.isBlank()) from = "no-reply@gpuoptimizer.com";
      if (workerThreads <= 0) workerThreads = 2;
    }
  }
}
