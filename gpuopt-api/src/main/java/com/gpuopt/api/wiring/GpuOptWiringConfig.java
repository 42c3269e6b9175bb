package com.gpuopt.api.wiring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gpuopt.api.config.GpuOptProperties;
import com.gpuopt.api.notification.SmtpNotificationSender;
import com.gpuopt.application.cache.TtlCache;
import com.gpuopt.application.guard.AccessGuard;
import com.gpuopt.application.guard.RateLimiter;
import com.gpuopt.application.identity.ApiKeyGenerator;
import com.gpuopt.application.identity.EmailPolicy;
import com.gpuopt.application.identity.IdentityStore;
import com.gpuopt.application.notification.NotificationDispatcher;
import com.gpuopt.application.payment.CurrencyConverter;
import com.gpuopt.application.payment.GatewayCredentials;
import com.gpuopt.application.payment.GatewayId;
import com.gpuopt.application.payment.PaymentOrchestrator;
import com.gpuopt.application.payment.PaymentSettings;
import com.gpuopt.application.ports.ApiUsageRepository;
import com.gpuopt.application.ports.BlockedIpRepository;
import com.gpuopt.application.ports.CustomerRepository;
import com.gpuopt.application.ports.NotificationSender;
import com.gpuopt.application.ports.PaymentTransactionRepository;
import com.gpuopt.application.ports.UsageRepository;
import com.gpuopt.application.stats.RevenueStatsService;
import com.gpuopt.application.usage.UsageIngestor;
import com.gpuopt.domain.model.Customer;
import com.gpuopt.infrastructure.db.ApiUsageSqlRepository;
import com.gpuopt.infrastructure.db.BlockedIpSqlRepository;
import com.gpuopt.infrastructure.db.CustomerSqlRepository;
import com.gpuopt.infrastructure.db.PaymentTransactionSqlRepository;
import com.gpuopt.infrastructure.db.ResourcePool;
import com.gpuopt.infrastructure.db.SqliteSchema;
import com.gpuopt.infrastructure.db.UsageSqlRepository;
import com.gpuopt.infrastructure.gateway.DemoGateway;
import com.gpuopt.infrastructure.gateway.FlutterwaveGateway;
import com.gpuopt.infrastructure.gateway.NowPaymentsGateway;
import com.gpuopt.infrastructure.gateway.PaddleGateway;
import com.gpuopt.infrastructure.gateway.PayPalGateway;
import com.gpuopt.infrastructure.gateway.RazorpayGateway;
import com.gpuopt.infrastructure.gateway.SimpleGatewayRegistry;
import com.gpuopt.infrastructure.http.HttpClient;
import com.gpuopt.infrastructure.notification.LoggingNotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Owns the storage pool, the identity cache and every core service.
 */
@Configuration
public class GpuOptWiringConfig {

  private static final Logger log = LoggerFactory.getLogger(GpuOptWiringConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "close")
  public ResourcePool resourcePool(GpuOptProperties props) {
    GpuOptProperties.Db db = props.db();
    ResourcePool pool = new ResourcePool(Path.of(db.path()), db.poolSize(), db.acquireTimeout(), db.busyTimeout());
    SqliteSchema.init(pool);
    return pool;
  }

  // ---- storage

  @Bean
  public CustomerSqlRepository customerRepository(ResourcePool pool, ObjectMapper mapper) {
    return new CustomerSqlRepository(pool, mapper);
  }

  @Bean
  public UsageRepository usageRepository(ResourcePool pool) {
    return new UsageSqlRepository(pool);
  }

  @Bean
  public PaymentTransactionRepository paymentTransactionRepository(ResourcePool pool) {
    return new PaymentTransactionSqlRepository(pool);
  }

  @Bean
  public BlockedIpRepository blockedIpRepository(ResourcePool pool) {
    return new BlockedIpSqlRepository(pool);
  }

  @Bean
  public ApiUsageRepository apiUsageRepository(ResourcePool pool) {
    return new ApiUsageSqlRepository(pool);
  }

  // ---- notifications

  @Bean
  @ConditionalOnProperty(prefix = "gpuopt.notifications", name = "mode", havingValue = "log", matchIfMissing = true)
  public NotificationSender loggingNotificationSender() {
    return new LoggingNotificationSender();
  }

  @Bean
  @ConditionalOnProperty(prefix = "gpuopt.notifications", name = "mode", havingValue = "smtp")
  public NotificationSender smtpNotificationSender(JavaMailSender mailSender, GpuOptProperties props) {
    return new SmtpNotificationSender(mailSender, props.notifications().from());
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService notificationExecutor(GpuOptProperties props) {
    return Executors.newFixedThreadPool(props.notifications().workerThreads());
  }

  @Bean
  public NotificationDispatcher notificationDispatcher(NotificationSender sender, ExecutorService notificationExecutor) {
    return new NotificationDispatcher(sender, notificationExecutor);
  }

  // ---- identity / usage

  @Bean
  public TtlCache<String, Customer> customerCache(GpuOptProperties props, Clock clock) {
    return new TtlCache<>(props.cache().ttl(), clock);
  }

  @Bean
  public IdentityStore identityStore(CustomerRepository customers,
                                     TtlCache<String, Customer> customerCache,
                                     GpuOptProperties props,
                                     NotificationDispatcher notifications,
                                     Clock clock) {
    return new IdentityStore(customers, customerCache, props.cache().ttl(), new ApiKeyGenerator(),
        new EmailPolicy(), notifications, clock);
  }

  @Bean
  public UsageIngestor usageIngestor(IdentityStore identities, UsageRepository usage, GpuOptProperties props, Clock clock) {
    return new UsageIngestor(identities, usage, props.usage().maxBatchSize(), clock);
  }

  @Bean
  public RevenueStatsService revenueStatsService(CustomerRepository customers, Clock clock) {
    return new RevenueStatsService(customers, clock);
  }

  // ---- payments

  @Bean
  public PaymentSettings paymentSettings(GpuOptProperties props) {
    GpuOptProperties.Payments p = props.payments();
    Map<GatewayId, GatewayCredentials> credentials = new EnumMap<>(GatewayId.class);
    p.gateways().forEach((code, values) -> {
      Optional<GatewayId> id = GatewayId.fromCode(code);
      if (id.isEmpty()) {
        log.warn("Ignoring credentials for unknown gateway '{}'", code);
        return;
      }
      credentials.put(id.get(), new GatewayCredentials(values));
    });
    return new PaymentSettings(p.callbackBaseUrl(), p.requestTimeout(), credentials);
  }

  @Bean
  public HttpClient gatewayHttpClient(PaymentSettings settings) {
    return new HttpClient(settings.requestTimeout());
  }

  @Bean
  public SimpleGatewayRegistry gatewayRegistry(HttpClient http, ObjectMapper mapper, PaymentSettings settings) {
    return new SimpleGatewayRegistry()
        .register(new NowPaymentsGateway(http, mapper, settings))
        .register(new FlutterwaveGateway(http, mapper, settings))
        .register(new PaddleGateway(http, mapper, settings))
        .register(new PayPalGateway(http, mapper, settings))
        .register(new RazorpayGateway(http, mapper, settings))
        .register(new DemoGateway());
  }

  @Bean
  public PaymentOrchestrator paymentOrchestrator(IdentityStore identities,
                                                 PaymentTransactionRepository transactions,
                                                 SimpleGatewayRegistry registry,
                                                 PaymentSettings settings,
                                                 NotificationDispatcher notifications,
                                                 Clock clock) {
    PaymentOrchestrator orchestrator = new PaymentOrchestrator(identities, transactions, registry, settings,
        new CurrencyConverter(), notifications, clock);
    for (GatewayId g : GatewayId.values()) {
      if (g != GatewayId.DEMO) {
        log.info("Payment gateway {}: {}", g.code(), orchestrator.isConfigured(g) ? "configured" : "not configured");
      }
    }
    return orchestrator;
  }

  // ---- access guard

  @Bean
  public RateLimiter rateLimiter(Clock clock) {
    return new RateLimiter(clock);
  }

  @Bean
  public AccessGuard accessGuard(IdentityStore identities, RateLimiter rateLimiter,
                                 BlockedIpRepository blockedIps, Clock clock) {
    return new AccessGuard(identities, rateLimiter, blockedIps, clock);
  }

  @Bean
  public ApplicationRunner blockListLoader(AccessGuard accessGuard) {
    return args -> accessGuard.reloadBlockList();
  }
}
