package com.gpuopt.application.support;

import com.gpuopt.application.cache.TtlCache;
import com.gpuopt.application.catalog.TierCatalog;
import com.gpuopt.application.identity.ApiKeyGenerator;
import com.gpuopt.application.identity.EmailPolicy;
import com.gpuopt.application.identity.IdentityStore;
import com.gpuopt.application.notification.NotificationDispatcher;
import com.gpuopt.domain.model.Customer;
import com.gpuopt.domain.model.PaymentStatus;
import com.gpuopt.domain.model.PaymentTransaction;
import com.gpuopt.domain.model.SubscriptionTier;

import java.time.Duration;
import java.time.Instant;

/**
 * Shared wiring for application-level tests. Notifications run on the calling thread.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    public final MutableClock clock = new MutableClock(T0);
    public final InMemoryPaymentTransactionRepository transactions = new InMemoryPaymentTransactionRepository();
    public final InMemoryCustomerRepository customers = new InMemoryCustomerRepository(transactions);
    public final RecordingNotificationSender sender = new RecordingNotificationSender();
    public final NotificationDispatcher notifications = new NotificationDispatcher(sender, Runnable::run);
    public final TtlCache<String, Customer> cache = new TtlCache<>(Duration.ofMinutes(10), clock);
    public final IdentityStore identities = new IdentityStore(
            customers, cache, Duration.ofMinutes(10), new ApiKeyGenerator(), new EmailPolicy(), notifications, clock);

    /** Records a pending payment for {@code email}. */
    public PaymentTransaction pendingPayment(String email, SubscriptionTier plan, String paymentId) {
        Instant now = clock.instant();
        return transactions.upsert(new PaymentTransaction(paymentId, email, "nowpayments", plan,
                TierCatalog.price(plan), "USD", PaymentStatus.PENDING, "{}", now, now));
    }

    /** Pays for {@code plan} and settles it, the way a confirmed webhook does. */
    public Customer upgrade(String email, SubscriptionTier plan, String paymentId) {
        return identities.applyPaymentCompletion(pendingPayment(email, plan, paymentId)).orElseThrow();
    }
}
