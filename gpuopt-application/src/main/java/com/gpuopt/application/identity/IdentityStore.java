package com.gpuopt.application.identity;

import com.gpuopt.application.cache.TtlCache;
import com.gpuopt.application.notification.NotificationDispatcher;
import com.gpuopt.application.ports.CustomerRepository;
import com.gpuopt.domain.DuplicateCustomerException;
import com.gpuopt.domain.NotFoundException;
import com.gpuopt.domain.model.Customer;
import com.gpuopt.domain.model.PaymentTransaction;
import com.gpuopt.domain.model.RevenueEvent;
import com.gpuopt.domain.model.UsageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owner of customer rows.
 *
 * Reads go through the cache under two namespaces (email and API key). Every mutation
 * commits first and then drops both cache entries before returning, so a caller that
 * observed the write never reads the previous state from the cache afterwards.
 */
public class IdentityStore {

    private static final Logger log = LoggerFactory.getLogger(IdentityStore.class);
    private static final Logger security = LoggerFactory.getLogger("security");

    static final String EMAIL_PREFIX = "customer_email:";
    static final String API_KEY_PREFIX = "customer_api:";
    static final int MAX_KEY_ATTEMPTS = 10;

    private final CustomerRepository customers;
    private final TtlCache<String, Customer> cache;
    private final Duration ttl;
    private final ApiKeyGenerator keyGenerator;
    private final EmailPolicy emailPolicy;
    private final NotificationDispatcher notifications;
    private final Clock clock;

    public IdentityStore(CustomerRepository customers,
                         TtlCache<String, Customer> cache,
                         Duration ttl,
                         ApiKeyGenerator keyGenerator,
                         EmailPolicy emailPolicy,
                         NotificationDispatcher notifications,
                         Clock clock) {
        this.customers = Objects.requireNonNull(customers, "customers");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator");
        this.emailPolicy = Objects.requireNonNull(emailPolicy, "emailPolicy");
        this.notifications = Objects.requireNonNull(notifications, "notifications");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Customer createCustomer(String email) {
        try {
            emailPolicy.validate(email);
        } catch (EmailPolicy.SuspiciousEmailException e) {
            security.warn("Rejected suspicious signup email: {}", e.getMessage());
            throw e;
        }

        if (customers.findByEmail(email).isPresent()) {
            throw new DuplicateCustomerException("Customer already exists: " + email);
        }

        Customer created = customers.insert(email, uniqueApiKey(), clock.instant());
        log.info("Customer created: email={} key={}", created.email(), ApiKeyGenerator.mask(created.apiKey()));

        notifications.welcome(created);
        return created;
    }

    public Optional<Customer> getByEmail(String email) {
        if (email == null || email.isBlank()) return Optional.empty();

        Optional<Customer> cached = cache.get(EMAIL_PREFIX + email);
        if (cached.isPresent()) return cached;

        long generation = cache.generation();
        Optional<Customer> loaded = customers.findByEmail(email);
        loaded.ifPresent(c -> populate(c, generation));
        return loaded;
    }

    public Optional<Customer> getByApiKey(String apiKey) {
        if (!ApiKeyGenerator.isWellFormed(apiKey)) return Optional.empty();

        Optional<Customer> cached = cache.get(API_KEY_PREFIX + apiKey);
        if (cached.isPresent()) return cached;

        long generation = cache.generation();
        Optional<Customer> loaded = customers.findByApiKey(apiKey);
        loaded.ifPresent(c -> populate(c, generation));
        return loaded;
    }

    /**
     * Settles a pending payment and moves its customer to the purchased tier. Status change,
     * tier change and audit event commit together; a storage failure leaves the payment
     * pending so a later confirmation applies it again.
     *
     * @return the upgraded customer, or empty when the payment was no longer pending
     * @throws NotFoundException if the customer does not exist
     */
    public Optional<Customer> applyPaymentCompletion(PaymentTransaction tx) {
        Customer before = customers.findByEmail(tx.customerEmail())
                .orElseThrow(() -> new NotFoundException("Customer not found: " + tx.customerEmail()));

        Instant now = clock.instant();
        RevenueEvent event = new RevenueEvent(
                RevenueEvent.UPGRADE,
                before.email(),
                tx.amount(),
                Map.of(
                        "from_tier", before.tier().code(),
                        "to_tier", tx.plan().code(),
                        "payment_id", tx.paymentId(),
                        "gateway", tx.gateway()
                ),
                now
        );

        boolean settled;
        try {
            settled = customers.settlePayment(tx.gateway(), tx.paymentId(), before.email(), tx.plan(), now, event);
        } finally {
            invalidate(before);
        }
        if (!settled) return Optional.empty();

        log.info("Customer {} upgraded {} -> {} (payment {}/{})", before.email(), before.tier().code(),
                tx.plan().code(), tx.gateway(), tx.paymentId());
        return customers.findByEmail(before.email());
    }

    /**
     * Single write path for usage: rows and aggregates commit together, then the cache is invalidated.
     */
    public void recordUsage(Customer customer, List<UsageRecord> records, double monthlySavingsDelta) {
        customers.appendUsage(customer.email(), records, records.size(), monthlySavingsDelta);
        invalidate(customer);
    }

    public void invalidate(Customer customer) {
        cache.delete(EMAIL_PREFIX + customer.email());
        cache.delete(API_KEY_PREFIX + customer.apiKey());
    }

    private void populate(Customer c, long generation) {
        cache.setIfGeneration(EMAIL_PREFIX + c.email(), c, ttl, generation);
        cache.setIfGeneration(API_KEY_PREFIX + c.apiKey(), c, ttl, generation);
    }

    private String uniqueApiKey() {
        for (int attempt = 1; attempt <= MAX_KEY_ATTEMPTS; attempt++) {
            String key = keyGenerator.generate();
            if (!ApiKeyGenerator.isWellFormed(key)) {
                log.warn("Generated API key failed format check, regenerating");
                continue;
            }
            if (!customers.existsByApiKey(key)) {
                return key;
            }
            security.warn("API key collision on attempt {}, regenerating", attempt);
        }
        throw new IllegalStateException("Could not generate a unique API key after " + MAX_KEY_ATTEMPTS + " attempts");
    }
}
