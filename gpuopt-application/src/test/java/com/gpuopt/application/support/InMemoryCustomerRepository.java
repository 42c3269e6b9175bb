package com.gpuopt.application.support;

import com.gpuopt.application.ports.CustomerRepository;
import com.gpuopt.application.ports.UsageRepository;
import com.gpuopt.domain.DuplicateCustomerException;
import com.gpuopt.domain.NotFoundException;
import com.gpuopt.domain.model.Customer;
import com.gpuopt.domain.model.PaymentStatus;
import com.gpuopt.domain.model.RevenueEvent;
import com.gpuopt.domain.model.SubscriptionTier;
import com.gpuopt.domain.model.UsageRecord;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Synchronized map-backed stand-in for the SQLite repository. Settlement flips the payment
 * row in the shared {@link InMemoryPaymentTransactionRepository}.
 */
public class InMemoryCustomerRepository implements CustomerRepository, UsageRepository {

    private final Map<String, Customer> byEmail = new LinkedHashMap<>();
    private final List<UsageRecord> usage = new ArrayList<>();
    private final List<RevenueEvent> events = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    public final AtomicInteger findByEmailCalls = new AtomicInteger();
    public final AtomicInteger findByApiKeyCalls = new AtomicInteger();
    public volatile RuntimeException failAppend;
    /** Thrown by {@link #settlePayment} before anything is written, as a rolled-back transaction would. */
    public volatile RuntimeException failSettle;

    private final InMemoryPaymentTransactionRepository transactions;

    public InMemoryCustomerRepository(InMemoryPaymentTransactionRepository transactions) {
        this.transactions = transactions;
    }

    @Override
    public synchronized Customer insert(String email, String apiKey, Instant createdAt) {
        if (byEmail.containsKey(email)) {
            throw new DuplicateCustomerException("Customer already exists: " + email);
        }
        Customer c = new Customer(ids.incrementAndGet(), email, apiKey, SubscriptionTier.FREE, 0, 0.0, createdAt, null);
        byEmail.put(email, c);
        events.add(new RevenueEvent(RevenueEvent.SIGNUP, email, BigDecimal.ZERO, Map.of("tier", "free"), createdAt));
        return c;
    }

    @Override
    public synchronized Optional<Customer> findByEmail(String email) {
        findByEmailCalls.incrementAndGet();
        return Optional.ofNullable(byEmail.get(email));
    }

    @Override
    public synchronized Optional<Customer> findByApiKey(String apiKey) {
        findByApiKeyCalls.incrementAndGet();
        return byEmail.values().stream().filter(c -> c.apiKey().equals(apiKey)).findFirst();
    }

    @Override
    public synchronized boolean existsByApiKey(String apiKey) {
        return byEmail.values().stream().anyMatch(c -> c.apiKey().equals(apiKey));
    }

    @Override
    public synchronized boolean settlePayment(String gateway, String paymentId, String email, SubscriptionTier tier,
                                              Instant paidAt, RevenueEvent event) {
        if (failSettle != null) throw failSettle;
        Customer c = byEmail.get(email);
        if (c == null) throw new NotFoundException("Customer not found: " + email);
        if (!transactions.compareAndSetStatus(gateway, paymentId, PaymentStatus.PENDING, PaymentStatus.COMPLETED, paidAt)) {
            return false;
        }
        byEmail.put(email, new Customer(c.id(), c.email(), c.apiKey(), tier, c.gpuCount(), c.monthlySavings(),
                c.createdAt(), paidAt));
        events.add(event);
        return true;
    }

    @Override
    public synchronized void appendUsage(String email, List<UsageRecord> records, int gpuCount, double monthlySavingsDelta) {
        if (failAppend != null) throw failAppend;
        Customer c = byEmail.get(email);
        if (c == null) return;
        usage.addAll(records);
        byEmail.put(email, new Customer(c.id(), c.email(), c.apiKey(), c.tier(), gpuCount,
                c.monthlySavings() + monthlySavingsDelta, c.createdAt(), c.lastPaymentAt()));
    }

    @Override
    public synchronized Map<SubscriptionTier, Long> countByTier() {
        Map<SubscriptionTier, Long> out = new EnumMap<>(SubscriptionTier.class);
        for (Customer c : byEmail.values()) {
            out.merge(c.tier(), 1L, Long::sum);
        }
        return out;
    }

    @Override
    public synchronized double totalMonthlySavings() {
        return byEmail.values().stream().mapToDouble(Customer::monthlySavings).sum();
    }

    @Override
    public synchronized Map<LocalDate, Long> dailySignups(Instant since) {
        Map<LocalDate, Long> out = new TreeMap<>();
        for (Customer c : byEmail.values()) {
            if (!c.createdAt().isBefore(since)) {
                out.merge(LocalDate.ofInstant(c.createdAt(), ZoneOffset.UTC), 1L, Long::sum);
            }
        }
        return out;
    }

    @Override
    public synchronized List<UsageRecord> recent(String customerEmail, int limit) {
        return usage.stream()
                .filter(u -> u.customerEmail().equals(customerEmail))
                .sorted(Comparator.comparing(UsageRecord::recordedAt).reversed())
                .limit(limit)
                .toList();
    }

    public synchronized List<UsageRecord> usage() {
        return List.copyOf(usage);
    }

    public synchronized List<RevenueEvent> events() {
        return List.copyOf(events);
    }

    /** Test hook: simulates another writer changing the row behind the cache. */
    public synchronized void put(Customer c) {
        byEmail.put(c.email(), c);
    }
}
