package com.gpuopt.application.ports;

import com.gpuopt.domain.model.Customer;
import com.gpuopt.domain.model.RevenueEvent;
import com.gpuopt.domain.model.SubscriptionTier;
import com.gpuopt.domain.model.UsageRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Customer storage boundary.
 *
 * Every multi-row write below runs in a single transaction on the implementation side.
 * Only {@code IdentityStore} calls the mutating methods.
 */
public interface CustomerRepository {

    /**
     * Inserts a free-tier customer together with its {@code signup} revenue event.
     *
     * @throws com.gpuopt.domain.DuplicateCustomerException if the email is taken
     */
    Customer insert(String email, String apiKey, Instant createdAt);

    Optional<Customer> findByEmail(String email);

    Optional<Customer> findByApiKey(String apiKey);

    boolean existsByApiKey(String apiKey);

    /**
     * Settles a pending payment: moves the {@code (gateway, paymentId)} transaction to
     * {@code completed}, sets the customer's tier and last-payment time and appends the audit
     * event, all in one transaction.
     *
     * @return false when the transaction was no longer pending; nothing is written then
     * @throws com.gpuopt.domain.NotFoundException if the customer does not exist (nothing is written)
     */
    boolean settlePayment(String gateway, String paymentId, String email, SubscriptionTier tier,
                          Instant paidAt, RevenueEvent event);

    /**
     * Appends usage rows, sets the GPU count and adds to the monthly savings aggregate.
     */
    void appendUsage(String email, List<UsageRecord> records, int gpuCount, double monthlySavingsDelta);

    Map<SubscriptionTier, Long> countByTier();

    double totalMonthlySavings();

    Map<LocalDate, Long> dailySignups(Instant since);
}
