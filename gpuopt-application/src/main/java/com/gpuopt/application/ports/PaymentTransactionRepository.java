package com.gpuopt.application.ports;

import com.gpuopt.domain.model.PaymentStatus;
import com.gpuopt.domain.model.PaymentTransaction;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Transactions are keyed by {@code (gateway, paymentId)}.
 */
public interface PaymentTransactionRepository {

    /**
     * Inserts the transaction, or refreshes metadata of an existing pending one.
     * Never changes the status of an existing row.
     *
     * @return the stored row
     */
    PaymentTransaction upsert(PaymentTransaction tx);

    Optional<PaymentTransaction> find(String gateway, String paymentId);

    /**
     * Atomic status move. Returns false when the stored status is not {@code expected}.
     */
    boolean compareAndSetStatus(String gateway, String paymentId,
                                PaymentStatus expected, PaymentStatus next, Instant at);

    List<PaymentTransaction> findPendingOlderThan(Instant cutoff, int limit);
}
