package com.gpuopt.application.support;

import com.gpuopt.application.ports.PaymentTransactionRepository;
import com.gpuopt.domain.model.PaymentStatus;
import com.gpuopt.domain.model.PaymentTransaction;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryPaymentTransactionRepository implements PaymentTransactionRepository {

    private final Map<String, PaymentTransaction> rows = new LinkedHashMap<>();

    private static String key(String gateway, String paymentId) {
        return gateway + "/" + paymentId;
    }

    @Override
    public synchronized PaymentTransaction upsert(PaymentTransaction tx) {
        String k = key(tx.gateway(), tx.paymentId());
        PaymentTransaction existing = rows.get(k);
        if (existing == null) {
            rows.put(k, tx);
            return tx;
        }
        if (existing.status() == PaymentStatus.PENDING) {
            PaymentTransaction refreshed = new PaymentTransaction(existing.paymentId(), existing.customerEmail(),
                    existing.gateway(), existing.plan(), existing.amount(), existing.currency(), existing.status(),
                    tx.metadataJson(), existing.createdAt(), tx.updatedAt());
            rows.put(k, refreshed);
            return refreshed;
        }
        return existing;
    }

    @Override
    public synchronized Optional<PaymentTransaction> find(String gateway, String paymentId) {
        return Optional.ofNullable(rows.get(key(gateway, paymentId)));
    }

    @Override
    public synchronized boolean compareAndSetStatus(String gateway, String paymentId,
                                                    PaymentStatus expected, PaymentStatus next, Instant at) {
        PaymentTransaction tx = rows.get(key(gateway, paymentId));
        if (tx == null || tx.status() != expected) return false;
        rows.put(key(gateway, paymentId), tx.withStatus(next, at));
        return true;
    }

    @Override
    public synchronized List<PaymentTransaction> findPendingOlderThan(Instant cutoff, int limit) {
        return rows.values().stream()
                .filter(t -> t.status() == PaymentStatus.PENDING && t.createdAt().isBefore(cutoff))
                .sorted(Comparator.comparing(PaymentTransaction::createdAt))
                .limit(limit)
                .toList();
    }

    public synchronized int size() {
        return rows.size();
    }
}
