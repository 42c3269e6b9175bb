package com.gpuopt.infrastructure.db;

import com.gpuopt.application.ports.PaymentTransactionRepository;
import com.gpuopt.domain.model.PaymentStatus;
import com.gpuopt.domain.model.PaymentTransaction;
import com.gpuopt.domain.model.SubscriptionTier;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Payment transactions keyed by {@code (gateway, payment_id)}.
 *
 * Status only moves through {@link #compareAndSetStatus}; the upsert refreshes metadata of
 * pending rows and leaves settled rows untouched.
 */
public final class PaymentTransactionSqlRepository implements PaymentTransactionRepository {

    private static final String COLUMNS =
            "payment_id, customer_email, gateway, plan, amount, currency, status, metadata, created_at, updated_at";

    private final ResourcePool pool;

    public PaymentTransactionSqlRepository(ResourcePool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public PaymentTransaction upsert(PaymentTransaction tx) {
        return pool.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO payment_transactions(payment_id, customer_email, gateway, plan, amount, currency,
                                                     status, metadata, created_at, updated_at)
                    VALUES(?,?,?,?,?,?,?,?,?,?)
                    ON CONFLICT(gateway, payment_id) DO UPDATE SET
                      metadata=excluded.metadata,
                      updated_at=excluded.updated_at
                    WHERE payment_transactions.status = 'pending'
                    """)) {
                ps.setString(1, tx.paymentId());
                ps.setString(2, tx.customerEmail());
                ps.setString(3, tx.gateway());
                ps.setString(4, tx.plan().code());
                ps.setString(5, tx.amount().toPlainString());
                ps.setString(6, tx.currency());
                ps.setString(7, tx.status().code());
                ps.setString(8, tx.metadataJson());
                ps.setString(9, SqlTime.format(tx.createdAt()));
                ps.setString(10, SqlTime.format(tx.updatedAt()));
                ps.executeUpdate();
            }
            return find(c, tx.gateway(), tx.paymentId())
                    .orElseThrow(() -> new IllegalStateException("Upserted payment vanished: " + tx.paymentId()));
        });
    }

    @Override
    public Optional<PaymentTransaction> find(String gateway, String paymentId) {
        return pool.withConnection(c -> find(c, gateway, paymentId));
    }

    @Override
    public boolean compareAndSetStatus(String gateway, String paymentId,
                                       PaymentStatus expected, PaymentStatus next, Instant at) {
        return pool.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE payment_transactions SET status = ?, updated_at = ?
                    WHERE gateway = ? AND payment_id = ? AND status = ?
                    """)) {
                ps.setString(1, next.code());
                ps.setString(2, SqlTime.format(at));
                ps.setString(3, gateway);
                ps.setString(4, paymentId);
                ps.setString(5, expected.code());
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public List<PaymentTransaction> findPendingOlderThan(Instant cutoff, int limit) {
        return pool.withConnection(c -> {
            List<PaymentTransaction> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS
                    + " FROM payment_transactions WHERE status = 'pending' AND created_at < ?"
                    + " ORDER BY created_at LIMIT ?")) {
                ps.setString(1, SqlTime.format(cutoff));
                ps.setInt(2, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
            return out;
        });
    }

    private static Optional<PaymentTransaction> find(Connection c, String gateway, String paymentId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM payment_transactions WHERE gateway = ? AND payment_id = ?")) {
            ps.setString(1, gateway);
            ps.setString(2, paymentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private static PaymentTransaction map(ResultSet rs) throws SQLException {
        return new PaymentTransaction(
                rs.getString("payment_id"),
                rs.getString("customer_email"),
                rs.getString("gateway"),
                SubscriptionTier.fromCode(rs.getString("plan")),
                new BigDecimal(rs.getString("amount")),
                rs.getString("currency"),
                PaymentStatus.fromCode(rs.getString("status")),
                rs.getString("metadata"),
                SqlTime.parse(rs.getString("created_at")),
                SqlTime.parse(rs.getString("updated_at"))
        );
    }
}
