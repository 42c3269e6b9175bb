package com.gpuopt.infrastructure.db;

import com.gpuopt.domain.model.PaymentStatus;
import com.gpuopt.domain.model.PaymentTransaction;
import com.gpuopt.domain.model.SubscriptionTier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentTransactionSqlRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path dir;

    private ResourcePool pool;
    private PaymentTransactionSqlRepository transactions;

    @BeforeEach
    void setUp() {
        pool = new ResourcePool(dir.resolve("gpuopt.db"), 2, Duration.ofSeconds(1), Duration.ofSeconds(5));
        SqliteSchema.init(pool);
        transactions = new PaymentTransactionSqlRepository(pool);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private static PaymentTransaction pending(String id, String gateway, Instant at, String meta) {
        return new PaymentTransaction(id, "a@example.com", gateway, SubscriptionTier.PROFESSIONAL,
                new BigDecimal("49.00"), "USD", PaymentStatus.PENDING, meta, at, at);
    }

    @Test
    void upsertIsIdempotentPerGatewayAndId() {
        transactions.upsert(pending("p1", "nowpayments", T0, "{\"v\":1}"));
        PaymentTransaction again = transactions.upsert(pending("p1", "nowpayments", T0.plusSeconds(5), "{\"v\":2}"));
        transactions.upsert(pending("p1", "paypal", T0, null));

        assertThat(again.metadataJson()).isEqualTo("{\"v\":2}");
        assertThat(again.createdAt()).isEqualTo(T0);
        assertThat(again.amount()).isEqualByComparingTo("49");
        assertThat(transactions.find("paypal", "p1")).isPresent();
        assertThat(transactions.find("razorpay", "p1")).isEmpty();
    }

    @Test
    void compareAndSetMovesPendingOnce() {
        transactions.upsert(pending("p1", "nowpayments", T0, null));

        assertThat(transactions.compareAndSetStatus("nowpayments", "p1",
                PaymentStatus.PENDING, PaymentStatus.COMPLETED, T0.plusSeconds(1))).isTrue();
        assertThat(transactions.compareAndSetStatus("nowpayments", "p1",
                PaymentStatus.PENDING, PaymentStatus.FAILED, T0.plusSeconds(2))).isFalse();

        PaymentTransaction tx = transactions.find("nowpayments", "p1").orElseThrow();
        assertThat(tx.status()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(tx.updatedAt()).isEqualTo(T0.plusSeconds(1));
    }

    @Test
    void upsertNeverTouchesSettledRow() {
        transactions.upsert(pending("p1", "nowpayments", T0, "{\"v\":1}"));
        transactions.compareAndSetStatus("nowpayments", "p1", PaymentStatus.PENDING, PaymentStatus.FAILED, T0);

        PaymentTransaction stored = transactions.upsert(pending("p1", "nowpayments", T0, "{\"v\":2}"));

        assertThat(stored.status()).isEqualTo(PaymentStatus.FAILED);
        assertThat(stored.metadataJson()).isEqualTo("{\"v\":1}");
    }

    @Test
    void findsOnlyStalePendingTransactions() {
        transactions.upsert(pending("old", "nowpayments", T0, null));
        transactions.upsert(pending("new", "nowpayments", T0.plus(Duration.ofHours(2)), null));
        transactions.upsert(pending("done", "nowpayments", T0, null));
        transactions.compareAndSetStatus("nowpayments", "done", PaymentStatus.PENDING, PaymentStatus.COMPLETED, T0);

        assertThat(transactions.findPendingOlderThan(T0.plus(Duration.ofHours(1)), 10))
                .extracting(PaymentTransaction::paymentId)
                .containsExactly("old");
    }
}
