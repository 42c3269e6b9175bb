package com.gpuopt.infrastructure.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gpuopt.application.ports.CustomerRepository;
import com.gpuopt.domain.DuplicateCustomerException;
import com.gpuopt.domain.NotFoundException;
import com.gpuopt.domain.model.Customer;
import com.gpuopt.domain.model.RevenueEvent;
import com.gpuopt.domain.model.SubscriptionTier;
import com.gpuopt.domain.model.UsageRecord;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * SQLite-backed customers, including the revenue audit trail and usage rows written with them.
 * Payment settlement also touches {@code payment_transactions} so that status and tier commit together.
 */
public final class CustomerSqlRepository implements CustomerRepository {

    private static final String COLUMNS =
            "id, email, api_key, subscription_tier, gpu_count, monthly_savings, created_at, last_payment";

    private final ResourcePool pool;
    private final ObjectMapper mapper;

    public CustomerSqlRepository(ResourcePool pool, ObjectMapper mapper) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Customer insert(String email, String apiKey, Instant createdAt) {
        return pool.inTransaction(c -> {
            long id;
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO customers(email, api_key, subscription_tier, created_at) VALUES(?,?,?,?)")) {
                ps.setString(1, email);
                ps.setString(2, apiKey);
                ps.setString(3, SubscriptionTier.FREE.code());
                ps.setString(4, SqlTime.format(createdAt));
                ps.executeUpdate();
            } catch (SQLException e) {
                if (isUniqueViolationOn(e, "customers.email")) {
                    throw new DuplicateCustomerException("Customer already exists: " + email);
                }
                throw e;
            }
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
                rs.next();
                id = rs.getLong(1);
            }

            insertEvent(c, new RevenueEvent(RevenueEvent.SIGNUP, email, BigDecimal.ZERO, Map.of(), createdAt));
            return new Customer(id, email, apiKey, SubscriptionTier.FREE, 0, 0.0, createdAt, null);
        });
    }

    @Override
    public Optional<Customer> findByEmail(String email) {
        return findOne("SELECT " + COLUMNS + " FROM customers WHERE email = ?", email);
    }

    @Override
    public Optional<Customer> findByApiKey(String apiKey) {
        return findOne("SELECT " + COLUMNS + " FROM customers WHERE api_key = ?", apiKey);
    }

    @Override
    public boolean existsByApiKey(String apiKey) {
        return pool.withConnection(c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM customers WHERE api_key = ?")) {
                ps.setString(1, apiKey);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public boolean settlePayment(String gateway, String paymentId, String email, SubscriptionTier tier,
                                 Instant paidAt, RevenueEvent event) {
        return pool.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE payment_transactions SET status = 'completed', updated_at = ?
                    WHERE gateway = ? AND payment_id = ? AND status = 'pending'
                    """)) {
                ps.setString(1, SqlTime.format(paidAt));
                ps.setString(2, gateway);
                ps.setString(3, paymentId);
                if (ps.executeUpdate() == 0) return false;
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE customers SET subscription_tier = ?, last_payment = ? WHERE email = ?")) {
                ps.setString(1, tier.code());
                ps.setString(2, SqlTime.format(paidAt));
                ps.setString(3, email);
                if (ps.executeUpdate() == 0) {
                    // rolls back the status change
                    throw new NotFoundException("Customer not found: " + email);
                }
            }
            insertEvent(c, event);
            return true;
        });
    }

    @Override
    public void appendUsage(String email, List<UsageRecord> records, int gpuCount, double monthlySavingsDelta) {
        pool.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO gpu_usage_logs(customer_email, gpu_index, gpu_name, utilization, memory_used,
                                               memory_total, cost_per_hour, potential_savings, recorded_at)
                    VALUES(?,?,?,?,?,?,?,?,?)
                    """)) {
                for (UsageRecord r : records) {
                    ps.setString(1, email);
                    ps.setInt(2, r.gpuIndex());
                    ps.setString(3, r.gpuName());
                    ps.setDouble(4, r.utilization());
                    ps.setDouble(5, r.memoryUsed());
                    ps.setDouble(6, r.memoryTotal());
                    ps.setDouble(7, r.costPerHour());
                    ps.setDouble(8, r.potentialSavings());
                    ps.setString(9, SqlTime.format(r.recordedAt()));
                    ps.addBatch();
                }
                if (!records.isEmpty()) ps.executeBatch();
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE customers SET gpu_count = ?, monthly_savings = monthly_savings + ? WHERE email = ?")) {
                ps.setInt(1, gpuCount);
                ps.setDouble(2, monthlySavingsDelta);
                ps.setString(3, email);
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Map<SubscriptionTier, Long> countByTier() {
        return pool.withConnection(c -> {
            Map<SubscriptionTier, Long> out = new EnumMap<>(SubscriptionTier.class);
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery(
                         "SELECT subscription_tier, COUNT(*) FROM customers GROUP BY subscription_tier")) {
                while (rs.next()) {
                    out.put(SubscriptionTier.fromCode(rs.getString(1)), rs.getLong(2));
                }
            }
            return out;
        });
    }

    @Override
    public double totalMonthlySavings() {
        return pool.withConnection(c -> {
            try (Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COALESCE(SUM(monthly_savings), 0) FROM customers")) {
                rs.next();
                return rs.getDouble(1);
            }
        });
    }

    @Override
    public Map<LocalDate, Long> dailySignups(Instant since) {
        return pool.withConnection(c -> {
            Map<LocalDate, Long> out = new TreeMap<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT substr(created_at, 1, 10) AS day, COUNT(*)
                    FROM customers
                    WHERE created_at >= ?
                    GROUP BY day
                    ORDER BY day
                    """)) {
                ps.setString(1, SqlTime.format(since));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.put(LocalDate.parse(rs.getString(1)), rs.getLong(2));
                    }
                }
            }
            return out;
        });
    }

    private Optional<Customer> findOne(String sql, String value) {
        if (value == null) return Optional.empty();
        return pool.withConnection(c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, value);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<Customer>empty();
                }
            }
        });
    }

    private void insertEvent(Connection c, RevenueEvent event) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO revenue_events(event_type, customer_email, amount, metadata, created_at) VALUES(?,?,?,?,?)")) {
            ps.setString(1, event.eventType());
            ps.setString(2, event.customerEmail());
            ps.setString(3, event.amount() == null ? "0" : event.amount().toPlainString());
            ps.setString(4, toJson(event.metadata()));
            ps.setString(5, SqlTime.format(event.createdAt()));
            ps.executeUpdate();
        }
    }

    private String toJson(Map<String, String> metadata) {
        try {
            return mapper.writeValueAsString(new TreeMap<>(metadata));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Revenue event metadata serialization failed", e);
        }
    }

    private static Customer map(ResultSet rs) throws SQLException {
        return new Customer(
                rs.getLong("id"),
                rs.getString("email"),
                rs.getString("api_key"),
                SubscriptionTier.fromCode(rs.getString("subscription_tier")),
                rs.getInt("gpu_count"),
                rs.getDouble("monthly_savings"),
                SqlTime.parse(rs.getString("created_at")),
                SqlTime.parse(rs.getString("last_payment"))
        );
    }

    static boolean isUniqueViolationOn(SQLException e, String column) {
        String msg = e.getMessage();
        return msg != null && msg.contains("UNIQUE") && msg.contains(column);
    }
}
