package com.gpuopt.infrastructure.db;

import com.gpuopt.application.ports.UsageRepository;
import com.gpuopt.domain.model.UsageRecord;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class UsageSqlRepository implements UsageRepository {

    private final ResourcePool pool;

    public UsageSqlRepository(ResourcePool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public List<UsageRecord> recent(String customerEmail, int limit) {
        return pool.withConnection(c -> {
            List<UsageRecord> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT customer_email, gpu_index, gpu_name, utilization, memory_used, memory_total,
                           cost_per_hour, potential_savings, recorded_at
                    FROM gpu_usage_logs
                    WHERE customer_email = ?
                    ORDER BY recorded_at DESC, id DESC
                    LIMIT ?
                    """)) {
                ps.setString(1, customerEmail);
                ps.setInt(2, limit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new UsageRecord(
                                rs.getString("customer_email"),
                                rs.getInt("gpu_index"),
                                rs.getString("gpu_name"),
                                rs.getDouble("utilization"),
                                rs.getDouble("memory_used"),
                                rs.getDouble("memory_total"),
                                rs.getDouble("cost_per_hour"),
                                rs.getDouble("potential_savings"),
                                SqlTime.parse(rs.getString("recorded_at"))
                        ));
                    }
                }
            }
            return out;
        });
    }
}
