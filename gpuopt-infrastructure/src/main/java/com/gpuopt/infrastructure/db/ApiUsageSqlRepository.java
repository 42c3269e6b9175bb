package com.gpuopt.infrastructure.db;

import com.gpuopt.application.ports.ApiUsageRepository;
import com.gpuopt.domain.model.ApiUsageLog;

import java.sql.PreparedStatement;
import java.util.Objects;

public final class ApiUsageSqlRepository implements ApiUsageRepository {

    private final ResourcePool pool;

    public ApiUsageSqlRepository(ResourcePool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public void append(ApiUsageLog entry) {
        pool.withConnection(c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO api_usage_logs(customer_email, api_key, endpoint, method, ip, user_agent,
                                               status_code, duration_ms, created_at)
                    VALUES(?,?,?,?,?,?,?,?,?)
                    """)) {
                ps.setString(1, entry.customerEmail());
                ps.setString(2, entry.maskedApiKey());
                ps.setString(3, entry.endpoint());
                ps.setString(4, entry.method());
                ps.setString(5, entry.ip());
                ps.setString(6, entry.userAgent());
                ps.setInt(7, entry.statusCode());
                ps.setLong(8, entry.durationMs());
                ps.setString(9, SqlTime.format(entry.createdAt()));
                return ps.executeUpdate();
            }
        });
    }
}
