package com.gpuopt.infrastructure.db;

import com.gpuopt.application.ports.BlockedIpRepository;
import com.gpuopt.domain.model.BlockedIp;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class BlockedIpSqlRepository implements BlockedIpRepository {

    private final ResourcePool pool;

    public BlockedIpSqlRepository(ResourcePool pool) {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public void save(BlockedIp entry) {
        pool.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO blocked_ips(ip, reason, blocked_at, expires_at, is_active)
                    VALUES(?,?,?,?,?)
                    ON CONFLICT(ip) DO UPDATE SET
                      reason=excluded.reason,
                      blocked_at=excluded.blocked_at,
                      expires_at=excluded.expires_at,
                      is_active=excluded.is_active
                    """)) {
                ps.setString(1, entry.ip());
                ps.setString(2, entry.reason());
                ps.setString(3, SqlTime.format(entry.blockedAt()));
                ps.setString(4, SqlTime.format(entry.expiresAt()));
                ps.setInt(5, entry.active() ? 1 : 0);
                ps.executeUpdate();
            }
            return null;
        });
    }

    @Override
    public Optional<BlockedIp> find(String ip) {
        return pool.withConnection(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT ip, reason, blocked_at, expires_at, is_active FROM blocked_ips WHERE ip = ?")) {
                ps.setString(1, ip);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<BlockedIp>empty();
                }
            }
        });
    }

    @Override
    public boolean deactivate(String ip) {
        return pool.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE blocked_ips SET is_active = 0 WHERE ip = ? AND is_active = 1")) {
                ps.setString(1, ip);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public List<BlockedIp> findActive(Instant now) {
        return pool.withConnection(c -> {
            List<BlockedIp> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT ip, reason, blocked_at, expires_at, is_active FROM blocked_ips
                    WHERE is_active = 1 AND (expires_at IS NULL OR expires_at > ?)
                    ORDER BY blocked_at
                    """)) {
                ps.setString(1, SqlTime.format(now));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
            return out;
        });
    }

    private static BlockedIp map(ResultSet rs) throws SQLException {
        return new BlockedIp(
                rs.getString("ip"),
                rs.getString("reason"),
                SqlTime.parse(rs.getString("blocked_at")),
                SqlTime.parse(rs.getString("expires_at")),
                rs.getInt("is_active") == 1
        );
    }
}
