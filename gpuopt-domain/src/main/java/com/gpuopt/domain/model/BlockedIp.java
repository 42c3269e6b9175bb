package com.gpuopt.domain.model;

import java.time.Instant;

/**
 * Block-list entry. {@code expiresAt == null} means permanent.
 */
public record BlockedIp(
        String ip,
        String reason,
        Instant blockedAt,
        Instant expiresAt,
        boolean active
) {
    public boolean isActiveAt(Instant now) {
        return active && (expiresAt == null || now.isBefore(expiresAt));
    }
}
