package com.gpuopt.domain.model;

import java.util.Locale;

/**
 * Commercial tier of a customer. Stored and rendered by {@link #code()}.
 */
public enum SubscriptionTier {
    FREE,
    PROFESSIONAL,
    ENTERPRISE,
    CUSTOM;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored or client-supplied tier code (case-insensitive).
     *
     * @throws IllegalArgumentException for unknown codes
     */
    public static SubscriptionTier fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("tier code is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
