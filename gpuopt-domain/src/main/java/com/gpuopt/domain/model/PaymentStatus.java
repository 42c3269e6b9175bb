package com.gpuopt.domain.model;

import java.util.Locale;

/**
 * Lifecycle of a payment transaction. Only {@code PENDING} may move, and only once.
 */
public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(PaymentStatus next) {
        return this == PENDING && next != null && next != PENDING;
    }

    public static PaymentStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("payment status is blank");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
