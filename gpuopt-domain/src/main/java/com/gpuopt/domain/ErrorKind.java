package com.gpuopt.domain;

import java.util.Locale;

/**
 * Stable failure categories. The API layer renders {@link #reason()} to clients.
 */
public enum ErrorKind {
    VALIDATION,
    UNAUTHORIZED,
    FORBIDDEN,
    RATE_LIMITED,
    NOT_FOUND,
    DUPLICATE_CUSTOMER,
    STORAGE_UNAVAILABLE,
    INVALID_STATE_TRANSITION;

    public String reason() {
        return name().toLowerCase(Locale.ROOT);
    }
}
