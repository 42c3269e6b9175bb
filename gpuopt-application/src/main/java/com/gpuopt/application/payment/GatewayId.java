package com.gpuopt.application.payment;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported payment gateways and the credential fields each one needs before it can be used.
 */
public enum GatewayId {
    NOWPAYMENTS(List.of("api-key"), true),
    FLUTTERWAVE(List.of("secret-key"), false),
    PADDLE(List.of("vendor-id", "vendor-auth-code"), false),
    PAYPAL(List.of("client-id", "client-secret"), false),
    RAZORPAY(List.of("key-id", "key-secret"), false),
    DEMO(List.of(), false);

    private final List<String> requiredCredentials;
    private final boolean usdOnly;

    GatewayId(List<String> requiredCredentials, boolean usdOnly) {
        this.requiredCredentials = requiredCredentials;
        this.usdOnly = usdOnly;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public List<String> requiredCredentials() {
        return requiredCredentials;
    }

    /** Gateway prices in USD only; other currencies are converted before the call. */
    public boolean usdOnly() {
        return usdOnly;
    }

    public static Optional<GatewayId> fromCode(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        for (GatewayId id : values()) {
            if (id.code().equalsIgnoreCase(code.trim())) return Optional.of(id);
        }
        return Optional.empty();
    }
}
