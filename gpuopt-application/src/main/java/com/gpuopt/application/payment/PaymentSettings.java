package com.gpuopt.application.payment;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Payment configuration handed to the orchestrator and adapters.
 *
 * @param callbackBaseUrl public base URL used for redirect and IPN callbacks (no trailing slash)
 * @param requestTimeout  upper bound for every outbound gateway call
 */
public record PaymentSettings(
        String callbackBaseUrl,
        Duration requestTimeout,
        Map<GatewayId, GatewayCredentials> credentials
) {
    public PaymentSettings {
        Objects.requireNonNull(callbackBaseUrl, "callbackBaseUrl");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (callbackBaseUrl.endsWith("/")) {
            callbackBaseUrl = callbackBaseUrl.substring(0, callbackBaseUrl.length() - 1);
        }
        Map<GatewayId, GatewayCredentials> copy = new EnumMap<>(GatewayId.class);
        if (credentials != null) copy.putAll(credentials);
        credentials = Map.copyOf(copy);
    }

    public GatewayCredentials credentials(GatewayId gateway) {
        return credentials.getOrDefault(gateway, GatewayCredentials.EMPTY);
    }
}
