package com.gpuopt.infrastructure.gateway;

import com.gpuopt.application.payment.GatewayId;
import com.gpuopt.application.payment.GatewayRegistry;
import com.gpuopt.application.payment.PaymentGatewayPort;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory registry of gateway adapters.
 */
public final class SimpleGatewayRegistry implements GatewayRegistry {

    private final Map<GatewayId, PaymentGatewayPort> adapters = new EnumMap<>(GatewayId.class);

    public SimpleGatewayRegistry register(PaymentGatewayPort adapter) {
        Objects.requireNonNull(adapter, "adapter");
        adapters.put(adapter.id(), adapter);
        return this;
    }

    @Override
    public Optional<PaymentGatewayPort> find(GatewayId gateway) {
        if (gateway == null) return Optional.empty();
        return Optional.ofNullable(adapters.get(gateway));
    }

    public Set<GatewayId> registered() {
        return Set.copyOf(adapters.keySet());
    }
}
