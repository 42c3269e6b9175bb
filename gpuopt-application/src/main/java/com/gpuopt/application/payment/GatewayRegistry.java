package com.gpuopt.application.payment;

import java.util.Optional;

/**
 * Resolver for gateway adapters. Infrastructure provides the implementation.
 */
public interface GatewayRegistry {
    Optional<PaymentGatewayPort> find(GatewayId gateway);
}
