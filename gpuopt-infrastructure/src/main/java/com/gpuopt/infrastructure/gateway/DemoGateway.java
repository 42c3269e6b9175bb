package com.gpuopt.infrastructure.gateway;

import com.gpuopt.application.payment.ChargeRequest;
import com.gpuopt.application.payment.GatewayCharge;
import com.gpuopt.application.payment.GatewayId;
import com.gpuopt.application.payment.PaymentGatewayPort;
import com.gpuopt.domain.model.PaymentStatus;

import java.util.Optional;

/**
 * Fallback when no real gateway is configured. Produces a placeholder checkout URL and never settles.
 */
public final class DemoGateway implements PaymentGatewayPort {

    static final String CHECKOUT_BASE = "https://demo-payment.gpuoptimizer.com/pay/";

    @Override
    public GatewayId id() {
        return GatewayId.DEMO;
    }

    @Override
    public GatewayCharge create(ChargeRequest request) {
        String id = "demo_" + HttpGatewaySupport.randomHex(12);
        return new GatewayCharge(id, CHECKOUT_BASE + id, "{\"demo\":true}");
    }

    @Override
    public Optional<PaymentStatus> verify(String paymentId) {
        return Optional.empty();
    }
}
