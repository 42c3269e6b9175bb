package com.gpuopt.application.payment;

import com.gpuopt.domain.model.PaymentStatus;

import java.util.Optional;

/**
 * One payment provider.
 */
public interface PaymentGatewayPort {

    GatewayId id();

    GatewayCharge create(ChargeRequest request) throws GatewayException;

    /**
     * Asks the provider for the status of a payment we created.
     *
     * @return the terminal status, or empty while the provider still reports it as open
     */
    Optional<PaymentStatus> verify(String paymentId) throws GatewayException;
}
