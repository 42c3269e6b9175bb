package com.gpuopt.application.payment;

/**
 * Any failure talking to a payment provider: transport, non-success status or unexpected payload.
 * Never escapes {@link PaymentOrchestrator}.
 */
public class GatewayException extends Exception {

    private final GatewayId gateway;

    public GatewayException(GatewayId gateway, String message) {
        super(message);
        this.gateway = gateway;
    }

    public GatewayException(GatewayId gateway, String message, Throwable cause) {
        super(message, cause);
        this.gateway = gateway;
    }

    public GatewayId gateway() {
        return gateway;
    }
}
