package com.gpuopt.application.payment;

/**
 * Provider response to a charge: the reference we track and where to send the customer.
 */
public record GatewayCharge(
        String paymentId,
        String paymentUrl,
        String metadataJson
) {
}
