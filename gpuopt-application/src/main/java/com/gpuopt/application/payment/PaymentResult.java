package com.gpuopt.application.payment;

import com.gpuopt.domain.model.PaymentStatus;

import java.math.BigDecimal;

public record PaymentResult(
        boolean success,
        String paymentId,
        String paymentUrl,
        GatewayId gateway,
        BigDecimal amount,
        String currency,
        PaymentStatus status,
        String message
) {
    public static PaymentResult pending(GatewayId gateway, GatewayCharge charge, BigDecimal amount, String currency) {
        return new PaymentResult(true, charge.paymentId(), charge.paymentUrl(), gateway, amount, currency,
                PaymentStatus.PENDING, "Payment created");
    }

    public static PaymentResult failed(GatewayId gateway, BigDecimal amount, String currency, String message) {
        return new PaymentResult(false, null, null, gateway, amount, currency, PaymentStatus.FAILED, message);
    }
}
