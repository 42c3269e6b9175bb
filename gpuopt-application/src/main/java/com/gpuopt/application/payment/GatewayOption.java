package com.gpuopt.application.payment;

import java.util.List;

/** Entry of the gateway list shown to a paying customer. */
public record GatewayOption(
        GatewayId id,
        String name,
        List<String> currencies,
        String fees,
        boolean recommended
) {
}
