package com.gpuopt.application.payment;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Deterministic gateway choice by country.
 *
 * Regional preferences are tried first, then the global priority list, then {@link GatewayId#DEMO}.
 * Only gateways accepted by the {@code configured} predicate are returned.
 */
public final class GatewaySelector {

    private record Rule(Set<String> countries, List<GatewayId> preference) {
    }

    private static final List<Rule> REGIONAL_RULES = List.of(
            new Rule(Set.of("NG", "GH", "KE", "UG", "ZA", "TZ", "RW", "ZM"),
                    List.of(GatewayId.FLUTTERWAVE, GatewayId.PAYPAL)),
            new Rule(Set.of("IN", "MY", "AE"),
                    List.of(GatewayId.RAZORPAY, GatewayId.PAYPAL)),
            new Rule(Set.of("US", "GB", "CA", "AU", "FR", "DE", "IT", "ES", "NL", "BE", "CH", "SE", "DK", "NO",
                    "FI", "BR", "MX"),
                    List.of(GatewayId.FLUTTERWAVE, GatewayId.PADDLE, GatewayId.PAYPAL))
    );

    static final List<GatewayId> GLOBAL_PRIORITY = List.of(
            GatewayId.FLUTTERWAVE,
            GatewayId.NOWPAYMENTS,
            GatewayId.PADDLE,
            GatewayId.PAYPAL,
            GatewayId.RAZORPAY
    );

    private final Predicate<GatewayId> configured;

    public GatewaySelector(Predicate<GatewayId> configured) {
        this.configured = configured;
    }

    public GatewayId select(String countryCode) {
        String country = countryCode == null ? "" : countryCode.trim().toUpperCase(Locale.ROOT);

        for (Rule rule : REGIONAL_RULES) {
            if (rule.countries().contains(country)) {
                for (GatewayId g : rule.preference()) {
                    if (configured.test(g)) return g;
                }
                break;
            }
        }

        for (GatewayId g : GLOBAL_PRIORITY) {
            if (configured.test(g)) return g;
        }
        return GatewayId.DEMO;
    }
}
