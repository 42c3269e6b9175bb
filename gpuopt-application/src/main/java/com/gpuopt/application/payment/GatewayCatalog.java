package com.gpuopt.application.payment;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Static coverage data per gateway: display name, countries served, currencies, fees.
 */
public final class GatewayCatalog {

    /** Listing order shown to customers. */
    public static final List<GatewayId> DISPLAY_ORDER = List.of(
            GatewayId.NOWPAYMENTS,
            GatewayId.PAYPAL,
            GatewayId.PADDLE,
            GatewayId.RAZORPAY,
            GatewayId.FLUTTERWAVE
    );

    public record Entry(
            String name,
            Set<String> countries,
            List<String> currencies,
            String fees,
            boolean recommended
    ) {
        /** Empty country set means worldwide. */
        public boolean serves(String countryCode) {
            if (countries.isEmpty() || countryCode == null || countryCode.isBlank()) return true;
            return countries.contains(countryCode.trim().toUpperCase(Locale.ROOT));
        }
    }

    private static final Entry NOWPAYMENTS = new Entry(
            "Crypto Payments",
            Set.of(),
            List.of("BTC", "ETH", "USDT", "USDC", "LTC", "BCH", "XRP", "ADA", "DOT", "LINK", "UNI"),
            "0.5%",
            true);

    private static final Entry FLUTTERWAVE = new Entry(
            "Flutterwave",
            Set.of("NG", "GH", "KE", "UG", "ZA", "TZ", "RW", "ZM", "US", "GB", "CA", "AU", "FR", "DE", "IT",
                    "ES", "NL", "BE", "CH", "SE", "DK", "NO", "FI", "BR", "MX", "AR"),
            List.of("NGN", "GHS", "KES", "UGX", "ZAR", "TZS", "RWF", "ZMW", "USD", "GBP", "EUR", "CAD", "AUD"),
            "1.4%",
            false);

    private static final Entry PADDLE = new Entry(
            "Paddle",
            Set.of(),
            List.of("USD", "EUR", "GBP", "CAD", "AUD", "JPY", "CHF", "SEK", "DKK", "NOK"),
            "5%",
            false);

    private static final Entry PAYPAL = new Entry(
            "PayPal",
            Set.of(),
            List.of("USD", "EUR", "GBP", "CAD", "AUD", "JPY"),
            "2.9% + fixed fee",
            true);

    private static final Entry RAZORPAY = new Entry(
            "Razorpay",
            Set.of("IN", "MY", "AE"),
            List.of("INR", "MYR", "AED"),
            "2%",
            false);

    private static final Entry DEMO = new Entry(
            "Demo Payment (Testing)",
            Set.of(),
            List.of("USD", "EUR", "GBP"),
            "0% (Demo)",
            true);

    private GatewayCatalog() {}

    public static Entry entry(GatewayId gateway) {
        return switch (gateway) {
            case NOWPAYMENTS -> NOWPAYMENTS;
            case FLUTTERWAVE -> FLUTTERWAVE;
            case PADDLE -> PADDLE;
            case PAYPAL -> PAYPAL;
            case RAZORPAY -> RAZORPAY;
            case DEMO -> DEMO;
        };
    }

    public static GatewayOption option(GatewayId gateway) {
        Entry e = entry(gateway);
        return new GatewayOption(gateway, e.name(), e.currencies(), e.fees(), e.recommended());
    }
}
