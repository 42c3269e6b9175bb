package com.gpuopt.application.payment;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class GatewaySelectorTest {

    private static GatewaySelector with(GatewayId... configured) {
        Set<GatewayId> set = configured.length == 0 ? EnumSet.noneOf(GatewayId.class) : EnumSet.of(configured[0], configured);
        return new GatewaySelector(set::contains);
    }

    @Test
    void africaPrefersFlutterwaveThenPaypal() {
        assertThat(with(GatewayId.FLUTTERWAVE, GatewayId.PAYPAL).select("NG")).isEqualTo(GatewayId.FLUTTERWAVE);
        assertThat(with(GatewayId.PAYPAL, GatewayId.NOWPAYMENTS).select("KE")).isEqualTo(GatewayId.PAYPAL);
    }

    @Test
    void razorpayMarkets() {
        assertThat(with(GatewayId.RAZORPAY, GatewayId.PAYPAL).select("IN")).isEqualTo(GatewayId.RAZORPAY);
        assertThat(with(GatewayId.PAYPAL).select("AE")).isEqualTo(GatewayId.PAYPAL);
    }

    @Test
    void developedMarketsPreferFlutterwavePaddlePaypal() {
        assertThat(with(GatewayId.PADDLE, GatewayId.PAYPAL).select("de")).isEqualTo(GatewayId.PADDLE);
        assertThat(with(GatewayId.PAYPAL, GatewayId.NOWPAYMENTS).select("US")).isEqualTo(GatewayId.PAYPAL);
    }

    @Test
    void regionalMissFallsBackToGlobalPriority() {
        assertThat(with(GatewayId.NOWPAYMENTS).select("IN")).isEqualTo(GatewayId.NOWPAYMENTS);
        assertThat(with(GatewayId.RAZORPAY, GatewayId.NOWPAYMENTS).select("JP")).isEqualTo(GatewayId.NOWPAYMENTS);
        assertThat(with(GatewayId.RAZORPAY).select(null)).isEqualTo(GatewayId.RAZORPAY);
    }

    @Test
    void nothingConfiguredMeansDemo() {
        assertThat(with().select("US")).isEqualTo(GatewayId.DEMO);
        assertThat(with().select(null)).isEqualTo(GatewayId.DEMO);
    }

    @Test
    void selectionIsDeterministic() {
        GatewaySelector s = with(GatewayId.FLUTTERWAVE, GatewayId.NOWPAYMENTS, GatewayId.PADDLE);
        for (int i = 0; i < 10; i++) {
            assertThat(s.select("FR")).isEqualTo(GatewayId.FLUTTERWAVE);
            assertThat(s.select("JP")).isEqualTo(GatewayId.FLUTTERWAVE);
        }
    }
}
