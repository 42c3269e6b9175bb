package com.gpuopt.infrastructure.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gpuopt.application.payment.GatewayCharge;
import com.gpuopt.application.payment.GatewayException;
import com.gpuopt.application.payment.GatewayId;
import com.gpuopt.domain.model.PaymentStatus;
import com.gpuopt.infrastructure.http.HttpClient;
import okhttp3.Headers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PayPalGatewayTest {

    private final HttpClient http = mock(HttpClient.class);
    private final PayPalGateway gateway = new PayPalGateway(http, new ObjectMapper(),
            GatewayTestSupport.settings(GatewayId.PAYPAL, Map.of("client-id", "cid", "client-secret", "cs")));

    @BeforeEach
    void token() throws Exception {
        when(http.postForm(eq("https://api.sandbox.paypal.com/v1/oauth2/token"), anyMap(), any(Headers.class)))
                .thenReturn("{\"access_token\":\"tok\"}");
    }

    @Test
    void usesSandboxUnlessLive() {
        assertThat(gateway.apiUrl()).isEqualTo(PayPalGateway.SANDBOX_URL);
        PayPalGateway live = new PayPalGateway(http, new ObjectMapper(), GatewayTestSupport.settings(GatewayId.PAYPAL,
                Map.of("client-id", "cid", "client-secret", "cs", "mode", "live")));
        assertThat(live.apiUrl()).isEqualTo(PayPalGateway.LIVE_URL);
    }

    @Test
    void returnsApproveLink() throws Exception {
        when(http.postJson(eq("https://api.sandbox.paypal.com/v2/checkout/orders"), anyString(), any(Headers.class)))
                .thenReturn("""
                        {"id":"5O190127TN364715T","status":"CREATED","links":[
                          {"href":"https://api.sandbox.paypal.com/v2/checkout/orders/5O1","rel":"self"},
                          {"href":"https://www.sandbox.paypal.com/checkoutnow?token=5O1","rel":"approve"}]}
                        """);

        GatewayCharge charge = gateway.create(GatewayTestSupport.charge("49.00", "USD"));

        assertThat(charge.paymentId()).isEqualTo("5O190127TN364715T");
        assertThat(charge.paymentUrl()).isEqualTo("https://www.sandbox.paypal.com/checkoutnow?token=5O1");
    }

    @Test
    void missingApproveLinkIsRejected() throws Exception {
        when(http.postJson(anyString(), anyString(), any(Headers.class))).thenReturn("{\"id\":\"X\",\"links\":[]}");

        assertThatThrownBy(() -> gateway.create(GatewayTestSupport.charge("49.00", "USD")))
                .isInstanceOf(GatewayException.class);
    }

    @Test
    void verifyMapsOrderStatus() throws Exception {
        when(http.get(eq("https://api.sandbox.paypal.com/v2/checkout/orders/A"), any(Headers.class)))
                .thenReturn("{\"status\":\"COMPLETED\"}");
        when(http.get(eq("https://api.sandbox.paypal.com/v2/checkout/orders/B"), any(Headers.class)))
                .thenReturn("{\"status\":\"VOIDED\"}");
        when(http.get(eq("https://api.sandbox.paypal.com/v2/checkout/orders/C"), any(Headers.class)))
                .thenReturn("{\"status\":\"APPROVED\"}");

        assertThat(gateway.verify("A")).contains(PaymentStatus.COMPLETED);
        assertThat(gateway.verify("B")).contains(PaymentStatus.FAILED);
        assertThat(gateway.verify("C")).isEmpty();
    }
}
