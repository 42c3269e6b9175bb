package com.gpuopt.infrastructure.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gpuopt.application.payment.ChargeRequest;
import com.gpuopt.application.payment.GatewayCharge;
import com.gpuopt.application.payment.GatewayException;
import com.gpuopt.application.payment.GatewayId;
import com.gpuopt.application.payment.PaymentSettings;
import com.gpuopt.domain.model.PaymentStatus;
import com.gpuopt.infrastructure.http.HttpClient;
import okhttp3.Headers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Paddle classic pay links. Paddle confirms through its own webhooks, so {@link #verify} never settles.
 */
public final class PaddleGateway extends HttpGatewaySupport {

    public static final String DEFAULT_API_URL = "https://vendors.paddle.com/api/2.0";

    private final String apiUrl;

    public PaddleGateway(HttpClient http, ObjectMapper mapper, PaymentSettings settings) {
        this(http, mapper, settings, DEFAULT_API_URL);
    }

    PaddleGateway(HttpClient http, ObjectMapper mapper, PaymentSettings settings, String apiUrl) {
        super(http, mapper, settings);
        this.apiUrl = apiUrl;
    }

    @Override
    public GatewayId id() {
        return GatewayId.PADDLE;
    }

    @Override
    public GatewayCharge create(ChargeRequest request) throws GatewayException {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("vendor_id", credentials().get("vendor-id"));
        form.put("vendor_auth_code", credentials().get("vendor-auth-code"));
        form.put("prices[0]", request.currency() + ":" + request.amount().toPlainString());
        form.put("return_url", callback("/payment/success"));
        form.put("title", "GPU Optimizer " + planTitle(request.plan().code()) + " Plan");
        form.put("webhook_url", callback("/api/webhooks/paddle"));
        form.put("customer_email", request.customerEmail());

        JsonNode root = call("pay link creation",
                () -> http.postForm(apiUrl + "/product/generate_pay_link", form, Headers.of()));
        if (!"true".equals(readText(root, "success"))) {
            throw new GatewayException(id(), "pay link rejected: " + readText(root, "error", "message"));
        }
        String url = require(root, "pay link", "response", "url");
        String paymentId = "paddle_" + randomHex(8);

        ObjectNode meta = mapper.createObjectNode();
        meta.put("pay_link", url);
        return new GatewayCharge(paymentId, url, json(meta));
    }

    @Override
    public Optional<PaymentStatus> verify(String paymentId) {
        return Optional.empty();
    }
}
