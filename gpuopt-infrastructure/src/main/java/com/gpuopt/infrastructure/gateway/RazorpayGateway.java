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
import okhttp3.Credentials;
import okhttp3.Headers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Razorpay Orders API. Amounts are sent in the smallest currency unit.
 */
public final class RazorpayGateway extends HttpGatewaySupport {

    public static final String DEFAULT_API_URL = "https://api.razorpay.com/v1";
    static final String CHECKOUT_URL = "https://checkout.razorpay.com/v1/checkout.js";

    private final String apiUrl;

    public RazorpayGateway(HttpClient http, ObjectMapper mapper, PaymentSettings settings) {
        this(http, mapper, settings, DEFAULT_API_URL);
    }

    RazorpayGateway(HttpClient http, ObjectMapper mapper, PaymentSettings settings, String apiUrl) {
        super(http, mapper, settings);
        this.apiUrl = apiUrl;
    }

    @Override
    public GatewayId id() {
        return GatewayId.RAZORPAY;
    }

    @Override
    public GatewayCharge create(ChargeRequest request) throws GatewayException {
        String receipt = "gpu_opt_" + randomHex(8);

        ObjectNode payload = mapper.createObjectNode();
        payload.put("amount", minorUnits(request.amount()));
        payload.put("currency", request.currency());
        payload.put("receipt", receipt);
        ObjectNode notes = payload.putObject("notes");
        notes.put("plan", request.plan().code());
        notes.put("customer_email", request.customerEmail());

        String body = json(payload);
        JsonNode root = call("order creation", () -> http.postJson(apiUrl + "/orders", body, headers()));
        String orderId = require(root, "order id", "id");

        ObjectNode meta = mapper.createObjectNode();
        meta.put("receipt", receipt);
        meta.put("key_id", credentials().get("key-id"));
        return new GatewayCharge(orderId, CHECKOUT_URL, json(meta));
    }

    @Override
    public Optional<PaymentStatus> verify(String orderId) throws GatewayException {
        JsonNode root = call("status check", () -> http.get(apiUrl + "/orders/" + orderId, headers()));
        return "paid".equals(readText(root, "status")) ? Optional.of(PaymentStatus.COMPLETED) : Optional.empty();
    }

    static long minorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private Headers headers() {
        return Headers.of("Authorization",
                Credentials.basic(credentials().get("key-id"), credentials().get("key-secret")));
    }
}
