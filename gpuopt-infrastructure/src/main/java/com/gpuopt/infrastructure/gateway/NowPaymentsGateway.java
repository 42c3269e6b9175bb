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

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * NOWPayments crypto checkout. Prices are always sent in USD, paid in BTC.
 */
public final class NowPaymentsGateway extends HttpGatewaySupport {

    public static final String DEFAULT_API_URL = "https://api.nowpayments.io/v1";
    static final String PAY_CURRENCY = "btc";

    private final String apiUrl;

    public NowPaymentsGateway(HttpClient http, ObjectMapper mapper, PaymentSettings settings) {
        this(http, mapper, settings, DEFAULT_API_URL);
    }

    NowPaymentsGateway(HttpClient http, ObjectMapper mapper, PaymentSettings settings, String apiUrl) {
        super(http, mapper, settings);
        this.apiUrl = apiUrl;
    }

    @Override
    public GatewayId id() {
        return GatewayId.NOWPAYMENTS;
    }

    @Override
    public GatewayCharge create(ChargeRequest request) throws GatewayException {
        String orderId = "gpu_" + randomHex(8);

        ObjectNode payload = mapper.createObjectNode();
        payload.put("price_amount", request.amount());
        payload.put("price_currency", "USD");
        payload.put("pay_currency", PAY_CURRENCY);
        payload.put("order_id", orderId);
        payload.put("order_description", "GPUOptimizer " + planTitle(request.plan().code()) + " Plan");
        payload.put("ipn_callback_url", callback("/api/webhooks/nowpayments"));
        payload.put("success_url", callback("/payment/success?order_id=" + URLEncoder.encode(orderId, StandardCharsets.UTF_8)));
        payload.put("cancel_url", callback("/payment/cancel"));

        String body = json(payload);
        JsonNode root = call("payment creation", () -> http.postJson(apiUrl + "/payment", body, headers()));

        String paymentId = require(root, "payment_id", "payment_id");
        String url = readText(root, "payment_url");
        if (url == null || url.isBlank()) url = readText(root, "invoice_url");

        ObjectNode meta = mapper.createObjectNode();
        meta.put("order_id", orderId);
        meta.put("pay_currency", PAY_CURRENCY);
        meta.put("pay_address", readText(root, "pay_address"));
        meta.put("pay_amount", readText(root, "pay_amount"));
        return new GatewayCharge(paymentId, url, json(meta));
    }

    @Override
    public Optional<PaymentStatus> verify(String paymentId) throws GatewayException {
        JsonNode root = call("status check", () -> http.get(apiUrl + "/payment/" + paymentId, headers()));
        return mapStatus(readText(root, "payment_status"));
    }

    /** Maps a NOWPayments {@code payment_status}; open states map to empty. */
    public static Optional<PaymentStatus> mapStatus(String status) {
        if (status == null) return Optional.empty();
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "finished" -> Optional.of(PaymentStatus.COMPLETED);
            case "failed", "refunded", "expired" -> Optional.of(PaymentStatus.FAILED);
            default -> Optional.empty();
        };
    }

    private Headers headers() {
        return Headers.of("x-api-key", credentials().get("api-key"));
    }
}
