package com.gpuopt.infrastructure.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
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

import java.util.Map;
import java.util.Optional;

/**
 * PayPal Orders v2. Sandbox unless credential {@code mode} is {@code live}.
 */
public final class PayPalGateway extends HttpGatewaySupport {

    static final String LIVE_URL = "https://api.paypal.com";
    static final String SANDBOX_URL = "https://api.sandbox.paypal.com";

    public PayPalGateway(HttpClient http, ObjectMapper mapper, PaymentSettings settings) {
        super(http, mapper, settings);
    }

    @Override
    public GatewayId id() {
        return GatewayId.PAYPAL;
    }

    String apiUrl() {
        return "live".equalsIgnoreCase(credentials().get("mode")) ? LIVE_URL : SANDBOX_URL;
    }

    @Override
    public GatewayCharge create(ChargeRequest request) throws GatewayException {
        String token = accessToken();

        ObjectNode payload = mapper.createObjectNode();
        payload.put("intent", "CAPTURE");
        ArrayNode units = payload.putArray("purchase_units");
        ObjectNode unit = units.addObject();
        ObjectNode amount = unit.putObject("amount");
        amount.put("currency_code", request.currency());
        amount.put("value", request.amount().toPlainString());
        unit.put("description", "GPU Optimizer " + planTitle(request.plan().code()) + " Plan");
        ObjectNode ctx = payload.putObject("application_context");
        ctx.put("return_url", callback("/payment/paypal/success"));
        ctx.put("cancel_url", callback("/payment/cancel"));
        ctx.put("brand_name", "GPU Optimizer");
        ctx.put("user_action", "PAY_NOW");

        String body = json(payload);
        JsonNode root = call("order creation",
                () -> http.postJson(apiUrl() + "/v2/checkout/orders", body, bearer(token)));

        String orderId = require(root, "order id", "id");
        String approve = null;
        JsonNode links = root.get("links");
        if (links != null && links.isArray()) {
            for (JsonNode link : links) {
                if ("approve".equals(readText(link, "rel"))) {
                    approve = readText(link, "href");
                    break;
                }
            }
        }
        if (approve == null) {
            throw new GatewayException(id(), "approve link missing in paypal response");
        }

        ObjectNode meta = mapper.createObjectNode();
        meta.put("order_id", orderId);
        meta.put("mode", credentials().get("mode").isEmpty() ? "sandbox" : credentials().get("mode"));
        return new GatewayCharge(orderId, approve, json(meta));
    }

    @Override
    public Optional<PaymentStatus> verify(String orderId) throws GatewayException {
        String token = accessToken();
        JsonNode root = call("status check",
                () -> http.get(apiUrl() + "/v2/checkout/orders/" + orderId, bearer(token)));
        String status = readText(root, "status");
        if ("COMPLETED".equals(status)) return Optional.of(PaymentStatus.COMPLETED);
        if ("VOIDED".equals(status)) return Optional.of(PaymentStatus.FAILED);
        return Optional.empty();
    }

    private String accessToken() throws GatewayException {
        Headers auth = Headers.of("Authorization",
                Credentials.basic(credentials().get("client-id"), credentials().get("client-secret")));
        JsonNode root = call("token request", () -> http.postForm(
                apiUrl() + "/v1/oauth2/token", Map.of("grant_type", "client_credentials"), auth));
        return require(root, "access_token", "access_token");
    }

    private static Headers bearer(String token) {
        return Headers.of("Authorization", "Bearer " + token);
    }
}
