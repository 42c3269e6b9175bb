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
import java.util.Optional;

/**
 * Flutterwave hosted checkout. Our {@code tx_ref} doubles as the payment id.
 */
public final class FlutterwaveGateway extends HttpGatewaySupport {

    public static final String DEFAULT_API_URL = "https://api.flutterwave.com/v3";

    private final String apiUrl;

    public FlutterwaveGateway(HttpClient http, ObjectMapper mapper, PaymentSettings settings) {
        this(http, mapper, settings, DEFAULT_API_URL);
    }

    FlutterwaveGateway(HttpClient http, ObjectMapper mapper, PaymentSettings settings, String apiUrl) {
        super(http, mapper, settings);
        this.apiUrl = apiUrl;
    }

    @Override
    public GatewayId id() {
        return GatewayId.FLUTTERWAVE;
    }

    @Override
    public GatewayCharge create(ChargeRequest request) throws GatewayException {
        String txRef = "gopt_" + randomHex(12);
        String plan = planTitle(request.plan().code());

        ObjectNode payload = mapper.createObjectNode();
        payload.put("tx_ref", txRef);
        payload.put("amount", request.amount());
        payload.put("currency", request.currency());
        payload.put("redirect_url", callback("/payment/flutterwave/callback"));
        payload.put("payment_options", "card,mobilemoney,ussd,banktransfer");
        ObjectNode customer = payload.putObject("customer");
        customer.put("email", request.customerEmail());
        customer.put("name", localPart(request.customerEmail()));
        ObjectNode customizations = payload.putObject("customizations");
        customizations.put("title", "GPU Optimizer " + plan);
        customizations.put("description", "GPU Optimizer " + plan + " Plan subscription");

        String body = json(payload);
        JsonNode root = call("payment creation", () -> http.postJson(apiUrl + "/payments", body, headers()));
        if (!"success".equals(readText(root, "status"))) {
            throw new GatewayException(id(), "payment creation rejected: " + readText(root, "message"));
        }
        String link = require(root, "payment link", "data", "link");

        ObjectNode meta = mapper.createObjectNode();
        meta.put("tx_ref", txRef);
        meta.put("country", request.countryCode());
        return new GatewayCharge(txRef, link, json(meta));
    }

    @Override
    public Optional<PaymentStatus> verify(String txRef) throws GatewayException {
        String url = apiUrl + "/transactions/verify_by_reference?tx_ref=" + URLEncoder.encode(txRef, StandardCharsets.UTF_8);
        JsonNode root = call("status check", () -> http.get(url, headers()));
        String status = readText(root, "data", "status");
        if ("successful".equals(status)) return Optional.of(PaymentStatus.COMPLETED);
        if ("failed".equals(status)) return Optional.of(PaymentStatus.FAILED);
        return Optional.empty();
    }

    private Headers headers() {
        return Headers.of("Authorization", "Bearer " + credentials().get("secret-key"));
    }

    private static String localPart(String email) {
        int at = email.indexOf('@');
        return at > 0 ? email.substring(0, at) : email;
    }
}
