package com.gpuopt.infrastructure.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gpuopt.application.payment.GatewayCredentials;
import com.gpuopt.application.payment.GatewayException;
import com.gpuopt.application.payment.PaymentGatewayPort;
import com.gpuopt.application.payment.PaymentSettings;
import com.gpuopt.infrastructure.http.HttpClient;

import java.io.IOException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Shared plumbing for HTTP gateway adapters: credentials, JSON parsing, error translation.
 */
abstract class HttpGatewaySupport implements PaymentGatewayPort {

    protected final HttpClient http;
    protected final ObjectMapper mapper;
    protected final PaymentSettings settings;

    protected HttpGatewaySupport(HttpClient http, ObjectMapper mapper, PaymentSettings settings) {
        this.http = Objects.requireNonNull(http, "http");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    protected GatewayCredentials credentials() {
        return settings.credentials(id());
    }

    protected String callback(String path) {
        return settings.callbackBaseUrl() + path;
    }

    @FunctionalInterface
    protected interface HttpCall {
        String run() throws IOException;
    }

    /** Runs the call and parses its JSON body; transport and HTTP errors become {@link GatewayException}. */
    protected JsonNode call(String what, HttpCall call) throws GatewayException {
        String body;
        try {
            body = call.run();
        } catch (IOException e) {
            throw new GatewayException(id(), what + " failed: " + e.getMessage(), e);
        }
        try {
            return mapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new GatewayException(id(), what + " returned invalid JSON", e);
        }
    }

    protected String json(ObjectNode node) throws GatewayException {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new GatewayException(id(), "payload serialization failed", e);
        }
    }

    protected String require(JsonNode root, String what, String... path) throws GatewayException {
        String v = readText(root, path);
        if (v == null || v.isBlank()) {
            throw new GatewayException(id(), what + " missing in " + id().code() + " response");
        }
        return v;
    }

    static String readText(JsonNode root, String... path) {
        JsonNode cur = root;
        for (String p : path) {
            if (cur == null) return null;
            cur = cur.get(p);
        }
        if (cur == null || cur.isNull()) return null;
        return cur.isValueNode() ? cur.asText() : cur.toString();
    }

    static String randomHex(int length) {
        byte[] bytes = new byte[(length + 1) / 2];
        ThreadLocalRandom.current().nextBytes(bytes);
        return HexFormat.of().formatHex(bytes).substring(0, length);
    }

    static String planTitle(String planCode) {
        return Character.toUpperCase(planCode.charAt(0)) + planCode.substring(1);
    }
}
