package com.gpuopt.infrastructure.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * NOWPayments IPN signature verifier.
 *
 * NOWPayments sends, in {@code x-nowpayments-sig}, the HMAC SHA-512 hex digest of the
 * request JSON re-serialized with keys sorted and no whitespace.
 */
public final class NowPaymentsSignatureVerifier {

    public static final String HEADER = "x-nowpayments-sig";

    private static final ObjectMapper SORTED = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private NowPaymentsSignatureVerifier() {}

    public static boolean verify(byte[] rawBody, String headerSignature, String secret) {
        if (rawBody == null || headerSignature == null || secret == null || secret.isBlank()) return false;

        String canonical;
        try {
            canonical = canonicalJson(rawBody);
        } catch (IOException e) {
            return false;
        }
        byte[] a = sign(canonical, secret).getBytes(StandardCharsets.UTF_8);
        byte[] b = headerSignature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(a, b);
    }

    /** Key-sorted compact JSON, recursively. */
    static String canonicalJson(byte[] rawBody) throws IOException {
        Object plain = SORTED.readValue(rawBody, Object.class);
        return SORTED.writeValueAsString(plain);
    }

    static String sign(String payload, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA512");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA512"));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("HMAC calculation failed", e);
        }
    }
}
