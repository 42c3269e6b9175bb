package com.gpuopt.api.billing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gpuopt.application.payment.GatewayId;
import com.gpuopt.application.payment.PaymentOrchestrator;
import com.gpuopt.application.payment.PaymentSettings;
import com.gpuopt.domain.ValidationException;
import com.gpuopt.domain.model.PaymentStatus;
import com.gpuopt.domain.model.PaymentTransaction;
import com.gpuopt.infrastructure.gateway.NowPaymentsGateway;
import com.gpuopt.infrastructure.gateway.NowPaymentsSignatureVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Provider callbacks.
 *
 * NOWPayments posts signed IPNs; the signature is checked against the {@code ipn-secret}
 * credential. Flutterwave redirects the customer back with {@code tx_ref}, which is
 * re-verified with the provider before anything changes.
 */
@RestController
public class PaymentWebhookController {

  private static final Logger log = LoggerFactory.getLogger(PaymentWebhookController.class);
  private static final Logger security = LoggerFactory.getLogger("security");

  private final PaymentOrchestrator payments;
  private final PaymentSettings settings;
  private final ObjectMapper mapper;

  public PaymentWebhookController(PaymentOrchestrator payments, PaymentSettings settings, ObjectMapper mapper) {
    this.payments = payments;
    this.settings = settings;
    this.mapper = mapper;
  }

  @PostMapping("/api/webhooks/nowpayments")
  public ResponseEntity<Map<String, Object>> nowPayments(
      @RequestHeader(value = NowPaymentsSignatureVerifier.HEADER, required = false) String signature,
      @RequestBody String rawBody
  ) {
    String secret = settings.credentials(GatewayId.NOWPAYMENTS).get("ipn-secret");
    byte[] raw = rawBody.getBytes(StandardCharsets.UTF_8);
    if (!NowPaymentsSignatureVerifier.verify(raw, signature, secret)) {
      security.warn("Rejected NOWPayments IPN with invalid signature");
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of(
          "status", "error",
          "reason", "invalid_signature",
          "ts", Instant.now().toString()
      ));
    }

    JsonNode root;
    try {
      root = mapper.readTree(raw);
    } catch (IOException e) {
      throw new ValidationException("Malformed IPN body");
    }
    String paymentId = text(root, "payment_id");
    String providerStatus = text(root, "payment_status");
    if (paymentId == null) {
      throw new ValidationException("payment_id missing");
    }

    Optional<PaymentStatus> mapped = NowPaymentsGateway.mapStatus(providerStatus);
    log.info("NOWPayments IPN: payment_id={} payment_status={}", paymentId, providerStatus);
    if (mapped.isEmpty()) {
      return ResponseEntity.ok(Map.of(
          "status", "ok",
          "payment_id", paymentId,
          "payment_status", PaymentStatus.PENDING.code()
      ));
    }

    PaymentTransaction tx = payments.confirmTransaction(GatewayId.NOWPAYMENTS, paymentId, mapped.get());
    return ResponseEntity.ok(Map.of(
        "status", "ok",
        "payment_id", tx.paymentId(),
        "payment_status", tx.status().code()
    ));
  }

  @GetMapping("/payment/flutterwave/callback")
  public Map<String, Object> flutterwaveCallback(@RequestParam(value = "tx_ref", required = false) String txRef) {
    if (txRef == null || txRef.isBlank()) {
      throw new ValidationException("tx_ref is required");
    }
    PaymentTransaction tx = payments.checkStatus(GatewayId.FLUTTERWAVE, txRef.trim());
    String message = switch (tx.status()) {
      case COMPLETED -> "Payment successful! You can close this window.";
      case FAILED -> "Payment failed. Please try again.";
      case PENDING -> "Payment is still being processed.";
    };
    return Map.of(
        "status", "ok",
        "payment_id", tx.paymentId(),
        "payment_status", tx.status().code(),
        "message", message
    );
  }

  private static String text(JsonNode root, String field) {
    JsonNode n = root.get(field);
    if (n == null || n.isNull()) return null;
    String v = n.asText();
    return v.isBlank() ? null : v;
  }
}
