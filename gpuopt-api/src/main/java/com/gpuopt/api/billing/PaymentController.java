package com.gpuopt.api.billing;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.gpuopt.api.common.ApiExceptionHandler;
import com.gpuopt.api.guard.ApiGuard;
import com.gpuopt.application.payment.GatewayId;
import com.gpuopt.application.payment.GatewayOption;
import com.gpuopt.application.payment.PaymentOrchestrator;
import com.gpuopt.application.payment.PaymentRequest;
import com.gpuopt.application.payment.PaymentResult;
import com.gpuopt.domain.ValidationException;
import com.gpuopt.domain.model.PaymentTransaction;
import com.gpuopt.domain.model.SubscriptionTier;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
public class PaymentController {

  private final PaymentOrchestrator payments;
  private final ApiGuard guard;

  public PaymentController(PaymentOrchestrator payments, ApiGuard guard) {
    this.payments = payments;
    this.guard = guard;
  }

  /**
   * {@code gateway} may be omitted or {@code auto} for selection by {@code country_code}.
   */
  public record CreatePaymentRequest(
      @NotBlank String customerEmail,
      @NotBlank @JsonAlias("tier") String plan,
      BigDecimal amount,
      String currency,
      @JsonAlias("payment_method") String gateway,
      String countryCode
  ) {}

  @PostMapping("/api/payment/create")
  public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody CreatePaymentRequest body,
                                                    HttpServletRequest request) {
    guard.enforcePaymentLimit(request);

    PaymentResult r = payments.createPayment(new PaymentRequest(
        body.customerEmail().trim(),
        parsePlan(body.plan()),
        body.amount(),
        body.currency(),
        parseGateway(body.gateway()),
        body.countryCode()
    ));

    if (!r.success()) {
      Map<String, Object> out = new LinkedHashMap<>(
          ApiExceptionHandler.error(HttpStatus.BAD_GATEWAY, "payment_failed", r.message()).getBody());
      out.put("gateway", r.gateway().code());
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(out);
    }

    Map<String, Object> out = new LinkedHashMap<>();
    out.put("status", r.status().code());
    out.put("payment_id", r.paymentId());
    out.put("payment_url", r.paymentUrl());
    out.put("gateway", r.gateway().code());
    out.put("amount", r.amount());
    out.put("currency", r.currency());
    out.put("message", r.message());
    return ResponseEntity.ok(out);
  }

  @GetMapping("/api/payment/gateways")
  public Map<String, Object> gateways(@RequestParam(value = "country", required = false) String country) {
    List<Map<String, Object>> options = payments.availableGateways(country).stream()
        .map(PaymentController::option)
        .toList();
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("status", "success");
    out.put("gateways", options);
    out.put("recommended", options.isEmpty() ? null : options.get(0));
    out.put("message", "Found " + options.size() + " available payment methods");
    return out;
  }

  @GetMapping("/api/payment/{gateway}/{paymentId}/status")
  public Map<String, Object> status(@PathVariable("gateway") String gateway,
                                    @PathVariable("paymentId") String paymentId) {
    GatewayId id = GatewayId.fromCode(gateway)
        .orElseThrow(() -> new ValidationException("Unknown gateway: " + gateway));
    PaymentTransaction tx = payments.checkStatus(id, paymentId);
    return transaction(tx);
  }

  static Map<String, Object> transaction(PaymentTransaction tx) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("status", "success");
    out.put("payment_id", tx.paymentId());
    out.put("gateway", tx.gateway());
    out.put("payment_status", tx.status().code());
    out.put("plan", tx.plan().code());
    out.put("amount", tx.amount());
    out.put("currency", tx.currency());
    out.put("updated_at", String.valueOf(tx.updatedAt()));
    return out;
  }

  private static Map<String, Object> option(GatewayOption o) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("id", o.id().code());
    out.put("name", o.name());
    out.put("currencies", o.currencies());
    out.put("fees", o.fees());
    out.put("recommended", o.recommended());
    return out;
  }

  static SubscriptionTier parsePlan(String plan) {
    try {
      return SubscriptionTier.fromCode(plan);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Invalid plan: " + plan);
    }
  }

  static GatewayId parseGateway(String gateway) {
    if (gateway == null || gateway.isBlank() || "auto".equals(gateway.trim().toLowerCase(Locale.ROOT))) {
      return null;
    }
    return GatewayId.fromCode(gateway)
        .orElseThrow(() -> new ValidationException("Unknown gateway: " + gateway));
  }
}
