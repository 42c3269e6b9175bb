package com.gpuopt.api.guard;

import com.gpuopt.api.config.GpuOptProperties;
import com.gpuopt.api.tracing.RequestContext;
import com.gpuopt.application.guard.AccessGuard;
import com.gpuopt.application.guard.GuardChain;
import com.gpuopt.application.guard.GuardContext;
import com.gpuopt.application.guard.GuardStages;
import com.gpuopt.domain.RateLimitedException;
import com.gpuopt.domain.UnauthorizedException;
import com.gpuopt.domain.model.Customer;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * HTTP face of the guard chain.
 *
 * Two chains run per request: the address chain (blocked IP, per-IP quota) from
 * {@link GuardInterceptor} on every guarded route, and the key chain (API key, tier quota)
 * from controllers that accept a key in the body.
 */
@Component
public class ApiGuard {

  public static final String CUSTOMER_ATTR = ApiGuard.class.getName() + ".customer";

  private final AccessGuard accessGuard;
  private final GpuOptProperties.Guard limits;
  private final GuardChain addressChain;
  private final GuardChain keyChain;

  public ApiGuard(AccessGuard accessGuard, GpuOptProperties props) {
    this.accessGuard = accessGuard;
    this.limits = props.guard();
    this.addressChain = new GuardChain(List.of(
        GuardStages.blockedIp(accessGuard),
        GuardStages.ipRateLimit(accessGuard, limits.ipLimit(), limits.ipWindow())
    ));
    this.keyChain = new GuardChain(List.of(
        GuardStages.apiKey(accessGuard),
        GuardStages.tierRateLimit(accessGuard)
    ));
  }

  public void enforceAddress(HttpServletRequest request) {
    addressChain.enforce(new GuardContext(clientIp(request), request.getRequestURI(), null, null));
  }

  /**
   * Authenticates by {@code Authorization: Bearer} or the body key and applies the tier quota.
   * The customer is also stored as a request attribute for usage logging.
   */
  public Customer enforceApiKey(HttpServletRequest request, String bodyApiKey) {
    GuardContext ctx = keyChain.enforce(new GuardContext(
        clientIp(request),
        request.getRequestURI(),
        request.getHeader(HttpHeaders.AUTHORIZATION),
        bodyApiKey
    ));
    Customer customer = ctx.customer().orElseThrow(() -> new UnauthorizedException("Invalid API key"));
    request.setAttribute(CUSTOMER_ATTR, customer);
    return customer;
  }

  public void enforceSignupLimit(HttpServletRequest request) {
    routeLimit("signup", request, limits.signupLimit(), limits.signupWindow());
  }

  public void enforcePaymentLimit(HttpServletRequest request) {
    routeLimit("payment", request, limits.paymentLimit(), limits.paymentWindow());
  }

  private void routeLimit(String route, HttpServletRequest request, int limit, Duration window) {
    if (!accessGuard.checkRateLimit(route + ":" + clientIp(request), limit, window)) {
      throw new RateLimitedException("Too many " + route + " attempts, try again later");
    }
  }

  static String clientIp(HttpServletRequest request) {
    String ip = RequestContext.clientIp();
    return ip != null ? ip : request.getRemoteAddr();
  }
}
