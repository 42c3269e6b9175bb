package com.gpuopt.api.guard;

import com.gpuopt.application.identity.ApiKeyGenerator;
import com.gpuopt.application.ports.ApiUsageRepository;
import com.gpuopt.domain.model.ApiUsageLog;
import com.gpuopt.domain.model.Customer;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Clock;

/**
 * Writes one {@code api_usage_logs} row per API call. Keys are stored masked.
 * A failed write is logged and never affects the response.
 */
@Component
public class ApiUsageLoggingInterceptor implements HandlerInterceptor {

  private static final Logger log = LoggerFactory.getLogger(ApiUsageLoggingInterceptor.class);
  private static final String START_ATTR = ApiUsageLoggingInterceptor.class.getName() + ".start";

  private final ApiUsageRepository apiUsage;
  private final Clock clock;

  public ApiUsageLoggingInterceptor(ApiUsageRepository apiUsage, Clock clock) {
    this.apiUsage = apiUsage;
    this.clock = clock;
  }

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
    request.setAttribute(START_ATTR, System.nanoTime());
    return true;
  }

  @Override
  public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
    Object start = request.getAttribute(START_ATTR);
    long durationMs = start instanceof Long s ? (System.nanoTime() - s) / 1_000_000 : 0;
    Customer customer = (Customer) request.getAttribute(ApiGuard.CUSTOMER_ATTR);

    ApiUsageLog entry = new ApiUsageLog(
        customer == null ? null : customer.email(),
        customer == null ? null : ApiKeyGenerator.mask(customer.apiKey()),
        request.getRequestURI(),
        request.getMethod(),
        ApiGuard.clientIp(request),
        request.getHeader(HttpHeaders.USER_AGENT),
        response.getStatus(),
        durationMs,
        clock.instant()
    );
    try {
      apiUsage.append(entry);
    } catch (RuntimeException e) {
      log.warn("API usage log write failed: {}", e.getMessage());
    }
  }
}
