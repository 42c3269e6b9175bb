package com.gpuopt.api.guard;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/** Rejects blocked or over-quota addresses before any handler runs. */
@Component
public class GuardInterceptor implements HandlerInterceptor {

  private final ApiGuard guard;

  public GuardInterceptor(ApiGuard guard) {
    this.guard = guard;
  }

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
    guard.enforceAddress(request);
    return true;
  }
}
