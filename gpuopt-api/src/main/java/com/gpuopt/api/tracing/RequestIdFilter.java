package com.gpuopt.api.tracing;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Adds a stable correlation id for every HTTP request.
 *
 * - Reads request id from X-Request-Id (if provided), otherwise generates a UUID
 * - Takes the client address from the servlet request; forwarded headers are only honoured
 *   when server.forward-headers-strategy trusts the proxy in front of us
 * - Stores both in MDC + RequestContext and echoes the id in X-Request-Id
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

  public static final String HDR_REQUEST_ID = "X-Request-Id";
  public static final String MDC_REQUEST_ID = "requestId";
  public static final String MDC_CLIENT_IP = "clientIp";

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String reqId = firstNonBlank(request.getHeader(HDR_REQUEST_ID), request.getHeader("X-Correlation-Id"));
    if (reqId == null) reqId = UUID.randomUUID().toString();
    String ip = clientIp(request);

    MDC.put(MDC_REQUEST_ID, reqId);
    MDC.put(MDC_CLIENT_IP, ip);
    RequestContext.set(reqId, ip);

    response.setHeader(HDR_REQUEST_ID, reqId);

    try {
      filterChain.doFilter(request, response);
    } finally {
      RequestContext.clear();
      MDC.remove(MDC_REQUEST_ID);
      MDC.remove(MDC_CLIENT_IP);
    }
  }

  // Rate limits and the block list key on this; a raw X-Forwarded-For is caller-controlled.
  static String clientIp(HttpServletRequest request) {
    return request.getRemoteAddr();
  }

  private static String firstNonBlank(String a, String b) {
    if (a != null && !a.isBlank()) return a.trim();
    if (b != null && !b.isBlank()) return b.trim();
    return null;
  }
}
