package com.gpuopt.api.tracing;

/**
 * Per-request values kept in a ThreadLocal for the duration of one HTTP request.
 */
public final class RequestContext {

  private static final ThreadLocal<Ctx> TL = new ThreadLocal<>();

  private RequestContext() {}

  public static void set(String requestId, String clientIp) {
    TL.set(new Ctx(requestId, clientIp));
  }

  public static void clear() {
    TL.remove();
  }

  public static String requestId() {
    Ctx c = TL.get();
    return c == null ? null : c.requestId;
  }

  public static String clientIp() {
    Ctx c = TL.get();
    return c == null ? null : c.clientIp;
  }

  private record Ctx(String requestId, String clientIp) {}
}
