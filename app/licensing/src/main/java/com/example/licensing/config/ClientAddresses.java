package com.example.licensing.config;

import jakarta.servlet.http.HttpServletRequest;

/** X-Forwarded-For を考慮したクライアント IP の解決。MDC と監査ログで共用する。 */
public final class ClientAddresses {

  private ClientAddresses() {}

  public static String resolveClientIp(HttpServletRequest request) {
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }
}
