package com.example.common;

import java.util.UUID;

public final class RequestIds {
  private RequestIds() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  /** ヘッダで受け取った ID があればそれを使い、無ければ新規採番する。 */
  public static String resolve(String candidate) {
    if (candidate != null && !candidate.isBlank()) {
      return candidate.trim();
    }
    return newRequestId();
  }
}
