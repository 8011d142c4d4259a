package com.example.licensing.model;

/** activation 要求に付随するクライアント情報。監査ログにのみ使う。 */
public record ActivationMetadata(String clientIp, String userAgent, String clientVersion) {

  private static final String UNKNOWN = "unknown";

  public ActivationMetadata {
    clientIp = clientIp == null || clientIp.isBlank() ? UNKNOWN : clientIp;
    userAgent = userAgent == null || userAgent.isBlank() ? UNKNOWN : userAgent;
    clientVersion = clientVersion == null || clientVersion.isBlank() ? UNKNOWN : clientVersion;
  }

  public static ActivationMetadata unknown() {
    return new ActivationMetadata(null, null, null);
  }
}
