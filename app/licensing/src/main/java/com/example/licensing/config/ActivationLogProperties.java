/*
 * どこで: Licensing 設定
 * 何を: activation 監査ログの保持期間と非同期書き込み設定を保持する
 * なぜ: 監査ログの失敗を activation 本体から切り離した上で、再試行回数を運用で調整するため
 */
package com.example.licensing.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "licensing.activation-log")
public record ActivationLogProperties(
    Duration retention, int maxAttempts, Duration retryBackoff, int poolSize, int queueCapacity) {

  public ActivationLogProperties {
    retention = retention == null ? Duration.ofDays(30) : retention;
    maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
    retryBackoff = retryBackoff == null ? Duration.ofMillis(200) : retryBackoff;
    poolSize = poolSize <= 0 ? 2 : poolSize;
    queueCapacity = queueCapacity <= 0 ? 1000 : queueCapacity;
  }
}
