/*
 * どこで: Licensing 設定
 * 何を: ライセンス発行時の既定値を保持する
 * なぜ: 管理 API の省略値やキー接頭辞を環境ごとに切り替えるため
 */
package com.example.licensing.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "licensing")
public record LicensingProperties(
    String keyPrefix, int defaultMaxActivations, Duration defaultValidity) {

  public LicensingProperties {
    keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? "PHANTOM-" : keyPrefix;
    defaultMaxActivations = defaultMaxActivations <= 0 ? 1 : defaultMaxActivations;
    defaultValidity = defaultValidity == null ? Duration.ofDays(30) : defaultValidity;
  }
}
