/*
 * どこで: Licensing 設定
 * 何を: 起動時に投入するデモライセンスの定義を保持する
 * なぜ: 開発/検証環境だけでシードを有効化できるようにするため
 */
package com.example.licensing.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "licensing.seed")
public record LicenseSeedProperties(boolean enabled, List<SeedLicense> licenses) {

  public LicenseSeedProperties {
    licenses = licenses == null ? List.of() : List.copyOf(licenses);
  }

  public record SeedLicense(String key, int maxActivations, Duration validity) {}
}
