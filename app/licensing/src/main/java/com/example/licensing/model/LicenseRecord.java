/*
 * どこで: Licensing ドメインモデル
 * 何を: ライセンスの正規化された内部表現を定義する
 * なぜ: Redis の文字列フィールドを境界でのみ解釈し、以降は型付きで扱うため
 */
package com.example.licensing.model;

import java.time.Instant;

public record LicenseRecord(
    String licenseKey,
    int maxActivations,
    int currentActivations,
    Instant createdAt,
    Instant expiresAt,
    boolean active) {

  /** 期限ちょうどの時刻はまだ有効として扱う。 */
  public boolean isExpiredAt(Instant now) {
    return now.isAfter(expiresAt);
  }

  public boolean hasRemainingActivations() {
    return currentActivations < maxActivations;
  }
}
