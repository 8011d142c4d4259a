/*
 * どこで: Licensing API レスポンス DTO
 * 何を: 管理一覧の 1 ライセンス分を表す
 * なぜ: 内部レコードの型を API 契約から切り離すため
 */
package com.example.licensing.api.response;

import com.example.licensing.model.LicenseRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LicenseSummary(
    String licenseKey,
    int maxActivations,
    int currentActivations,
    String createdAt,
    String expiresAt,
    boolean active) {

  public static LicenseSummary from(LicenseRecord record) {
    return new LicenseSummary(
        record.licenseKey(),
        record.maxActivations(),
        record.currentActivations(),
        record.createdAt() == null ? null : record.createdAt().toString(),
        record.expiresAt().toString(),
        record.active());
  }
}
