/*
 * どこで: Licensing API レスポンス DTO
 * 何を: validate/check の応答を定義する
 * なぜ: 成功/失敗を問わず機械可読な outcome と人が読むメッセージを同じ形で返すため
 */
package com.example.licensing.api.response;

import com.example.licensing.model.BindingResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LicenseResponse(
    boolean success, String outcome, String message, String error, String expiresAt) {

  public static LicenseResponse from(BindingResult result) {
    final String outcome = result.outcome().name();
    final String description = result.outcome().description();
    if (result.success()) {
      return new LicenseResponse(
          true,
          outcome,
          description,
          null,
          result.expiresAt() == null ? null : result.expiresAt().toString());
    }
    return new LicenseResponse(false, outcome, null, description, null);
  }
}
