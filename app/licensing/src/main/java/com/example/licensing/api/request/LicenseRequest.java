/*
 * どこで: Licensing API リクエスト DTO
 * 何を: validate/check の入力を定義する
 * なぜ: クライアントが送る license_key/hwid を型安全に取り扱うため
 */
package com.example.licensing.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LicenseRequest(
    @NotBlank(message = "license_key is required") String licenseKey,
    @NotBlank(message = "hwid is required") String hwid,
    String version) {}
