/*
 * どこで: Licensing ドメインモデル
 * 何を: validate/check の結果種別を定義する
 * なぜ: 想定内の業務エラーを例外ではなく値としてクライアントへ返すため
 */
package com.example.licensing.model;

import java.util.Locale;

public enum BindingOutcome {
  VALIDATED(true, "License validated successfully"),
  ACTIVATED(true, "License activated successfully"),
  VALID(true, "License is valid"),
  INVALID_LICENSE(false, "Invalid license key"),
  DEACTIVATED(false, "License deactivated"),
  EXPIRED(false, "License expired"),
  CONFLICTING_BINDING(false, "HWID already registered with different license"),
  ACTIVATION_LIMIT_REACHED(false, "Maximum activations reached"),
  NOT_BOUND(false, "HWID not associated with this license");

  private final boolean success;
  private final String description;

  BindingOutcome(boolean success, String description) {
    this.success = success;
    this.description = description;
  }

  public boolean success() {
    return success;
  }

  public String description() {
    return description;
  }

  /** メトリクスのタグ値に使う小文字表記。 */
  public String tagValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
