package com.example.licensing.model;

import java.time.Instant;

/**
 * validate/check の判定結果。
 *
 * @param outcome 結果種別
 * @param expiresAt 成功時のみライセンスの有効期限、失敗時は null
 */
public record BindingResult(BindingOutcome outcome, Instant expiresAt) {

  public static BindingResult success(BindingOutcome outcome, Instant expiresAt) {
    if (!outcome.success()) {
      throw new IllegalArgumentException("not a success outcome: " + outcome);
    }
    return new BindingResult(outcome, expiresAt);
  }

  public static BindingResult rejected(BindingOutcome outcome) {
    if (outcome.success()) {
      throw new IllegalArgumentException("not a rejection outcome: " + outcome);
    }
    return new BindingResult(outcome, null);
  }

  public boolean success() {
    return outcome.success();
  }
}
