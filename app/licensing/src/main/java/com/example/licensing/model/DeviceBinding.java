/*
 * どこで: Licensing ドメインモデル
 * 何を: ハードウェア ID から初回有効化したライセンスへの対応を表す
 * なぜ: バインディングの照合を文字列比較のまま散在させないため
 */
package com.example.licensing.model;

public record DeviceBinding(String deviceId, String licenseKey) {

  public boolean targets(String requestedLicenseKey) {
    return licenseKey.equals(requestedLicenseKey);
  }
}
