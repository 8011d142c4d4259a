/*
 * どこで: Licensing API
 * 何を: リクエスト妥当性エラーを表現する
 * なぜ: バリデーション失敗を 400 へ正規化するため
 */
package com.example.licensing.api;

public class InvalidLicenseRequestException extends RuntimeException {
  public InvalidLicenseRequestException(String message) {
    super(message);
  }
}
