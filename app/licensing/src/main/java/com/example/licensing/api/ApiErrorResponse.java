/*
 * どこで: Licensing API
 * 何を: 業務判定以外のエラー応答フォーマットを定義する
 * なぜ: validate/check の失敗応答と同じ success/outcome/error の形でクライアントへ返すため
 */
package com.example.licensing.api;

public record ApiErrorResponse(boolean success, String outcome, String error) {

  public static ApiErrorResponse of(String outcome, String error) {
    return new ApiErrorResponse(false, outcome, error);
  }
}
