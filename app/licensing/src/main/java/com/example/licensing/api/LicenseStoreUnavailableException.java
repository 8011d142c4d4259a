/*
 * どこで: Licensing API
 * 何を: ストア到達不能/タイムアウトを表現する
 * なぜ: 業務エラーと区別し、クライアントへ再試行可能な 503 として返すため
 */
package com.example.licensing.api;

public class LicenseStoreUnavailableException extends RuntimeException {
  public LicenseStoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
