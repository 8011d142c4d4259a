/*
 * どこで: Licensing ドメインモデル
 * 何を: activation 監査ログ 1 件分のデータを表す
 * なぜ: 書き込み専用の監査情報を protocol の判定から切り離すため
 */
package com.example.licensing.model;

import java.time.Instant;

public record ActivationLogEntry(
    String licenseKey,
    String deviceId,
    Instant occurredAt,
    String clientIp,
    String userAgent,
    String clientVersion) {}
