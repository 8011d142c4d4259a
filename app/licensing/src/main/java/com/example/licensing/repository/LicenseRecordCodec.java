/*
 * どこで: Licensing Repository 層
 * 何を: LicenseRecord と Redis hash フィールドを相互変換する
 * なぜ: 文字列フィールドの解釈を保存境界だけに閉じ込めるため
 */
package com.example.licensing.repository;

import com.example.common.RedisValueUtils;
import com.example.licensing.model.LicenseRecord;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class LicenseRecordCodec {

  static final String FIELD_KEY = "key";
  static final String FIELD_MAX_ACTIVATIONS = "max_activations";
  static final String FIELD_CURRENT_ACTIVATIONS = "current_activations";
  static final String FIELD_CREATED_AT = "created_at_epoch_millis";
  static final String FIELD_EXPIRES_AT = "expires_at_epoch_millis";
  static final String FIELD_ACTIVE = "active";

  private LicenseRecordCodec() {}

  public static Map<String, String> encode(LicenseRecord record) {
    final Map<String, String> fields = new LinkedHashMap<>();
    fields.put(FIELD_KEY, record.licenseKey());
    fields.put(FIELD_MAX_ACTIVATIONS, Integer.toString(record.maxActivations()));
    fields.put(FIELD_CURRENT_ACTIVATIONS, Integer.toString(record.currentActivations()));
    fields.put(FIELD_CREATED_AT, RedisValueUtils.toEpochMillis(record.createdAt()));
    fields.put(FIELD_EXPIRES_AT, RedisValueUtils.toEpochMillis(record.expiresAt()));
    fields.put(FIELD_ACTIVE, RedisValueUtils.toFlag(record.active()));
    return fields;
  }

  /**
   * 役割: hash の生フィールドを LicenseRecord へ復元する。
   * 動作: key フィールドが無い hash は未登録として empty を返し、数値/時刻が壊れていれば IllegalStateException を送出する。
   * 前提: raw は HashOperations#entries の戻り値をそのまま渡す。
   */
  public static Optional<LicenseRecord> decode(Map<Object, Object> raw) {
    final Map<String, String> fields = RedisValueUtils.normalizeFields(raw);
    final String licenseKey = fields.get(FIELD_KEY);
    if (licenseKey == null || licenseKey.isBlank()) {
      return Optional.empty();
    }
    final var expiresAt = RedisValueUtils.parseEpochMillis(fields.get(FIELD_EXPIRES_AT));
    if (expiresAt == null) {
      throw new IllegalStateException(FIELD_EXPIRES_AT + " is missing for " + licenseKey);
    }
    return Optional.of(
        new LicenseRecord(
            licenseKey,
            RedisValueUtils.parseInt(fields.get(FIELD_MAX_ACTIVATIONS), FIELD_MAX_ACTIVATIONS),
            RedisValueUtils.parseInt(
                fields.getOrDefault(FIELD_CURRENT_ACTIVATIONS, "0"), FIELD_CURRENT_ACTIVATIONS),
            RedisValueUtils.parseEpochMillis(fields.get(FIELD_CREATED_AT)),
            expiresAt,
            RedisValueUtils.parseFlag(fields.get(FIELD_ACTIVE))));
  }
}
