/*
 * どこで: 共通ユーティリティ
 * 何を: Redis に文字列で保存する値と Java 型を相互変換する
 * なぜ: Redis の hash は全フィールドが文字列で往復するため、変換規則を一箇所に固定するため
 */
package com.example.common;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public final class RedisValueUtils {

  private static final String TRUE_FLAG = "1";
  private static final String FALSE_FLAG = "0";

  private RedisValueUtils() {}

  // 前提: Lua スクリプトから数値比較できるよう、時刻は epoch millis の文字列で保存する
  public static String toEpochMillis(Instant instant) {
    return instant == null ? null : Long.toString(instant.toEpochMilli());
  }

  public static Instant parseEpochMillis(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.ofEpochMilli(Long.parseLong(value.trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalStateException("malformed epoch millis: " + value, ex);
    }
  }

  public static String toFlag(boolean value) {
    return value ? TRUE_FLAG : FALSE_FLAG;
  }

  public static boolean parseFlag(String value) {
    return TRUE_FLAG.equals(value);
  }

  public static int parseInt(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException(fieldName + " is missing");
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalStateException("malformed " + fieldName + ": " + value, ex);
    }
  }

  /** HashOperations#entries の Object キー/値を文字列へ正規化する。 */
  public static Map<String, String> normalizeFields(Map<Object, Object> raw) {
    final Map<String, String> map = new HashMap<>();
    if (raw == null) {
      return map;
    }
    for (Map.Entry<Object, Object> e : raw.entrySet()) {
      map.put(
          String.valueOf(e.getKey()), e.getValue() == null ? null : String.valueOf(e.getValue()));
    }
    return map;
  }
}
