package com.example.licensing.repository;

import com.example.common.RedisValueUtils;
import com.example.licensing.model.ActivationLogEntry;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisActivationLogRepository implements ActivationLogRepository {

  private static final String FIELD_LICENSE = "license";
  private static final String FIELD_HWID = "hwid";
  private static final String FIELD_TIMESTAMP = "timestamp";
  private static final String FIELD_IP = "ip";
  private static final String FIELD_USER_AGENT = "user_agent";
  private static final String FIELD_CLIENT_VERSION = "client_version";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisActivationLogRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public void append(ActivationLogEntry entry, Duration retention) {
    final String key = activationKey(entry);
    final Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_LICENSE, entry.licenseKey());
    fields.put(FIELD_HWID, entry.deviceId());
    fields.put(FIELD_TIMESTAMP, RedisValueUtils.toEpochMillis(entry.occurredAt()));
    fields.put(FIELD_IP, entry.clientIp());
    fields.put(FIELD_USER_AGENT, entry.userAgent());
    fields.put(FIELD_CLIENT_VERSION, entry.clientVersion());

    redisTemplate.opsForHash().putAll(key, fields);
    redisTemplate.expire(key, retention);
  }

  // 1 端末は 1 ライセンスに一度しか activation しないため、時刻 + hwid で一意になる
  static String activationKey(ActivationLogEntry entry) {
    return "activation:"
        + entry.licenseKey()
        + ":"
        + entry.occurredAt().toEpochMilli()
        + ":"
        + entry.deviceId();
  }
}
