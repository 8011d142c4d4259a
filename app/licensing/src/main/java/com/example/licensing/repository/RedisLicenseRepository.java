package com.example.licensing.repository;

import com.example.common.RedisValueUtils;
import com.example.licensing.model.LicenseRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
public class RedisLicenseRepository implements LicenseRepository {

  static final String LICENSE_KEY_PREFIX = "license:";
  private static final long SCAN_COUNT = 100;
  private static final long LIMIT_REACHED = -1;

  private static final RedisScript<Long> CREATE_SCRIPT =
      RedisScript.of(new ClassPathResource("scripts/create_license.lua"), Long.class);
  private static final RedisScript<Long> INCREMENT_SCRIPT =
      RedisScript.of(new ClassPathResource("scripts/increment_activation.lua"), Long.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisLicenseRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public Optional<LicenseRecord> findByKey(String licenseKey) {
    final Map<Object, Object> raw = redisTemplate.opsForHash().entries(licenseKey(licenseKey));
    if (raw == null || raw.isEmpty()) {
      return Optional.empty();
    }
    return LicenseRecordCodec.decode(raw);
  }

  @Override
  public LicenseRecord create(
      String licenseKey, int maxActivations, Duration validity, Instant now) {
    final LicenseRecord record =
        new LicenseRecord(licenseKey, maxActivations, 0, now, now.plus(validity), true);
    final Object[] args = flatten(LicenseRecordCodec.encode(record));
    final Long created = redisTemplate.execute(CREATE_SCRIPT, List.of(licenseKey(licenseKey)), args);
    if (created == null || created == 0L) {
      throw new LicenseAlreadyExistsException(licenseKey);
    }
    return record;
  }

  @Override
  public OptionalLong incrementActivation(String licenseKey) {
    final Long updated = redisTemplate.execute(INCREMENT_SCRIPT, List.of(licenseKey(licenseKey)));
    if (updated == null || updated <= LIMIT_REACHED) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(updated);
  }

  @Override
  public boolean deactivate(String licenseKey) {
    final String key = licenseKey(licenseKey);
    // レコードは物理削除しないため、存在確認と更新の間に消える競合は無い
    if (!Boolean.TRUE.equals(redisTemplate.opsForHash().hasKey(key, LicenseRecordCodec.FIELD_KEY))) {
      return false;
    }
    redisTemplate.opsForHash().put(key, LicenseRecordCodec.FIELD_ACTIVE, RedisValueUtils.toFlag(false));
    return true;
  }

  @Override
  public List<LicenseRecord> findAll() {
    final List<String> keys = new ArrayList<>();
    final ScanOptions options =
        ScanOptions.scanOptions().match(LICENSE_KEY_PREFIX + "*").count(SCAN_COUNT).build();
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      while (cursor.hasNext()) {
        keys.add(cursor.next());
      }
    }
    final List<LicenseRecord> records = new ArrayList<>();
    for (String key : keys) {
      LicenseRecordCodec.decode(redisTemplate.opsForHash().entries(key)).ifPresent(records::add);
    }
    records.sort(
        Comparator.comparing(
            LicenseRecord::createdAt, Comparator.nullsLast(Comparator.naturalOrder())));
    return records;
  }

  static String licenseKey(String licenseKey) {
    return LICENSE_KEY_PREFIX + licenseKey;
  }

  private Object[] flatten(Map<String, String> fields) {
    final List<String> args = new ArrayList<>(fields.size() * 2);
    for (Map.Entry<String, String> e : fields.entrySet()) {
      args.add(e.getKey());
      args.add(e.getValue());
    }
    return args.toArray();
  }
}
