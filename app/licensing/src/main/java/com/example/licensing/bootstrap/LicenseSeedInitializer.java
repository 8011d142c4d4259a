/*
 * どこで: Licensing 起動処理
 * 何を: 設定されたデモライセンスを起動時に登録する
 * なぜ: 開発/検証環境でクライアントをすぐ試せるようにするため
 */
package com.example.licensing.bootstrap;

import com.example.licensing.config.LicenseSeedProperties;
import com.example.licensing.config.LicenseSeedProperties.SeedLicense;
import com.example.licensing.repository.LicenseAlreadyExistsException;
import com.example.licensing.repository.LicenseRepository;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "licensing.seed.enabled", havingValue = "true")
@RequiredArgsConstructor
public class LicenseSeedInitializer {

  private static final Logger logger = LoggerFactory.getLogger(LicenseSeedInitializer.class);

  private final LicenseRepository licenseRepository;
  private final LicenseSeedProperties properties;
  private final Clock clock;

  @PostConstruct
  public void seed() {
    final Instant now = Instant.now(clock);
    int created = 0;
    try {
      for (SeedLicense seed : properties.licenses()) {
        if (seedOne(seed, now)) {
          created++;
        }
      }
    } catch (DataAccessException ex) {
      // Redis 未起動でもアプリ自体は起動させ、validate 側で TRANSIENT を返す
      logger.error("license seeding aborted: license store unavailable", ex);
      return;
    }
    logger.info(
        "license seeding finished created={} configured={}", created, properties.licenses().size());
  }

  private boolean seedOne(SeedLicense seed, Instant now) {
    if (seed.key() == null || seed.key().isBlank()) {
      throw new IllegalStateException("licensing.seed.licenses[].key must be set");
    }
    if (seed.maxActivations() <= 0
        || seed.validity() == null
        || seed.validity().isNegative()
        || seed.validity().isZero()) {
      throw new IllegalStateException("invalid seed license definition: " + seed.key());
    }
    if (licenseRepository.findByKey(seed.key()).isPresent()) {
      logger.debug("seed license already exists licenseKey={}", seed.key());
      return false;
    }
    try {
      licenseRepository.create(seed.key(), seed.maxActivations(), seed.validity(), now);
      logger.info(
          "seed license created licenseKey={} maxActivations={} validity={}",
          seed.key(),
          seed.maxActivations(),
          seed.validity());
      return true;
    } catch (LicenseAlreadyExistsException ex) {
      // 別インスタンスが先に登録した
      logger.debug("seed license created concurrently licenseKey={}", seed.key());
      return false;
    }
  }
}
