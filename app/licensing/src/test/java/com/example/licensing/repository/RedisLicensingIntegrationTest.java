/*
 * どこで: Licensing Redis 結合テスト
 * 何を: Lua スクリプトと Service を実 Redis 上で動かし、上限と binding の不変条件を検証する
 * なぜ: モックでは再現できない並行 activation の原子性を保証するため
 */
package com.example.licensing.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.licensing.config.ActivationLogProperties;
import com.example.licensing.model.ActivationMetadata;
import com.example.licensing.model.BindingOutcome;
import com.example.licensing.model.BindingResult;
import com.example.licensing.model.LicenseRecord;
import com.example.licensing.service.ActivationLogWriter;
import com.example.licensing.service.LicenseBindingService;
import com.example.licensing.service.LicensingMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers(disabledWithoutDocker = true)
class RedisLicensingIntegrationTest {

  private static final Instant NOW = Instant.parse("2026-02-24T12:00:00Z");

  @Container
  static final GenericContainer<?> REDIS =
      new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

  private static LettuceConnectionFactory connectionFactory;
  private static StringRedisTemplate redisTemplate;

  private RedisLicenseRepository licenseRepository;
  private LicenseBindingService service;

  @BeforeAll
  static void connect() {
    connectionFactory =
        new LettuceConnectionFactory(
            new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
    connectionFactory.afterPropertiesSet();
    connectionFactory.start();
    redisTemplate = new StringRedisTemplate(connectionFactory);
  }

  @AfterAll
  static void disconnect() {
    if (connectionFactory != null) {
      connectionFactory.destroy();
    }
  }

  @BeforeEach
  void setUp() {
    redisTemplate.execute(
        (RedisCallback<Void>)
            connection -> {
              connection.serverCommands().flushAll();
              return null;
            });
    licenseRepository = new RedisLicenseRepository(redisTemplate);
    final LicensingMetrics metrics = new LicensingMetrics(new SimpleMeterRegistry());
    service =
        new LicenseBindingService(
            licenseRepository,
            new RedisLuaDeviceBindingRepository(redisTemplate),
            new ActivationLogWriter(
                new RedisActivationLogRepository(redisTemplate),
                new ActivationLogProperties(Duration.ofDays(30), 1, Duration.ZERO, 1, 10),
                new SyncTaskExecutor(),
                metrics),
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private BindingResult activate(String licenseKey, String deviceId) {
    return service.activateOrValidate(licenseKey, deviceId, ActivationMetadata.unknown());
  }

  private int currentActivations(String licenseKey) {
    return licenseRepository.findByKey(licenseKey).orElseThrow().currentActivations();
  }

  @Test
  void createRejectsExistingKey() {
    licenseRepository.create("L1", 1, Duration.ofDays(30), NOW);

    assertThatThrownBy(() -> licenseRepository.create("L1", 5, Duration.ofDays(30), NOW))
        .isInstanceOf(LicenseAlreadyExistsException.class);
    assertThat(licenseRepository.findByKey("L1").orElseThrow().maxActivations()).isEqualTo(1);
  }

  @Test
  void singleSeatLicenseBindsFirstDeviceOnly() {
    licenseRepository.create("L1", 1, Duration.ofDays(30), NOW);

    assertThat(activate("L1", "D1").outcome()).isEqualTo(BindingOutcome.ACTIVATED);
    assertThat(activate("L1", "D1").outcome()).isEqualTo(BindingOutcome.VALIDATED);
    assertThat(activate("L1", "D2").outcome()).isEqualTo(BindingOutcome.ACTIVATION_LIMIT_REACHED);
    assertThat(currentActivations("L1")).isEqualTo(1);
    assertThat(redisTemplate.hasKey("hwid:D2")).isFalse();
  }

  @Test
  void fullLicenseRejectsNewDeviceWithoutMutation() {
    licenseRepository.create("L2", 5, Duration.ofDays(30), NOW);
    for (int i = 0; i < 5; i++) {
      assertThat(licenseRepository.incrementActivation("L2")).isPresent();
    }
    assertThat(licenseRepository.incrementActivation("L2")).isEmpty();

    assertThat(activate("L2", "D3").outcome()).isEqualTo(BindingOutcome.ACTIVATION_LIMIT_REACHED);
    assertThat(currentActivations("L2")).isEqualTo(5);
  }

  @Test
  void deviceBoundElsewhereConflicts() {
    licenseRepository.create("L1", 1, Duration.ofDays(30), NOW);
    licenseRepository.create("L3", 1, Duration.ofDays(30), NOW);
    activate("L1", "D1");

    assertThat(activate("L3", "D1").outcome()).isEqualTo(BindingOutcome.CONFLICTING_BINDING);
    assertThat(redisTemplate.opsForValue().get("hwid:D1")).isEqualTo("L1");
    assertThat(currentActivations("L3")).isZero();
  }

  @Test
  void checkOnExpiredLicenseReportsExpiredWithoutBinding() {
    licenseRepository.create("L4", 1, Duration.ofDays(30), NOW.minus(Duration.ofDays(31)));

    assertThat(service.check("L4", "D4").outcome()).isEqualTo(BindingOutcome.EXPIRED);
    assertThat(redisTemplate.hasKey("hwid:D4")).isFalse();
  }

  @Test
  void revalidationNeverChangesCounter() {
    licenseRepository.create("L5", 3, Duration.ofDays(30), NOW);
    activate("L5", "D1");

    for (int i = 0; i < 10; i++) {
      final BindingResult result = activate("L5", "D1");
      assertThat(result.outcome()).isEqualTo(BindingOutcome.VALIDATED);
      assertThat(result.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
    }
    assertThat(service.check("L5", "D1").outcome()).isEqualTo(BindingOutcome.VALID);
    assertThat(currentActivations("L5")).isEqualTo(1);
  }

  @Test
  void deactivationKeepsBindingsButRejectsRequests() {
    licenseRepository.create("L6", 2, Duration.ofDays(30), NOW);
    activate("L6", "D1");

    assertThat(licenseRepository.deactivate("L6")).isTrue();

    assertThat(activate("L6", "D1").outcome()).isEqualTo(BindingOutcome.DEACTIVATED);
    assertThat(service.check("L6", "D1").outcome()).isEqualTo(BindingOutcome.DEACTIVATED);
    assertThat(redisTemplate.opsForValue().get("hwid:D1")).isEqualTo("L6");
    assertThat(licenseRepository.deactivate("MISSING")).isFalse();
  }

  @Test
  void activationWritesAuditEntryWithRetention() {
    licenseRepository.create("L7", 1, Duration.ofDays(30), NOW);

    activate("L7", "D1");

    final String key = "activation:L7:" + NOW.toEpochMilli() + ":D1";
    assertThat(redisTemplate.opsForHash().get(key, "license")).isEqualTo("L7");
    assertThat(redisTemplate.getExpire(key, TimeUnit.SECONDS)).isPositive();
  }

  @Test
  void concurrentActivationsNeverExceedLimit() throws Exception {
    licenseRepository.create("L8", 3, Duration.ofDays(30), NOW);
    final List<BindingResult> results = runConcurrently(20, i -> activate("L8", "DEV-" + i));

    assertThat(results)
        .filteredOn(result -> result.outcome() == BindingOutcome.ACTIVATED)
        .hasSize(3);
    assertThat(results)
        .filteredOn(result -> result.outcome() == BindingOutcome.ACTIVATION_LIMIT_REACHED)
        .hasSize(17);
    assertThat(currentActivations("L8")).isEqualTo(3);
    final Set<String> bindings = redisTemplate.keys("hwid:*");
    assertThat(bindings).hasSize(3);
  }

  @Test
  void concurrentActivationsOfSameDeviceBindOnce() throws Exception {
    licenseRepository.create("L9", 5, Duration.ofDays(30), NOW);
    final List<BindingResult> results = runConcurrently(10, i -> activate("L9", "SAME"));

    assertThat(results)
        .filteredOn(result -> result.outcome() == BindingOutcome.ACTIVATED)
        .hasSize(1);
    assertThat(results).allMatch(BindingResult::success);
    assertThat(currentActivations("L9")).isEqualTo(1);
  }

  @Test
  void findAllListsEveryLicense() {
    licenseRepository.create("OLD", 1, Duration.ofDays(30), NOW.minusSeconds(10));
    licenseRepository.create("NEW", 1, Duration.ofDays(30), NOW);

    final List<LicenseRecord> records = licenseRepository.findAll();

    assertThat(records).extracting(LicenseRecord::licenseKey).containsExactly("OLD", "NEW");
  }

  private interface IndexedCall {
    BindingResult call(int index);
  }

  private List<BindingResult> runConcurrently(int threads, IndexedCall call) throws Exception {
    final ExecutorService pool = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      final List<Future<BindingResult>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        final int index = i;
        final Callable<BindingResult> task =
            () -> {
              start.await();
              return call.call(index);
            };
        futures.add(pool.submit(task));
      }
      start.countDown();
      final List<BindingResult> results = new ArrayList<>();
      for (Future<BindingResult> future : futures) {
        results.add(future.get(30, TimeUnit.SECONDS));
      }
      return results;
    } finally {
      pool.shutdownNow();
    }
  }
}
