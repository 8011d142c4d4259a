package com.example.licensing.api;

import com.example.licensing.api.response.HealthResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** ストアへの PING で疎通を返す簡易ヘルスチェック。詳細は /actuator/health を参照する。 */
@RestController
public class HealthController {

  private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final Clock clock;

  public HealthController(StringRedisTemplate redisTemplate, Clock clock) {
    this.redisTemplate = redisTemplate;
    this.clock = clock;
  }

  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    try {
      redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
    } catch (DataAccessException ex) {
      logger.warn("health check failed: license store unavailable", ex);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(new HealthResponse(false, null, "Redis connection failed", null));
    }
    return ResponseEntity.ok(
        new HealthResponse(true, "Server is running", null, Instant.now(clock).toString()));
  }
}
