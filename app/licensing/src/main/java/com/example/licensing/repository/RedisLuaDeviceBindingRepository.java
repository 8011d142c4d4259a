package com.example.licensing.repository;

import com.example.licensing.model.ActivationAttempt;
import com.example.licensing.model.BindingOutcome;
import com.example.licensing.model.DeviceBinding;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
public class RedisLuaDeviceBindingRepository implements DeviceBindingRepository {

  static final String BINDING_KEY_PREFIX = "hwid:";

  @SuppressWarnings("rawtypes")
  private static final RedisScript<List> ACTIVATE_SCRIPT =
      RedisScript.of(new ClassPathResource("scripts/activate_device.lua"), List.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisLuaDeviceBindingRepository(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public Optional<DeviceBinding> findByDeviceId(String deviceId) {
    final String licenseKey = redisTemplate.opsForValue().get(bindingKey(deviceId));
    if (licenseKey == null || licenseKey.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(new DeviceBinding(deviceId, licenseKey));
  }

  @Override
  public ActivationAttempt activate(String licenseKey, String deviceId, Instant now) {
    final List<?> result =
        redisTemplate.execute(
            ACTIVATE_SCRIPT,
            List.of(RedisLicenseRepository.licenseKey(licenseKey), bindingKey(deviceId)),
            licenseKey,
            Long.toString(now.toEpochMilli()));
    if (result == null || result.isEmpty()) {
      throw new IllegalStateException("activation script returned no result");
    }
    final BindingOutcome outcome = toOutcome(String.valueOf(result.get(0)));
    final int current = result.size() > 1 ? parseCount(result.get(1)) : 0;
    return new ActivationAttempt(outcome, current);
  }

  private static int parseCount(Object raw) {
    try {
      return Integer.parseInt(String.valueOf(raw));
    } catch (NumberFormatException ex) {
      throw new IllegalStateException("malformed activation count: " + raw, ex);
    }
  }

  static String bindingKey(String deviceId) {
    return BINDING_KEY_PREFIX + deviceId;
  }

  private BindingOutcome toOutcome(String status) {
    return switch (status) {
      case "activated" -> BindingOutcome.ACTIVATED;
      // 同一端末の同時 activation に先を越された場合は既存 binding の再検証と同じ扱い
      case "bound" -> BindingOutcome.VALIDATED;
      case "conflict" -> BindingOutcome.CONFLICTING_BINDING;
      case "limit" -> BindingOutcome.ACTIVATION_LIMIT_REACHED;
      case "expired" -> BindingOutcome.EXPIRED;
      case "inactive" -> BindingOutcome.DEACTIVATED;
      case "not_found" -> BindingOutcome.INVALID_LICENSE;
      default -> throw new IllegalStateException("unexpected activation status: " + status);
    };
  }
}
