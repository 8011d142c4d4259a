/*
 * どこで: Licensing サービス層
 * 何を: validate(activate-or-validate) と check を実行する
 * なぜ: 事前判定・原子的 activation・監査ログ・メトリクスの順序を 1 か所で保証するため
 */
package com.example.licensing.service;

import com.example.licensing.api.InvalidLicenseRequestException;
import com.example.licensing.api.LicenseStoreUnavailableException;
import com.example.licensing.model.ActivationAttempt;
import com.example.licensing.model.ActivationLogEntry;
import com.example.licensing.model.ActivationMetadata;
import com.example.licensing.model.BindingOutcome;
import com.example.licensing.model.BindingResult;
import com.example.licensing.model.DeviceBinding;
import com.example.licensing.model.LicenseRecord;
import com.example.licensing.repository.DeviceBindingRepository;
import com.example.licensing.repository.LicenseRepository;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class LicenseBindingService {

  private static final Logger logger = LoggerFactory.getLogger(LicenseBindingService.class);
  static final String OPERATION_VALIDATE = "validate";
  static final String OPERATION_CHECK = "check";

  private final LicenseRepository licenseRepository;
  private final DeviceBindingRepository bindingRepository;
  private final ActivationLogWriter activationLogWriter;
  private final LicensingMetrics metrics;
  private final Clock clock;

  public LicenseBindingService(
      LicenseRepository licenseRepository,
      DeviceBindingRepository bindingRepository,
      ActivationLogWriter activationLogWriter,
      LicensingMetrics metrics,
      Clock clock) {
    this.licenseRepository = licenseRepository;
    this.bindingRepository = bindingRepository;
    this.activationLogWriter = activationLogWriter;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: 端末の binding を検証し、未登録なら activation を行う。
   * 動作: 既存 binding が一致すれば状態を変えずに VALIDATED、空きがあれば binding 作成と件数加算を原子的に行い ACTIVATED を返す。
   * 前提: Redis に到達できない場合のみ LicenseStoreUnavailableException を送出する。
   */
  public BindingResult activateOrValidate(
      String licenseKey, String deviceId, ActivationMetadata metadata) {
    validateInputs(licenseKey, deviceId);
    final Instant now = Instant.now(clock);
    final BindingResult result;
    try {
      final LicenseRecord record = licenseRepository.findByKey(licenseKey).orElse(null);
      final DeviceBinding binding = record == null ? null : findBinding(deviceId);
      final BindingDecision decision =
          BindingDecisions.decideActivation(record, binding, licenseKey, now);
      result =
          decision.requiresActivation()
              ? activate(record, deviceId, now, metadata)
              : toResult(decision.outcome(), record);
    } catch (DataAccessException ex) {
      throw storeUnavailable(OPERATION_VALIDATE, licenseKey, ex);
    } catch (IllegalStateException ex) {
      throw malformedRecord(OPERATION_VALIDATE, licenseKey, deviceId, ex);
    }
    recordOutcome(OPERATION_VALIDATE, licenseKey, deviceId, result);
    return result;
  }

  /**
   * 役割: 既存 binding がこのライセンスを指しているかだけを確認する。
   * 動作: binding 作成や件数加算は行わない。未登録端末は NOT_BOUND を返す。
   */
  public BindingResult check(String licenseKey, String deviceId) {
    validateInputs(licenseKey, deviceId);
    final Instant now = Instant.now(clock);
    final BindingResult result;
    try {
      final LicenseRecord record = licenseRepository.findByKey(licenseKey).orElse(null);
      final DeviceBinding binding = record == null ? null : findBinding(deviceId);
      result = toResult(BindingDecisions.decideCheck(record, binding, licenseKey, now), record);
    } catch (DataAccessException ex) {
      throw storeUnavailable(OPERATION_CHECK, licenseKey, ex);
    } catch (IllegalStateException ex) {
      throw malformedRecord(OPERATION_CHECK, licenseKey, deviceId, ex);
    }
    recordOutcome(OPERATION_CHECK, licenseKey, deviceId, result);
    return result;
  }

  private BindingResult activate(
      LicenseRecord record, String deviceId, Instant now, ActivationMetadata metadata) {
    // 事前判定はスナップショットに基づくため、最終結果はスクリプト側の再判定に従う
    final ActivationAttempt attempt =
        bindingRepository.activate(record.licenseKey(), deviceId, now);
    if (attempt.outcome() == BindingOutcome.ACTIVATED) {
      logger.info(
          "license activated licenseKey={} deviceId={} activations={}/{}",
          record.licenseKey(),
          deviceId,
          attempt.currentActivations(),
          record.maxActivations());
      activationLogWriter.submit(toLogEntry(record.licenseKey(), deviceId, now, metadata));
    }
    return toResult(attempt.outcome(), record);
  }

  private DeviceBinding findBinding(String deviceId) {
    return bindingRepository.findByDeviceId(deviceId).orElse(null);
  }

  private BindingResult toResult(BindingOutcome outcome, LicenseRecord record) {
    if (outcome.success()) {
      return BindingResult.success(outcome, record.expiresAt());
    }
    return BindingResult.rejected(outcome);
  }

  private ActivationLogEntry toLogEntry(
      String licenseKey, String deviceId, Instant now, ActivationMetadata metadata) {
    final ActivationMetadata safeMetadata =
        metadata == null ? ActivationMetadata.unknown() : metadata;
    return new ActivationLogEntry(
        licenseKey,
        deviceId,
        now,
        safeMetadata.clientIp(),
        safeMetadata.userAgent(),
        safeMetadata.clientVersion());
  }

  private void recordOutcome(
      String operation, String licenseKey, String deviceId, BindingResult result) {
    metrics.recordRequest(operation, result.outcome().tagValue());
    if (result.success()) {
      logger.debug(
          "{} succeeded licenseKey={} deviceId={} outcome={}",
          operation,
          licenseKey,
          deviceId,
          result.outcome());
    } else {
      logger.info(
          "{} rejected licenseKey={} deviceId={} outcome={}",
          operation,
          licenseKey,
          deviceId,
          result.outcome());
    }
  }

  private LicenseStoreUnavailableException storeUnavailable(
      String operation, String licenseKey, DataAccessException ex) {
    metrics.recordStoreError(operation);
    logger.warn("{} failed: license store unavailable licenseKey={}", operation, licenseKey, ex);
    return new LicenseStoreUnavailableException("license store unavailable", ex);
  }

  // 保存データの破損は再試行で直らないため TRANSIENT にはせず、キー付きで記録して上位へ送る
  private IllegalStateException malformedRecord(
      String operation, String licenseKey, String deviceId, IllegalStateException ex) {
    metrics.recordStoreError(operation);
    logger.warn(
        "{} failed: malformed license data licenseKey={} deviceId={}",
        operation,
        licenseKey,
        deviceId,
        ex);
    return ex;
  }

  private void validateInputs(String licenseKey, String deviceId) {
    if (licenseKey == null || licenseKey.isBlank()) {
      throw new InvalidLicenseRequestException("license_key is required");
    }
    if (deviceId == null || deviceId.isBlank()) {
      throw new InvalidLicenseRequestException("hwid is required");
    }
  }
}
