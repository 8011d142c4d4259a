/*
 * どこで: Licensing サービス層
 * 何を: activation 監査ログを非同期かつ回数制限付きの再試行で書き込む
 * なぜ: 監査ログの失敗や遅延を activation の結果へ波及させないため
 */
package com.example.licensing.service;

import com.example.licensing.config.ActivationLogExecutorConfig;
import com.example.licensing.config.ActivationLogProperties;
import com.example.licensing.model.ActivationLogEntry;
import com.example.licensing.repository.ActivationLogRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

@Component
public class ActivationLogWriter {

  private static final Logger logger = LoggerFactory.getLogger(ActivationLogWriter.class);
  static final String REASON_REJECTED = "rejected";
  static final String REASON_EXHAUSTED = "exhausted";
  static final String REASON_INTERRUPTED = "interrupted";

  private final ActivationLogRepository repository;
  private final ActivationLogProperties properties;
  private final TaskExecutor executor;
  private final LicensingMetrics metrics;

  public ActivationLogWriter(
      ActivationLogRepository repository,
      ActivationLogProperties properties,
      @Qualifier(ActivationLogExecutorConfig.EXECUTOR_NAME) TaskExecutor executor,
      LicensingMetrics metrics) {
    this.repository = repository;
    this.properties = properties;
    this.executor = executor;
    this.metrics = metrics;
  }

  /** 書き込みを executor へ投入する。キューが満杯なら破棄して警告のみ残す。 */
  public void submit(ActivationLogEntry entry) {
    try {
      executor.execute(() -> writeWithRetry(entry));
    } catch (TaskRejectedException ex) {
      metrics.recordActivationLogFailure(REASON_REJECTED);
      logger.warn(
          "activation log dropped: executor saturated licenseKey={} deviceId={}",
          entry.licenseKey(),
          entry.deviceId());
    }
  }

  @VisibleForTesting
  void writeWithRetry(ActivationLogEntry entry) {
    final int maxAttempts = properties.maxAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        repository.append(entry, properties.retention());
        return;
      } catch (RuntimeException ex) {
        if (attempt >= maxAttempts) {
          metrics.recordActivationLogFailure(REASON_EXHAUSTED);
          logger.warn(
              "activation log write failed after {} attempts licenseKey={} deviceId={}",
              attempt,
              entry.licenseKey(),
              entry.deviceId(),
              ex);
          return;
        }
        logger.debug(
            "activation log write failed, retrying attempt={} licenseKey={}",
            attempt,
            entry.licenseKey());
        if (!backoff(properties.retryBackoff())) {
          metrics.recordActivationLogFailure(REASON_INTERRUPTED);
          logger.warn(
              "activation log write interrupted licenseKey={} deviceId={}",
              entry.licenseKey(),
              entry.deviceId());
          return;
        }
      }
    }
  }

  private boolean backoff(Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
