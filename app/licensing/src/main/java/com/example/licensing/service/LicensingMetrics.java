/*
 * どこで: Licensing サービス層
 * 何を: validate/check の結果と依存先エラーのメトリクス記録を集約する
 * なぜ: activation 上限到達や Redis 障害を運用で継続監視できるようにするため
 */
package com.example.licensing.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class LicensingMetrics {

  private static final String METRIC_REQUEST_TOTAL = "licensing.request.total";
  private static final String METRIC_ACTIVATION_LOG_FAILURE_TOTAL =
      "licensing.activation_log.failure.total";
  private static final String METRIC_STORE_ERROR_TOTAL = "licensing.store.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> activationLogFailureCounters =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> storeErrorCounters = new ConcurrentHashMap<>();

  public LicensingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordRequest(String operation, String outcome) {
    final String key = operation + ":" + outcome;
    requestCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_REQUEST_TOTAL)
                    .description("License validate/check requests by outcome")
                    .tags(Tags.of("operation", operation, "outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordActivationLogFailure(String reason) {
    activationLogFailureCounters
        .computeIfAbsent(
            reason,
            ignored ->
                Counter.builder(METRIC_ACTIVATION_LOG_FAILURE_TOTAL)
                    .description("Activation log entries that could not be written")
                    .tags(Tags.of("reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStoreError(String operation) {
    storeErrorCounters
        .computeIfAbsent(
            operation,
            ignored ->
                Counter.builder(METRIC_STORE_ERROR_TOTAL)
                    .description("Key-value store failures surfaced as transient errors")
                    .tags(Tags.of("operation", operation))
                    .register(meterRegistry))
        .increment();
  }
}
