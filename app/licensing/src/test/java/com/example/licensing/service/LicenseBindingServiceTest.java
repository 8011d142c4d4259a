package com.example.licensing.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.licensing.api.InvalidLicenseRequestException;
import com.example.licensing.api.LicenseStoreUnavailableException;
import com.example.licensing.config.ActivationLogProperties;
import com.example.licensing.model.ActivationAttempt;
import com.example.licensing.model.ActivationLogEntry;
import com.example.licensing.model.ActivationMetadata;
import com.example.licensing.model.BindingOutcome;
import com.example.licensing.model.BindingResult;
import com.example.licensing.model.DeviceBinding;
import com.example.licensing.model.LicenseRecord;
import com.example.licensing.repository.ActivationLogRepository;
import com.example.licensing.repository.DeviceBindingRepository;
import com.example.licensing.repository.LicenseRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.data.redis.RedisConnectionFailureException;

class LicenseBindingServiceTest {

  private static final Instant NOW = Instant.parse("2026-02-24T12:00:00Z");
  private static final Instant EXPIRES_AT = NOW.plus(Duration.ofDays(30));
  private static final String KEY = "PHANTOM-123456789";

  private LicenseRepository licenseRepository;
  private DeviceBindingRepository bindingRepository;
  private ActivationLogWriter activationLogWriter;
  private LicensingMetrics metrics;
  private LicenseBindingService service;

  @BeforeEach
  void setUp() {
    licenseRepository = Mockito.mock(LicenseRepository.class);
    bindingRepository = Mockito.mock(DeviceBindingRepository.class);
    activationLogWriter = Mockito.mock(ActivationLogWriter.class);
    metrics = Mockito.mock(LicensingMetrics.class);
    service =
        new LicenseBindingService(
            licenseRepository,
            bindingRepository,
            activationLogWriter,
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static LicenseRecord license(int max, int current) {
    return new LicenseRecord(KEY, max, current, NOW.minusSeconds(60), EXPIRES_AT, true);
  }

  @Test
  void activatesUnboundDeviceAndWritesActivationLog() {
    when(licenseRepository.findByKey(KEY)).thenReturn(Optional.of(license(1, 0)));
    when(bindingRepository.findByDeviceId("HW-A")).thenReturn(Optional.empty());
    when(bindingRepository.activate(KEY, "HW-A", NOW))
        .thenReturn(new ActivationAttempt(BindingOutcome.ACTIVATED, 1));

    final BindingResult result =
        service.activateOrValidate(
            KEY, "HW-A", new ActivationMetadata("10.0.0.1", "client/1.0", "1.2.3"));

    assertThat(result.outcome()).isEqualTo(BindingOutcome.ACTIVATED);
    assertThat(result.expiresAt()).isEqualTo(EXPIRES_AT);
    final ArgumentCaptor<ActivationLogEntry> entryCaptor =
        ArgumentCaptor.forClass(ActivationLogEntry.class);
    verify(activationLogWriter).submit(entryCaptor.capture());
    assertThat(entryCaptor.getValue())
        .isEqualTo(new ActivationLogEntry(KEY, "HW-A", NOW, "10.0.0.1", "client/1.0", "1.2.3"));
    verify(metrics).recordRequest("validate", "activated");
  }

  @Test
  void boundDeviceIsValidatedWithoutMutation() {
    when(licenseRepository.findByKey(KEY)).thenReturn(Optional.of(license(1, 1)));
    when(bindingRepository.findByDeviceId("HW-A"))
        .thenReturn(Optional.of(new DeviceBinding("HW-A", KEY)));

    final BindingResult result =
        service.activateOrValidate(KEY, "HW-A", ActivationMetadata.unknown());

    assertThat(result.outcome()).isEqualTo(BindingOutcome.VALIDATED);
    assertThat(result.expiresAt()).isEqualTo(EXPIRES_AT);
    verify(bindingRepository, never()).activate(anyString(), anyString(), any());
    verify(activationLogWriter, never()).submit(any());
  }

  @Test
  void unknownLicenseSkipsBindingLookup() {
    when(licenseRepository.findByKey(KEY)).thenReturn(Optional.empty());

    final BindingResult result =
        service.activateOrValidate(KEY, "HW-A", ActivationMetadata.unknown());

    assertThat(result.outcome()).isEqualTo(BindingOutcome.INVALID_LICENSE);
    assertThat(result.expiresAt()).isNull();
    verify(bindingRepository, never()).findByDeviceId(anyString());
    verify(metrics).recordRequest("validate", "invalid_license");
  }

  @Test
  void scriptVerdictOverridesStaleSnapshot() {
    // 読み取り時点では空きがあったが、スクリプト実行時には別端末が最後の枠を取っていた
    when(licenseRepository.findByKey(KEY)).thenReturn(Optional.of(license(1, 0)));
    when(bindingRepository.findByDeviceId("HW-B")).thenReturn(Optional.empty());
    when(bindingRepository.activate(KEY, "HW-B", NOW))
        .thenReturn(new ActivationAttempt(BindingOutcome.ACTIVATION_LIMIT_REACHED, 1));

    final BindingResult result =
        service.activateOrValidate(KEY, "HW-B", ActivationMetadata.unknown());

    assertThat(result.outcome()).isEqualTo(BindingOutcome.ACTIVATION_LIMIT_REACHED);
    verify(activationLogWriter, never()).submit(any());
  }

  @Test
  void concurrentActivationOfSameDeviceResolvesToValidated() {
    when(licenseRepository.findByKey(KEY)).thenReturn(Optional.of(license(2, 0)));
    when(bindingRepository.findByDeviceId("HW-A")).thenReturn(Optional.empty());
    when(bindingRepository.activate(KEY, "HW-A", NOW))
        .thenReturn(new ActivationAttempt(BindingOutcome.VALIDATED, 1));

    final BindingResult result =
        service.activateOrValidate(KEY, "HW-A", ActivationMetadata.unknown());

    assertThat(result.outcome()).isEqualTo(BindingOutcome.VALIDATED);
    assertThat(result.expiresAt()).isEqualTo(EXPIRES_AT);
    verify(activationLogWriter, never()).submit(any());
  }

  @Test
  void activationLogFailureDoesNotAffectOutcome() {
    final ActivationLogRepository logRepository = Mockito.mock(ActivationLogRepository.class);
    doThrow(new RedisConnectionFailureException("timeout"))
        .when(logRepository)
        .append(any(), any());
    final LicenseBindingService serviceWithFailingLog =
        new LicenseBindingService(
            licenseRepository,
            bindingRepository,
            new ActivationLogWriter(
                logRepository,
                new ActivationLogProperties(null, 2, Duration.ZERO, 1, 10),
                new SyncTaskExecutor(),
                metrics),
            metrics,
            Clock.fixed(NOW, ZoneOffset.UTC));
    when(licenseRepository.findByKey(KEY)).thenReturn(Optional.of(license(1, 0)));
    when(bindingRepository.findByDeviceId("HW-A")).thenReturn(Optional.empty());
    when(bindingRepository.activate(KEY, "HW-A", NOW))
        .thenReturn(new ActivationAttempt(BindingOutcome.ACTIVATED, 1));

    final BindingResult result =
        serviceWithFailingLog.activateOrValidate(KEY, "HW-A", ActivationMetadata.unknown());

    assertThat(result.outcome()).isEqualTo(BindingOutcome.ACTIVATED);
    verify(metrics).recordActivationLogFailure("exhausted");
  }

  @Test
  void storeFailureSurfacesAsTransient() {
    when(licenseRepository.findByKey(KEY))
        .thenThrow(new RedisConnectionFailureException("connection refused"));

    assertThatThrownBy(() -> service.activateOrValidate(KEY, "HW-A", ActivationMetadata.unknown()))
        .isInstanceOf(LicenseStoreUnavailableException.class);
    verify(metrics).recordStoreError("validate");
    verify(metrics, never()).recordRequest(anyString(), anyString());
  }

  @Test
  void malformedLicenseDataIsNotReportedAsTransient() {
    when(licenseRepository.findByKey(KEY))
        .thenThrow(new IllegalStateException("malformed max_activations: abc"));

    assertThatThrownBy(() -> service.check(KEY, "HW-A"))
        .isInstanceOf(IllegalStateException.class)
        .isNotInstanceOf(LicenseStoreUnavailableException.class)
        .hasMessageContaining("max_activations");
    verify(metrics).recordStoreError("check");
    verify(metrics, never()).recordRequest(anyString(), anyString());
  }

  @Test
  void storeFailureDuringActivationSurfacesAsTransient() {
    when(licenseRepository.findByKey(KEY)).thenReturn(Optional.of(license(1, 0)));
    when(bindingRepository.findByDeviceId("HW-A")).thenReturn(Optional.empty());
    doThrow(new RedisConnectionFailureException("timeout"))
        .when(bindingRepository)
        .activate(KEY, "HW-A", NOW);

    assertThatThrownBy(() -> service.activateOrValidate(KEY, "HW-A", ActivationMetadata.unknown()))
        .isInstanceOf(LicenseStoreUnavailableException.class);
    verify(activationLogWriter, never()).submit(any());
  }

  @Test
  void checkNeverActivates() {
    when(licenseRepository.findByKey(KEY)).thenReturn(Optional.of(license(1, 0)));
    when(bindingRepository.findByDeviceId("HW-A")).thenReturn(Optional.empty());

    final BindingResult result = service.check(KEY, "HW-A");

    assertThat(result.outcome()).isEqualTo(BindingOutcome.NOT_BOUND);
    verify(bindingRepository, never()).activate(anyString(), anyString(), any());
    verify(metrics).recordRequest("check", "not_bound");
  }

  @Test
  void checkReturnsExpirationForBoundDevice() {
    when(licenseRepository.findByKey(KEY)).thenReturn(Optional.of(license(1, 1)));
    when(bindingRepository.findByDeviceId("HW-A"))
        .thenReturn(Optional.of(new DeviceBinding("HW-A", KEY)));

    final BindingResult result = service.check(KEY, "HW-A");

    assertThat(result.outcome()).isEqualTo(BindingOutcome.VALID);
    assertThat(result.expiresAt()).isEqualTo(EXPIRES_AT);
  }

  @Test
  void checkStoreFailureSurfacesAsTransient() {
    when(licenseRepository.findByKey(KEY))
        .thenThrow(new RedisConnectionFailureException("connection refused"));

    assertThatThrownBy(() -> service.check(KEY, "HW-A"))
        .isInstanceOf(LicenseStoreUnavailableException.class);
    verify(metrics).recordStoreError("check");
  }

  @Test
  void blankInputsAreRejected() {
    assertThatThrownBy(() -> service.activateOrValidate(" ", "HW-A", null))
        .isInstanceOf(InvalidLicenseRequestException.class)
        .hasMessage("license_key is required");
    assertThatThrownBy(() -> service.check(KEY, null))
        .isInstanceOf(InvalidLicenseRequestException.class)
        .hasMessage("hwid is required");
  }
}
