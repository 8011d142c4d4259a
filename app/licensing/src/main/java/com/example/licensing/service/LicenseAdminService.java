/*
 * どこで: Licensing サービス層
 * 何を: 管理 API 向けのライセンス発行・一覧・無効化を行う
 * なぜ: キー生成の衝突再試行と既定値補完を Controller から切り離すため
 */
package com.example.licensing.service;

import com.example.licensing.api.InvalidLicenseRequestException;
import com.example.licensing.api.LicenseNotFoundException;
import com.example.licensing.api.LicenseStoreUnavailableException;
import com.example.licensing.api.request.CreateLicenseRequest;
import com.example.licensing.api.response.CreateLicenseResponse;
import com.example.licensing.api.response.LicenseSummary;
import com.example.licensing.api.response.LicensesResponse;
import com.example.licensing.config.LicensingProperties;
import com.example.licensing.model.LicenseRecord;
import com.example.licensing.repository.LicenseAlreadyExistsException;
import com.example.licensing.repository.LicenseRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class LicenseAdminService {

  private static final Logger logger = LoggerFactory.getLogger(LicenseAdminService.class);
  static final int MAX_KEY_ATTEMPTS = 5;

  private final LicenseRepository licenseRepository;
  private final LicenseKeyGenerator keyGenerator;
  private final LicensingProperties properties;
  private final LicensingMetrics metrics;
  private final Clock clock;

  public LicenseAdminService(
      LicenseRepository licenseRepository,
      LicenseKeyGenerator keyGenerator,
      LicensingProperties properties,
      LicensingMetrics metrics,
      Clock clock) {
    this.licenseRepository = licenseRepository;
    this.keyGenerator = keyGenerator;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  public CreateLicenseResponse create(CreateLicenseRequest request) {
    final int maxActivations = resolveMaxActivations(request);
    final Duration validity = resolveValidity(request);
    final Instant now = Instant.now(clock);
    try {
      for (int attempt = 1; attempt <= MAX_KEY_ATTEMPTS; attempt++) {
        final String licenseKey = keyGenerator.generate();
        try {
          final LicenseRecord record =
              licenseRepository.create(licenseKey, maxActivations, validity, now);
          logger.info(
              "license created licenseKey={} maxActivations={} expiresAt={}",
              record.licenseKey(),
              record.maxActivations(),
              record.expiresAt());
          return new CreateLicenseResponse(
              true, record.licenseKey(), record.expiresAt().toString(), record.maxActivations());
        } catch (LicenseAlreadyExistsException ex) {
          logger.debug("generated license key collided attempt={}", attempt);
        }
      }
    } catch (DataAccessException ex) {
      throw storeUnavailable("admin_create", ex);
    }
    throw new IllegalStateException(
        "could not generate a unique license key after " + MAX_KEY_ATTEMPTS + " attempts");
  }

  public LicensesResponse list() {
    try {
      final List<LicenseSummary> licenses =
          licenseRepository.findAll().stream().map(LicenseSummary::from).toList();
      return new LicensesResponse(true, licenses);
    } catch (DataAccessException ex) {
      throw storeUnavailable("admin_list", ex);
    }
  }

  /** active フラグのみを落とす。既存 binding と activation 件数はそのまま残る。 */
  public void deactivate(String licenseKey) {
    if (licenseKey == null || licenseKey.isBlank()) {
      throw new InvalidLicenseRequestException("licenseKey is required");
    }
    final boolean deactivated;
    try {
      deactivated = licenseRepository.deactivate(licenseKey);
    } catch (DataAccessException ex) {
      throw storeUnavailable("admin_deactivate", ex);
    }
    if (!deactivated) {
      throw new LicenseNotFoundException(licenseKey);
    }
    logger.info("license deactivated licenseKey={}", licenseKey);
  }

  private int resolveMaxActivations(CreateLicenseRequest request) {
    if (request == null || request.maxActivations() == null) {
      return properties.defaultMaxActivations();
    }
    if (request.maxActivations() <= 0) {
      throw new InvalidLicenseRequestException("max_activations must be positive");
    }
    return request.maxActivations();
  }

  private Duration resolveValidity(CreateLicenseRequest request) {
    if (request == null || request.daysValid() == null) {
      return properties.defaultValidity();
    }
    if (request.daysValid() <= 0) {
      throw new InvalidLicenseRequestException("days_valid must be positive");
    }
    return Duration.ofDays(request.daysValid());
  }

  private LicenseStoreUnavailableException storeUnavailable(
      String operation, DataAccessException ex) {
    metrics.recordStoreError(operation);
    logger.warn("{} failed: license store unavailable", operation, ex);
    return new LicenseStoreUnavailableException("license store unavailable", ex);
  }
}
