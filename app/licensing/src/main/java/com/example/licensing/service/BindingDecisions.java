/*
 * どこで: Licensing サービス層
 * 何を: (ライセンス, 端末 binding, 現在時刻) から validate/check の結果を決める
 * なぜ: 判定順序を副作用のない関数に固定し、Redis なしで網羅的に検証するため
 */
package com.example.licensing.service;

import com.example.licensing.model.BindingOutcome;
import com.example.licensing.model.DeviceBinding;
import com.example.licensing.model.LicenseRecord;
import java.time.Instant;
import org.springframework.lang.Nullable;

public final class BindingDecisions {

  private BindingDecisions() {}

  /**
   * 役割: validate 要求の事前判定を行う。
   * 動作: 未登録 → 無効化 → 期限切れ → binding 照合 → 上限 の順に評価し、最初に該当した結果を返す。
   *       binding が無く上限にも達していなければ activation へ進む判定を返す。
   * 前提: record/binding は Redis から読んだ直後の値を渡す。無ければ null。
   */
  public static BindingDecision decideActivation(
      @Nullable LicenseRecord record,
      @Nullable DeviceBinding binding,
      String requestedLicenseKey,
      Instant now) {
    final BindingOutcome licenseRejection = rejectLicense(record, now);
    if (licenseRejection != null) {
      return BindingDecision.settled(licenseRejection);
    }
    if (binding != null) {
      return BindingDecision.settled(
          binding.targets(requestedLicenseKey)
              ? BindingOutcome.VALIDATED
              : BindingOutcome.CONFLICTING_BINDING);
    }
    if (!record.hasRemainingActivations()) {
      return BindingDecision.settled(BindingOutcome.ACTIVATION_LIMIT_REACHED);
    }
    return BindingDecision.proceedToActivation();
  }

  /**
   * 役割: check 要求の結果を決める。
   * 動作: ライセンス自体の判定は validate と同じ順で行い、その後は既存 binding の一致だけを成功とする。
   * 前提: check は binding を作らないため、常に確定した結果を返す。
   */
  public static BindingOutcome decideCheck(
      @Nullable LicenseRecord record,
      @Nullable DeviceBinding binding,
      String requestedLicenseKey,
      Instant now) {
    final BindingOutcome licenseRejection = rejectLicense(record, now);
    if (licenseRejection != null) {
      return licenseRejection;
    }
    if (binding == null) {
      return BindingOutcome.NOT_BOUND;
    }
    return binding.targets(requestedLicenseKey)
        ? BindingOutcome.VALID
        : BindingOutcome.CONFLICTING_BINDING;
  }

  @Nullable
  private static BindingOutcome rejectLicense(@Nullable LicenseRecord record, Instant now) {
    if (record == null) {
      return BindingOutcome.INVALID_LICENSE;
    }
    if (!record.active()) {
      return BindingOutcome.DEACTIVATED;
    }
    if (record.isExpiredAt(now)) {
      return BindingOutcome.EXPIRED;
    }
    return null;
  }
}
