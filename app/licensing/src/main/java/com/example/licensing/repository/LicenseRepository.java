/*
 * どこで: Licensing Repository 層
 * 何を: ライセンスレコードの永続化操作を抽象化する
 * なぜ: Redis 実装詳細を Service から切り離すため
 */
package com.example.licensing.repository;

import com.example.licensing.model.LicenseRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

public interface LicenseRepository {

  /** 役割: key からライセンスを取得する。 動作: 未登録なら empty を返す。副作用は無い。 */
  Optional<LicenseRecord> findByKey(String licenseKey);

  /**
   * 役割: 新規ライセンスを登録する。 動作: 存在確認と書き込みを原子的に行い、既存キーなら LicenseAlreadyExistsException を送出する。
   * 前提: maxActivations は正、validity は正の期間であること。
   */
  LicenseRecord create(String licenseKey, int maxActivations, Duration validity, Instant now);

  /**
   * 役割: activation 件数を上限内で 1 加算する。 動作: 加算後の件数を返し、上限到達または未登録なら empty を返す。
   * 前提: 複数プロセスから同時に呼ばれても上限を超えないこと。
   */
  OptionalLong incrementActivation(String licenseKey);

  /** 役割: active フラグを落とす。 動作: 更新できれば true、未登録なら false を返す。 */
  boolean deactivate(String licenseKey);

  /** 役割: 全ライセンスを列挙する。 動作: 作成日時の昇順で返す。 */
  List<LicenseRecord> findAll();
}
