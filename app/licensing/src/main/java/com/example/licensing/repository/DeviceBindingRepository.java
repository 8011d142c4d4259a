/*
 * どこで: Licensing Repository 層
 * 何を: hwid -> license の binding 参照と原子的な activation を抽象化する
 * なぜ: Lua スクリプト実行を Service から分離しテスト容易性を高めるため
 */
package com.example.licensing.repository;

import com.example.licensing.model.ActivationAttempt;
import com.example.licensing.model.DeviceBinding;
import java.time.Instant;
import java.util.Optional;

public interface DeviceBindingRepository {

  /** 役割: 端末の binding を取得する。 動作: 未登録なら empty を返す。 */
  Optional<DeviceBinding> findByDeviceId(String deviceId);

  /**
   * 役割: binding 作成と activation 件数の加算を原子的に行う。
   * 動作: ストア上の最新状態で判定をやり直し、ACTIVATED 以外の結果では何も書き込まない。
   * 前提: now は現在時刻を渡す。
   */
  ActivationAttempt activate(String licenseKey, String deviceId, Instant now);
}
