package com.example.licensing.repository;

import com.example.licensing.model.ActivationLogEntry;
import java.time.Duration;

public interface ActivationLogRepository {

  /** 役割: activation 監査ログを追記する。 動作: retention 経過後に Redis 側で自動削除される。 */
  void append(ActivationLogEntry entry, Duration retention);
}
