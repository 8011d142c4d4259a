/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: 期限判定を固定時刻でテストできるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // テスト側で固定 Clock を登録した場合はそちらを優先する
  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }
}
