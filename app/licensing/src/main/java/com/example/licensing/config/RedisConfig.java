/*
 * どこで: Licensing インフラ設定
 * 何を: StringRedisTemplate と Lettuce クライアントの切断時挙動を提供する
 * なぜ: Redis 断の間にコマンドを溜めず、即座に TRANSIENT として返すため
 */
package com.example.licensing.config;

import io.lettuce.core.ClientOptions;
import org.springframework.boot.autoconfigure.data.redis.LettuceClientOptionsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RedisConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }

  // 既定 (ACCEPT_COMMANDS) では再接続まで command がキューされ、timeout まで応答が返らない
  @Bean
  LettuceClientOptionsBuilderCustomizer rejectCommandsWhileDisconnected() {
    return builder ->
        builder.disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS);
  }
}
