package com.example.licensing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ActivationLogExecutorConfig {

  public static final String EXECUTOR_NAME = "activationLogExecutor";

  // キューが溢れた場合は呼び出し側で TaskRejectedException を受けて破棄する
  @Bean(name = EXECUTOR_NAME)
  ThreadPoolTaskExecutor activationLogExecutor(ActivationLogProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("activation-log-");
    executor.setCorePoolSize(properties.poolSize());
    executor.setMaxPoolSize(properties.poolSize());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    return executor;
  }
}
