/*
 * どこで: Licensing Web 設定
 * 何を: RequestMdcInterceptor を license / admin / health API へ適用する
 * なぜ: validate/check の監査ログと運用ログを request_id で突き合わせるため
 */
package com.example.licensing.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  static final String[] MDC_PATHS = {"/validate", "/check", "/health", "/admin/**"};

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(MDC_PATHS);
  }
}
