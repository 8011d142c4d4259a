/*
 * どこで: Licensing アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: API + 起動時シード + 外部接続設定を単一アプリとして起動するため
 */
package com.example.licensing;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class LicensingApplication {

  public static void main(String[] args) {
    SpringApplication.run(LicensingApplication.class, args);
  }
}
