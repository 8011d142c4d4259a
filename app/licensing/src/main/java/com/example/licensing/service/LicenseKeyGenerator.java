package com.example.licensing.service;

import com.example.licensing.config.LicensingProperties;
import java.security.SecureRandom;
import org.springframework.stereotype.Component;

/** 接頭辞 + 英大文字/数字 9 桁のライセンスキーを生成する。一意性は登録時の存在確認で担保する。 */
@Component
public class LicenseKeyGenerator {

  static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
  static final int RANDOM_LENGTH = 9;

  private final SecureRandom random = new SecureRandom();
  private final LicensingProperties properties;

  public LicenseKeyGenerator(LicensingProperties properties) {
    this.properties = properties;
  }

  public String generate() {
    final StringBuilder builder = new StringBuilder(properties.keyPrefix());
    for (int i = 0; i < RANDOM_LENGTH; i++) {
      builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return builder.toString();
  }
}
