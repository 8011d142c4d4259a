/*
 * どこで: Licensing API
 * 何を: クライアント向けの validate/check エンドポイントを公開する
 * なぜ: クライアントが起動時にライセンスと端末の紐付けを確認する入口を提供するため
 */
package com.example.licensing.api;

import com.example.licensing.api.request.LicenseRequest;
import com.example.licensing.api.response.LicenseResponse;
import com.example.licensing.config.ClientAddresses;
import com.example.licensing.model.ActivationMetadata;
import com.example.licensing.service.LicenseBindingService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class LicenseController {

  private final LicenseBindingService licenseBindingService;

  // 業務上の拒否も 200 で返し、success/outcome で区別させる
  @PostMapping("/validate")
  public ResponseEntity<LicenseResponse> validate(
      @Valid @RequestBody LicenseRequest request,
      @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
      HttpServletRequest servletRequest) {
    final ActivationMetadata metadata =
        new ActivationMetadata(
            ClientAddresses.resolveClientIp(servletRequest), userAgent, request.version());
    return ResponseEntity.ok(
        LicenseResponse.from(
            licenseBindingService.activateOrValidate(
                request.licenseKey(), request.hwid(), metadata)));
  }

  @PostMapping("/check")
  public ResponseEntity<LicenseResponse> check(@Valid @RequestBody LicenseRequest request) {
    return ResponseEntity.ok(
        LicenseResponse.from(licenseBindingService.check(request.licenseKey(), request.hwid())));
  }
}
