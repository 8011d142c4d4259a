/*
 * どこで: Licensing 管理 API
 * 何を: ライセンスの発行・一覧・無効化エンドポイントを公開する
 * なぜ: 運用者がライセンスを管理する入口を、クライアント API と分けて提供するため
 */
package com.example.licensing.api;

import com.example.licensing.api.request.CreateLicenseRequest;
import com.example.licensing.api.response.CreateLicenseResponse;
import com.example.licensing.api.response.LicensesResponse;
import com.example.licensing.service.LicenseAdminService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/licenses")
@RequiredArgsConstructor
public class AdminLicenseController {

  private final LicenseAdminService licenseAdminService;

  @PostMapping
  public ResponseEntity<CreateLicenseResponse> create(
      @Valid @RequestBody(required = false) CreateLicenseRequest request) {
    return ResponseEntity.ok(licenseAdminService.create(request));
  }

  @GetMapping
  public ResponseEntity<LicensesResponse> list() {
    return ResponseEntity.ok(licenseAdminService.list());
  }

  @PostMapping("/{licenseKey}:deactivate")
  public ResponseEntity<Void> deactivate(@PathVariable("licenseKey") String licenseKey) {
    licenseAdminService.deactivate(licenseKey);
    return ResponseEntity.noContent().build();
  }
}
