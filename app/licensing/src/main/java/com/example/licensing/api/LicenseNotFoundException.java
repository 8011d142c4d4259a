package com.example.licensing.api;

public class LicenseNotFoundException extends RuntimeException {
  public LicenseNotFoundException(String licenseKey) {
    super("license not found: " + licenseKey);
  }
}
