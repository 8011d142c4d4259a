package com.example.licensing.repository;

public class LicenseAlreadyExistsException extends RuntimeException {
  public LicenseAlreadyExistsException(String licenseKey) {
    super("license already exists: " + licenseKey);
  }
}
