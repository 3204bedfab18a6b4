package com.codeheadsystems.otp.server.model;

/**
 * What a newly registered principal needs to configure an authenticator app.
 *
 * @param principal    the principal identifier
 * @param base32Secret the shared secret for manual entry
 * @param uri          the otpauth provisioning uri
 * @param qrCodeSvg    the uri rendered as an svg QR code
 */
public record RegistrationResult(String principal, String base32Secret, String uri, String qrCodeSvg) {

  @Override
  public String toString() {
    return "RegistrationResult[principal=" + principal + "]";
  }
}
