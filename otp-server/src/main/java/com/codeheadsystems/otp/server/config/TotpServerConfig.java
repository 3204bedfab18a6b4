package com.codeheadsystems.otp.server.config;

import com.codeheadsystems.otp.rfc.totp.TotpConfig;
import java.util.Objects;

/**
 * Server-side settings: the issuer advertised to authenticator apps and the TOTP parameters
 * applied to new registrations.
 *
 * @param issuer the issuer name
 * @param totp   parameters for new credentials
 */
public record TotpServerConfig(String issuer, TotpConfig totp) {

  public TotpServerConfig {
    Objects.requireNonNull(issuer, "issuer");
    Objects.requireNonNull(totp, "totp");
    if (issuer.isBlank() || issuer.contains(":")) {
      throw new IllegalArgumentException("issuer must be non-blank and must not contain ':'");
    }
  }

  public TotpServerConfig(String issuer) {
    this(issuer, TotpConfig.DEFAULT);
  }
}
