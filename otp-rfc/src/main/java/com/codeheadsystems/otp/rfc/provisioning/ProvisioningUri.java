package com.codeheadsystems.otp.rfc.provisioning;

import com.codeheadsystems.otp.rfc.totp.TotpConfig;
import java.util.Arrays;
import java.util.Objects;
import org.apache.commons.codec.binary.Base32;

/**
 * The {@code otpauth://totp/} key URI understood by authenticator apps.
 * <p>
 * Format: {@code otpauth://totp/{issuer}:{label}?secret={base32}&issuer={issuer}&algorithm=SHA1&digit={digits}&period={period}}.
 * Issuer and label are written as given. Tested against Google Authenticator, Microsoft
 * Authenticator and Synology Secure SignIn. The secret is copied in and out; equality compares its
 * contents.
 *
 * @param issuer    the service name shown by the app
 * @param label     the account name
 * @param secret    the shared secret
 * @param algorithm the HMAC algorithm
 * @param digits    code length
 * @param period    time step in seconds
 */
public record ProvisioningUri(String issuer, String label, byte[] secret, OtpAlgorithm algorithm,
                              int digits, long period) {

  private static final Base32 BASE32 = new Base32();

  public ProvisioningUri {
    secret = Objects.requireNonNull(secret, "secret").clone();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * The RFC 4648 Base32 form of the secret, as typed into an app by hand.
   *
   * @return the encoded secret
   */
  public String base32Secret() {
    return BASE32.encodeToString(secret);
  }

  /**
   * Renders the URI.
   *
   * @return the uri string
   */
  public String toUri() {
    return "otpauth://totp/" + issuer + ":" + label
        + "?secret=" + base32Secret()
        + "&issuer=" + issuer
        + "&algorithm=" + algorithm.name()
        + "&digit=" + digits
        + "&period=" + Long.toUnsignedString(period);
  }

  @Override
  public byte[] secret() {
    return secret.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ProvisioningUri other
        && Objects.equals(issuer, other.issuer)
        && Objects.equals(label, other.label)
        && Arrays.equals(secret, other.secret)
        && algorithm == other.algorithm
        && digits == other.digits
        && period == other.period;
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(issuer, label, algorithm, digits, period) + Arrays.hashCode(secret);
  }

  @Override
  public String toString() {
    return "ProvisioningUri[issuer=" + issuer + ", label=" + label + ", algorithm=" + algorithm
        + ", digits=" + digits + ", period=" + period + "]";
  }

  /**
   * Builder for {@link ProvisioningUri}. Digits and period default to {@link TotpConfig#DEFAULT}.
   */
  public static class Builder {

    private String issuer;
    private String label;
    private byte[] secret;
    private OtpAlgorithm algorithm = OtpAlgorithm.SHA1;
    private int digits = TotpConfig.DEFAULT.digits();
    private long period = TotpConfig.DEFAULT.period();

    public Builder withIssuer(String issuer) {
      this.issuer = issuer;
      return this;
    }

    public Builder withLabel(String label) {
      this.label = label;
      return this;
    }

    public Builder withSecret(byte[] secret) {
      this.secret = secret;
      return this;
    }

    public Builder withAlgorithm(String algorithm) {
      this.algorithm = OtpAlgorithm.coerce(algorithm);
      return this;
    }

    public Builder withConfig(TotpConfig config) {
      this.digits = config.digits();
      this.period = config.period();
      return this;
    }

    public ProvisioningUri build() {
      Objects.requireNonNull(issuer, "issuer");
      Objects.requireNonNull(label, "label");
      Objects.requireNonNull(secret, "secret");
      return new ProvisioningUri(issuer, label, secret, algorithm, digits, period);
    }
  }
}
