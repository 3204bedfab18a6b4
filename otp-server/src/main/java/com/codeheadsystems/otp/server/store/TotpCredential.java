package com.codeheadsystems.otp.server.store;

import com.codeheadsystems.otp.rfc.hotp.Counter;
import com.codeheadsystems.otp.rfc.totp.TotpConfig;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A registered principal's TOTP credential. The secret is copied in and out; equality compares
 * its contents.
 *
 * @param principal    the principal identifier
 * @param secret       the shared secret
 * @param config       the parameters the client was provisioned with
 * @param lastAccepted the counter of the last accepted code, or null before the first login
 * @param createdAt    when the credential was registered
 */
public record TotpCredential(
    String principal,
    byte[] secret,
    TotpConfig config,
    Counter lastAccepted,
    Instant createdAt) {

  public TotpCredential {
    secret = Objects.requireNonNull(secret, "secret").clone();
  }

  @Override
  public byte[] secret() {
    return secret.clone();
  }

  public Optional<Counter> lastAcceptedCounter() {
    return Optional.ofNullable(lastAccepted);
  }

  /**
   * A copy that records the counter of an accepted code.
   *
   * @param counter the accepted counter
   * @return the credential
   */
  public TotpCredential withLastAccepted(Counter counter) {
    return new TotpCredential(principal, secret, config, counter, createdAt);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TotpCredential other
        && Objects.equals(principal, other.principal)
        && Arrays.equals(secret, other.secret)
        && Objects.equals(config, other.config)
        && Objects.equals(lastAccepted, other.lastAccepted)
        && Objects.equals(createdAt, other.createdAt);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(principal, config, lastAccepted, createdAt) + Arrays.hashCode(secret);
  }

  @Override
  public String toString() {
    return "TotpCredential[principal=" + principal + ", config=" + config
        + ", lastAccepted=" + lastAccepted + ", createdAt=" + createdAt + "]";
  }
}
