package com.codeheadsystems.otp.server.store;

import java.util.Optional;

/**
 * Storage abstraction for TOTP credentials.
 * <p>
 * Implementations must be thread-safe. Secrets are sensitive: production implementations
 * should encrypt them at rest.
 */
public interface CredentialStore {

  /**
   * Stores or replaces the credential for its principal.
   *
   * @param credential the credential
   */
  void store(TotpCredential credential);

  /**
   * Retrieves the credential for the given principal.
   *
   * @param principal the principal identifier
   * @return the stored credential, or empty if the principal is not registered
   */
  Optional<TotpCredential> load(String principal);

  /**
   * Removes the credential for the given principal, if present.
   *
   * @param principal the principal identifier
   */
  void delete(String principal);
}
