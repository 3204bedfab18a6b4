package com.codeheadsystems.otp.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link CredentialStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All registrations are lost on restart. Suitable for development and testing only.
 */
public class InMemoryCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCredentialStore.class);

  private final ConcurrentHashMap<String, TotpCredential> store = new ConcurrentHashMap<>();

  public InMemoryCredentialStore() {
    log.warn("Using InMemoryCredentialStore: registrations will NOT survive restarts. "
        + "Replace with a persistent CredentialStore for production.");
  }

  @Override
  public void store(TotpCredential credential) {
    store.put(credential.principal(), credential);
    log.debug("Stored credential for principal={}", credential.principal());
  }

  @Override
  public Optional<TotpCredential> load(String principal) {
    return Optional.ofNullable(store.get(principal));
  }

  @Override
  public void delete(String principal) {
    store.remove(principal);
    log.debug("Deleted credential for principal={}", principal);
  }
}
