package com.codeheadsystems.otp.server.manager;

import com.codeheadsystems.otp.rfc.hotp.Counter;
import com.codeheadsystems.otp.rfc.provisioning.ProvisioningUri;
import com.codeheadsystems.otp.rfc.provisioning.QrCodeRenderer;
import com.codeheadsystems.otp.rfc.provisioning.SecretGenerator;
import com.codeheadsystems.otp.rfc.totp.TotpConfig;
import com.codeheadsystems.otp.rfc.totp.TotpCounterDerivation;
import com.codeheadsystems.otp.rfc.verify.VerificationResult;
import com.codeheadsystems.otp.rfc.verify.Verifier;
import com.codeheadsystems.otp.server.config.TotpServerConfig;
import com.codeheadsystems.otp.server.exceptions.AuthenticationFailedException;
import com.codeheadsystems.otp.server.model.AuthenticationResult;
import com.codeheadsystems.otp.server.model.RegistrationResult;
import com.codeheadsystems.otp.server.store.CredentialStore;
import com.codeheadsystems.otp.server.store.TotpCredential;
import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic TOTP registration and authentication.
 * <p>
 * Each principal's credential is read, verified and written back under a lock chosen by hashing
 * the principal into a fixed set of stripes, so two concurrent logins cannot both accept the same
 * code and unknown principals leave nothing behind. A code whose counter is at or
 * below the last accepted counter is never accepted again.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}       bad request data, HTTP 400</li>
 *   <li>{@link AuthenticationFailedException}  unknown principal or rejected code, HTTP 401</li>
 *   <li>{@link IllegalStateException}          principal already registered, HTTP 409</li>
 * </ul>
 */
@Singleton
public class TotpServerManager {

  private static final Logger log = LoggerFactory.getLogger(TotpServerManager.class);

  static final int LOCK_STRIPES = 64;

  private final TotpServerConfig config;
  private final CredentialStore credentialStore;
  private final SecretGenerator secretGenerator;
  private final QrCodeRenderer qrCodeRenderer;
  private final Clock clock;

  private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

  @Inject
  public TotpServerManager(final TotpServerConfig config,
                           final CredentialStore credentialStore,
                           final SecretGenerator secretGenerator,
                           final QrCodeRenderer qrCodeRenderer,
                           final Clock clock) {
    log.info("TotpServerManager({}, {})", config, credentialStore.getClass().getSimpleName());
    this.config = config;
    this.credentialStore = credentialStore;
    this.secretGenerator = secretGenerator;
    this.qrCodeRenderer = qrCodeRenderer;
    this.clock = clock;
    for (int i = 0; i < locks.length; i++) {
      locks[i] = new ReentrantLock();
    }
  }

  public TotpServerManager(final TotpServerConfig config, final CredentialStore credentialStore) {
    this(config, credentialStore, new SecretGenerator(), new QrCodeRenderer(), Clock.systemUTC());
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Creates a credential for the principal and returns what the client needs to provision an
   * authenticator app.
   *
   * @param principal the principal identifier
   * @param label     the account name shown in the app
   * @return the registration result
   * @throws IllegalArgumentException if principal or label is blank
   * @throws IllegalStateException    if the principal is already registered
   */
  public RegistrationResult register(String principal, String label) {
    requireNonBlank(principal, "principal");
    requireNonBlank(label, "label");
    log.debug("register(principal={})", principal);
    return withLock(principal, () -> {
      if (credentialStore.load(principal).isPresent()) {
        throw new IllegalStateException("Principal is already registered");
      }
      TotpConfig totp = config.totp();
      byte[] secret = secretGenerator.generate(totp.secretBits());
      ProvisioningUri uri = ProvisioningUri.builder()
          .withIssuer(config.issuer())
          .withLabel(label)
          .withSecret(secret)
          .withConfig(totp)
          .build();
      String uriString = uri.toUri();
      String svg = qrCodeRenderer.toSvg(uriString);
      credentialStore.store(new TotpCredential(principal, secret, totp, null, clock.instant()));
      return new RegistrationResult(principal, uri.base32Secret(), uriString, svg);
    });
  }

  /**
   * Removes the principal's credential, if any.
   *
   * @param principal the principal identifier
   */
  public void delete(String principal) {
    requireNonBlank(principal, "principal");
    log.debug("delete(principal={})", principal);
    withLock(principal, () -> {
      credentialStore.delete(principal);
      return null;
    });
  }

  // ── Authentication ───────────────────────────────────────────────────────

  /**
   * Verifies a code typed by the principal at the current time and records its counter as used.
   *
   * @param principal the principal identifier
   * @param code      the decimal code, exactly as many digits as the credential was provisioned with
   * @return the authentication result
   * @throws IllegalArgumentException       if the code is not a string of the expected length of digits
   * @throws AuthenticationFailedException  if the principal is unknown or the code is not accepted
   */
  public AuthenticationResult authenticate(String principal, String code) {
    requireNonBlank(principal, "principal");
    return withLock(principal, () -> {
      TotpCredential credential = credentialStore.load(principal)
          .orElseThrow(() -> {
            log.info("authenticate(principal={}): not registered", principal);
            return new AuthenticationFailedException(null);
          });
      TotpConfig totp = credential.config();
      int submitted = parseCode(code, totp.digits());

      Counter derived = new TotpCounterDerivation(totp, clock).currentCounter();
      Counter start = derived;
      int skipped = 0;
      if (credential.lastAccepted() != null && derived.compareTo(credential.lastAccepted()) <= 0) {
        start = credential.lastAccepted().increment();
        skipped = (int) Math.min(totp.threshold(), start.value() - derived.value());
      }
      VerificationResult result = Verifier.verify(
          credential.secret(), start, submitted, totp.digits(), totp.threshold() - skipped);
      if (result.isRejected()) {
        log.info("authenticate(principal={}): rejected, {}", principal, result.error());
        throw new AuthenticationFailedException(result.error());
      }
      credentialStore.store(credential.withLastAccepted(result.counter()));
      int steps = skipped + result.steps();
      log.debug("authenticate(principal={}): accepted at counter {} ({} step(s))", principal, result.counter(), steps);
      return new AuthenticationResult(principal, steps, result.counter());
    });
  }

  private static int parseCode(String code, int digits) {
    if (code == null || code.length() != digits) {
      throw new IllegalArgumentException("Code must have exactly " + digits + " digits");
    }
    for (int i = 0; i < code.length(); i++) {
      char c = code.charAt(i);
      if (c < '0' || c > '9') {
        throw new IllegalArgumentException("Code must contain only digits");
      }
    }
    return Integer.parseInt(code);
  }

  private static void requireNonBlank(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  ReentrantLock lockFor(String principal) {
    return locks[Math.floorMod(principal.hashCode(), LOCK_STRIPES)];
  }

  private <T> T withLock(String principal, Supplier<T> action) {
    ReentrantLock lock = lockFor(principal);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
